package org.iceforge.ocient.connector.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Row-oriented query result. Each row keeps its columns in the order they appeared in the
 * response document; only the first row is used to decide the column set.
 */
public record RowSet(List<Map<String, ScalarValue>> rows) {

    private static final RowSet EMPTY = new RowSet(List.of());

    public RowSet {
        rows = rows == null ? List.of() : Collections.unmodifiableList(rows);
    }

    public static RowSet empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /**
     * Column names of the first row, in document order.
     */
    public List<String> columns() {
        if (rows.isEmpty()) return List.of();
        return List.copyOf(rows.get(0).keySet());
    }

    /**
     * Values of the first column across all rows. Rows that lack the column yield a null value.
     */
    public List<ScalarValue> firstColumn() {
        List<String> columns = columns();
        if (columns.isEmpty()) return List.of();
        return column(columns.get(0));
    }

    public List<ScalarValue> column(String name) {
        List<ScalarValue> out = new ArrayList<>(rows.size());
        for (Map<String, ScalarValue> row : rows) {
            ScalarValue v = row.get(name);
            out.add(v == null ? ScalarValue.NullValue.INSTANCE : v);
        }
        return out;
    }
}
