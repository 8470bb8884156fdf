package org.iceforge.ocient.connector.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One named column of a {@link Frame}. All values share the Java type implied by {@link #type()}:
 * {@code Double}, {@code String}, {@code Boolean} or {@code Instant}.
 */
public record Field(String name, ColumnType type, List<Object> values) {

    public Field {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        values = values == null ? List.of() : Collections.unmodifiableList(values);
    }

    public int size() {
        return values.size();
    }

    public Object value(int row) {
        return values.get(row);
    }
}
