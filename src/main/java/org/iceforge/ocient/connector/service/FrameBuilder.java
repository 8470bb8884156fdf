package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.model.ColumnType;
import org.iceforge.ocient.connector.model.Field;
import org.iceforge.ocient.connector.model.Frame;
import org.iceforge.ocient.connector.model.RowSet;
import org.iceforge.ocient.connector.model.ScalarValue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a {@link RowSet} into a column-oriented {@link Frame}.
 *
 * <p>Column types are decided once, from the first row. Later rows are coerced to that type and
 * never re-inferred. By default a cell that does not fit becomes the type's zero value, so a
 * dashboard keeps rendering over heterogeneous data at the cost of hiding bad cells. With
 * {@code strict} set, a non-null cell that does not fit raises {@link ValueCoercionException}.
 */
public class FrameBuilder {

    public static final String FRAME_NAME = "response";

    private final boolean strict;

    public FrameBuilder(boolean strict) {
        this.strict = strict;
    }

    public Frame build(RowSet rowSet) {
        if (rowSet == null || rowSet.isEmpty()) {
            return Frame.empty(FRAME_NAME);
        }

        List<Map<String, ScalarValue>> rows = rowSet.rows();
        List<Field> fields = new ArrayList<>();
        for (Map.Entry<String, ScalarValue> sample : rows.get(0).entrySet()) {
            String column = sample.getKey();
            ColumnType type = classify(sample.getValue());

            List<Object> values = new ArrayList<>(rows.size());
            for (int i = 0; i < rows.size(); i++) {
                ScalarValue cell = rows.get(i).get(column);
                values.add(coerce(column, i, type, cell == null ? ScalarValue.NullValue.INSTANCE : cell));
            }
            fields.add(new Field(column, type, values));
        }
        return new Frame(FRAME_NAME, fields);
    }

    public static ColumnType classify(ScalarValue sample) {
        if (sample instanceof ScalarValue.StringValue s && TimestampParser.isTimestamp(s.value())) {
            return ColumnType.TIMESTAMP;
        }
        if (sample instanceof ScalarValue.NumberValue) {
            return ColumnType.FLOAT;
        }
        if (sample instanceof ScalarValue.BoolValue) {
            return ColumnType.BOOLEAN;
        }
        return ColumnType.TEXT;
    }

    private Object coerce(String column, int row, ColumnType type, ScalarValue cell) {
        switch (type) {
            case FLOAT:
                if (cell instanceof ScalarValue.NumberValue n) {
                    return n.value();
                }
                break;
            case BOOLEAN:
                if (cell instanceof ScalarValue.BoolValue b) {
                    return b.value();
                }
                break;
            case TIMESTAMP:
                if (cell instanceof ScalarValue.StringValue s) {
                    Optional<Instant> parsed = TimestampParser.parse(s.value());
                    if (parsed.isPresent()) {
                        return parsed.get();
                    }
                }
                break;
            case TEXT:
                return cell.asText();
            default:
                throw new IllegalStateException("Unhandled column type " + type);
        }

        if (strict && !cell.isNull()) {
            throw new ValueCoercionException(column, row, type, cell.asText());
        }
        return type.zeroValue();
    }
}
