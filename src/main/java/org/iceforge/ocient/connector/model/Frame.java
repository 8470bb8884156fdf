package org.iceforge.ocient.connector.model;

import java.util.List;
import java.util.Optional;

/**
 * Column-oriented result handed to charting. Every field holds exactly one value per source row.
 */
public record Frame(String name, List<Field> fields) {

    public Frame {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static Frame empty(String name) {
        return new Frame(name, List.of());
    }

    public int rowCount() {
        return fields.isEmpty() ? 0 : fields.get(0).size();
    }

    public Optional<Field> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
