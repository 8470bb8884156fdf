package org.iceforge.ocient.connector.model;

import java.time.Instant;

public enum ColumnType {
    FLOAT(0.0d),
    TEXT(""),
    BOOLEAN(Boolean.FALSE),
    TIMESTAMP(Instant.parse("0001-01-01T00:00:00Z"));

    private final Object zeroValue;

    ColumnType(Object zeroValue) {
        this.zeroValue = zeroValue;
    }

    /**
     * Value substituted for cells that are missing or cannot be coerced to this type.
     */
    public Object zeroValue() {
        return zeroValue;
    }
}
