package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.model.ColumnType;

/**
 * Raised by {@link FrameBuilder} in strict mode when a cell cannot become its column's type.
 */
public class ValueCoercionException extends RuntimeException {

    private final String column;
    private final int row;
    private final ColumnType targetType;

    public ValueCoercionException(String column, int row, ColumnType targetType, String value) {
        super("Cannot convert value '" + value + "' in column '" + column + "' (row " + row + ") to " + targetType);
        this.column = column;
        this.row = row;
        this.targetType = targetType;
    }

    public String getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    public ColumnType getTargetType() {
        return targetType;
    }
}
