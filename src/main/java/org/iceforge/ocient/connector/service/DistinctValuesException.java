package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.model.QueryOutcome;

public class DistinctValuesException extends RemoteQueryException {

    private final String column;

    public DistinctValuesException(String column, QueryOutcome outcome) {
        super("Failed to load distinct values for column '" + column + "': " + outcome.message(), outcome);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
