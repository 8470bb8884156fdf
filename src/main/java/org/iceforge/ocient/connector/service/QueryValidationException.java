package org.iceforge.ocient.connector.service;

/**
 * A query was rejected before anything was sent to the database.
 */
public class QueryValidationException extends RuntimeException {
    public QueryValidationException(String message) {
        super(message);
    }
}
