package org.iceforge.ocient.connector.model;

public enum ErrorKind {
    /** Rejected locally before anything was sent. */
    VALIDATION,
    /** Connection refused, TLS failure, timeout. */
    TRANSPORT,
    /** The response body was not a collection document. */
    PROTOCOL,
    /** The database answered with a non-success SQL state. */
    REMOTE_SQL,
    /** Strict coercion rejected a cell. */
    CONVERSION
}
