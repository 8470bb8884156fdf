package org.iceforge.ocient.connector.model;

import java.util.Objects;

/**
 * Result of a single execute call: rows plus a success status, or a typed failure.
 * Failures always carry an empty {@link RowSet}.
 */
public record QueryOutcome(String queryId,
                           RowSet rows,
                           QueryStatus status,
                           ErrorKind errorKind,
                           String message) {

    public QueryOutcome {
        rows = rows == null ? RowSet.empty() : rows;
    }

    public static QueryOutcome success(String queryId, RowSet rows, QueryStatus status) {
        return new QueryOutcome(queryId, rows, Objects.requireNonNull(status), null, null);
    }

    public static QueryOutcome remoteError(String queryId, QueryStatus status) {
        Objects.requireNonNull(status);
        String message = "Query failed: " + status.reason()
                + " (SQL state: " + status.sqlState() + ", vendor code: " + status.vendorCode() + ")";
        return new QueryOutcome(queryId, RowSet.empty(), status, ErrorKind.REMOTE_SQL, message);
    }

    public static QueryOutcome parseFailure(String message) {
        return new QueryOutcome(null, RowSet.empty(), null, ErrorKind.PROTOCOL, message);
    }

    public static QueryOutcome transportFailure(String message) {
        return new QueryOutcome(null, RowSet.empty(), null, ErrorKind.TRANSPORT, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }
}
