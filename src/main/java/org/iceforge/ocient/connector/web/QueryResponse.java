package org.iceforge.ocient.connector.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.iceforge.ocient.connector.model.ErrorKind;
import org.iceforge.ocient.connector.model.Frame;
import org.iceforge.ocient.connector.model.QueryOutcome;
import org.iceforge.ocient.connector.model.QueryStatus;

import java.util.Map;

/**
 * Per-query part of a batch response: a frame on success, an error otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse(String refId, String queryId, Frame frame, QueryError error) {

    public static QueryResponse ok(String refId, String queryId, Frame frame) {
        return new QueryResponse(refId, queryId, frame, null);
    }

    public static QueryResponse failed(String refId, QueryOutcome outcome) {
        QueryStatus s = outcome.status();
        return new QueryResponse(refId, outcome.queryId(), null, new QueryError(
                outcome.errorKind(),
                outcome.message(),
                s == null ? null : s.reason(),
                s == null ? null : s.sqlState(),
                s == null ? null : s.vendorCode()));
    }

    public static QueryResponse failed(String refId, ErrorKind kind, String message) {
        return new QueryResponse(refId, null, null, new QueryError(kind, message, null, null, null));
    }

    public boolean isSuccess() {
        return error == null;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record QueryError(ErrorKind kind, String message, String reason, String sqlState, Integer vendorCode) {}

    public record Batch(Map<String, QueryResponse> responses) {}
}
