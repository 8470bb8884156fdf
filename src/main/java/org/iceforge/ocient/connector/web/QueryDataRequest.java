package org.iceforge.ocient.connector.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.time.Instant;
import java.util.List;

public class QueryDataRequest {

    @NotEmpty
    @Valid
    private List<QueryRequest> queries;

    /**
     * Dashboard time range, substituted for $__timeFrom() and $__timeTo().
     */
    private Instant from;
    private Instant to;

    public List<QueryRequest> getQueries() {
        return queries;
    }

    public void setQueries(List<QueryRequest> queries) {
        this.queries = queries;
    }

    public Instant getFrom() {
        return from;
    }

    public void setFrom(Instant from) {
        this.from = from;
    }

    public Instant getTo() {
        return to;
    }

    public void setTo(Instant to) {
        this.to = to;
    }
}
