package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.model.ErrorKind;
import org.iceforge.ocient.connector.model.QueryOutcome;
import org.iceforge.ocient.connector.model.QueryStatus;

import java.util.Objects;

/**
 * A statement issued on the caller's behalf did not succeed. Carries the failed outcome so the
 * status triple reaches the caller unchanged.
 */
public class RemoteQueryException extends RuntimeException {

    private final transient QueryOutcome outcome;

    public RemoteQueryException(String message, QueryOutcome outcome) {
        super(message);
        this.outcome = Objects.requireNonNull(outcome);
    }

    public QueryOutcome getOutcome() {
        return outcome;
    }

    public ErrorKind getKind() {
        return outcome.errorKind();
    }

    public QueryStatus getStatus() {
        return outcome.status();
    }
}
