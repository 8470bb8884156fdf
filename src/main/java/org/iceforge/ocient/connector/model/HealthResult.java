package org.iceforge.ocient.connector.model;

public record HealthResult(Status status, String message) {

    public enum Status { OK, ERROR }

    public static HealthResult ok(String message) {
        return new HealthResult(Status.OK, message);
    }

    public static HealthResult error(String message) {
        return new HealthResult(Status.ERROR, message);
    }
}
