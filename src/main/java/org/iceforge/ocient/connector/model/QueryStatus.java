package org.iceforge.ocient.connector.model;

/**
 * Status block returned by the execute endpoint. {@code vendorCode} is null when no
 * response was received.
 */
public record QueryStatus(String reason, String sqlState, Integer vendorCode) {

    public static final String SUCCESS_STATE = "00000";

    public boolean isSuccess() {
        return SUCCESS_STATE.equals(sqlState);
    }
}
