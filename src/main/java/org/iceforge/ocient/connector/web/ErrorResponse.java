package org.iceforge.ocient.connector.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final Instant timestamp = Instant.now();
    private final String error;
    private final String detail;
    private final String column;
    private final String sqlState;
    private final Integer vendorCode;

    public ErrorResponse(String error, String detail) {
        this(error, detail, null, null, null);
    }

    public ErrorResponse(String error, String detail, String column, String sqlState, Integer vendorCode) {
        this.error = error;
        this.detail = detail;
        this.column = column;
        this.sqlState = sqlState;
        this.vendorCode = vendorCode;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getError() {
        return error;
    }

    public String getDetail() {
        return detail;
    }

    public String getColumn() {
        return column;
    }

    public String getSqlState() {
        return sqlState;
    }

    public Integer getVendorCode() {
        return vendorCode;
    }
}
