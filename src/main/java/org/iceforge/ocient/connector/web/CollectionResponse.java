package org.iceforge.ocient.connector.web;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Collection-format response of the execute endpoint. Rows stay as raw JSON nodes so the
 * decoder can map each cell onto a scalar variant; Jackson keeps row keys in document order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CollectionResponse {

    @JsonProperty("query_id")
    private String queryId;

    private Status status;

    private List<Map<String, JsonNode>> data;

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public List<Map<String, JsonNode>> getData() {
        return data;
    }

    public void setData(List<Map<String, JsonNode>> data) {
        this.data = data;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Status {
        private String reason;

        @JsonProperty("sql_state")
        private String sqlState;

        @JsonProperty("vendor_code")
        private Integer vendorCode;

        public String getReason() {
            return reason;
        }

        public void setReason(String reason) {
            this.reason = reason;
        }

        public String getSqlState() {
            return sqlState;
        }

        public void setSqlState(String sqlState) {
            this.sqlState = sqlState;
        }

        public Integer getVendorCode() {
            return vendorCode;
        }

        public void setVendorCode(Integer vendorCode) {
            this.vendorCode = vendorCode;
        }
    }
}
