package org.iceforge.ocient.connector.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.ocient.connector.model.QueryOutcome;
import org.iceforge.ocient.connector.model.QueryStatus;
import org.iceforge.ocient.connector.model.RowSet;
import org.iceforge.ocient.connector.model.ScalarValue;
import org.iceforge.ocient.connector.web.CollectionResponse;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps an execute response body onto a {@link QueryOutcome}. The HTTP status is only used to
 * describe bodies that cannot be read; a readable body is judged by its {@code sql_state}.
 */
@Component
public class CollectionDecoder {

    private static final int MAX_SNIPPET = 200;

    private final ObjectMapper objectMapper;

    public CollectionDecoder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper);
    }

    public QueryOutcome decode(HttpStatusCode httpStatus, String body) {
        if (!StringUtils.hasText(body)) {
            return QueryOutcome.parseFailure("Empty response body (HTTP " + httpStatus.value() + ")");
        }

        CollectionResponse response;
        try {
            response = objectMapper.readValue(body, CollectionResponse.class);
        } catch (JsonProcessingException e) {
            return QueryOutcome.parseFailure("Error parsing response (HTTP " + httpStatus.value() + "): "
                    + e.getOriginalMessage() + "; body starts with: " + snippet(body));
        }

        if (response == null || response.getStatus() == null) {
            return QueryOutcome.parseFailure("Response has no status block (HTTP " + httpStatus.value() + ")");
        }

        CollectionResponse.Status s = response.getStatus();
        QueryStatus status = new QueryStatus(s.getReason(), s.getSqlState(), s.getVendorCode());
        if (!status.isSuccess()) {
            return QueryOutcome.remoteError(response.getQueryId(), status);
        }
        return QueryOutcome.success(response.getQueryId(), toRowSet(response.getData()), status);
    }

    static RowSet toRowSet(List<Map<String, JsonNode>> data) {
        if (data == null || data.isEmpty()) {
            return RowSet.empty();
        }
        List<Map<String, ScalarValue>> rows = new ArrayList<>(data.size());
        for (Map<String, JsonNode> raw : data) {
            Map<String, ScalarValue> row = new LinkedHashMap<>();
            if (raw != null) {
                raw.forEach((k, v) -> row.put(k, ScalarValue.of(v)));
            }
            rows.add(row);
        }
        return new RowSet(rows);
    }

    private static String snippet(String body) {
        return body.length() <= MAX_SNIPPET ? body : body.substring(0, MAX_SNIPPET) + "...";
    }
}
