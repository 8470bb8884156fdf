package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.model.ColumnInfo;
import org.iceforge.ocient.connector.model.QueryOutcome;
import org.iceforge.ocient.connector.model.RowSet;
import org.iceforge.ocient.connector.model.ScalarValue;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Schema, table and column discovery against {@code information_schema}, feeding the
 * query-builder pickers.
 */
@Service
public class MetadataService {

    static final String SCHEMAS_SQL =
            "SELECT DISTINCT(table_schema) FROM information_schema.tables ORDER BY table_schema";

    private final OcientClient client;

    public MetadataService(OcientClient client) {
        this.client = Objects.requireNonNull(client);
    }

    public Mono<List<String>> schemas() {
        return client.execute(SCHEMAS_SQL)
                .map(o -> firstColumnText(requireSuccess("schemas", o)));
    }

    public Mono<List<String>> tables(String schema) {
        if (!StringUtils.hasText(schema)) {
            return Mono.just(List.of());
        }
        String sql = "SELECT DISTINCT(table_name) FROM information_schema.tables WHERE table_schema = "
                + SqlLiterals.quote(schema) + " ORDER BY table_name";
        return client.execute(sql)
                .map(o -> firstColumnText(requireSuccess("tables of " + schema, o)));
    }

    public Mono<List<ColumnInfo>> columns(String schema, String table) {
        if (!StringUtils.hasText(schema) || !StringUtils.hasText(table)) {
            return Mono.just(List.of());
        }
        String sql = "SELECT column_name, data_type, is_nullable, column_default FROM information_schema.columns"
                + " WHERE table_schema = " + SqlLiterals.quote(schema)
                + " AND table_name = " + SqlLiterals.quote(table)
                + " ORDER BY column_name";
        return client.execute(sql)
                .map(o -> toColumns(requireSuccess("columns of " + schema + "." + table, o)));
    }

    private static List<ColumnInfo> toColumns(RowSet rows) {
        List<ColumnInfo> out = new ArrayList<>(rows.size());
        for (Map<String, ScalarValue> row : rows.rows()) {
            out.add(new ColumnInfo(
                    text(row.get("column_name")),
                    text(row.get("data_type")),
                    text(row.get("is_nullable")),
                    text(row.get("column_default"))));
        }
        return out;
    }

    private static String text(ScalarValue v) {
        return v == null || v.isNull() ? null : v.asText();
    }

    private static List<String> firstColumnText(RowSet rows) {
        return rows.firstColumn().stream().map(ScalarValue::asText).toList();
    }

    private static RowSet requireSuccess(String what, QueryOutcome outcome) {
        if (!outcome.isSuccess()) {
            throw new RemoteQueryException("Failed to load " + what + ": " + outcome.message(), outcome);
        }
        return outcome.rows();
    }
}
