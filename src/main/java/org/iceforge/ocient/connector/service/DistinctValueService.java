package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.model.DistinctValueOptions;
import org.iceforge.ocient.connector.model.DistinctValuePage;
import org.iceforge.ocient.connector.model.QueryOutcome;
import org.iceforge.ocient.connector.model.RowSet;
import org.iceforge.ocient.connector.model.ScalarValue;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Pages through the distinct non-null values of a column.
 *
 * <p>Every page runs two statements: an unfiltered {@code COUNT(DISTINCT ...)} and the filtered,
 * ordered value query. Both are issued together and the page is built once both return. If
 * either fails the whole page fails with a {@link DistinctValuesException}.
 */
@Service
public class DistinctValueService {

    private final OcientClient client;

    public DistinctValueService(OcientClient client) {
        this.client = Objects.requireNonNull(client);
    }

    public Mono<DistinctValuePage> getDistinctColumnValues(String schema, String table, String column,
                                                           DistinctValueOptions options) {
        if (!StringUtils.hasText(schema) || !StringUtils.hasText(table) || !StringUtils.hasText(column)) {
            return Mono.just(DistinctValuePage.empty());
        }
        DistinctValueOptions opts = options == null ? DistinctValueOptions.firstPage() : options;

        Mono<Long> total = client.execute(countSql(schema, table, column))
                .map(outcome -> requireSuccess(column, outcome))
                .map(DistinctValueService::readCount);

        Mono<List<String>> values = client.execute(valuesSql(schema, table, column, opts))
                .map(outcome -> requireSuccess(column, outcome))
                .map(rows -> rows.firstColumn().stream().map(ScalarValue::asText).toList());

        return Mono.zip(total, values)
                .map(t -> DistinctValuePage.of(t.getT2(), t.getT1(), opts.offset()));
    }

    static String countSql(String schema, String table, String column) {
        return "SELECT COUNT(DISTINCT " + column + ") AS value_count FROM " + schema + "." + table
                + " WHERE " + column + " IS NOT NULL";
    }

    static String valuesSql(String schema, String table, String column, DistinctValueOptions opts) {
        StringBuilder sql = new StringBuilder()
                .append("SELECT DISTINCT ").append(column)
                .append(" FROM ").append(schema).append('.').append(table)
                .append(" WHERE ").append(column).append(" IS NOT NULL");
        if (opts.hasSearch()) {
            sql.append(" AND LOWER(CAST(").append(column).append(" AS VARCHAR)) LIKE LOWER('%")
               .append(SqlLiterals.escape(opts.searchPattern())).append("%')");
        }
        sql.append(" ORDER BY ").append(column).append(" ASC")
           .append(" LIMIT ").append(opts.limit())
           .append(" OFFSET ").append(opts.offset());
        return sql.toString();
    }

    private static RowSet requireSuccess(String column, QueryOutcome outcome) {
        if (!outcome.isSuccess()) {
            throw new DistinctValuesException(column, outcome);
        }
        return outcome.rows();
    }

    private static long readCount(RowSet rows) {
        List<ScalarValue> first = rows.firstColumn();
        if (!first.isEmpty() && first.get(0) instanceof ScalarValue.NumberValue n) {
            return (long) n.value();
        }
        return 0L;
    }
}
