package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.web.QueryRequest;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds a SELECT statement from query-builder selections. Identifiers are concatenated as
 * given; only literal values are quoted.
 */
@Service
public class SqlAssembler {

    public static final List<String> OPERATORS = List.of("=", "!=", ">", ">=", "<", "<=", "LIKE");

    public String assemble(QueryRequest req) {
        Objects.requireNonNull(req);

        if (!StringUtils.hasText(req.getSchema()) || !StringUtils.hasText(req.getTable())) {
            throw new QueryValidationException("Query builder needs both a schema and a table.");
        }

        List<String> columns = new ArrayList<>();
        String timeseries = StringUtils.hasText(req.getTimeseriesColumn()) ? req.getTimeseriesColumn().trim() : null;
        if (req.getSelectedColumns() != null) {
            for (QueryRequest.SelectedColumn c : req.getSelectedColumns()) {
                if (c == null || !StringUtils.hasText(c.getName())) continue;
                columns.add(c.getName().trim());
                if (timeseries == null && c.isTimeseriesColumn()) {
                    timeseries = c.getName().trim();
                }
            }
        }

        // WHERE stage
        List<String> where = new ArrayList<>();
        if (req.getWhereClauses() != null) {
            for (QueryRequest.WhereClause clause : req.getWhereClauses()) {
                where.add(predicate(clause));
            }
        }
        if (timeseries != null) {
            where.add(timeseries + " >= " + TimeMacros.TIME_FROM);
            where.add(timeseries + " <= " + TimeMacros.TIME_TO);
        }

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(columns.isEmpty() ? "*" : String.join(", ", columns))
           .append(" FROM ").append(req.getSchema().trim()).append('.').append(req.getTable().trim());

        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where));
        }

        // ORDER BY stage
        if (timeseries != null) {
            sql.append(" ORDER BY ").append(timeseries).append(" ASC");
        }

        return sql.toString();
    }

    private static String predicate(QueryRequest.WhereClause clause) {
        if (clause == null || !StringUtils.hasText(clause.getColumn())) {
            throw new QueryValidationException("WHERE clause is missing a column.");
        }
        String op = clause.getOperator() == null ? "" : clause.getOperator().trim().toUpperCase(Locale.ROOT);
        if (!OPERATORS.contains(op)) {
            throw new QueryValidationException("Unsupported operator '" + clause.getOperator()
                    + "' on column '" + clause.getColumn() + "'. Allowed: " + OPERATORS);
        }
        return clause.getColumn().trim() + " " + op + " " + SqlLiterals.quote(clause.getValue());
    }
}
