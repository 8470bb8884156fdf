package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.web.QueryRequest;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlAssemblerTest {

    private final SqlAssembler assembler = new SqlAssembler();

    @Test
    void selectsAllColumnsWithSingleWhereClause() {
        QueryRequest req = builder("s", "t");
        req.setWhereClauses(List.of(new QueryRequest.WhereClause("x", "=", "5")));

        assertThat(assembler.assemble(req)).isEqualTo("SELECT * FROM s.t WHERE x = '5'");
    }

    @Test
    void noClausesMeansNoWhere() {
        QueryRequest req = builder("s", "t");
        req.setSelectedColumns(List.of(new QueryRequest.SelectedColumn("a"), new QueryRequest.SelectedColumn("b")));

        assertThat(assembler.assemble(req)).isEqualTo("SELECT a, b FROM s.t");
    }

    @Test
    void timeseriesColumnAddsRangeAndTrailingOrderBy() {
        QueryRequest req = builder("sys", "metrics");
        req.setSelectedColumns(List.of(new QueryRequest.SelectedColumn("ts"), new QueryRequest.SelectedColumn("cpu")));
        req.setWhereClauses(List.of(new QueryRequest.WhereClause("host", "like", "web%")));
        req.setTimeseriesColumn("ts");

        assertThat(assembler.assemble(req)).isEqualTo(
                "SELECT ts, cpu FROM sys.metrics WHERE host LIKE 'web%'"
                        + " AND ts >= $__timeFrom() AND ts <= $__timeTo() ORDER BY ts ASC");
    }

    @Test
    void timeseriesFlagOnSelectedColumnIsHonored() {
        QueryRequest req = builder("s", "t");
        QueryRequest.SelectedColumn ts = new QueryRequest.SelectedColumn("created_at");
        ts.setTimeseriesColumn(true);
        req.setSelectedColumns(List.of(ts));

        assertThat(assembler.assemble(req)).isEqualTo(
                "SELECT created_at FROM s.t WHERE created_at >= $__timeFrom() AND created_at <= $__timeTo()"
                        + " ORDER BY created_at ASC");
    }

    @Test
    void quotesAreDoubledInLiterals() {
        QueryRequest req = builder("s", "t");
        req.setWhereClauses(List.of(new QueryRequest.WhereClause("name", "!=", "O'Brien")));

        assertThat(assembler.assemble(req)).isEqualTo("SELECT * FROM s.t WHERE name != 'O''Brien'");
    }

    @Test
    void rejectsUnknownOperatorAndMissingTable() {
        QueryRequest bad = builder("s", "t");
        bad.setWhereClauses(List.of(new QueryRequest.WhereClause("x", "; DROP", "1")));
        assertThatThrownBy(() -> assembler.assemble(bad))
                .isInstanceOf(QueryValidationException.class)
                .hasMessageContaining("Unsupported operator");

        assertThatThrownBy(() -> assembler.assemble(builder("s", " ")))
                .isInstanceOf(QueryValidationException.class);
    }

    @Test
    void expandedMacrosUseQuotedNativeTimestamps() {
        QueryRequest req = builder("s", "t");
        req.setTimeseriesColumn("ts");

        String sql = TimeMacros.expand(assembler.assemble(req),
                Instant.parse("2024-01-15T00:00:00Z"), Instant.parse("2024-01-16T12:00:00.750Z"));

        assertThat(sql).isEqualTo("SELECT * FROM s.t WHERE ts >= '2024-01-15 00:00:00'"
                + " AND ts <= '2024-01-16 12:00:00' ORDER BY ts ASC");
    }

    @Test
    void macrosWithoutRangeAreLeftInPlace() {
        String sql = "SELECT * FROM t WHERE ts >= $__timeFrom()";
        assertThat(TimeMacros.expand(sql, null, null)).isEqualTo(sql);
    }

    private static QueryRequest builder(String schema, String table) {
        QueryRequest req = new QueryRequest();
        req.setRawQuery(false);
        req.setSchema(schema);
        req.setTable(table);
        return req;
    }
}
