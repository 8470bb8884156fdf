package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.model.DistinctValueOptions;
import org.iceforge.ocient.connector.model.DistinctValuePage;
import org.iceforge.ocient.connector.model.QueryOutcome;
import org.iceforge.ocient.connector.model.QueryStatus;
import org.iceforge.ocient.connector.model.RowSet;
import org.iceforge.ocient.connector.model.ScalarValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DistinctValueServiceTest {

    private static final List<String> HOSTS = IntStream.range(0, 150)
            .mapToObj(i -> String.format("host-%03d", i))
            .toList();

    OcientClient client;
    DistinctValueService service;
    final List<String> statements = new ArrayList<>();

    @BeforeEach
    void setUp() {
        client = mock(OcientClient.class);
        service = new DistinctValueService(client);
    }

    @Test
    void pagesThroughOneHundredFiftyValues() {
        when(client.execute(anyString())).thenAnswer(inv -> {
            String sql = inv.getArgument(0);
            statements.add(sql);
            if (sql.contains("COUNT(DISTINCT")) {
                return Mono.just(ok("value_count", List.of(150.0)));
            }
            int offset = sql.endsWith("OFFSET 100") ? 100 : 0;
            return Mono.just(ok("host", new ArrayList<Object>(HOSTS.subList(offset, Math.min(offset + 100, 150)))));
        });

        StepVerifier.create(service.getDistinctColumnValues("sys", "metrics", "host", DistinctValueOptions.firstPage()))
                .assertNext(page -> {
                    assertThat(page.values()).hasSize(100);
                    assertThat(page.values().get(0)).isEqualTo("host-000");
                    assertThat(page.totalCount()).isEqualTo(150);
                    assertThat(page.hasMore()).isTrue();
                })
                .verifyComplete();

        StepVerifier.create(service.getDistinctColumnValues("sys", "metrics", "host", new DistinctValueOptions(100, 100, "")))
                .assertNext(page -> {
                    assertThat(page.values()).hasSize(50);
                    assertThat(page.values().get(49)).isEqualTo("host-149");
                    assertThat(page.totalCount()).isEqualTo(150);
                    assertThat(page.hasMore()).isFalse();
                })
                .verifyComplete();

        assertThat(statements).contains(
                "SELECT COUNT(DISTINCT host) AS value_count FROM sys.metrics WHERE host IS NOT NULL",
                "SELECT DISTINCT host FROM sys.metrics WHERE host IS NOT NULL ORDER BY host ASC LIMIT 100 OFFSET 0");
    }

    @Test
    void searchFiltersValuesButNotTheTotal() {
        when(client.execute(anyString())).thenAnswer(inv -> {
            String sql = inv.getArgument(0);
            statements.add(sql);
            return sql.contains("COUNT(DISTINCT")
                    ? Mono.just(ok("value_count", List.of(150.0)))
                    : Mono.just(ok("host", List.of("host-042")));
        });

        DistinctValuePage page = service.getDistinctColumnValues("sys", "metrics", "host",
                new DistinctValueOptions(100, 0, "St-04'2")).block();

        assertThat(page.values()).containsExactly("host-042");
        assertThat(page.totalCount()).isEqualTo(150);
        assertThat(page.hasMore()).isTrue();
        assertThat(statements).contains("SELECT DISTINCT host FROM sys.metrics WHERE host IS NOT NULL"
                + " AND LOWER(CAST(host AS VARCHAR)) LIKE LOWER('%St-04''2%') ORDER BY host ASC LIMIT 100 OFFSET 0");
    }

    @Test
    void numericValuesAreRenderedAsText() {
        when(client.execute(anyString())).thenAnswer(inv -> {
            String sql = inv.getArgument(0);
            return sql.contains("COUNT(DISTINCT")
                    ? Mono.just(ok("value_count", List.of(6.0)))
                    : Mono.just(ok("code", List.of(200.0, 404.0, 2.5, 0.0005, 12345678.5, 1234567890123456.0)));
        });

        DistinctValuePage page = service.getDistinctColumnValues("web", "requests", "code", null).block();

        assertThat(page.values()).containsExactly("200", "404", "2.5", "0.0005", "12345678.5", "1234567890123456");
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void failingSubQueryFailsThePageNamingTheColumn() {
        QueryStatus denied = new QueryStatus("Permission denied", "42501", -1);
        when(client.execute(anyString())).thenAnswer(inv -> {
            String sql = inv.getArgument(0);
            return sql.contains("COUNT(DISTINCT")
                    ? Mono.just(ok("value_count", List.of(10.0)))
                    : Mono.just(QueryOutcome.remoteError("q-err", denied));
        });

        StepVerifier.create(service.getDistinctColumnValues("sys", "metrics", "host", DistinctValueOptions.firstPage()))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(DistinctValuesException.class);
                    DistinctValuesException dve = (DistinctValuesException) e;
                    assertThat(dve.getColumn()).isEqualTo("host");
                    assertThat(dve.getStatus().sqlState()).isEqualTo("42501");
                })
                .verify();
    }

    @Test
    void blankArgumentsGiveEmptyPageWithoutCalls() {
        StepVerifier.create(service.getDistinctColumnValues("sys", "", "host", DistinctValueOptions.firstPage()))
                .assertNext(page -> {
                    assertThat(page.values()).isEmpty();
                    assertThat(page.totalCount()).isZero();
                    assertThat(page.hasMore()).isFalse();
                })
                .verifyComplete();

        verifyNoInteractions(client);
    }

    @Test
    void optionsAreNormalized() {
        DistinctValueOptions opts = new DistinctValueOptions(0, -5, null);

        assertThat(opts.limit()).isEqualTo(DistinctValueOptions.DEFAULT_LIMIT);
        assertThat(opts.offset()).isZero();
        assertThat(opts.searchPattern()).isEmpty();
        assertThat(opts.hasSearch()).isFalse();
    }

    static QueryOutcome ok(String column, List<?> values) {
        List<Map<String, ScalarValue>> rows = new ArrayList<>();
        for (Object v : values) {
            Map<String, ScalarValue> row = new LinkedHashMap<>();
            row.put(column, FrameBuilderTest.scalar(v));
            rows.add(row);
        }
        return QueryOutcome.success("q-" + column, new RowSet(rows), new QueryStatus("", QueryStatus.SUCCESS_STATE, 0));
    }
}
