package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.model.ErrorKind;
import org.iceforge.ocient.connector.model.QueryOutcome;
import org.iceforge.ocient.connector.web.QueryDataRequest;
import org.iceforge.ocient.connector.web.QueryRequest;
import org.iceforge.ocient.connector.web.QueryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Objects;

@Service
public class ConnectorQueryService {
    private static final Logger logger = LoggerFactory.getLogger(ConnectorQueryService.class);

    private final SqlAssembler assembler;
    private final OcientClient client;
    private final FrameBuilder frameBuilder;

    public ConnectorQueryService(SqlAssembler assembler,
                                 OcientClient client,
                                 FrameBuilder frameBuilder) {
        this.assembler = Objects.requireNonNull(assembler);
        this.client = Objects.requireNonNull(client);
        this.frameBuilder = Objects.requireNonNull(frameBuilder);
    }

    /**
     * Runs every query of the batch. Queries fail independently; responses keep request order.
     */
    public Mono<QueryResponse.Batch> query(QueryDataRequest req) {
        return Flux.fromIterable(req.getQueries())
                .flatMapSequential(q -> run(q, req.getFrom(), req.getTo()))
                .collect(LinkedHashMap<String, QueryResponse>::new, (m, r) -> m.put(r.refId(), r))
                .map(m -> new QueryResponse.Batch(Collections.unmodifiableMap(m)));
    }

    public Mono<QueryResponse> run(QueryRequest q, Instant from, Instant to) {
        String refId = q.getRefId();
        String sql;
        try {
            sql = TimeMacros.expand(statementFor(q), from, to);
        } catch (QueryValidationException e) {
            logger.info("Rejected query refId={}: {}", refId, e.getMessage());
            return Mono.just(QueryResponse.failed(refId, ErrorKind.VALIDATION, e.getMessage()));
        }

        logger.info("Executing query refId={} sql={}", refId, sql);
        return client.execute(sql).map(outcome -> toResponse(refId, outcome));
    }

    /**
     * SQL text for a query: the raw text, or the assembled builder selection.
     */
    public String statementFor(QueryRequest q) {
        String sql = q.isRawQuery() ? q.getQueryText() : assembler.assemble(q);
        if (!StringUtils.hasText(sql)) {
            throw new QueryValidationException("query text is empty");
        }
        return sql;
    }

    private QueryResponse toResponse(String refId, QueryOutcome outcome) {
        if (!outcome.isSuccess()) {
            logger.warn("Query failed refId={} kind={} message={}", refId, outcome.errorKind(), outcome.message());
            return QueryResponse.failed(refId, outcome);
        }
        try {
            return QueryResponse.ok(refId, outcome.queryId(), frameBuilder.build(outcome.rows()));
        } catch (ValueCoercionException e) {
            logger.warn("Conversion failed refId={}: {}", refId, e.getMessage());
            return QueryResponse.failed(refId, ErrorKind.CONVERSION, e.getMessage());
        }
    }
}
