package org.iceforge.ocient.connector.web;

import jakarta.validation.Valid;
import org.iceforge.ocient.connector.service.ConnectorQueryService;
import org.iceforge.ocient.connector.service.SqlAssembler;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Objects;

@RestController
@RequestMapping("/api/query")
public class QueryController {

    private final ConnectorQueryService service;
    private final SqlAssembler assembler;

    public QueryController(ConnectorQueryService service, SqlAssembler assembler) {
        this.service = Objects.requireNonNull(service);
        this.assembler = Objects.requireNonNull(assembler);
    }

    /**
     * Executes a batch of queries and returns one frame or error per refId.
     */
    @PostMapping
    public Mono<QueryResponse.Batch> query(@Valid @RequestBody QueryDataRequest req) {
        return service.query(req);
    }

    /**
     * Assembles the SQL for a query-builder selection without running it.
     */
    @PostMapping("/sql")
    public SqlText sql(@RequestBody QueryRequest req) {
        return new SqlText(assembler.assemble(req));
    }

    public record SqlText(String sql) {}
}
