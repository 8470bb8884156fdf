package org.iceforge.ocient.connector.web;

import org.iceforge.ocient.connector.model.ColumnInfo;
import org.iceforge.ocient.connector.model.HealthResult;
import org.iceforge.ocient.connector.service.HealthService;
import org.iceforge.ocient.connector.service.MetadataService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

@RestController
@RequestMapping("/api")
public class MetadataController {

    private final MetadataService metadata;
    private final HealthService health;

    public MetadataController(MetadataService metadata, HealthService health) {
        this.metadata = Objects.requireNonNull(metadata);
        this.health = Objects.requireNonNull(health);
    }

    @GetMapping("/metadata/schemas")
    public Mono<List<String>> schemas() {
        return metadata.schemas();
    }

    @GetMapping("/metadata/tables")
    public Mono<List<String>> tables(@RequestParam(value = "schema", required = false) String schema) {
        return metadata.tables(schema);
    }

    @GetMapping("/metadata/columns")
    public Mono<List<ColumnInfo>> columns(@RequestParam(value = "schema", required = false) String schema,
                                          @RequestParam(value = "table", required = false) String table) {
        return metadata.columns(schema, table);
    }

    @GetMapping("/health")
    public Mono<HealthResult> health() {
        return health.check();
    }
}
