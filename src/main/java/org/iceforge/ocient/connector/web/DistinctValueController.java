package org.iceforge.ocient.connector.web;

import org.iceforge.ocient.connector.model.BrowsingSession;
import org.iceforge.ocient.connector.model.DistinctValueOptions;
import org.iceforge.ocient.connector.model.DistinctValuePage;
import org.iceforge.ocient.connector.service.DistinctValueBrowser;
import org.iceforge.ocient.connector.service.DistinctValueService;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Distinct-value discovery for the WHERE-clause value picker. Session endpoints take the
 * caller's {@link BrowsingSession} and return the updated one.
 */
@RestController
@RequestMapping("/api/distinct-values")
public class DistinctValueController {

    private final DistinctValueService service;
    private final DistinctValueBrowser browser;

    public DistinctValueController(DistinctValueService service, DistinctValueBrowser browser) {
        this.service = Objects.requireNonNull(service);
        this.browser = Objects.requireNonNull(browser);
    }

    @GetMapping
    public Mono<DistinctValuePage> page(@RequestParam("schema") String schema,
                                        @RequestParam("table") String table,
                                        @RequestParam("column") String column,
                                        @RequestParam(value = "limit", defaultValue = "100") int limit,
                                        @RequestParam(value = "offset", defaultValue = "0") int offset,
                                        @RequestParam(value = "search", required = false) String search) {
        return service.getDistinctColumnValues(schema, table, column, new DistinctValueOptions(limit, offset, search));
    }

    @PostMapping("/session/open")
    public Mono<BrowsingSession> open(@RequestParam("schema") String schema,
                                      @RequestParam("table") String table,
                                      @RequestParam("column") String column) {
        return browser.open(schema, table, column);
    }

    @PostMapping("/session/search")
    public Mono<BrowsingSession> search(@RequestBody BrowsingSession session,
                                        @RequestParam(value = "filter", required = false) String filter) {
        return browser.search(session, filter);
    }

    @PostMapping("/session/next")
    public Mono<BrowsingSession> next(@RequestBody BrowsingSession session) {
        return browser.next(session);
    }

    @PostMapping("/session/previous")
    public Mono<BrowsingSession> previous(@RequestBody BrowsingSession session) {
        return browser.previous(session);
    }

    @PostMapping("/session/select")
    public BrowsingSession select(@RequestBody BrowsingSession session,
                                  @RequestParam("value") String value) {
        return browser.select(session, value);
    }
}
