package org.iceforge.ocient.connector.service;

import org.iceforge.ocient.connector.model.BrowsingSession;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Session-level navigation over {@link DistinctValueService}. Sessions are passed in and handed
 * back; nothing is kept between calls.
 */
@Service
public class DistinctValueBrowser {

    private final DistinctValueService values;

    public DistinctValueBrowser(DistinctValueService values) {
        this.values = Objects.requireNonNull(values);
    }

    /**
     * Starts browsing a column: page, filter and selection are reset and the first page loaded.
     */
    public Mono<BrowsingSession> open(String schema, String table, String column) {
        return load(BrowsingSession.start(schema, table, column), 0);
    }

    /**
     * Keeps the session when it already targets the column, otherwise starts over.
     */
    public Mono<BrowsingSession> retarget(BrowsingSession session, String schema, String table, String column) {
        if (session != null && session.targets(schema, table, column)) {
            return Mono.just(session);
        }
        return open(schema, table, column);
    }

    /**
     * Applies a new filter from page 0. When a non-empty filter leaves exactly one value, that
     * value becomes the selection.
     */
    public Mono<BrowsingSession> search(BrowsingSession session, String filter) {
        String f = filter == null ? "" : filter;
        return load(session.withSearchFilter(f), 0)
                .map(s -> StringUtils.hasLength(f) && s.values().size() == 1
                        ? s.withSelectedValue(s.values().get(0))
                        : s);
    }

    public Mono<BrowsingSession> next(BrowsingSession session) {
        if (!session.hasMore()) {
            return Mono.just(session);
        }
        return load(session, session.currentPage() + 1);
    }

    public Mono<BrowsingSession> previous(BrowsingSession session) {
        if (session.currentPage() == 0) {
            return Mono.just(session);
        }
        return load(session, session.currentPage() - 1);
    }

    public BrowsingSession select(BrowsingSession session, String value) {
        return session.withSelectedValue(value);
    }

    private Mono<BrowsingSession> load(BrowsingSession session, int page) {
        return values.getDistinctColumnValues(session.schema(), session.table(), session.column(), session.optionsFor(page))
                .map(result -> session.withPage(page, result));
    }
}
