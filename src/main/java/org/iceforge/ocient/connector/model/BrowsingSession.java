package org.iceforge.ocient.connector.model;

import java.util.List;
import java.util.Objects;

/**
 * Caller-held state of an interactive distinct-value browse. The service never stores it:
 * each browsing call takes a session and returns the next one.
 */
public record BrowsingSession(String schema,
                              String table,
                              String column,
                              int currentPage,
                              int pageSize,
                              String searchFilter,
                              String selectedValue,
                              List<String> values,
                              long totalCount,
                              boolean hasMore) {

    public static final int PAGE_SIZE = DistinctValueOptions.DEFAULT_LIMIT;

    public BrowsingSession {
        currentPage = Math.max(0, currentPage);
        pageSize = pageSize > 0 ? pageSize : PAGE_SIZE;
        searchFilter = searchFilter == null ? "" : searchFilter;
        selectedValue = selectedValue == null ? "" : selectedValue;
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static BrowsingSession start(String schema, String table, String column) {
        return new BrowsingSession(schema, table, column, 0, PAGE_SIZE, "", "", List.of(), 0, false);
    }

    public boolean targets(String schema, String table, String column) {
        return Objects.equals(this.schema, schema)
                && Objects.equals(this.table, table)
                && Objects.equals(this.column, column);
    }

    public int offsetOf(int page) {
        return page * pageSize;
    }

    public DistinctValueOptions optionsFor(int page) {
        return new DistinctValueOptions(pageSize, offsetOf(page), searchFilter);
    }

    public BrowsingSession withPage(int page, DistinctValuePage result) {
        return new BrowsingSession(schema, table, column, page, pageSize, searchFilter, selectedValue,
                result.values(), result.totalCount(), result.hasMore());
    }

    public BrowsingSession withSearchFilter(String filter) {
        return new BrowsingSession(schema, table, column, 0, pageSize, filter, selectedValue,
                values, totalCount, hasMore);
    }

    public BrowsingSession withSelectedValue(String value) {
        return new BrowsingSession(schema, table, column, currentPage, pageSize, searchFilter, value,
                values, totalCount, hasMore);
    }
}
