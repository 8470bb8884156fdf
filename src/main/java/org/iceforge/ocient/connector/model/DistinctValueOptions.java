package org.iceforge.ocient.connector.model;

public record DistinctValueOptions(int limit, int offset, String searchPattern) {

    public static final int DEFAULT_LIMIT = 100;

    public DistinctValueOptions {
        limit = limit > 0 ? limit : DEFAULT_LIMIT;
        offset = Math.max(0, offset);
        searchPattern = searchPattern == null ? "" : searchPattern;
    }

    public static DistinctValueOptions firstPage() {
        return new DistinctValueOptions(DEFAULT_LIMIT, 0, "");
    }

    public boolean hasSearch() {
        return !searchPattern.isEmpty();
    }
}
