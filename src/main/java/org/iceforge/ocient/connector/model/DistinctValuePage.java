package org.iceforge.ocient.connector.model;

import java.util.List;

/**
 * One page of distinct values. {@code totalCount} is the unfiltered distinct cardinality of the
 * column, so it does not shrink when a search pattern narrows {@code values}.
 */
public record DistinctValuePage(List<String> values, long totalCount, boolean hasMore) {

    public DistinctValuePage {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static DistinctValuePage empty() {
        return new DistinctValuePage(List.of(), 0, false);
    }

    public static DistinctValuePage of(List<String> values, long totalCount, int offset) {
        return new DistinctValuePage(values, totalCount, offset + values.size() < totalCount);
    }
}
