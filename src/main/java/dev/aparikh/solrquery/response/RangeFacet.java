package dev.aparikh.solrquery.response;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Buckets of one range facet, plus the {@code facet.range.other} counts when requested.
 */
public record RangeFacet(
        List<FacetCount> counts,
        @Nullable String gap,
        @Nullable String start,
        @Nullable String end,
        @Nullable Long before,
        @Nullable Long after,
        @Nullable Long between
) {

    public RangeFacet {
        counts = List.copyOf(counts);
    }
}
