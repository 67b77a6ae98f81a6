package dev.aparikh.solrquery.response;

import org.jspecify.annotations.Nullable;

/**
 * One facet bucket. {@code value} is null for the {@code facet.missing} bucket.
 */
public record FacetCount(@Nullable String value, long count) {
}
