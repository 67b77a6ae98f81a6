package dev.aparikh.solrquery.response;

import org.jspecify.annotations.Nullable;

/**
 * One group of a {@code group.field} or {@code group.func}. {@code groupValue} is null for
 * documents without a value in the grouping field.
 */
public record Group<T extends SearchDocument>(@Nullable String groupValue, DocumentList<T> doclist) {
}
