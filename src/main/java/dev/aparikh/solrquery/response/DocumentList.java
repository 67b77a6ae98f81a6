package dev.aparikh.solrquery.response;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A page of documents with its hit count, as found under {@code response}, a group's
 * {@code doclist}, or a MoreLikeThis entry.
 */
public record DocumentList<T extends SearchDocument>(
        long numFound,
        long start,
        @Nullable Boolean numFoundExact,
        List<T> docs
) {

    public DocumentList {
        docs = List.copyOf(docs);
    }
}
