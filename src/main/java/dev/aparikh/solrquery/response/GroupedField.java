package dev.aparikh.solrquery.response;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Grouping result for one {@code group.field}, {@code group.func} or {@code group.query}.
 *
 * @param matches number of documents that matched the query
 * @param ngroups number of groups, present when {@code group.ngroups=true}
 * @param groups  the groups (empty for {@code group.query} and {@code group.format=simple})
 * @param doclist the single flat list for {@code group.query} and {@code group.format=simple}
 */
public record GroupedField<T extends SearchDocument>(
        long matches,
        @Nullable Long ngroups,
        List<Group<T>> groups,
        @Nullable DocumentList<T> doclist
) {

    public GroupedField {
        groups = List.copyOf(groups);
    }
}
