package dev.aparikh.solrquery.response;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * A decoded Solr search response.
 *
 * <p>Optional blocks are null when Solr did not return them, never empty placeholders, so
 * {@code hasFacets()} and friends tell a feature that was not requested apart from one that
 * matched nothing.</p>
 *
 * @param status        {@code responseHeader.status}
 * @param queryTime     {@code responseHeader.QTime} in milliseconds
 * @param numFound      total hits
 * @param start         offset of the first returned document
 * @param numFoundExact whether {@code numFound} is exact, when Solr reports it
 * @param docs          the returned documents
 * @param facetCounts   {@code facet_counts}
 * @param highlighting  snippets per document id and field
 * @param grouped       grouping results per group command
 * @param moreLikeThis  similar documents per document id
 * @param raw           the whole response, verbatim
 */
public record SearchResult<T extends SearchDocument>(
        int status,
        int queryTime,
        long numFound,
        long start,
        @Nullable Boolean numFoundExact,
        List<T> docs,
        @Nullable FacetCounts facetCounts,
        @Nullable Map<String, Map<String, List<String>>> highlighting,
        @Nullable Map<String, GroupedField<T>> grouped,
        @Nullable Map<String, DocumentList<T>> moreLikeThis,
        Map<String, Object> raw
) {

    public SearchResult {
        docs = List.copyOf(docs);
    }

    public boolean hasFacets() {
        return facetCounts != null;
    }

    public boolean hasHighlighting() {
        return highlighting != null;
    }

    public boolean isGrouped() {
        return grouped != null;
    }

    public boolean hasMoreLikeThis() {
        return moreLikeThis != null;
    }

    /**
     * Highlight snippets for one document field; empty when there are none.
     */
    public List<String> highlights(String docId, String field) {
        if (highlighting == null) {
            return List.of();
        }
        return highlighting.getOrDefault(docId, Map.of()).getOrDefault(field, List.of());
    }
}
