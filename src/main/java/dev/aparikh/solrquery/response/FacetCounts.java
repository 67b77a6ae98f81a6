package dev.aparikh.solrquery.response;

import java.util.List;
import java.util.Map;

/**
 * Decoded {@code facet_counts} block.
 *
 * @param facetQueries   count per {@code facet.query}
 * @param facetFields    buckets per {@code facet.field}, in Solr's order
 * @param facetRanges    buckets per {@code facet.range} field
 * @param facetPivot     pivot trees as returned by Solr
 * @param facetIntervals interval facets as returned by Solr
 * @param raw            the whole block, verbatim
 */
public record FacetCounts(
        Map<String, Long> facetQueries,
        Map<String, List<FacetCount>> facetFields,
        Map<String, RangeFacet> facetRanges,
        Map<String, Object> facetPivot,
        Map<String, Object> facetIntervals,
        Map<String, Object> raw
) {

    /**
     * Buckets for one field facet; empty when the field was not faceted.
     */
    public List<FacetCount> field(String name) {
        return facetFields.getOrDefault(name, List.of());
    }

    public long query(String facetQuery) {
        return facetQueries.getOrDefault(facetQuery, 0L);
    }
}
