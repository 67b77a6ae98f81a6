package dev.aparikh.solrquery.parser;

import dev.aparikh.solrquery.params.CommonParams;
import dev.aparikh.solrquery.params.WireParams;

/**
 * A fully described Solr query: parser-specific fields plus the shared {@link CommonParams}.
 *
 * <p>Implementations are immutable and validated at construction, so {@link #build()} is
 * pure and may be called any number of times.</p>
 */
public interface QueryParser {

    /**
     * Flattens this query into Solr wire params.
     */
    WireParams build();

    CommonParams commonParams();
}
