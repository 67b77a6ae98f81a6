package dev.aparikh.solrquery.client;

import dev.aparikh.solrquery.exception.SolrQueryException;
import dev.aparikh.solrquery.params.WireParams;

/**
 * Sends composed params to a collection's {@code /select} handler.
 */
public interface SolrTransport {

    /**
     * Executes one query. A response with a non-2xx status is returned, not thrown, so the
     * decoder can report Solr's own error detail.
     *
     * @throws SolrQueryException if Solr could not be reached
     */
    TransportResponse query(String collection, WireParams params);
}
