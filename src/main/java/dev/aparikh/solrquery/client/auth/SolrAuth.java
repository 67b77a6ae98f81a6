package dev.aparikh.solrquery.client.auth;

import org.apache.solr.client.solrj.SolrRequest;

/**
 * Credentials attached to every outgoing request.
 */
public sealed interface SolrAuth permits BasicAuth, BearerAuth {

    void apply(SolrRequest<?> request);
}
