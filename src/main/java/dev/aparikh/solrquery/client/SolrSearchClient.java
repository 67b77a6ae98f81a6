package dev.aparikh.solrquery.client;

import dev.aparikh.solrquery.compose.QueryComposer;
import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.WireParams;
import dev.aparikh.solrquery.parser.QueryParser;
import dev.aparikh.solrquery.response.SearchDocument;
import dev.aparikh.solrquery.response.SearchResponseDecoder;
import dev.aparikh.solrquery.response.SearchResult;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a query model against Solr and returns the decoded result: compose, send, decode.
 *
 * <p>Each call is a single request; failures are not retried.</p>
 */
public class SolrSearchClient {

    private static final Logger log = LoggerFactory.getLogger(SolrSearchClient.class);

    private final SolrTransport transport;
    private final QueryComposer composer;
    private final SearchResponseDecoder decoder;
    private final String defaultCollection;

    public SolrSearchClient(SolrTransport transport, QueryComposer composer, SearchResponseDecoder decoder,
                            String defaultCollection) {
        this.transport = transport;
        this.composer = composer;
        this.decoder = decoder;
        this.defaultCollection = ParamChecks.requireText(defaultCollection, "Default collection");
    }

    public SearchResult<SearchDocument> search(QueryParser parser) {
        return search(defaultCollection, parser, null, SearchDocument.class);
    }

    public <T extends SearchDocument> SearchResult<T> search(QueryParser parser, Class<T> type) {
        return search(defaultCollection, parser, null, type);
    }

    /**
     * Runs a parser query with caller overrides on top of its params.
     *
     * @param collection target collection
     * @param parser     the query model
     * @param overrides  extra params; they win over the parser's own on shared keys
     * @param type       document type to bind results to
     */
    public <T extends SearchDocument> SearchResult<T> search(String collection, QueryParser parser,
                                                             @Nullable WireParams overrides, Class<T> type) {
        return execute(collection, composer.compose(parser, overrides), type);
    }

    /**
     * Runs a raw Lucene-syntax query against the default collection.
     */
    public <T extends SearchDocument> SearchResult<T> search(String rawQuery, Class<T> type) {
        return execute(defaultCollection, composer.compose(rawQuery, null), type);
    }

    private <T extends SearchDocument> SearchResult<T> execute(String collection, WireParams params, Class<T> type) {
        log.debug("Querying collection '{}' with params {}", collection, params.keys());
        TransportResponse response = transport.query(collection, params);
        SearchResult<T> result = decoder.decode(response, type);
        log.debug("Collection '{}' returned {} hits in {} ms", collection, result.numFound(), result.queryTime());
        return result;
    }
}
