package dev.aparikh.solrquery.client;

import dev.aparikh.solrquery.client.auth.SolrAuth;
import dev.aparikh.solrquery.exception.SolrQueryException;
import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.WireParams;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrRequest;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.impl.InputStreamResponseParser;
import org.apache.solr.client.solrj.request.QueryRequest;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.util.NamedList;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * {@link SolrTransport} over a SolrJ {@link SolrClient}.
 *
 * <p>The response stream is read through an {@link InputStreamResponseParser}, which hands back
 * the body and HTTP status without raising on non-2xx. Solr's JSON error payload therefore
 * reaches the decoder intact and surfaces as a {@link SolrQueryException} in one place.</p>
 */
public class SolrJTransport implements SolrTransport {

    private static final Logger log = LoggerFactory.getLogger(SolrJTransport.class);

    static final String STREAM_KEY = "stream";
    static final String STATUS_KEY = "responseStatus";

    private final SolrClient solrClient;
    private final @Nullable SolrAuth auth;

    public SolrJTransport(SolrClient solrClient) {
        this(solrClient, null);
    }

    public SolrJTransport(SolrClient solrClient, @Nullable SolrAuth auth) {
        this.solrClient = solrClient;
        this.auth = auth;
    }

    @Override
    public TransportResponse query(String collection, WireParams params) {
        ParamChecks.requireText(collection, "Collection");
        QueryRequest request = new QueryRequest(params.toSolrParams(), SolrRequest.METHOD.GET);
        request.setResponseParser(new InputStreamResponseParser("json"));
        if (auth != null) {
            auth.apply(request);
        }

        try {
            NamedList<Object> response = solrClient.request(request, collection);
            Object status = response.get(STATUS_KEY);
            int code = status instanceof Number ? ((Number) status).intValue() : 200;
            String body = read(response.get(STREAM_KEY));
            if (code < 200 || code >= 300) {
                log.warn("Solr query on collection '{}' returned HTTP {}", collection, code);
            }
            return new TransportResponse(code, body);
        } catch (SolrException e) {
            throw new SolrQueryException("Solr request failed with HTTP " + e.code() + ": " + e.getMessage(),
                    e.code(), null, null, e);
        } catch (SolrServerException | IOException e) {
            throw new SolrQueryException("Failed to query Solr collection '" + collection + "': " + e.getMessage(), e);
        }
    }

    private static @Nullable String read(@Nullable Object stream) throws IOException {
        if (stream == null) {
            return null;
        }
        try (InputStream in = (InputStream) stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
