package dev.aparikh.solrquery.client.auth;

import dev.aparikh.solrquery.params.ParamChecks;
import org.apache.solr.client.solrj.SolrRequest;

/**
 * Bearer token authentication, e.g. for Solr's {@code JWTAuthPlugin}.
 */
public record BearerAuth(String token) implements SolrAuth {

    public static final String AUTHORIZATION = "Authorization";

    public BearerAuth {
        ParamChecks.requireText(token, "Token");
    }

    @Override
    public void apply(SolrRequest<?> request) {
        request.addHeader(AUTHORIZATION, "Bearer " + token);
    }

    @Override
    public String toString() {
        return "BearerAuth[token=****]";
    }
}
