package dev.aparikh.solrquery.client.auth;

import dev.aparikh.solrquery.params.ParamChecks;
import org.apache.solr.client.solrj.SolrRequest;

/**
 * HTTP Basic authentication, for Solr's {@code BasicAuthPlugin}.
 */
public record BasicAuth(String username, String password) implements SolrAuth {

    public BasicAuth {
        ParamChecks.requireText(username, "Username");
        ParamChecks.requirePresent(password, "Password");
    }

    @Override
    public void apply(SolrRequest<?> request) {
        request.setBasicAuthCredentials(username, password);
    }

    @Override
    public String toString() {
        return "BasicAuth[username=" + username + ", password=****]";
    }
}
