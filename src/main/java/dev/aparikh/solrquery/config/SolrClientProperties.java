package dev.aparikh.solrquery.config;

import dev.aparikh.solrquery.client.auth.BasicAuth;
import dev.aparikh.solrquery.client.auth.BearerAuth;
import dev.aparikh.solrquery.client.auth.SolrAuth;
import dev.aparikh.solrquery.exception.SolrQueryConfigurationException;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings bound from {@code solr.*}.
 *
 * <pre>{@code
 * solr.url=http://localhost:8983
 * solr.collection=products
 * solr.request-timeout=30s
 * solr.username=reader
 * solr.password=secret
 * }</pre>
 *
 * @param url               Solr base URL; {@code /solr/} is appended when missing
 * @param collection        default collection for {@code SolrSearchClient}
 * @param connectionTimeout time to establish a connection
 * @param requestTimeout    time to wait for a complete response
 * @param username          Basic auth user
 * @param password          Basic auth password
 * @param token             bearer token; mutually exclusive with Basic auth
 */
@ConfigurationProperties(prefix = "solr")
public record SolrClientProperties(
        String url,
        @Nullable String collection,
        Duration connectionTimeout,
        Duration requestTimeout,
        @Nullable String username,
        @Nullable String password,
        @Nullable String token
) {

    public static final String DEFAULT_URL = "http://localhost:8983";
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofMillis(10000);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofMillis(60000);

    public SolrClientProperties {
        if (url == null || url.isBlank()) {
            url = DEFAULT_URL;
        }
        if (connectionTimeout == null) {
            connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
        }
        if (requestTimeout == null) {
            requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        }
    }

    /**
     * Credentials to send with each request, or null when none are configured.
     *
     * @throws SolrQueryConfigurationException if both a token and a username are set
     */
    public @Nullable SolrAuth auth() {
        boolean hasUser = username != null && !username.isBlank();
        boolean hasToken = token != null && !token.isBlank();
        if (hasUser && hasToken) {
            throw new SolrQueryConfigurationException("Configure either solr.username/password or solr.token, not both");
        }
        if (hasToken) {
            return new BearerAuth(token);
        }
        if (hasUser) {
            return new BasicAuth(username, password == null ? "" : password);
        }
        return null;
    }
}
