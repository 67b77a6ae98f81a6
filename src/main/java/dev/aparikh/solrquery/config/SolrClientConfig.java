package dev.aparikh.solrquery.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.solrquery.client.SolrJTransport;
import dev.aparikh.solrquery.client.SolrSearchClient;
import dev.aparikh.solrquery.client.SolrTransport;
import dev.aparikh.solrquery.compose.QueryComposer;
import dev.aparikh.solrquery.response.SearchResponseDecoder;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.impl.HttpJdkSolrClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

/**
 * Auto-configuration for the Solr query client.
 *
 * <p>Every bean backs off when the application defines its own. {@link SolrSearchClient} is
 * only created when {@code solr.collection} is set.</p>
 *
 * <p>The base URL is normalized so that it ends with {@code /solr/}:</p>
 * <ul>
 *   <li>{@code http://localhost:8983} → {@code http://localhost:8983/solr/}
 *   <li>{@code http://localhost:8983/} → {@code http://localhost:8983/solr/}
 *   <li>{@code http://localhost:8983/solr} → {@code http://localhost:8983/solr/}
 *   <li>{@code http://localhost:8983/solr/} → unchanged
 * </ul>
 *
 * <p>The client is SolrJ's {@link HttpJdkSolrClient}, built on the JDK HttpClient, so no Jetty
 * client is put on the application's classpath.</p>
 *
 * @see SolrClientProperties
 */
@AutoConfiguration
@EnableConfigurationProperties(SolrClientProperties.class)
public class SolrClientConfig {

    private static final Logger log = LoggerFactory.getLogger(SolrClientConfig.class);

    private static final String SOLR_PATH = "solr/";

    @Bean
    @ConditionalOnMissingBean
    SolrClient solrClient(SolrClientProperties properties) {
        String url = normalizeUrl(properties.url());
        log.info("Connecting to Solr at {}", url);
        return new HttpJdkSolrClient.Builder(url)
                .withConnectionTimeout(properties.connectionTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .withIdleTimeout(properties.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .withRequestTimeout(properties.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    QueryComposer queryComposer() {
        return new QueryComposer();
    }

    @Bean
    @ConditionalOnMissingBean
    SearchResponseDecoder searchResponseDecoder(ObjectProvider<ObjectMapper> objectMapper) {
        return new SearchResponseDecoder(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    SolrTransport solrTransport(SolrClient solrClient, SolrClientProperties properties) {
        return new SolrJTransport(solrClient, properties.auth());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "solr", name = "collection")
    SolrSearchClient solrSearchClient(SolrTransport transport, QueryComposer composer,
                                      SearchResponseDecoder decoder, SolrClientProperties properties) {
        return new SolrSearchClient(transport, composer, decoder, properties.collection());
    }

    /**
     * Ensures the URL ends with {@code /solr/}.
     */
    static String normalizeUrl(String url) {
        String normalized = url.trim();
        if (!normalized.endsWith("/")) {
            normalized = normalized + "/";
        }
        if (!normalized.endsWith("/" + SOLR_PATH) && !normalized.contains("/" + SOLR_PATH)) {
            normalized = normalized + SOLR_PATH;
        }
        return normalized;
    }
}
