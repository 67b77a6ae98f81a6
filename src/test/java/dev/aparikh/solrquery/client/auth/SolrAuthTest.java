package dev.aparikh.solrquery.client.auth;

import dev.aparikh.solrquery.exception.SolrQueryConfigurationException;
import org.apache.solr.client.solrj.SolrRequest;
import org.apache.solr.client.solrj.request.QueryRequest;
import org.apache.solr.common.params.ModifiableSolrParams;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolrAuthTest {

    private final QueryRequest request = new QueryRequest(new ModifiableSolrParams(), SolrRequest.METHOD.GET);

    @Test
    void shouldSetBasicCredentials() {
        new BasicAuth("reader", "secret").apply(request);

        assertThat(request.getBasicAuthUser()).isEqualTo("reader");
        assertThat(request.getBasicAuthPassword()).isEqualTo("secret");
    }

    @Test
    void shouldAddBearerHeader() {
        new BearerAuth("abc.def").apply(request);

        assertThat(request.getHeaders()).containsEntry("Authorization", "Bearer abc.def");
    }

    @Test
    void shouldMaskSecretsInToString() {
        assertThat(new BasicAuth("reader", "secret").toString()).doesNotContain("secret").contains("reader");
        assertThat(new BearerAuth("abc.def").toString()).doesNotContain("abc.def");
    }

    @Test
    void shouldRejectBlankCredentials() {
        assertThatThrownBy(() -> new BasicAuth(" ", "x")).isInstanceOf(SolrQueryConfigurationException.class);
        assertThatThrownBy(() -> new BearerAuth("")).isInstanceOf(SolrQueryConfigurationException.class);
    }
}
