package dev.aparikh.solrquery.params;

import dev.aparikh.solrquery.exception.ParamSerializationException;
import org.apache.solr.common.params.ModifiableSolrParams;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WireParamsTest {

    @Test
    void shouldIgnoreNullAndEmptyValues() {
        WireParams params = WireParams.builder()
                .put("rows", null)
                .put("fq", List.of())
                .put("q", "*:*")
                .build();

        assertThat(params.keys()).containsExactly("q");
    }

    @Test
    void shouldKeepRepeatedValuesAsList() {
        WireParams params = WireParams.builder()
                .put("fq", List.of("inStock:true", "price:[0 TO 50]"))
                .build();

        assertThat(params.getAll("fq")).containsExactly("inStock:true", "price:[0 TO 50]");
        assertThat(params.getString("fq")).isEqualTo("inStock:true,price:[0 TO 50]");
    }

    @Test
    void shouldAppendToExistingKey() {
        WireParams params = WireParams.builder()
                .put("fq", "a:1")
                .append("fq", "b:2")
                .append("fq", List.of("c:3"))
                .build();

        assertThat(params.getAll("fq")).containsExactly("a:1", "b:2", "c:3");
    }

    @Test
    void shouldLetOverridesWinOnMerge() {
        WireParams base = WireParams.builder().put("rows", 10).put("q", "*:*").build();
        WireParams overrides = WireParams.builder().put("rows", 20).build();

        WireParams merged = base.merge(overrides);

        assertThat(merged.get("rows")).isEqualTo(20);
        assertThat(merged.get("q")).isEqualTo("*:*");
        assertThat(base.get("rows")).isEqualTo(10);
    }

    @Test
    void shouldReturnSameInstanceWhenMergingNothing() {
        WireParams base = WireParams.builder().put("q", "*:*").build();

        assertThat(base.merge(null)).isSameAs(base);
        assertThat(base.merge(WireParams.empty())).isSameAs(base);
    }

    @Test
    void shouldIgnoreKeyOrderInEquality() {
        WireParams first = WireParams.builder().put("a", 1).put("b", 2).build();
        WireParams second = WireParams.builder().put("b", 2).put("a", 1).build();

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
    }

    @Test
    void shouldConvertToSolrParamsWithRepeatedKeys() {
        WireParams params = WireParams.builder()
                .put("q", "title:mouse")
                .put("rows", 5)
                .put("facet", true)
                .put("fq", List.of("a:1", "b:2"))
                .build();

        ModifiableSolrParams solrParams = params.toSolrParams();

        assertThat(solrParams.get("q")).isEqualTo("title:mouse");
        assertThat(solrParams.get("rows")).isEqualTo("5");
        assertThat(solrParams.get("facet")).isEqualTo("true");
        assertThat(solrParams.getParams("fq")).containsExactly("a:1", "b:2");
    }

    @Test
    void shouldNormalizeCallerMap() {
        WireParams params = WireParams.of(Map.of("echoParams", CommonParams.EchoParams.ALL));

        assertThat(params.get("echoParams")).isEqualTo("all");
    }

    @Test
    void shouldRejectUnsupportedValueType() {
        assertThatThrownBy(() -> WireParams.builder().put("q", new Object()))
                .isInstanceOf(ParamSerializationException.class)
                .hasMessageContaining("'q'");
    }

    @Test
    void shouldRejectEmptyKey() {
        assertThatThrownBy(() -> WireParams.builder().put("", "x"))
                .isInstanceOf(ParamSerializationException.class);
    }
}
