package dev.aparikh.solrquery.params;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalParamsTest {

    @Test
    void shouldRenderTypeParamsAndBody() {
        LocalParams localParams = LocalParams.builder("knn")
                .param("f", "vector")
                .param("topK", 10)
                .body("[0.1,0.2]")
                .build();

        assertThat(localParams.render()).isEqualTo("{!knn f=vector topK=10}[0.1,0.2]");
    }

    @Test
    void shouldSkipNullParams() {
        LocalParams localParams = LocalParams.builder("geofilt")
                .param("score", null)
                .param("filter", false)
                .build();

        assertThat(localParams.render()).isEqualTo("{!geofilt filter=false}");
    }

    @Test
    void shouldQuoteValuesWithWhitespaceOrQuotes() {
        LocalParams localParams = LocalParams.builder("knn")
                .param("preFilter", "inStock:true AND price:[0 TO 10]")
                .param("excludeTags", "it's")
                .build();

        assertThat(localParams.render())
                .isEqualTo("{!knn preFilter='inStock:true AND price:[0 TO 10]' excludeTags='it\\'s'}");
    }

    @Test
    void shouldParseWhatItRenders() {
        LocalParams original = LocalParams.builder("knn")
                .param("f", "vector")
                .params("preFilter", List.of("category:\"books\"", "inStock:true AND price:[0 TO 10]"))
                .param("topK", 5)
                .body("[1.0,2.0]")
                .build();

        LocalParams parsed = LocalParams.parse(original.render());

        assertThat(parsed.type()).isEqualTo("knn");
        assertThat(parsed.value("f")).isEqualTo("vector");
        assertThat(parsed.values("preFilter"))
                .containsExactly("category:\"books\"", "inStock:true AND price:[0 TO 10]");
        assertThat(parsed.value("topK")).isEqualTo("5");
        assertThat(parsed.body()).isEqualTo("[1.0,2.0]");
        assertThat(parsed.render()).isEqualTo(original.render());
    }

    @Test
    void shouldReturnNullForMissingKey() {
        LocalParams parsed = LocalParams.parse("{!bbox}");

        assertThat(parsed.type()).isEqualTo("bbox");
        assertThat(parsed.value("score")).isNull();
        assertThat(parsed.body()).isEmpty();
    }

    @Test
    void shouldRejectTextWithoutPrefix() {
        assertThatThrownBy(() -> LocalParams.parse("knn f=vector"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectUnterminatedExpression() {
        assertThatThrownBy(() -> LocalParams.parse("{!knn f=vector"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
