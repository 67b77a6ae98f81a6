package dev.aparikh.solrquery.response;

import dev.aparikh.solrquery.client.TransportResponse;
import dev.aparikh.solrquery.exception.SolrQueryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchResponseDecoderTest {

    private static final String TWO_DOCS = """
            {
              "responseHeader": {"status": 0, "QTime": 3},
              "response": {
                "numFound": 2, "start": 0, "numFoundExact": true,
                "docs": [
                  {"id": "1", "name": "Mouse", "price": 19.99, "_version_": 1},
                  {"id": "2", "name": "Trackball"}
                ]
              }
            }
            """;

    private SearchResponseDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new SearchResponseDecoder();
    }

    @Nested
    class Documents {

        @Test
        void shouldDecodeHitsWithoutOptionalBlocks() {
            SearchResult<Product> result = decoder.decode(200, TWO_DOCS, Product.class);

            assertThat(result.status()).isZero();
            assertThat(result.queryTime()).isEqualTo(3);
            assertThat(result.numFound()).isEqualTo(2);
            assertThat(result.start()).isZero();
            assertThat(result.numFoundExact()).isTrue();
            assertThat(result.docs()).extracting(Product::getId).containsExactly("1", "2");
            assertThat(result.facetCounts()).isNull();
            assertThat(result.highlighting()).isNull();
            assertThat(result.grouped()).isNull();
            assertThat(result.moreLikeThis()).isNull();
            assertThat(result.hasFacets()).isFalse();
        }

        @Test
        void shouldKeepUnknownFields() {
            SearchResult<Product> result = decoder.decode(new TransportResponse(200, TWO_DOCS), Product.class);

            Product mouse = result.docs().get(0);
            assertThat(mouse.getName()).isEqualTo("Mouse");
            assertThat(mouse.get("price")).isEqualTo(19.99);
            assertThat(mouse.getAdditionalFields()).containsKeys("price", "_version_");
            assertThat(result.docs().get(1).getAdditionalFields()).isEmpty();
        }

        @Test
        void shouldDecodeIntoPlainDocuments() {
            SearchResult<SearchDocument> result = decoder.decode(200, TWO_DOCS, SearchDocument.class);

            assertThat(result.docs().get(0).get("id")).isEqualTo("1");
            assertThat(result.raw()).containsKeys("responseHeader", "response");
        }

        @Test
        void shouldFailWhenRequiredFieldMissing() {
            String body = """
                    {"responseHeader": {"status": 0, "QTime": 1},
                     "response": {"numFound": 1, "start": 0, "docs": [{"name": "No id"}]}}
                    """;

            assertThatThrownBy(() -> decoder.decode(200, body, Product.class))
                    .isInstanceOf(SolrQueryException.class)
                    .hasMessageContaining("Product")
                    .satisfies(e -> {
                        SolrQueryException ex = (SolrQueryException) e;
                        assertThat(ex.statusCode()).isEqualTo(200);
                        assertThat(ex.rawPayload()).isEqualTo(body);
                    });
        }

        @Test
        void shouldDefaultMissingHeaderFields() {
            SearchResult<SearchDocument> result = decoder.decode(200,
                    "{\"response\": {\"numFound\": 0, \"start\": 0, \"docs\": []}}", SearchDocument.class);

            assertThat(result.status()).isZero();
            assertThat(result.queryTime()).isZero();
            assertThat(result.numFoundExact()).isNull();
            assertThat(result.docs()).isEmpty();
        }
    }

    @Nested
    class Errors {

        @Test
        void shouldRaiseSolrErrorWithStatus() {
            String body = """
                    {"responseHeader": {"status": 400, "QTime": 0},
                     "error": {"msg": "undefined field foo", "code": 400}}
                    """;

            assertThatThrownBy(() -> decoder.decode(400, body, SearchDocument.class))
                    .isInstanceOf(SolrQueryException.class)
                    .hasMessageContaining("400")
                    .hasMessageContaining("undefined field foo")
                    .satisfies(e -> {
                        SolrQueryException ex = (SolrQueryException) e;
                        assertThat(ex.statusCode()).isEqualTo(400);
                        assertThat(ex.rawPayload()).isEqualTo(body);
                        assertThat(ex.parsedPayload()).containsKey("error");
                    });
        }

        @Test
        void shouldRaiseErrorForNonJsonFailure() {
            assertThatThrownBy(() -> decoder.decode(503, "Service Unavailable", SearchDocument.class))
                    .isInstanceOf(SolrQueryException.class)
                    .satisfies(e -> {
                        SolrQueryException ex = (SolrQueryException) e;
                        assertThat(ex.statusCode()).isEqualTo(503);
                        assertThat(ex.parsedPayload()).isNull();
                    });
        }

        @Test
        void shouldRaiseErrorForInvalidJson() {
            assertThatThrownBy(() -> decoder.decode(200, "{not json", SearchDocument.class))
                    .isInstanceOf(SolrQueryException.class)
                    .hasMessageContaining("not valid JSON");
        }

        @Test
        void shouldRaiseErrorForEmptyBody() {
            assertThatThrownBy(() -> decoder.decode(200, "", SearchDocument.class))
                    .isInstanceOf(SolrQueryException.class);
        }

        @Test
        void shouldRaiseErrorForJsonArray() {
            assertThatThrownBy(() -> decoder.decode(200, "[1,2]", SearchDocument.class))
                    .isInstanceOf(SolrQueryException.class)
                    .hasMessageContaining("not a JSON object");
        }
    }

    @Nested
    class Facets {

        @Test
        void shouldDecodeFieldQueryAndRangeFacets() {
            String body = """
                    {"responseHeader": {"status": 0, "QTime": 2},
                     "response": {"numFound": 3, "start": 0, "docs": []},
                     "facet_counts": {
                       "facet_queries": {"price:[0 TO 10]": 2},
                       "facet_fields": {"category": ["electronics", 2, "books", 1, null, 0]},
                       "facet_ranges": {"price": {"counts": ["0.0", 2, "100.0", 1],
                                                  "gap": 100.0, "start": 0.0, "end": 200.0, "before": 0}},
                       "facet_intervals": {},
                       "facet_heatmaps": {}
                     }}
                    """;

            SearchResult<SearchDocument> result = decoder.decode(200, body, SearchDocument.class);

            FacetCounts facets = result.facetCounts();
            assertThat(result.hasFacets()).isTrue();
            assertThat(facets.query("price:[0 TO 10]")).isEqualTo(2);
            assertThat(facets.field("category")).containsExactly(
                    new FacetCount("electronics", 2),
                    new FacetCount("books", 1),
                    new FacetCount(null, 0));
            assertThat(facets.field("brand")).isEmpty();

            RangeFacet price = facets.facetRanges().get("price");
            assertThat(price.counts()).containsExactly(new FacetCount("0.0", 2), new FacetCount("100.0", 1));
            assertThat(price.gap()).isEqualTo("100.0");
            assertThat(price.before()).isZero();
            assertThat(price.after()).isNull();
            assertThat(facets.raw()).containsKey("facet_heatmaps");
        }

        @Test
        void shouldDecodeMapStyleBuckets() {
            String body = """
                    {"response": {"numFound": 0, "start": 0, "docs": []},
                     "facet_counts": {"facet_fields": {"brand": {"acme": 4, "zeta": 1}}}}
                    """;

            FacetCounts facets = decoder.decode(200, body, SearchDocument.class).facetCounts();

            assertThat(facets.field("brand")).containsExactly(new FacetCount("acme", 4), new FacetCount("zeta", 1));
            assertThat(facets.facetPivot()).isEmpty();
        }
    }

    @Test
    void shouldDecodeHighlighting() {
        String body = """
                {"response": {"numFound": 1, "start": 0, "docs": [{"id": "1"}]},
                 "highlighting": {"1": {"title": ["<em>Mouse</em> pad"], "body": []}}}
                """;

        SearchResult<SearchDocument> result = decoder.decode(200, body, SearchDocument.class);

        assertThat(result.hasHighlighting()).isTrue();
        assertThat(result.highlights("1", "title")).containsExactly("<em>Mouse</em> pad");
        assertThat(result.highlights("1", "body")).isEmpty();
        assertThat(result.highlights("2", "title")).isEmpty();
    }

    @Nested
    class Grouping {

        private static final String GROUPED = """
                {"responseHeader": {"status": 0, "QTime": 4},
                 "grouped": {"brand": {"matches": 3, "ngroups": 2, "groups": [
                   {"groupValue": "acme", "doclist": {"numFound": 2, "start": 0,
                     "docs": [{"id": "1", "name": "A"}, {"id": "2", "name": "B"}]}},
                   {"groupValue": null, "doclist": {"numFound": 1, "start": 0,
                     "docs": [{"id": "3", "name": "C"}]}}
                 ]}}}
                """;

        @Test
        void shouldDecodeGroups() {
            SearchResult<Product> result = decoder.decode(200, GROUPED, Product.class);

            GroupedField<Product> brand = result.grouped().get("brand");
            assertThat(result.isGrouped()).isTrue();
            assertThat(brand.matches()).isEqualTo(3);
            assertThat(brand.ngroups()).isEqualTo(2);
            assertThat(brand.groups()).extracting(Group::groupValue).containsExactly("acme", null);
            assertThat(brand.groups().get(0).doclist().docs()).extracting(Product::getId).containsExactly("1", "2");
            assertThat(brand.doclist()).isNull();
        }

        @Test
        void shouldFlattenGroupedDocumentsWhenResponseMissing() {
            SearchResult<Product> result = decoder.decode(200, GROUPED, Product.class);

            assertThat(result.numFound()).isEqualTo(3);
            assertThat(result.start()).isZero();
            assertThat(result.docs()).extracting(Product::getId).containsExactly("1", "2", "3");
        }

        @Test
        void shouldDecodeSimpleFormat() {
            String body = """
                    {"grouped": {"brand": {"matches": 2,
                      "doclist": {"numFound": 2, "start": 0, "docs": [{"id": "1"}, {"id": "2"}]}}}}
                    """;

            SearchResult<SearchDocument> result = decoder.decode(200, body, SearchDocument.class);

            GroupedField<SearchDocument> brand = result.grouped().get("brand");
            assertThat(brand.groups()).isEmpty();
            assertThat(brand.ngroups()).isNull();
            assertThat(brand.doclist().numFound()).isEqualTo(2);
            assertThat(result.docs()).hasSize(2);
        }
    }

    @Test
    void shouldDecodeMoreLikeThis() {
        String body = """
                {"response": {"numFound": 1, "start": 0, "docs": [{"id": "1", "name": "Mouse"}]},
                 "moreLikeThis": {"1": {"numFound": 5, "start": 0, "docs": [{"id": "7", "name": "Trackpad"}]}}}
                """;

        SearchResult<Product> result = decoder.decode(200, body, Product.class);

        assertThat(result.hasMoreLikeThis()).isTrue();
        DocumentList<Product> similar = result.moreLikeThis().get("1");
        assertThat(similar.numFound()).isEqualTo(5);
        assertThat(similar.docs()).extracting(Product::getName).containsExactly("Trackpad");
    }

    @Test
    void shouldDecodeFlatMoreLikeThis() {
        String body = """
                {"response": {"numFound": 0, "start": 0, "docs": []},
                 "moreLikeThis": ["1", {"numFound": 1, "start": 0, "docs": [{"id": "9"}]}]}
                """;

        SearchResult<SearchDocument> result = decoder.decode(200, body, SearchDocument.class);

        assertThat(result.moreLikeThis()).containsOnlyKeys("1");
        assertThat(result.moreLikeThis().get("1").docs()).hasSize(1);
        assertThat(List.copyOf(result.moreLikeThis().keySet())).containsExactly("1");
    }
}
