package dev.aparikh.solrquery.parser.sparse;

import dev.aparikh.solrquery.exception.SolrQueryConfigurationException;
import dev.aparikh.solrquery.params.CommonParams;
import dev.aparikh.solrquery.params.WireParams;
import dev.aparikh.solrquery.params.config.FacetConfig;
import dev.aparikh.solrquery.params.config.GroupConfig;
import dev.aparikh.solrquery.params.config.HighlightConfig;
import dev.aparikh.solrquery.params.config.MoreLikeThisConfig;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SparseQueryParserTest {

    private static Map<String, Double> weights(String field1, double boost1, String field2, double boost2) {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(field1, boost1);
        weights.put(field2, boost2);
        return weights;
    }

    @Nested
    class Standard {

        @Test
        void shouldBuildQueryWithRowsAndFacet() {
            StandardQueryParser parser = StandardQueryParser.builder()
                    .query("title:mouse")
                    .rows(5)
                    .facet(FacetConfig.builder().fields("category").build())
                    .build();

            WireParams params = parser.build();

            assertThat(params.get("q")).isEqualTo("title:mouse");
            assertThat(params.get("rows")).isEqualTo(5);
            assertThat(params.get("facet")).isEqualTo(true);
            assertThat(params.getAll("facet.field")).containsExactly("category");
            assertThat(params.containsKey("defType")).isFalse();
            assertThat(params.keys()).containsExactlyInAnyOrder("q", "rows", "facet", "facet.field");
        }

        @Test
        void shouldBuildSameParamsEveryTime() {
            StandardQueryParser parser = StandardQueryParser.builder()
                    .query("title:mouse")
                    .filters("inStock:true")
                    .highlight(HighlightConfig.builder().fields("title").build())
                    .build();

            assertThat(parser.build()).isEqualTo(parser.build());
        }

        @Test
        void shouldEmitOperatorDefaultFieldAndSow() {
            WireParams params = StandardQueryParser.builder()
                    .query("mouse keyboard")
                    .operator(SparseQueryParser.Operator.AND)
                    .defaultField("title")
                    .splitOnWhitespace(false)
                    .build()
                    .build();

            assertThat(params.get("q.op")).isEqualTo("AND");
            assertThat(params.get("df")).isEqualTo("title");
            assertThat(params.get("sow")).isEqualTo(false);
        }

        @Test
        void shouldAttachAllFeatureBlocksTogether() {
            WireParams params = StandardQueryParser.builder()
                    .query("*:*")
                    .facet(FacetConfig.builder().build())
                    .group(GroupConfig.builder().by("brand").build())
                    .highlight(HighlightConfig.builder().build())
                    .moreLikeThis(MoreLikeThisConfig.builder().fields("body").build())
                    .build()
                    .build();

            assertThat(params.get("facet")).isEqualTo(true);
            assertThat(params.get("group")).isEqualTo(true);
            assertThat(params.get("hl")).isEqualTo(true);
            assertThat(params.get("mlt")).isEqualTo(true);
        }

        @Test
        void shouldCarryCommonParams() {
            CommonParams common = CommonParams.builder().start(20).rows(10).sort("score desc").build();

            StandardQueryParser parser = StandardQueryParser.builder()
                    .query("*:*")
                    .commonParams(common)
                    .build();

            assertThat(parser.commonParams()).isEqualTo(common);
            assertThat(parser.build().get("start")).isEqualTo(20);
            assertThat(parser.build().get("sort")).isEqualTo("score desc");
        }

        @Test
        void shouldRejectMissingQuery() {
            assertThatThrownBy(() -> StandardQueryParser.builder().rows(5).build())
                    .isInstanceOf(SolrQueryConfigurationException.class)
                    .hasMessageContaining("q");
        }

        @Test
        void shouldRejectBlankQuery() {
            assertThatThrownBy(() -> StandardQueryParser.of("  "))
                    .isInstanceOf(SolrQueryConfigurationException.class);
        }
    }

    @Nested
    class DisMax {

        @Test
        void shouldEmitDisMaxFields() {
            WireParams params = DisMaxQueryParser.builder()
                    .query("wireless mouse")
                    .queryFields(weights("title", 2.0, "description", 1.0))
                    .phraseFields(weights("title", 3.0, "description", 1.5))
                    .minimumMatch("75%")
                    .tie(0.1)
                    .boostQueries("inStock:true")
                    .boostFunctions("recip(ms(NOW,date),3.16e-11,1,1)")
                    .build()
                    .build();

            assertThat(params.get("defType")).isEqualTo("dismax");
            assertThat(params.get("qf")).isEqualTo("title^2.0 description^1.0");
            assertThat(params.get("pf")).isEqualTo("title^3.0 description^1.5");
            assertThat(params.get("mm")).isEqualTo("75%");
            assertThat(params.get("tie")).isEqualTo(0.1);
            assertThat(params.getAll("bq")).containsExactly("inStock:true");
            assertThat(params.getAll("bf")).containsExactly("recip(ms(NOW,date),3.16e-11,1,1)");
        }

        @Test
        void shouldAcceptTieBounds() {
            assertThat(DisMaxQueryParser.builder().query("a").tie(0.0).build().build().get("tie")).isEqualTo(0.0);
            assertThat(DisMaxQueryParser.builder().query("a").tie(1.0).build().build().get("tie")).isEqualTo(1.0);
        }

        @Test
        void shouldRejectTieOutOfRange() {
            assertThatThrownBy(() -> DisMaxQueryParser.builder().query("a").tie(1.5).build())
                    .isInstanceOf(SolrQueryConfigurationException.class)
                    .hasMessageContaining("tie");
        }

        @Test
        void shouldRejectNaNTie() {
            assertThatThrownBy(() -> DisMaxQueryParser.builder().query("a").tie(Double.NaN).build())
                    .isInstanceOf(SolrQueryConfigurationException.class)
                    .hasMessageContaining("tie");
        }

        @Test
        void shouldRejectNaNBoost() {
            Map<String, Double> qf = weights("title", Double.NaN, "body", 1.0);

            assertThatThrownBy(() -> DisMaxQueryParser.builder().query("a").queryFields(qf).build())
                    .isInstanceOf(SolrQueryConfigurationException.class)
                    .hasMessageContaining("title");
        }

        @Test
        void shouldRejectNegativeSlop() {
            assertThatThrownBy(() -> DisMaxQueryParser.builder().query("a").phraseSlop(-1).build())
                    .isInstanceOf(SolrQueryConfigurationException.class);
        }

        @Test
        void shouldKeepQueryFieldOrderAfterCallerMutation() {
            Map<String, Double> qf = weights("title", 2.0, "body", 1.0);
            DisMaxQueryParser parser = DisMaxQueryParser.builder().query("a").queryFields(qf).build();

            qf.put("extra", 5.0);

            assertThat(parser.build().get("qf")).isEqualTo("title^2.0 body^1.0");
        }
    }

    @Nested
    class ExtendedDisMax {

        @Test
        void shouldEmitEdismaxFieldsOnTopOfDisMax() {
            WireParams params = ExtendedDisMaxQueryParser.builder()
                    .query("laptop")
                    .queryFields(weights("title", 2.0, "body", 1.0))
                    .bigramPhraseFields(weights("title", 1.5, "body", 1.0))
                    .bigramPhraseSlop(1)
                    .userFields("title", "-secret")
                    .boosts("log(popularity)", "recip(rord(date),1,1000,1000)")
                    .minimumMatchAutoRelax(true)
                    .lowercaseOperators(false)
                    .build()
                    .build();

            assertThat(params.get("defType")).isEqualTo("edismax");
            assertThat(params.get("qf")).isEqualTo("title^2.0 body^1.0");
            assertThat(params.get("pf2")).isEqualTo("title^1.5 body^1.0");
            assertThat(params.get("ps2")).isEqualTo(1);
            assertThat(params.get("uf")).isEqualTo("title -secret");
            assertThat(params.getAll("boost")).containsExactly("log(popularity)", "recip(rord(date),1,1000,1000)");
            assertThat(params.get("mm.autoRelax")).isEqualTo(true);
            assertThat(params.get("lowercaseOperators")).isEqualTo(false);
        }

        @Test
        void shouldShareDisMaxBaseWithoutBeingDisMax() {
            AbstractDisMaxQueryParser edismax = ExtendedDisMaxQueryParser.builder()
                    .query("laptop")
                    .queryFields(weights("title", 2.0, "body", 1.0))
                    .tie(0.3)
                    .build();
            AbstractDisMaxQueryParser dismax = DisMaxQueryParser.builder()
                    .query("laptop")
                    .queryFields(weights("title", 2.0, "body", 1.0))
                    .tie(0.3)
                    .build();

            assertThat(edismax).isNotInstanceOf(DisMaxQueryParser.class);
            assertThat(edismax.queryFields()).isEqualTo(dismax.queryFields());
            assertThat(edismax.build().get("defType")).isEqualTo("edismax");
            assertThat(dismax.build().get("defType")).isEqualTo("dismax");
            assertThat(edismax.build().get("tie")).isEqualTo(dismax.build().get("tie"));
        }

        @Test
        void shouldOmitEmptyUserFields() {
            WireParams params = ExtendedDisMaxQueryParser.builder().query("laptop").userFields().build().build();

            assertThat(params.containsKey("uf")).isFalse();
        }

        @Test
        void shouldAttachFeatureBlocks() {
            WireParams params = ExtendedDisMaxQueryParser.builder()
                    .query("laptop")
                    .facet(FacetConfig.builder().fields("brand").build())
                    .build()
                    .build();

            assertThat(params.getAll("facet.field")).containsExactly("brand");
        }
    }

    @Nested
    class Terms {

        @Test
        void shouldAppendTermsFilterAfterCommonFilters() {
            WireParams params = TermsQueryParser.builder()
                    .field("id")
                    .terms("a", "b", "c")
                    .filters("inStock:true")
                    .build()
                    .build();

            assertThat(params.get("q")).isEqualTo("*:*");
            assertThat(params.getAll("fq")).containsExactly("inStock:true", "{!terms f=id separator=,}a,b,c");
        }

        @Test
        void shouldUseSeparatorAndMethod() {
            TermsQueryParser parser = TermsQueryParser.builder()
                    .query("category:books")
                    .field("sku")
                    .terms(List.of("x1", "x2"))
                    .separator("|")
                    .method(TermsQueryParser.Method.BOOLEAN_QUERY)
                    .build();

            assertThat(parser.build().get("q")).isEqualTo("category:books");
            assertThat(parser.build().getAll("fq"))
                    .containsExactly("{!terms f=sku separator=| method=booleanQuery}x1|x2");
        }

        @Test
        void shouldRejectTermContainingSeparator() {
            assertThatThrownBy(() -> TermsQueryParser.builder().field("id").terms("a,b", "c").build())
                    .isInstanceOf(SolrQueryConfigurationException.class)
                    .hasMessageContaining("a,b");
        }

        @Test
        void shouldAcceptCommaTermWithOtherSeparator() {
            TermsQueryParser parser = TermsQueryParser.builder().field("id").terms("a,b", "c").separator("|").build();

            assertThat(parser.build().getAll("fq")).containsExactly("{!terms f=id separator=|}a,b|c");
        }

        @Test
        void shouldRejectEmptyTerms() {
            assertThatThrownBy(() -> TermsQueryParser.builder().field("id").terms().build())
                    .isInstanceOf(SolrQueryConfigurationException.class);
        }

        @Test
        void shouldRejectMissingField() {
            assertThatThrownBy(() -> TermsQueryParser.builder().terms("a").build())
                    .isInstanceOf(SolrQueryConfigurationException.class);
        }
    }
}
