package dev.aparikh.solrquery.parser.sparse;

import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.WireParams;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Extended DisMax: DisMax plus full Lucene syntax, bigram/trigram phrase boosts, and
 * multiplicative boosts.
 *
 * @see <a href="https://solr.apache.org/guide/solr/latest/query-guide/edismax-query-parser.html">Extended DisMax Query Parser</a>
 */
public final class ExtendedDisMaxQueryParser extends AbstractDisMaxQueryParser {

    private final @Nullable Boolean minimumMatchAutoRelax;
    private final @Nullable Boolean lowercaseOperators;
    private final @Nullable Map<String, Double> bigramPhraseFields;
    private final @Nullable Integer bigramPhraseSlop;
    private final @Nullable Map<String, Double> trigramPhraseFields;
    private final @Nullable Integer trigramPhraseSlop;
    private final @Nullable Boolean stopwords;
    private final @Nullable List<String> userFields;
    private final @Nullable List<String> boosts;

    private ExtendedDisMaxQueryParser(Builder builder) {
        super(builder);
        this.minimumMatchAutoRelax = builder.minimumMatchAutoRelax;
        this.lowercaseOperators = builder.lowercaseOperators;
        this.bigramPhraseFields = weights(builder.bigramPhraseFields, "pf2");
        this.bigramPhraseSlop = builder.bigramPhraseSlop;
        this.trigramPhraseFields = weights(builder.trigramPhraseFields, "pf3");
        this.trigramPhraseSlop = builder.trigramPhraseSlop;
        this.stopwords = builder.stopwords;
        this.userFields = ParamChecks.copyTexts(builder.userFields, "uf");
        this.boosts = ParamChecks.copyTexts(builder.boosts, "boost");

        ParamChecks.requireNonNegative(bigramPhraseSlop, "ps2");
        ParamChecks.requireNonNegative(trigramPhraseSlop, "ps3");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected String defType() {
        return "edismax";
    }

    @Override
    protected void contributeQuery(WireParams.Builder params) {
        super.contributeQuery(params);
        params.put("mm.autoRelax", minimumMatchAutoRelax)
                .put("lowercaseOperators", lowercaseOperators)
                .put("pf2", weighted(bigramPhraseFields))
                .put("ps2", bigramPhraseSlop)
                .put("pf3", weighted(trigramPhraseFields))
                .put("ps3", trigramPhraseSlop)
                .put("stopwords", stopwords)
                .put("uf", userFields == null || userFields.isEmpty() ? null : String.join(" ", userFields))
                .put("boost", boosts);
    }

    public static final class Builder extends AbstractDisMaxQueryParser.AbstractBuilder<ExtendedDisMaxQueryParser, Builder> {

        private @Nullable Boolean minimumMatchAutoRelax;
        private @Nullable Boolean lowercaseOperators;
        private @Nullable Map<String, Double> bigramPhraseFields;
        private @Nullable Integer bigramPhraseSlop;
        private @Nullable Map<String, Double> trigramPhraseFields;
        private @Nullable Integer trigramPhraseSlop;
        private @Nullable Boolean stopwords;
        private @Nullable List<String> userFields;
        private @Nullable List<String> boosts;

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder minimumMatchAutoRelax(boolean minimumMatchAutoRelax) {
            this.minimumMatchAutoRelax = minimumMatchAutoRelax;
            return this;
        }

        public Builder lowercaseOperators(boolean lowercaseOperators) {
            this.lowercaseOperators = lowercaseOperators;
            return this;
        }

        public Builder bigramPhraseFields(Map<String, Double> fields) {
            this.bigramPhraseFields = fields;
            return this;
        }

        public Builder bigramPhraseSlop(int slop) {
            this.bigramPhraseSlop = slop;
            return this;
        }

        public Builder trigramPhraseFields(Map<String, Double> fields) {
            this.trigramPhraseFields = fields;
            return this;
        }

        public Builder trigramPhraseSlop(int slop) {
            this.trigramPhraseSlop = slop;
            return this;
        }

        public Builder stopwords(boolean stopwords) {
            this.stopwords = stopwords;
            return this;
        }

        /**
         * Fields users may query explicitly, e.g. {@code "title", "-secret"} or {@code "*"}.
         */
        public Builder userFields(String... userFields) {
            this.userFields = Arrays.asList(userFields);
            return this;
        }

        /**
         * Multiplicative boost functions, sent as repeated {@code boost}.
         */
        public Builder boosts(String... boosts) {
            this.boosts = Arrays.asList(boosts);
            return this;
        }

        @Override
        public ExtendedDisMaxQueryParser build() {
            return new ExtendedDisMaxQueryParser(this);
        }
    }
}
