package dev.aparikh.solrquery.params.config;

import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.ParamFormat;
import dev.aparikh.solrquery.params.WireParams;
import dev.aparikh.solrquery.params.WireValue;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MoreLikeThis: similar documents derived from the terms of each matched document.
 *
 * <p>Flattens to {@code mlt=true} plus {@code mlt.*} options. Field lists are comma-joined;
 * {@code mlt.qf} uses the weighted {@code field^boost} syntax.</p>
 */
public final class MoreLikeThisConfig extends AbstractFeatureConfig {

    public static final String ENABLE_KEY = "mlt";

    private final @Nullable List<String> fields;
    private final @Nullable Integer minTermFreq;
    private final @Nullable Integer minDocFreq;
    private final @Nullable Integer maxDocFreq;
    private final @Nullable Integer maxDocFreqPct;
    private final @Nullable Integer minWordLength;
    private final @Nullable Integer maxWordLength;
    private final @Nullable Integer maxQueryTerms;
    private final @Nullable Integer maxNumTokensParsed;
    private final @Nullable Boolean boost;
    private final @Nullable Map<String, Double> queryFields;
    private final @Nullable InterestingTerms interestingTerms;
    private final @Nullable Boolean matchInclude;
    private final @Nullable Integer matchOffset;
    private final @Nullable Integer count;

    private MoreLikeThisConfig(Builder builder) {
        super(ENABLE_KEY);
        this.fields = ParamChecks.copyTexts(builder.fields, "MoreLikeThis field");
        this.minTermFreq = builder.minTermFreq;
        this.minDocFreq = builder.minDocFreq;
        this.maxDocFreq = builder.maxDocFreq;
        this.maxDocFreqPct = builder.maxDocFreqPct;
        this.minWordLength = builder.minWordLength;
        this.maxWordLength = builder.maxWordLength;
        this.maxQueryTerms = builder.maxQueryTerms;
        this.maxNumTokensParsed = builder.maxNumTokensParsed;
        this.boost = builder.boost;
        ParamChecks.requireWeights(builder.queryFields, "mlt.qf");
        this.queryFields = builder.queryFields == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryFields));
        this.interestingTerms = builder.interestingTerms;
        this.matchInclude = builder.matchInclude;
        this.matchOffset = builder.matchOffset;
        this.count = builder.count;

        ParamChecks.requireNonNegative(minTermFreq, "mlt.mintf");
        ParamChecks.requireNonNegative(minDocFreq, "mlt.mindf");
        ParamChecks.requireNonNegative(maxDocFreq, "mlt.maxdf");
        ParamChecks.requireRange(maxDocFreqPct, 0, 100, "mlt.maxdfpct");
        ParamChecks.requireNonNegative(minWordLength, "mlt.minwl");
        ParamChecks.requireNonNegative(maxWordLength, "mlt.maxwl");
        ParamChecks.requirePositive(maxQueryTerms, "mlt.maxqt");
        ParamChecks.requireNonNegative(count, "mlt.count");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected void contribute(WireParams.Builder params) {
        option(params, "fl", fields == null || fields.isEmpty() ? null : ParamFormat.commaJoin(fields));
        option(params, "mintf", minTermFreq);
        option(params, "mindf", minDocFreq);
        option(params, "maxdf", maxDocFreq);
        option(params, "maxdfpct", maxDocFreqPct);
        option(params, "minwl", minWordLength);
        option(params, "maxwl", maxWordLength);
        option(params, "maxqt", maxQueryTerms);
        option(params, "maxntp", maxNumTokensParsed);
        option(params, "boost", boost);
        option(params, "qf", queryFields == null || queryFields.isEmpty()
                ? null : ParamFormat.weightedFields(queryFields));
        option(params, "interestingTerms", interestingTerms);
        option(params, "match.include", matchInclude);
        option(params, "match.offset", matchOffset);
        option(params, "count", count);
    }

    public enum InterestingTerms implements WireValue {
        NONE("none"),
        LIST("list"),
        DETAILS("details");

        private final String wireValue;

        InterestingTerms(String wireValue) {
            this.wireValue = wireValue;
        }

        @Override
        public String wireValue() {
            return wireValue;
        }
    }

    public static class Builder {
        private @Nullable List<String> fields;
        private @Nullable Integer minTermFreq;
        private @Nullable Integer minDocFreq;
        private @Nullable Integer maxDocFreq;
        private @Nullable Integer maxDocFreqPct;
        private @Nullable Integer minWordLength;
        private @Nullable Integer maxWordLength;
        private @Nullable Integer maxQueryTerms;
        private @Nullable Integer maxNumTokensParsed;
        private @Nullable Boolean boost;
        private @Nullable Map<String, Double> queryFields;
        private @Nullable InterestingTerms interestingTerms;
        private @Nullable Boolean matchInclude;
        private @Nullable Integer matchOffset;
        private @Nullable Integer count;

        public Builder fields(String... fields) {
            this.fields = Arrays.asList(fields);
            return this;
        }

        public Builder minTermFreq(int minTermFreq) {
            this.minTermFreq = minTermFreq;
            return this;
        }

        public Builder minDocFreq(int minDocFreq) {
            this.minDocFreq = minDocFreq;
            return this;
        }

        public Builder maxDocFreq(int maxDocFreq) {
            this.maxDocFreq = maxDocFreq;
            return this;
        }

        public Builder maxDocFreqPct(int maxDocFreqPct) {
            this.maxDocFreqPct = maxDocFreqPct;
            return this;
        }

        public Builder minWordLength(int minWordLength) {
            this.minWordLength = minWordLength;
            return this;
        }

        public Builder maxWordLength(int maxWordLength) {
            this.maxWordLength = maxWordLength;
            return this;
        }

        public Builder maxQueryTerms(int maxQueryTerms) {
            this.maxQueryTerms = maxQueryTerms;
            return this;
        }

        public Builder maxNumTokensParsed(int maxNumTokensParsed) {
            this.maxNumTokensParsed = maxNumTokensParsed;
            return this;
        }

        public Builder boost(boolean boost) {
            this.boost = boost;
            return this;
        }

        public Builder queryFields(Map<String, Double> queryFields) {
            this.queryFields = queryFields;
            return this;
        }

        public Builder interestingTerms(InterestingTerms interestingTerms) {
            this.interestingTerms = interestingTerms;
            return this;
        }

        public Builder matchInclude(boolean matchInclude) {
            this.matchInclude = matchInclude;
            return this;
        }

        public Builder matchOffset(int matchOffset) {
            this.matchOffset = matchOffset;
            return this;
        }

        /**
         * Similar documents returned per result.
         */
        public Builder count(int count) {
            this.count = count;
            return this;
        }

        public MoreLikeThisConfig build() {
            return new MoreLikeThisConfig(this);
        }
    }
}
