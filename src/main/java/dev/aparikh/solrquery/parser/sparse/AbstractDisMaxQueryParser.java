package dev.aparikh.solrquery.parser.sparse;

import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.ParamFormat;
import dev.aparikh.solrquery.params.WireParams;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fields shared by the DisMax family: weighted query and phrase fields, minimum match, tie
 * and additive boosts.
 */
public abstract class AbstractDisMaxQueryParser extends SparseQueryParser {

    public static final String QUERY_ALT = "q.alt";
    public static final String QUERY_FIELDS = "qf";
    public static final String QUERY_SLOP = "qs";
    public static final String MINIMUM_MATCH = "mm";
    public static final String PHRASE_FIELDS = "pf";
    public static final String PHRASE_SLOP = "ps";
    public static final String TIE = "tie";
    public static final String BOOST_QUERY = "bq";
    public static final String BOOST_FUNCTION = "bf";

    private final @Nullable String queryAlt;
    private final @Nullable Map<String, Double> queryFields;
    private final @Nullable Integer querySlop;
    private final @Nullable String minimumMatch;
    private final @Nullable Map<String, Double> phraseFields;
    private final @Nullable Integer phraseSlop;
    private final @Nullable Double tie;
    private final @Nullable List<String> boostQueries;
    private final @Nullable List<String> boostFunctions;

    protected AbstractDisMaxQueryParser(AbstractBuilder<?, ?> builder) {
        super(builder);
        this.queryAlt = builder.queryAlt;
        this.queryFields = weights(builder.queryFields, QUERY_FIELDS);
        this.querySlop = builder.querySlop;
        this.minimumMatch = builder.minimumMatch;
        this.phraseFields = weights(builder.phraseFields, PHRASE_FIELDS);
        this.phraseSlop = builder.phraseSlop;
        this.tie = builder.tie;
        this.boostQueries = ParamChecks.copyTexts(builder.boostQueries, BOOST_QUERY);
        this.boostFunctions = ParamChecks.copyTexts(builder.boostFunctions, BOOST_FUNCTION);

        ParamChecks.requireNonNegative(querySlop, QUERY_SLOP);
        ParamChecks.requireNonNegative(phraseSlop, PHRASE_SLOP);
        ParamChecks.requireRange(tie, 0.0, 1.0, TIE);
    }

    /**
     * Copies a weighted-field map, keeping the caller's iteration order.
     */
    protected static @Nullable Map<String, Double> weights(@Nullable Map<String, Double> weights, String name) {
        ParamChecks.requireWeights(weights, name);
        return weights == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    protected static @Nullable String weighted(@Nullable Map<String, Double> weights) {
        return weights == null || weights.isEmpty() ? null : ParamFormat.weightedFields(weights);
    }

    /**
     * Value sent as {@code defType}.
     */
    protected abstract String defType();

    @Override
    protected void contributeQuery(WireParams.Builder params) {
        params.put(DEF_TYPE, defType())
                .put(QUERY_ALT, queryAlt)
                .put(QUERY_FIELDS, weighted(queryFields))
                .put(QUERY_SLOP, querySlop)
                .put(MINIMUM_MATCH, minimumMatch)
                .put(PHRASE_FIELDS, weighted(phraseFields))
                .put(PHRASE_SLOP, phraseSlop)
                .put(TIE, tie)
                .put(BOOST_QUERY, boostQueries)
                .put(BOOST_FUNCTION, boostFunctions);
    }

    public @Nullable Map<String, Double> queryFields() {
        return queryFields;
    }

    /**
     * Builder for the shared DisMax fields.
     */
    public abstract static class AbstractBuilder<P extends AbstractDisMaxQueryParser, B extends AbstractBuilder<P, B>>
            extends SparseQueryParser.Builder<P, B> {

        private @Nullable String queryAlt;
        private @Nullable Map<String, Double> queryFields;
        private @Nullable Integer querySlop;
        private @Nullable String minimumMatch;
        private @Nullable Map<String, Double> phraseFields;
        private @Nullable Integer phraseSlop;
        private @Nullable Double tie;
        private @Nullable List<String> boostQueries;
        private @Nullable List<String> boostFunctions;

        /**
         * Fallback query when {@code q} is blank or absent, typically {@code *:*}.
         */
        public B queryAlt(String queryAlt) {
            this.queryAlt = queryAlt;
            return self();
        }

        public B queryFields(Map<String, Double> queryFields) {
            this.queryFields = queryFields;
            return self();
        }

        public B querySlop(int querySlop) {
            this.querySlop = querySlop;
            return self();
        }

        /**
         * Minimum should match, e.g. {@code 2}, {@code 75%} or {@code 2<-25% 9<-3}.
         */
        public B minimumMatch(String minimumMatch) {
            this.minimumMatch = minimumMatch;
            return self();
        }

        public B phraseFields(Map<String, Double> phraseFields) {
            this.phraseFields = phraseFields;
            return self();
        }

        public B phraseSlop(int phraseSlop) {
            this.phraseSlop = phraseSlop;
            return self();
        }

        /**
         * Tiebreaker in [0, 1]: 0 is pure max, 1 sums all field scores.
         */
        public B tie(double tie) {
            this.tie = tie;
            return self();
        }

        public B boostQueries(String... boostQueries) {
            this.boostQueries = Arrays.asList(boostQueries);
            return self();
        }

        public B boostFunctions(String... boostFunctions) {
            this.boostFunctions = Arrays.asList(boostFunctions);
            return self();
        }
    }
}
