package dev.aparikh.solrquery.params.config;

import dev.aparikh.solrquery.exception.SolrQueryConfigurationException;
import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.ParamFormat;
import dev.aparikh.solrquery.params.WireParams;
import dev.aparikh.solrquery.params.WireValue;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Faceting: counts of matching documents per field value, per query or per range.
 *
 * <p>Flattens to {@code facet=true} plus {@code facet.*} options:</p>
 * <pre>{@code
 * FacetConfig facet = FacetConfig.builder()
 *     .fields("category", "brand")
 *     .limit(10)
 *     .mincount(1)
 *     .range(new FacetRange("price", "0", "1000", "100"))
 *     .build();
 * }</pre>
 *
 * @see <a href="https://solr.apache.org/guide/solr/latest/query-guide/faceting.html">Faceting</a>
 */
public final class FacetConfig extends AbstractFeatureConfig {

    public static final String ENABLE_KEY = "facet";

    private final @Nullable List<String> queries;
    private final @Nullable List<String> fields;
    private final @Nullable String prefix;
    private final @Nullable String contains;
    private final @Nullable Boolean containsIgnoreCase;
    private final @Nullable String matches;
    private final @Nullable Sort sort;
    private final @Nullable Integer limit;
    private final @Nullable Integer offset;
    private final @Nullable Integer mincount;
    private final @Nullable Boolean missing;
    private final @Nullable Method method;
    private final @Nullable Integer enumCacheMinDf;
    private final @Nullable Boolean exists;
    private final @Nullable String excludeTerms;
    private final @Nullable Integer overrequestCount;
    private final @Nullable Double overrequestRatio;
    private final @Nullable Integer threads;
    private final List<FacetRange> ranges;
    private final List<List<String>> pivots;
    private final @Nullable Integer pivotMincount;

    private FacetConfig(Builder builder) {
        super(ENABLE_KEY);
        this.queries = ParamChecks.copyTexts(builder.queries, "Facet query");
        this.fields = ParamChecks.copyTexts(builder.fields, "Facet field");
        this.prefix = builder.prefix;
        this.contains = builder.contains;
        this.containsIgnoreCase = builder.containsIgnoreCase;
        this.matches = builder.matches;
        this.sort = builder.sort;
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.mincount = builder.mincount;
        this.missing = builder.missing;
        this.method = builder.method;
        this.enumCacheMinDf = builder.enumCacheMinDf;
        this.exists = builder.exists;
        this.excludeTerms = builder.excludeTerms;
        this.overrequestCount = builder.overrequestCount;
        this.overrequestRatio = builder.overrequestRatio;
        this.threads = builder.threads;
        this.ranges = List.copyOf(builder.ranges);
        this.pivots = builder.pivots.stream().map(List::copyOf).toList();
        this.pivotMincount = builder.pivotMincount;

        ParamChecks.requireNonNegative(offset, "facet.offset");
        ParamChecks.requireNonNegative(mincount, "facet.mincount");
        ParamChecks.requireNonNegative(overrequestCount, "facet.overrequest.count");
        ParamChecks.requireNonNegative(pivotMincount, "facet.pivot.mincount");
        ParamChecks.requireNonNegative(overrequestRatio, "facet.overrequest.ratio");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected void contribute(WireParams.Builder params) {
        option(params, "query", queries);
        option(params, "field", fields);
        option(params, "prefix", prefix);
        option(params, "contains", contains);
        option(params, "contains.ignoreCase", containsIgnoreCase);
        option(params, "matches", matches);
        option(params, "sort", sort);
        option(params, "limit", limit);
        option(params, "offset", offset);
        option(params, "mincount", mincount);
        option(params, "missing", missing);
        option(params, "method", method);
        option(params, "enum.cache.minDf", enumCacheMinDf);
        option(params, "exists", exists);
        option(params, "excludeTerms", excludeTerms);
        option(params, "overrequest.count", overrequestCount);
        option(params, "overrequest.ratio", overrequestRatio);
        option(params, "threads", threads);
        for (FacetRange range : ranges) {
            range.contribute(params);
        }
        if (!pivots.isEmpty()) {
            option(params, "pivot", pivots.stream().map(ParamFormat::commaJoin).toList());
            option(params, "pivot.mincount", pivotMincount);
        }
    }

    public @Nullable List<String> fields() {
        return fields;
    }

    public List<FacetRange> ranges() {
        return ranges;
    }

    /**
     * Ordering of facet terms.
     */
    public enum Sort implements WireValue {
        COUNT("count"),
        INDEX("index");

        private final String wireValue;

        Sort(String wireValue) {
            this.wireValue = wireValue;
        }

        @Override
        public String wireValue() {
            return wireValue;
        }
    }

    /**
     * Field faceting algorithm.
     */
    public enum Method implements WireValue {
        /** Enumerate all terms; low-cardinality fields. */
        ENUM("enum"),
        /** Field cache; many unique terms, few per document. */
        FIELD_CACHE("fc"),
        /** Per-segment; single-valued strings with frequent updates. */
        PER_SEGMENT("fcs");

        private final String wireValue;

        Method(String wireValue) {
            this.wireValue = wireValue;
        }

        @Override
        public String wireValue() {
            return wireValue;
        }
    }

    public static class Builder {
        private @Nullable List<String> queries;
        private @Nullable List<String> fields;
        private @Nullable String prefix;
        private @Nullable String contains;
        private @Nullable Boolean containsIgnoreCase;
        private @Nullable String matches;
        private @Nullable Sort sort;
        private @Nullable Integer limit;
        private @Nullable Integer offset;
        private @Nullable Integer mincount;
        private @Nullable Boolean missing;
        private @Nullable Method method;
        private @Nullable Integer enumCacheMinDf;
        private @Nullable Boolean exists;
        private @Nullable String excludeTerms;
        private @Nullable Integer overrequestCount;
        private @Nullable Double overrequestRatio;
        private @Nullable Integer threads;
        private final List<FacetRange> ranges = new ArrayList<>();
        private final List<List<String>> pivots = new ArrayList<>();
        private @Nullable Integer pivotMincount;

        public Builder queries(String... queries) {
            this.queries = Arrays.asList(queries);
            return this;
        }

        public Builder fields(String... fields) {
            this.fields = Arrays.asList(fields);
            return this;
        }

        public Builder fields(List<String> fields) {
            this.fields = fields;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder contains(String contains) {
            this.contains = contains;
            return this;
        }

        public Builder containsIgnoreCase(boolean containsIgnoreCase) {
            this.containsIgnoreCase = containsIgnoreCase;
            return this;
        }

        public Builder matches(String regex) {
            this.matches = regex;
            return this;
        }

        public Builder sort(Sort sort) {
            this.sort = sort;
            return this;
        }

        /**
         * Max values per facet; {@code -1} for unlimited.
         */
        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder mincount(int mincount) {
            this.mincount = mincount;
            return this;
        }

        public Builder missing(boolean missing) {
            this.missing = missing;
            return this;
        }

        public Builder method(Method method) {
            this.method = method;
            return this;
        }

        public Builder enumCacheMinDf(int enumCacheMinDf) {
            this.enumCacheMinDf = enumCacheMinDf;
            return this;
        }

        public Builder exists(boolean exists) {
            this.exists = exists;
            return this;
        }

        public Builder excludeTerms(String excludeTerms) {
            this.excludeTerms = excludeTerms;
            return this;
        }

        public Builder overrequestCount(int overrequestCount) {
            this.overrequestCount = overrequestCount;
            return this;
        }

        public Builder overrequestRatio(double overrequestRatio) {
            this.overrequestRatio = overrequestRatio;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        /**
         * Adds a range facet. Ranges are emitted in the order they were added.
         */
        public Builder range(FacetRange range) {
            this.ranges.add(range);
            return this;
        }

        /**
         * Adds one pivot (decision tree) facet, e.g. {@code pivot("category", "brand")}.
         */
        public Builder pivot(String... fields) {
            if (fields.length == 0) {
                throw new SolrQueryConfigurationException("Pivot needs at least one field");
            }
            this.pivots.add(Arrays.asList(fields));
            return this;
        }

        public Builder pivotMincount(int pivotMincount) {
            this.pivotMincount = pivotMincount;
            return this;
        }

        public FacetConfig build() {
            return new FacetConfig(this);
        }
    }
}
