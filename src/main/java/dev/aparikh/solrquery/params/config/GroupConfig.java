package dev.aparikh.solrquery.params.config;

import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.WireParams;
import dev.aparikh.solrquery.params.WireValue;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * Result grouping (field collapsing): {@code group=true} plus {@code group.*} options.
 *
 * @see <a href="https://solr.apache.org/guide/solr/latest/query-guide/result-grouping.html">Result Grouping</a>
 */
public final class GroupConfig extends AbstractFeatureConfig {

    public static final String ENABLE_KEY = "group";

    private final @Nullable List<String> fields;
    private final @Nullable String func;
    private final @Nullable List<String> queries;
    private final @Nullable Integer limit;
    private final @Nullable Integer offset;
    private final @Nullable String sort;
    private final @Nullable Format format;
    private final @Nullable Boolean main;
    private final @Nullable Boolean ngroups;
    private final @Nullable Boolean truncate;
    private final @Nullable Boolean facet;
    private final @Nullable Integer cachePercent;

    private GroupConfig(Builder builder) {
        super(ENABLE_KEY);
        this.fields = ParamChecks.copyTexts(builder.fields, "Group field");
        this.func = builder.func;
        this.queries = ParamChecks.copyTexts(builder.queries, "Group query");
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.sort = builder.sort;
        this.format = builder.format;
        this.main = builder.main;
        this.ngroups = builder.ngroups;
        this.truncate = builder.truncate;
        this.facet = builder.facet;
        this.cachePercent = builder.cachePercent;

        ParamChecks.requireNonNegative(offset, "group.offset");
        ParamChecks.requireRange(cachePercent, 0, 100, "group.cache.percent");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected void contribute(WireParams.Builder params) {
        option(params, "field", fields);
        option(params, "func", func);
        option(params, "query", queries);
        option(params, "limit", limit);
        option(params, "offset", offset);
        option(params, "sort", sort);
        option(params, "format", format);
        option(params, "main", main);
        option(params, "ngroups", ngroups);
        option(params, "truncate", truncate);
        option(params, "facet", facet);
        option(params, "cache.percent", cachePercent);
    }

    public enum Format implements WireValue {
        GROUPED("grouped"),
        SIMPLE("simple");

        private final String wireValue;

        Format(String wireValue) {
            this.wireValue = wireValue;
        }

        @Override
        public String wireValue() {
            return wireValue;
        }
    }

    public static class Builder {
        private @Nullable List<String> fields;
        private @Nullable String func;
        private @Nullable List<String> queries;
        private @Nullable Integer limit;
        private @Nullable Integer offset;
        private @Nullable String sort;
        private @Nullable Format format;
        private @Nullable Boolean main;
        private @Nullable Boolean ngroups;
        private @Nullable Boolean truncate;
        private @Nullable Boolean facet;
        private @Nullable Integer cachePercent;

        /**
         * Fields to group by, sent as repeated {@code group.field}.
         */
        public Builder by(String... fields) {
            this.fields = Arrays.asList(fields);
            return this;
        }

        public Builder func(String func) {
            this.func = func;
            return this;
        }

        public Builder queries(String... queries) {
            this.queries = Arrays.asList(queries);
            return this;
        }

        /**
         * Documents returned per group.
         */
        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        /**
         * Sort of documents within each group.
         */
        public Builder sort(String sort) {
            this.sort = sort;
            return this;
        }

        public Builder format(Format format) {
            this.format = format;
            return this;
        }

        public Builder main(boolean main) {
            this.main = main;
            return this;
        }

        public Builder ngroups(boolean ngroups) {
            this.ngroups = ngroups;
            return this;
        }

        public Builder truncate(boolean truncate) {
            this.truncate = truncate;
            return this;
        }

        public Builder facet(boolean facet) {
            this.facet = facet;
            return this;
        }

        public Builder cachePercent(int cachePercent) {
            this.cachePercent = cachePercent;
            return this;
        }

        public GroupConfig build() {
            return new GroupConfig(this);
        }
    }
}
