package dev.aparikh.solrquery.parser.sparse;

import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.WireParams;
import dev.aparikh.solrquery.params.WireValue;
import dev.aparikh.solrquery.params.config.FacetConfig;
import dev.aparikh.solrquery.params.config.FeatureConfig;
import dev.aparikh.solrquery.params.config.GroupConfig;
import dev.aparikh.solrquery.params.config.HighlightConfig;
import dev.aparikh.solrquery.params.config.MoreLikeThisConfig;
import dev.aparikh.solrquery.parser.AbstractQueryParser;
import org.jspecify.annotations.Nullable;

/**
 * Keyword (lexical) query parsers. All of them accept the same four optional feature blocks:
 * faceting, grouping, highlighting and MoreLikeThis.
 */
public abstract class SparseQueryParser extends AbstractQueryParser {

    public static final String QUERY_OPERATOR = "q.op";
    public static final String DEFAULT_FIELD = "df";
    public static final String SPLIT_ON_WHITESPACE = "sow";

    private final String query;
    private final @Nullable Operator operator;
    private final @Nullable String defaultField;
    private final @Nullable Boolean splitOnWhitespace;
    private final @Nullable FacetConfig facet;
    private final @Nullable GroupConfig group;
    private final @Nullable HighlightConfig highlight;
    private final @Nullable MoreLikeThisConfig moreLikeThis;

    protected SparseQueryParser(Builder<?, ?> builder) {
        super(builder);
        this.query = ParamChecks.requireText(builder.query, "Query (q)");
        this.operator = builder.operator;
        this.defaultField = builder.defaultField;
        this.splitOnWhitespace = builder.splitOnWhitespace;
        this.facet = builder.facet;
        this.group = builder.group;
        this.highlight = builder.highlight;
        this.moreLikeThis = builder.moreLikeThis;
    }

    @Override
    protected final void contribute(WireParams.Builder params) {
        params.put(QUERY, query)
                .put(QUERY_OPERATOR, operator)
                .put(DEFAULT_FIELD, defaultField)
                .put(SPLIT_ON_WHITESPACE, splitOnWhitespace);
        contributeQuery(params);
        attach(params, facet);
        attach(params, group);
        attach(params, highlight);
        attach(params, moreLikeThis);
    }

    /**
     * Emits the parser-specific fields such as {@code defType} and {@code qf}.
     */
    protected abstract void contributeQuery(WireParams.Builder params);

    private static void attach(WireParams.Builder params, @Nullable FeatureConfig config) {
        if (config != null) {
            params.putAll(config.flatten());
        }
    }

    public String query() {
        return query;
    }

    public @Nullable FacetConfig facet() {
        return facet;
    }

    public @Nullable GroupConfig group() {
        return group;
    }

    public @Nullable HighlightConfig highlight() {
        return highlight;
    }

    public @Nullable MoreLikeThisConfig moreLikeThis() {
        return moreLikeThis;
    }

    /**
     * Default boolean operator between query terms.
     */
    public enum Operator implements WireValue {
        AND, OR;

        @Override
        public String wireValue() {
            return name();
        }
    }

    public abstract static class Builder<P extends SparseQueryParser, B extends Builder<P, B>>
            extends AbstractQueryParser.Builder<P, B> {

        private @Nullable String query;
        private @Nullable Operator operator;
        private @Nullable String defaultField;
        private @Nullable Boolean splitOnWhitespace;
        private @Nullable FacetConfig facet;
        private @Nullable GroupConfig group;
        private @Nullable HighlightConfig highlight;
        private @Nullable MoreLikeThisConfig moreLikeThis;

        public B query(String query) {
            this.query = query;
            return self();
        }

        public B operator(Operator operator) {
            this.operator = operator;
            return self();
        }

        public B defaultField(String defaultField) {
            this.defaultField = defaultField;
            return self();
        }

        public B splitOnWhitespace(boolean splitOnWhitespace) {
            this.splitOnWhitespace = splitOnWhitespace;
            return self();
        }

        public B facet(@Nullable FacetConfig facet) {
            this.facet = facet;
            return self();
        }

        public B group(@Nullable GroupConfig group) {
            this.group = group;
            return self();
        }

        public B highlight(@Nullable HighlightConfig highlight) {
            this.highlight = highlight;
            return self();
        }

        public B moreLikeThis(@Nullable MoreLikeThisConfig moreLikeThis) {
            this.moreLikeThis = moreLikeThis;
            return self();
        }
    }
}
