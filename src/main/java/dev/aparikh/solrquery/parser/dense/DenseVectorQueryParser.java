package dev.aparikh.solrquery.parser.dense;

import dev.aparikh.solrquery.exception.SolrQueryConfigurationException;
import dev.aparikh.solrquery.params.LocalParams;
import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.WireParams;
import dev.aparikh.solrquery.parser.AbstractQueryParser;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * Vector search parsers. The whole query travels as a single local-params {@code q} value,
 * e.g. {@code {!knn f=vector topK=10}[0.1,0.2,0.3]}.
 *
 * <p>Feature blocks are not attached to dense queries.</p>
 */
public abstract class DenseVectorQueryParser extends AbstractQueryParser {

    public static final String FIELD = "f";
    public static final String TOP_K = "topK";
    public static final String PRE_FILTER = "preFilter";
    public static final String INCLUDE_TAGS = "includeTags";
    public static final String EXCLUDE_TAGS = "excludeTags";

    private final String field;
    private final VectorSource source;
    private final @Nullable Integer topK;
    private final @Nullable List<String> preFilters;
    private final @Nullable List<String> includeTags;
    private final @Nullable List<String> excludeTags;

    protected DenseVectorQueryParser(Builder<?, ?> builder) {
        super(builder);
        this.field = ParamChecks.requireText(builder.field, "Vector field");
        this.source = builder.source();
        this.topK = builder.topK;
        this.preFilters = ParamChecks.copyTexts(builder.preFilters, PRE_FILTER);
        this.includeTags = ParamChecks.copyTexts(builder.includeTags, INCLUDE_TAGS);
        this.excludeTags = ParamChecks.copyTexts(builder.excludeTags, EXCLUDE_TAGS);
        ParamChecks.requirePositive(topK, TOP_K);
    }

    @Override
    protected final void contribute(WireParams.Builder params) {
        params.put(QUERY, localParams().render());
    }

    /**
     * The local-params form of this query as sent in {@code q}.
     */
    public abstract LocalParams localParams();

    /**
     * Adds the shared local params ({@code topK} and filter tags) after the parser-specific ones.
     */
    protected LocalParams.Builder withSharedParams(LocalParams.Builder localParams) {
        return localParams.param(TOP_K, topK)
                .params(PRE_FILTER, preFilters)
                .params(INCLUDE_TAGS, includeTags)
                .params(EXCLUDE_TAGS, excludeTags);
    }

    public String field() {
        return field;
    }

    public VectorSource source() {
        return source;
    }

    public @Nullable Integer topK() {
        return topK;
    }

    public abstract static class Builder<P extends DenseVectorQueryParser, B extends Builder<P, B>>
            extends AbstractQueryParser.Builder<P, B> {

        private @Nullable String field;
        private VectorSource.@Nullable Vector vector;
        private VectorSource.@Nullable Text text;
        private @Nullable Integer topK;
        private @Nullable List<String> preFilters;
        private @Nullable List<String> includeTags;
        private @Nullable List<String> excludeTags;

        public B field(String field) {
            this.field = field;
            return self();
        }

        public B vector(List<Float> vector) {
            this.vector = VectorSource.of(vector);
            return self();
        }

        public B vector(float[] vector) {
            this.vector = VectorSource.of(vector);
            return self();
        }

        /**
         * Text to be embedded by Solr using the named model.
         */
        public B text(String text, String model) {
            this.text = VectorSource.text(text, model);
            return self();
        }

        public B source(VectorSource source) {
            if (source instanceof VectorSource.Vector) {
                this.vector = (VectorSource.Vector) source;
            } else {
                this.text = (VectorSource.Text) source;
            }
            return self();
        }

        /**
         * Number of nearest neighbours to return.
         */
        public B topK(int topK) {
            this.topK = topK;
            return self();
        }

        /**
         * Filter queries applied before the vector search, sent as repeated {@code preFilter}.
         */
        public B preFilters(String... preFilters) {
            this.preFilters = Arrays.asList(preFilters);
            return self();
        }

        public B includeTags(String... includeTags) {
            this.includeTags = Arrays.asList(includeTags);
            return self();
        }

        public B excludeTags(String... excludeTags) {
            this.excludeTags = Arrays.asList(excludeTags);
            return self();
        }

        VectorSource source() {
            if (vector != null && text != null) {
                throw new SolrQueryConfigurationException("Set either a vector or a text query, not both");
            }
            if (vector != null) {
                return vector;
            }
            if (text != null) {
                return text;
            }
            throw new SolrQueryConfigurationException("A vector or a text query is required");
        }
    }
}
