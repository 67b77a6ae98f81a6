package dev.aparikh.solrquery.parser.dense;

import dev.aparikh.solrquery.exception.SolrQueryConfigurationException;
import dev.aparikh.solrquery.params.LocalParams;
import dev.aparikh.solrquery.params.ParamChecks;
import org.jspecify.annotations.Nullable;

/**
 * Returns every document whose vector similarity to the query vector reaches {@code minReturn},
 * rather than a fixed top K.
 *
 * <p>Only literal vectors are supported.</p>
 */
public final class VectorSimilarityQueryParser extends DenseVectorQueryParser {

    public static final String VECTOR_SIMILARITY = "vectorSimilarity";

    private final @Nullable Double minReturn;
    private final @Nullable Double minTraverse;

    private VectorSimilarityQueryParser(Builder builder) {
        super(builder);
        if (!(source() instanceof VectorSource.Vector)) {
            throw new SolrQueryConfigurationException("vectorSimilarity requires a literal vector, not text");
        }
        this.minReturn = builder.minReturn;
        this.minTraverse = builder.minTraverse;
        ParamChecks.requireFinite(minReturn, "minReturn");
        ParamChecks.requireFinite(minTraverse, "minTraverse");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public LocalParams localParams() {
        VectorSource.Vector vector = (VectorSource.Vector) source();
        return withSharedParams(LocalParams.builder(VECTOR_SIMILARITY)
                .param(FIELD, field())
                .param("minReturn", minReturn)
                .param("minTraverse", minTraverse))
                .body(vector.render())
                .build();
    }

    public static final class Builder extends DenseVectorQueryParser.Builder<VectorSimilarityQueryParser, Builder> {

        private @Nullable Double minReturn;
        private @Nullable Double minTraverse;

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        /**
         * Minimum similarity for a document to be returned.
         */
        public Builder minReturn(double minReturn) {
            this.minReturn = minReturn;
            return this;
        }

        /**
         * Minimum similarity for a graph node to be explored.
         */
        public Builder minTraverse(double minTraverse) {
            this.minTraverse = minTraverse;
            return this;
        }

        @Override
        public VectorSimilarityQueryParser build() {
            return new VectorSimilarityQueryParser(this);
        }
    }
}
