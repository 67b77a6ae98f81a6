package dev.aparikh.solrquery.parser.dense;

import dev.aparikh.solrquery.params.LocalParams;

/**
 * K-nearest-neighbour search over a dense vector field.
 *
 * <p>With a literal vector this sends {@code {!knn f=vector topK=10}[0.1,0.2]}; with text it
 * sends {@code {!knn_text_to_vector model=m f=vector topK=10}running shoes} and Solr embeds
 * the text itself.</p>
 *
 * @see <a href="https://solr.apache.org/guide/solr/latest/query-guide/dense-vector-search.html">Dense Vector Search</a>
 */
public final class KnnQueryParser extends DenseVectorQueryParser {

    public static final String KNN = "knn";
    public static final String KNN_TEXT_TO_VECTOR = "knn_text_to_vector";

    private KnnQueryParser(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public LocalParams localParams() {
        VectorSource source = source();
        if (source instanceof VectorSource.Vector) {
            VectorSource.Vector vector = (VectorSource.Vector) source;
            return withSharedParams(LocalParams.builder(KNN).param(FIELD, field()))
                    .body(vector.render())
                    .build();
        }
        VectorSource.Text text = (VectorSource.Text) source;
        return withSharedParams(LocalParams.builder(KNN_TEXT_TO_VECTOR)
                .param("model", text.model())
                .param(FIELD, field()))
                .body(text.text())
                .build();
    }

    public static final class Builder extends DenseVectorQueryParser.Builder<KnnQueryParser, Builder> {

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public KnnQueryParser build() {
            return new KnnQueryParser(this);
        }
    }
}
