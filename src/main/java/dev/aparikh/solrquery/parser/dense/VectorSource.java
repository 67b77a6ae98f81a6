package dev.aparikh.solrquery.parser.dense;

import dev.aparikh.solrquery.exception.SolrQueryConfigurationException;
import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.params.ParamFormat;

import java.util.List;

/**
 * What a dense query searches with: a precomputed vector, or text that Solr embeds with a
 * named model.
 */
public sealed interface VectorSource permits VectorSource.Vector, VectorSource.Text {

    static Vector of(List<Float> vector) {
        return new Vector(vector);
    }

    static Vector of(float[] vector) {
        Float[] boxed = new Float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            boxed[i] = vector[i];
        }
        return new Vector(List.of(boxed));
    }

    static Text text(String text, String model) {
        return new Text(text, model);
    }

    /**
     * Literal vector; every component must be finite.
     */
    record Vector(List<Float> values) implements VectorSource {

        public Vector {
            if (values == null || values.isEmpty()) {
                throw new SolrQueryConfigurationException("Vector cannot be null or empty");
            }
            for (Float value : values) {
                if (value == null || !Float.isFinite(value)) {
                    throw new SolrQueryConfigurationException("Vector components must be finite numbers, got " + value);
                }
            }
            values = List.copyOf(values);
        }

        public int dimension() {
            return values.size();
        }

        /**
         * Renders as {@code [0.1,0.2,0.3]}.
         */
        public String render() {
            return ParamFormat.vector(values);
        }
    }

    /**
     * Text embedded server-side by the model registered under {@code model}.
     */
    record Text(String text, String model) implements VectorSource {

        public Text {
            ParamChecks.requireText(text, "Query text");
            ParamChecks.requireText(model, "Embedding model");
        }
    }
}
