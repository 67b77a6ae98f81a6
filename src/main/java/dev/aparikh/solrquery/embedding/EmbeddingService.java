package dev.aparikh.solrquery.embedding;

import dev.aparikh.solrquery.params.ParamChecks;
import dev.aparikh.solrquery.parser.dense.VectorSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Embeds query text on the client side, for collections without a server-side
 * text-to-vector model.
 *
 * <pre>{@code
 * KnnQueryParser parser = KnnQueryParser.builder()
 *     .field("vector")
 *     .source(embeddingService.embedAsVector("running shoes"))
 *     .topK(10)
 *     .build();
 * }</pre>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingModel embeddingModel;

    public EmbeddingService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    /**
     * Generates an embedding for the given text.
     *
     * @param text the text to embed
     * @return the embedding vector
     * @throws dev.aparikh.solrquery.exception.SolrQueryConfigurationException if text is blank
     */
    public float[] embed(String text) {
        ParamChecks.requireText(text, "Text to embed");
        log.debug("Generating embedding for text (length: {})", text.length());
        float[] embedding = embeddingModel.embed(text);
        log.debug("Generated embedding with {} dimensions", embedding.length);
        return embedding;
    }

    /**
     * Generates an embedding ready to use as a dense query source.
     */
    public VectorSource.Vector embedAsVector(String text) {
        return VectorSource.of(embed(text));
    }
}
