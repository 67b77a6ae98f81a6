package dev.aparikh.solrquery.exception;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Umbrella exception for remote and decoding failures.
 * <p>
 * Raised when Solr answers with a non-2xx status, when the payload is not valid JSON, or
 * when a document cannot be bound to the requested document type. Carries the HTTP status
 * (if any) and the payload so callers can inspect Solr's own error detail.
 */
public class SolrQueryException extends RuntimeException {

    private final @Nullable Integer statusCode;
    private final @Nullable String rawPayload;
    private final @Nullable Map<String, Object> parsedPayload;

    public SolrQueryException(String message, @Nullable Integer statusCode, @Nullable String rawPayload,
                              @Nullable Map<String, Object> parsedPayload) {
        this(message, statusCode, rawPayload, parsedPayload, null);
    }

    public SolrQueryException(String message, @Nullable Integer statusCode, @Nullable String rawPayload,
                              @Nullable Map<String, Object> parsedPayload, @Nullable Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.rawPayload = rawPayload;
        this.parsedPayload = parsedPayload;
    }

    public SolrQueryException(String message, Throwable cause) {
        this(message, null, null, null, cause);
    }

    public @Nullable Integer statusCode() {
        return statusCode;
    }

    public @Nullable String rawPayload() {
        return rawPayload;
    }

    public @Nullable Map<String, Object> parsedPayload() {
        return parsedPayload;
    }
}
