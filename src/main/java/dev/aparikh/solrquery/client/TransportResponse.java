package dev.aparikh.solrquery.client;

import org.jspecify.annotations.Nullable;

/**
 * Raw HTTP outcome of one Solr request.
 *
 * @param status HTTP status code
 * @param body   response payload, or null when Solr sent none
 */
public record TransportResponse(int status, @Nullable String body) {

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
