package dev.aparikh.solrquery.exception;

/**
 * Thrown when a query model is built with a missing required field, with mutually
 * exclusive fields both set (or neither), or with a value outside its allowed range.
 *
 * <p>Always raised locally, before any request leaves the client.</p>
 */
public class SolrQueryConfigurationException extends IllegalArgumentException {

    public SolrQueryConfigurationException(String message) {
        super(message);
    }
}
