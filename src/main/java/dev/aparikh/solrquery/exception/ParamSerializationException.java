package dev.aparikh.solrquery.exception;

/**
 * Thrown when a parameter value has no wire representation.
 *
 * <p>Builders validate their input, so this indicates a broken internal invariant rather
 * than a caller mistake.</p>
 */
public class ParamSerializationException extends IllegalStateException {

    public ParamSerializationException(String message) {
        super(message);
    }
}
