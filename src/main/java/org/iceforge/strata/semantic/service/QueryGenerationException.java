package org.iceforge.strata.semantic.service;

/**
 * The generator call failed or produced an unusable answer. Transient from the caller's point of view.
 */
public class QueryGenerationException extends RuntimeException {
    public QueryGenerationException(String message) {
        super(message);
    }

    public QueryGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
