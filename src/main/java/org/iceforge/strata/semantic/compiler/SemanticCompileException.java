package org.iceforge.strata.semantic.compiler;

/**
 * Base type for deterministic compile failures. Retrying a compile with the same inputs
 * always fails the same way.
 */
public class SemanticCompileException extends RuntimeException {

    private final String code;

    public SemanticCompileException(String code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * Stable error code reported to API callers, e.g. UNKNOWN_METRIC.
     */
    public String code() {
        return code;
    }
}
