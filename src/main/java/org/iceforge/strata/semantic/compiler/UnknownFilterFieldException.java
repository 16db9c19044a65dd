package org.iceforge.strata.semantic.compiler;

public class UnknownFilterFieldException extends SemanticCompileException {
    public UnknownFilterFieldException(String field) {
        super("UNKNOWN_FILTER_FIELD", "Filter field '" + field + "' not found in dimensions or metrics.");
    }
}
