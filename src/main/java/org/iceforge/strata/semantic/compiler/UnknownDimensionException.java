package org.iceforge.strata.semantic.compiler;

public class UnknownDimensionException extends SemanticCompileException {
    public UnknownDimensionException(String dimensionName) {
        super("UNKNOWN_DIMENSION", "Dimension definition for '" + dimensionName + "' not found in semantic layer.");
    }
}
