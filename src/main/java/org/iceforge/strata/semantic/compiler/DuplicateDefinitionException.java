package org.iceforge.strata.semantic.compiler;

public class DuplicateDefinitionException extends SemanticCompileException {
    public DuplicateDefinitionException(String kind, String name) {
        super("DUPLICATE_DEFINITION", "Semantic layer declares " + kind + " '" + name + "' more than once.");
    }
}
