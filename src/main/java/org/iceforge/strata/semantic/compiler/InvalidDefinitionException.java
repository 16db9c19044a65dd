package org.iceforge.strata.semantic.compiler;

public class InvalidDefinitionException extends SemanticCompileException {
    public InvalidDefinitionException(String subject, String missingField) {
        super("INVALID_DEFINITION", subject + " is missing required field '" + missingField + "'.");
    }
}
