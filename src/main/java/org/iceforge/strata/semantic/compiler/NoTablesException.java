package org.iceforge.strata.semantic.compiler;

public class NoTablesException extends SemanticCompileException {
    public NoTablesException() {
        super("NO_TABLES", "No tables identified from metrics or dimensions. Unable to build query.");
    }
}
