package org.iceforge.strata.semantic.compiler;

public class MissingJoinException extends SemanticCompileException {

    private final String anchorTable;
    private final String table;

    public MissingJoinException(String anchorTable, String table) {
        super("MISSING_JOIN", "No join definition found between " + anchorTable + " and " + table + ".");
        this.anchorTable = anchorTable;
        this.table = table;
    }

    public String getAnchorTable() {
        return anchorTable;
    }

    public String getTable() {
        return table;
    }
}
