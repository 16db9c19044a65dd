package org.iceforge.strata.semantic.compiler;

import java.util.List;

/**
 * FROM/JOIN layout of a query: the anchor table and one join per other table, in discovery order.
 */
public record JoinPlan(String anchorTable, List<Join> joins, List<String> tables) {

    public JoinPlan {
        joins = List.copyOf(joins);
        tables = List.copyOf(tables);
    }

    public boolean isMultiTable() {
        return tables.size() > 1;
    }

    public record Join(String table, String predicate) {
    }
}
