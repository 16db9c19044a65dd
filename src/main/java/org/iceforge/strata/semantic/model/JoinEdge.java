package org.iceforge.strata.semantic.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A declared join between two tables. The one/many roles are informational only:
 * an edge connects its tables in either direction.
 */
public class JoinEdge {
    @JsonProperty("one")
    private String tableOne;
    @JsonProperty("many")
    private String tableMany;
    @JsonProperty("join")
    private String joinPredicate; // e.g. order_items.order_id = orders.order_id

    public JoinEdge() {
    }

    public JoinEdge(String tableOne, String tableMany, String joinPredicate) {
        this.tableOne = tableOne;
        this.tableMany = tableMany;
        this.joinPredicate = joinPredicate;
    }

    public boolean connects(String tableA, String tableB) {
        return (tableA.equals(tableOne) && tableB.equals(tableMany))
                || (tableB.equals(tableOne) && tableA.equals(tableMany));
    }

    public String getTableOne() {
        return tableOne;
    }

    public void setTableOne(String tableOne) {
        this.tableOne = tableOne;
    }

    public String getTableMany() {
        return tableMany;
    }

    public void setTableMany(String tableMany) {
        this.tableMany = tableMany;
    }

    public String getJoinPredicate() {
        return joinPredicate;
    }

    public void setJoinPredicate(String joinPredicate) {
        this.joinPredicate = joinPredicate;
    }
}
