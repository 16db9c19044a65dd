package org.iceforge.strata.semantic.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class DimensionDefinition {
    private String name;
    @JsonProperty("sql")
    private String sqlExpression; // physical column, e.g. created_at
    private String table;

    public DimensionDefinition() {
    }

    public DimensionDefinition(String name, String sqlExpression, String table) {
        this.name = name;
        this.sqlExpression = sqlExpression;
        this.table = table;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSqlExpression() {
        return sqlExpression;
    }

    public void setSqlExpression(String sqlExpression) {
        this.sqlExpression = sqlExpression;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }
}
