package org.iceforge.strata.semantic.model;

public class FilterClause {
    private String field;
    private String operator; // =, >, >=, <, <=, !=, LIKE ...
    private Object value; // String, Number or Boolean as read from JSON

    public FilterClause() {
    }

    public FilterClause(String field, String operator, Object value) {
        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }
}
