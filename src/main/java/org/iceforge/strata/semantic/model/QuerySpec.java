package org.iceforge.strata.semantic.model;

import java.util.ArrayList;
import java.util.List;

public class QuerySpec {

    private List<String> metrics = new ArrayList<>();

    /**
     * Dimensions to group by. A dimension may carry a date grain suffix, e.g. "ordered_date__week".
     */
    private List<String> dimensions = new ArrayList<>();

    private List<FilterClause> filters = new ArrayList<>();

    public QuerySpec() {
    }

    public QuerySpec(List<String> metrics, List<String> dimensions, List<FilterClause> filters) {
        setMetrics(metrics);
        setDimensions(dimensions);
        setFilters(filters);
    }

    public List<String> getMetrics() {
        return metrics;
    }

    public void setMetrics(List<String> metrics) {
        this.metrics = metrics == null ? new ArrayList<>() : metrics;
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public void setDimensions(List<String> dimensions) {
        this.dimensions = dimensions == null ? new ArrayList<>() : dimensions;
    }

    public List<FilterClause> getFilters() {
        return filters;
    }

    public void setFilters(List<FilterClause> filters) {
        this.filters = filters == null ? new ArrayList<>() : filters;
    }
}
