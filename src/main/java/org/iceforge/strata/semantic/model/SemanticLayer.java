package org.iceforge.strata.semantic.model;

import java.util.ArrayList;
import java.util.List;

public class SemanticLayer {
    private List<MetricDefinition> metrics = new ArrayList<>();
    private List<DimensionDefinition> dimensions = new ArrayList<>();
    private List<JoinEdge> joins = new ArrayList<>();

    public SemanticLayer() {
    }

    public SemanticLayer(List<MetricDefinition> metrics,
                         List<DimensionDefinition> dimensions,
                         List<JoinEdge> joins) {
        setMetrics(metrics);
        setDimensions(dimensions);
        setJoins(joins);
    }

    public List<MetricDefinition> getMetrics() {
        return metrics;
    }

    public void setMetrics(List<MetricDefinition> metrics) {
        this.metrics = metrics == null ? new ArrayList<>() : metrics;
    }

    public List<DimensionDefinition> getDimensions() {
        return dimensions;
    }

    public void setDimensions(List<DimensionDefinition> dimensions) {
        this.dimensions = dimensions == null ? new ArrayList<>() : dimensions;
    }

    public List<JoinEdge> getJoins() {
        return joins;
    }

    public void setJoins(List<JoinEdge> joins) {
        this.joins = joins == null ? new ArrayList<>() : joins;
    }
}
