package org.iceforge.strata.semantic.compiler;

import org.iceforge.strata.semantic.model.MetricDefinition;

public record ResolvedMetric(String requestedName, MetricDefinition definition) {

    public String table() {
        return definition.getTable();
    }
}
