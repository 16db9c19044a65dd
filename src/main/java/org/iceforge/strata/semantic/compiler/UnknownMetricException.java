package org.iceforge.strata.semantic.compiler;

public class UnknownMetricException extends SemanticCompileException {
    public UnknownMetricException(String metricName) {
        super("UNKNOWN_METRIC", "Metric definition for '" + metricName + "' not found in semantic layer.");
    }
}
