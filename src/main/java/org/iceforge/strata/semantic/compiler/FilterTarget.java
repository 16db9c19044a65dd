package org.iceforge.strata.semantic.compiler;

/**
 * What a filter field resolved to. Exactly one of {@code dimension} and {@code metric} is set.
 */
public record FilterTarget(ResolvedDimension dimension, ResolvedMetric metric) {

    static FilterTarget of(ResolvedDimension dimension) {
        return new FilterTarget(dimension, null);
    }

    static FilterTarget of(ResolvedMetric metric) {
        return new FilterTarget(null, metric);
    }

    public boolean isDimension() {
        return dimension != null;
    }
}
