package org.iceforge.strata.semantic.compiler;

import org.iceforge.strata.semantic.model.DimensionDefinition;
import org.iceforge.strata.semantic.model.MetricDefinition;

import java.util.Objects;
import java.util.Optional;

/**
 * Maps requested names onto catalog entries. Dimension and filter names may carry a date grain suffix;
 * metric names are matched as given.
 */
public final class IdentifierResolver {

    private final SemanticCatalog catalog;

    public IdentifierResolver(SemanticCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog);
    }

    public ResolvedMetric resolveMetric(String name) {
        MetricDefinition def = catalog.findMetric(name)
                .orElseThrow(() -> new UnknownMetricException(name));
        return new ResolvedMetric(name, def);
    }

    public ResolvedDimension resolveDimension(String name) {
        DateGrain.GrainedName parsed = DateGrain.parse(name);
        DimensionDefinition def = catalog.findDimension(parsed.base())
                .orElseThrow(() -> new UnknownDimensionException(name));
        return new ResolvedDimension(name, parsed.base(), parsed.grain(), def);
    }

    /**
     * Dimensions win over metrics when both declare the field's base name.
     */
    public FilterTarget resolveFilterField(String field) {
        DateGrain.GrainedName parsed = DateGrain.parse(field);

        Optional<DimensionDefinition> dim = catalog.findDimension(parsed.base());
        if (dim.isPresent()) {
            return FilterTarget.of(new ResolvedDimension(field, parsed.base(), parsed.grain(), dim.get()));
        }

        Optional<MetricDefinition> metric = catalog.findMetric(parsed.base());
        if (metric.isPresent()) {
            return FilterTarget.of(new ResolvedMetric(field, metric.get()));
        }

        throw new UnknownFilterFieldException(field);
    }
}
