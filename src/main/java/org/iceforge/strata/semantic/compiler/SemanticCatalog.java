package org.iceforge.strata.semantic.compiler;

import org.iceforge.strata.semantic.model.DimensionDefinition;
import org.iceforge.strata.semantic.model.JoinEdge;
import org.iceforge.strata.semantic.model.MetricDefinition;
import org.iceforge.strata.semantic.model.SemanticLayer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only lookup view over one semantic layer, built per compile call.
 * Metric names and dimension names must each be unique within the layer, and every definition and
 * join must carry all of its fields.
 */
public final class SemanticCatalog {

    private final Map<String, MetricDefinition> metrics;
    private final Map<String, DimensionDefinition> dimensions;
    private final List<JoinEdge> joins;

    private SemanticCatalog(Map<String, MetricDefinition> metrics,
                            Map<String, DimensionDefinition> dimensions,
                            List<JoinEdge> joins) {
        this.metrics = metrics;
        this.dimensions = dimensions;
        this.joins = joins;
    }

    public static SemanticCatalog of(SemanticLayer layer) {
        Objects.requireNonNull(layer, "layer");

        Map<String, MetricDefinition> metrics = new LinkedHashMap<>();
        List<MetricDefinition> declaredMetrics = nullToEmpty(layer.getMetrics());
        for (int i = 0; i < declaredMetrics.size(); i++) {
            MetricDefinition m = declaredMetrics.get(i);
            String subject = describe("Metric", i, m == null ? null : m.getName());
            requireField(subject, "name", m == null ? null : m.getName());
            requireField(subject, "sql", m.getSqlExpression());
            requireField(subject, "table", m.getTable());
            if (metrics.putIfAbsent(m.getName(), m) != null) {
                throw new DuplicateDefinitionException("metric", m.getName());
            }
        }

        Map<String, DimensionDefinition> dimensions = new LinkedHashMap<>();
        List<DimensionDefinition> declaredDimensions = nullToEmpty(layer.getDimensions());
        for (int i = 0; i < declaredDimensions.size(); i++) {
            DimensionDefinition d = declaredDimensions.get(i);
            String subject = describe("Dimension", i, d == null ? null : d.getName());
            requireField(subject, "name", d == null ? null : d.getName());
            requireField(subject, "sql", d.getSqlExpression());
            requireField(subject, "table", d.getTable());
            if (dimensions.putIfAbsent(d.getName(), d) != null) {
                throw new DuplicateDefinitionException("dimension", d.getName());
            }
        }

        List<JoinEdge> joins = nullToEmpty(layer.getJoins());
        for (int i = 0; i < joins.size(); i++) {
            JoinEdge j = joins.get(i);
            String subject = "Join at position " + i;
            requireField(subject, "one", j == null ? null : j.getTableOne());
            requireField(subject, "many", j.getTableMany());
            requireField(subject, "join", j.getJoinPredicate());
        }

        return new SemanticCatalog(metrics, dimensions, List.copyOf(joins));
    }

    public Optional<MetricDefinition> findMetric(String name) {
        return Optional.ofNullable(metrics.get(name));
    }

    public Optional<DimensionDefinition> findDimension(String name) {
        return Optional.ofNullable(dimensions.get(name));
    }

    /**
     * First declared edge connecting the two tables, in either direction.
     */
    public Optional<JoinEdge> findJoin(String tableA, String tableB) {
        for (JoinEdge edge : joins) {
            if (edge.connects(tableA, tableB)) {
                return Optional.of(edge);
            }
        }
        return Optional.empty();
    }

    static String describe(String kind, int position, String name) {
        return isBlank(name) ? kind + " at position " + position : kind + " '" + name + "'";
    }

    static void requireField(String subject, String field, String value) {
        if (isBlank(value)) {
            throw new InvalidDefinitionException(subject, field);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
