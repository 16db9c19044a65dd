package org.iceforge.strata.semantic.compiler;

import org.iceforge.strata.semantic.model.DimensionDefinition;
import org.iceforge.strata.semantic.model.MetricDefinition;
import org.iceforge.strata.semantic.model.SemanticLayer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentifierResolverTest {

    private final IdentifierResolver resolver = new IdentifierResolver(SemanticCatalog.of(new SemanticLayer(
            List.of(new MetricDefinition("total_revenue", "SUM(sale_price)", "order_items"),
                    new MetricDefinition("status", "COUNT(status)", "orders")),
            List.of(new DimensionDefinition("ordered_date", "created_at", "orders"),
                    new DimensionDefinition("status", "status", "orders")),
            List.of())));

    @Test
    void resolvesMetricByRequestedName() {
        ResolvedMetric metric = resolver.resolveMetric("total_revenue");

        assertThat(metric.requestedName()).isEqualTo("total_revenue");
        assertThat(metric.table()).isEqualTo("order_items");
    }

    @Test
    void metricNamesAreNotGrainStripped() {
        assertThatThrownBy(() -> resolver.resolveMetric("total_revenue__month"))
                .isInstanceOf(UnknownMetricException.class)
                .hasMessageContaining("'total_revenue__month'");
    }

    @Test
    void resolvesGrainedDimension() {
        ResolvedDimension dim = resolver.resolveDimension("ordered_date__month");

        assertThat(dim.baseName()).isEqualTo("ordered_date");
        assertThat(dim.grain()).isEqualTo(DateGrain.MONTH);
        assertThat(dim.alias()).isEqualTo("ordered_date__month");
        assertThat(dim.definition().getSqlExpression()).isEqualTo("created_at");
    }

    @Test
    void plainDimensionIsAliasedByBaseName() {
        ResolvedDimension dim = resolver.resolveDimension("ordered_date");

        assertThat(dim.grain()).isNull();
        assertThat(dim.alias()).isEqualTo("ordered_date");
    }

    @Test
    void unknownDimensionReportsRequestedName() {
        assertThatThrownBy(() -> resolver.resolveDimension("shipped_date__week"))
                .isInstanceOf(UnknownDimensionException.class)
                .hasMessageContaining("'shipped_date__week'");
    }

    @Test
    void filterFieldsPreferDimensions() {
        FilterTarget target = resolver.resolveFilterField("status");

        assertThat(target.isDimension()).isTrue();
        assertThat(target.dimension().table()).isEqualTo("orders");
    }

    @Test
    void filterFieldFallsBackToMetric() {
        FilterTarget target = resolver.resolveFilterField("total_revenue");

        assertThat(target.isDimension()).isFalse();
        assertThat(target.metric().definition().getName()).isEqualTo("total_revenue");
    }

    @Test
    void filterFieldMayCarryGrain() {
        FilterTarget target = resolver.resolveFilterField("ordered_date__year");

        assertThat(target.dimension().grain()).isEqualTo(DateGrain.YEAR);
    }

    @Test
    void unknownFilterField() {
        assertThatThrownBy(() -> resolver.resolveFilterField("country"))
                .isInstanceOf(UnknownFilterFieldException.class)
                .hasMessage("Filter field 'country' not found in dimensions or metrics.");
    }
}
