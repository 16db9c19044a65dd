package org.iceforge.strata.semantic.compiler;

import org.iceforge.strata.semantic.model.JoinEdge;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Star-shaped join planning: every table is joined directly to the first table referenced by the query.
 * No path through intermediate tables is attempted.
 */
public final class JoinPlanner {

    private final SemanticCatalog catalog;

    public JoinPlanner(SemanticCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog);
    }

    public JoinPlan plan(List<ResolvedMetric> metrics, List<ResolvedDimension> dimensions) {
        // first-seen order decides the anchor and the join order
        Set<String> tables = new LinkedHashSet<>();
        for (ResolvedMetric m : metrics) {
            tables.add(m.table());
        }
        for (ResolvedDimension d : dimensions) {
            tables.add(d.table());
        }

        if (tables.isEmpty()) {
            throw new NoTablesException();
        }

        List<String> ordered = new ArrayList<>(tables);
        String anchor = ordered.get(0);

        List<JoinPlan.Join> joins = new ArrayList<>();
        for (String table : ordered.subList(1, ordered.size())) {
            JoinEdge edge = catalog.findJoin(anchor, table)
                    .orElseThrow(() -> new MissingJoinException(anchor, table));
            joins.add(new JoinPlan.Join(table, edge.getJoinPredicate()));
        }

        return new JoinPlan(anchor, joins, ordered);
    }
}
