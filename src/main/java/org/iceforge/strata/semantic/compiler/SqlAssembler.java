package org.iceforge.strata.semantic.compiler;

import java.util.ArrayList;
import java.util.List;

/**
 * Joins clauses in canonical order, one clause per line. Clauses without content are left out.
 */
public final class SqlAssembler {

    public String assemble(JoinPlan plan, SqlClauses clauses) {
        if (plan == null || plan.anchorTable() == null) {
            throw new NoTablesException();
        }

        List<String> lines = new ArrayList<>();
        lines.add("SELECT " + (clauses.selectItems().isEmpty() ? "*" : String.join(", ", clauses.selectItems())));
        lines.add("FROM " + plan.anchorTable());
        for (JoinPlan.Join join : plan.joins()) {
            lines.add("JOIN " + join.table() + " ON " + join.predicate());
        }

        if (!clauses.wherePredicates().isEmpty()) {
            lines.add("WHERE " + String.join(" AND ", clauses.wherePredicates()));
        }
        if (!clauses.groupByTerms().isEmpty()) {
            lines.add("GROUP BY " + String.join(", ", clauses.groupByTerms()));
        }
        if (!clauses.havingPredicates().isEmpty()) {
            lines.add("HAVING " + String.join(" AND ", clauses.havingPredicates()));
        }

        return String.join("\n", lines);
    }
}
