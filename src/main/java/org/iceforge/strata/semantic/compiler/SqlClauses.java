package org.iceforge.strata.semantic.compiler;

import java.util.List;

/**
 * Clause contents ready for assembly. Empty lists mean the clause is omitted.
 */
public record SqlClauses(List<String> selectItems,
                         List<String> wherePredicates,
                         List<String> groupByTerms,
                         List<String> havingPredicates) {

    public SqlClauses {
        selectItems = List.copyOf(selectItems);
        wherePredicates = List.copyOf(wherePredicates);
        groupByTerms = List.copyOf(groupByTerms);
        havingPredicates = List.copyOf(havingPredicates);
    }
}
