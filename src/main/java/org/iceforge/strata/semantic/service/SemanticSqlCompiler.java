package org.iceforge.strata.semantic.service;

import org.iceforge.strata.semantic.compiler.ClauseBuilder;
import org.iceforge.strata.semantic.compiler.IdentifierResolver;
import org.iceforge.strata.semantic.compiler.JoinPlan;
import org.iceforge.strata.semantic.compiler.JoinPlanner;
import org.iceforge.strata.semantic.compiler.ResolvedDimension;
import org.iceforge.strata.semantic.compiler.ResolvedMetric;
import org.iceforge.strata.semantic.compiler.SemanticCatalog;
import org.iceforge.strata.semantic.compiler.SqlAssembler;
import org.iceforge.strata.semantic.compiler.SqlClauses;
import org.iceforge.strata.semantic.model.QuerySpec;
import org.iceforge.strata.semantic.model.SemanticLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles a query spec against a semantic layer into a single SQL statement.
 * Stateless: safe to call concurrently.
 */
@Service
public class SemanticSqlCompiler {

    private static final Logger log = LoggerFactory.getLogger(SemanticSqlCompiler.class);

    private final SqlAssembler assembler = new SqlAssembler();

    public CompiledQuery compile(QuerySpec query, SemanticLayer layer) {
        Objects.requireNonNull(query);
        Objects.requireNonNull(layer);

        SemanticCatalog catalog = SemanticCatalog.of(layer);
        IdentifierResolver resolver = new IdentifierResolver(catalog);

        List<ResolvedMetric> metrics = new ArrayList<>();
        for (String name : query.getMetrics()) {
            metrics.add(resolver.resolveMetric(name));
        }

        List<ResolvedDimension> dimensions = new ArrayList<>();
        for (String name : query.getDimensions()) {
            dimensions.add(resolver.resolveDimension(name));
        }

        JoinPlan plan = new JoinPlanner(catalog).plan(metrics, dimensions);
        SqlClauses clauses = new ClauseBuilder(resolver).build(metrics, dimensions, query.getFilters(), plan);
        String sql = assembler.assemble(plan, clauses);

        if (log.isDebugEnabled()) {
            log.debug("Compiled metrics={} dimensions={} over tables={}:\n{}",
                    query.getMetrics(), query.getDimensions(), plan.tables(), sql);
        }
        return new CompiledQuery(sql, plan.tables());
    }

    public record CompiledQuery(String sql, List<String> tables) {}
}
