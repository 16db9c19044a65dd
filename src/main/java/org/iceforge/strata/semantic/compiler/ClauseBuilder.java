package org.iceforge.strata.semantic.compiler;

import org.iceforge.strata.semantic.model.FilterClause;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds SELECT, WHERE, GROUP BY and HAVING contents from resolved definitions.
 *
 * <p>Metric SQL may contain at most one function call without nested parentheses, e.g. {@code SUM(sale_price)}.
 * In multi-table queries the argument of that call is qualified with the metric's table; anything after
 * the closing parenthesis is not preserved.
 */
public final class ClauseBuilder {

    private final IdentifierResolver resolver;

    public ClauseBuilder(IdentifierResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver);
    }

    public SqlClauses build(List<ResolvedMetric> metrics,
                            List<ResolvedDimension> dimensions,
                            List<FilterClause> filters,
                            JoinPlan plan) {
        boolean multiTable = plan.isMultiTable();

        List<String> select = new ArrayList<>();
        for (ResolvedMetric m : metrics) {
            select.add(metricExpression(m, multiTable) + " AS " + m.requestedName());
        }

        // every requested dimension is grouped, whether or not a metric was requested
        List<String> groupBy = new ArrayList<>();
        for (ResolvedDimension d : dimensions) {
            String expr = dimensionExpression(d, multiTable);
            select.add(expr + " AS " + d.alias());
            groupBy.add(expr);
        }

        List<String> where = new ArrayList<>();
        List<String> having = new ArrayList<>();
        for (int i = 0; i < filters.size(); i++) {
            FilterClause f = filters.get(i);
            String subject = SemanticCatalog.describe("Filter", i, f == null ? null : f.getField());
            SemanticCatalog.requireField(subject, "field", f == null ? null : f.getField());
            SemanticCatalog.requireField(subject, "operator", f.getOperator());
            FilterTarget target = resolver.resolveFilterField(f.getField());
            if (target.isDimension()) {
                where.add(predicate(dimensionExpression(target.dimension(), multiTable), f));
            } else {
                having.add(predicate(metricExpression(target.metric(), multiTable), f));
            }
        }

        return new SqlClauses(select, where, groupBy, having);
    }

    static String metricExpression(ResolvedMetric metric, boolean multiTable) {
        String expr = metric.definition().getSqlExpression();
        if (!multiTable) {
            return expr;
        }

        String table = metric.table();
        int open = expr.indexOf('(');
        int close = open < 0 ? -1 : expr.indexOf(')', open);
        if (open < 0 || close < 0) {
            return table + "." + expr;
        }

        String function = expr.substring(0, open).trim();
        String column = expr.substring(open + 1, close).trim();
        if (!"*".equals(column)) {
            column = table + "." + column;
        }
        return function + "(" + column + ")";
    }

    static String dimensionExpression(ResolvedDimension dimension, boolean multiTable) {
        String expr = dimension.definition().getSqlExpression();
        if (multiTable) {
            expr = dimension.table() + "." + expr;
        }
        if (dimension.grain() != null) {
            expr = "DATE_TRUNC(" + expr + ", " + dimension.grain().name() + ")";
        }
        return expr;
    }

    private static String predicate(String expr, FilterClause filter) {
        return expr + " " + filter.getOperator() + " " + renderValue(filter.getValue());
    }

    static String renderValue(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof CharSequence s) {
            return "'" + escapeSqlLiteral(s.toString()) + "'";
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof BigDecimal d) {
            return d.toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d).toPlainString() : value.toString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Collection<?> values) {
            // IN / NOT IN lists
            return values.stream()
                    .map(ClauseBuilder::renderValue)
                    .collect(Collectors.joining(", ", "(", ")"));
        }
        return "'" + escapeSqlLiteral(value.toString()) + "'";
    }

    private static String escapeSqlLiteral(String s) {
        return s.replace("'", "''");
    }
}
