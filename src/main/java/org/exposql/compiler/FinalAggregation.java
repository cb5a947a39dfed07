package org.exposql.compiler;

import java.util.ArrayList;
import java.util.List;
import org.exposql.expr.Expr;
import org.exposql.expr.Exprs;
import org.exposql.expr.FromClause;
import org.exposql.expr.SelectQuery;
import org.exposql.model.FunnelMetric;
import org.exposql.model.MeanMetric;

/**
 * Stages after the per-entity value is known: optional winsorization and the per-variant totals.
 * Both plan shapes end with these stages, which is what makes their outputs comparable.
 */
final class FinalAggregation {
    private FinalAggregation() {}

    /**
     * Global clipping bounds over all entity values. An unset bound is the plain min or max.
     */
    static SelectQuery percentiles(final MeanMetric metric, final String source) {
        final Expr value = Exprs.field(PlanColumns.VALUE);
        final Expr lower = metric.lowerBoundPercentile()
                .map(level -> quantile(level, value))
                .orElseGet(() -> Exprs.call("min", value));
        final Expr upper = metric.upperBoundPercentile()
                .map(level -> metric.ignoreZeros()
                        ? Exprs.call(
                                "coalesce",
                                quantile(level, Exprs.call(
                                        "if",
                                        Exprs.compare(Expr.CompareOp.NOT_EQ, value, Exprs.constant(0L)),
                                        value,
                                        Exprs.constant(null))),
                                Exprs.call("max", value))
                        : quantile(level, value))
                .orElseGet(() -> Exprs.call("max", value));
        return SelectQuery.builder()
                .select(PlanColumns.LOWER_BOUND, lower)
                .select(PlanColumns.UPPER_BOUND, upper)
                .from(source)
                .build();
    }

    static SelectQuery winsorized(final String source) {
        final Expr clipped = Exprs.call(
                "least",
                Exprs.call(
                        "greatest",
                        Exprs.field(PlanColumns.PERCENTILES, PlanColumns.LOWER_BOUND),
                        Exprs.field(source, PlanColumns.VALUE)),
                Exprs.field(PlanColumns.PERCENTILES, PlanColumns.UPPER_BOUND));
        return SelectQuery.builder()
                .select(PlanColumns.ENTITY_ID, Exprs.field(source, PlanColumns.ENTITY_ID))
                .select(PlanColumns.VARIANT, Exprs.field(source, PlanColumns.VARIANT))
                .select(PlanColumns.VALUE, clipped)
                .from(new FromClause.Join(
                        FromClause.Table.of(source),
                        FromClause.Table.of(PlanColumns.PERCENTILES),
                        FromClause.JoinType.CROSS,
                        null))
                .build();
    }

    static SelectQuery.Builder meanTotals(final List<SelectQuery.Cte> ctes, final String source) {
        final Expr value = Exprs.field(PlanColumns.VALUE);
        return SelectQuery.builder()
                .with(ctes)
                .select(PlanColumns.VARIANT, Exprs.field(PlanColumns.VARIANT))
                .select(PlanColumns.NUM_USERS, numUsers())
                .select(PlanColumns.TOTAL_SUM, Exprs.call("sum", value))
                .select(PlanColumns.TOTAL_SUM_OF_SQUARES, sumOfSquares(value))
                .from(source)
                .groupBy(Exprs.field(PlanColumns.VARIANT));
    }

    static SelectQuery.Builder funnelTotals(
            final List<SelectQuery.Cte> ctes,
            final String source,
            final FunnelMetric metric,
            final boolean stepCounts) {
        final Expr value = Exprs.field(PlanColumns.VALUE);
        final Expr successes = Exprs.call("countIf", FunnelEvaluator.completionPredicate(metric, value));
        final SelectQuery.Builder builder = SelectQuery.builder()
                .with(ctes)
                .select(PlanColumns.VARIANT, Exprs.field(PlanColumns.VARIANT))
                .select(PlanColumns.NUM_USERS, numUsers())
                .select(PlanColumns.SUCCESS_COUNT, successes)
                .select(PlanColumns.FAILURE_COUNT, Exprs.minus(numUsers(), successes));
        if (stepCounts) {
            final List<Expr> perStep = new ArrayList<>();
            for (int reached = 1; reached <= FunnelEvaluator.completionThreshold(metric); reached++) {
                perStep.add(Exprs.call("countIf", Exprs.gte(value, Exprs.constant((long) reached))));
            }
            builder.select(PlanColumns.STEP_COUNTS, Exprs.call("array", perStep.toArray(new Expr[0])));
        }
        return builder.from(source).groupBy(Exprs.field(PlanColumns.VARIANT));
    }

    static SelectQuery.Builder ratioTotals(final List<SelectQuery.Cte> ctes, final String source) {
        final Expr numerator = Exprs.field(PlanColumns.NUMERATOR_VALUE);
        final Expr denominator = Exprs.field(PlanColumns.DENOMINATOR_VALUE);
        return SelectQuery.builder()
                .with(ctes)
                .select(PlanColumns.VARIANT, Exprs.field(PlanColumns.VARIANT))
                .select(PlanColumns.NUM_USERS, numUsers())
                .select(PlanColumns.TOTAL_SUM, Exprs.call("sum", numerator))
                .select(PlanColumns.TOTAL_SUM_OF_SQUARES, sumOfSquares(numerator))
                .select(PlanColumns.DENOMINATOR_SUM, Exprs.call("sum", denominator))
                .select(PlanColumns.DENOMINATOR_SUM_SQUARES, sumOfSquares(denominator))
                .select(PlanColumns.NUMERATOR_DENOMINATOR_SUM_PRODUCT,
                        Exprs.call("sum", Exprs.multiply(numerator, denominator)))
                .from(source)
                .groupBy(Exprs.field(PlanColumns.VARIANT));
    }

    private static Expr sumOfSquares(final Expr value) {
        return Exprs.call("sum", Exprs.call("power", value, Exprs.constant(2L)));
    }

    private static Expr numUsers() {
        return Exprs.call("count", Exprs.field(PlanColumns.ENTITY_ID));
    }

    private static Expr quantile(final double level, final Expr value) {
        return Exprs.parametric("quantile", List.of(Exprs.constant(level)), value);
    }
}
