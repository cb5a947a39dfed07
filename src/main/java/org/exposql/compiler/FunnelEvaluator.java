package org.exposql.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.exposql.expr.Expr;
import org.exposql.expr.Exprs;
import org.exposql.model.ActionCatalog;
import org.exposql.model.FunnelMetric;
import org.exposql.model.MetricSource;

/**
 * Step classification and completion of funnel metrics.
 *
 * <p>Steps are counted, not indexed: the evaluation returns how many steps an entity reached
 * ({@code 0..n}) and an entity completed the funnel when that count equals {@code n}.
 */
public final class FunnelEvaluator {
    /** Stand-in for "no conversion window": one hundred years of seconds. */
    public static final long UNBOUNDED_WINDOW_SECONDS = 100L * 365L * 24L * 60L * 60L;
    public static final String FUNNEL_FUNCTION = "aggregate_funnel_steps";
    public static final String STEP_LABEL_PREFIX = "step_";
    public static final String UNKNOWN_STEP_LABEL = "step_unknown";

    private FunnelEvaluator() {}

    public static String stepLabel(final int index) {
        return STEP_LABEL_PREFIX + index;
    }

    public static Expr stepFilter(final MetricSource step, final ActionCatalog actions) {
        return SourceFilters.sourceFilter(step, actions);
    }

    /**
     * Rows that match at least one step; all other rows are never funnel candidates.
     */
    public static Expr anyStepFilter(final List<MetricSource> series, final ActionCatalog actions) {
        final List<Expr> filters = new ArrayList<>(series.size());
        for (final MetricSource step : series) {
            filters.add(stepFilter(step, actions));
        }
        return Exprs.or(filters);
    }

    /**
     * Label of the first step whose filter matches the row. Overlapping step filters resolve to
     * the earliest step.
     */
    public static Expr stepLevelExpression(final List<MetricSource> series, final ActionCatalog actions) {
        final List<Expr> args = new ArrayList<>(series.size() * 2 + 1);
        for (int i = 0; i < series.size(); i++) {
            args.add(stepFilter(series.get(i), actions));
            args.add(Exprs.constant(stepLabel(i)));
        }
        args.add(Exprs.constant(UNKNOWN_STEP_LABEL));
        return new Expr.Call("multiIf", List.of(), args, false);
    }

    public static long windowSeconds(final FunnelMetric metric) {
        final long seconds = metric.conversionWindowSeconds();
        return seconds > 0 ? seconds : UNBOUNDED_WINDOW_SECONDS;
    }

    public static int completionThreshold(final FunnelMetric metric) {
        return metric.series().size();
    }

    /**
     * Number of steps reached, given an array of {@code (timestamp, step_level)} tuples.
     */
    public static Expr funnelEvaluation(final FunnelMetric metric, final Expr stepTuples) {
        return Exprs.call(
                FUNNEL_FUNCTION,
                Exprs.constant((long) metric.series().size()),
                Exprs.constant(windowSeconds(metric)),
                Exprs.constant(metric.stepOrder().name().toLowerCase(Locale.ROOT)),
                stepTuples);
    }

    public static Expr completionPredicate(final FunnelMetric metric, final Expr stepsReached) {
        return Exprs.eq(stepsReached, Exprs.constant((long) completionThreshold(metric)));
    }
}
