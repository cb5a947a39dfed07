package org.exposql.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.exposql.expr.Expr;
import org.exposql.expr.Exprs;
import org.exposql.expr.SelectQuery;
import org.exposql.model.FunnelMetric;
import org.exposql.model.MeanMetric;
import org.exposql.model.MetricSource;
import org.exposql.model.RatioMetric;
import org.exposql.model.WarehouseSource;

/**
 * Shared skeleton of both plan shapes. Subclasses produce the stages up to and including
 * {@code entity_metrics} (one {@code (entity_id, variant, value)} row per exposed entity); this
 * class appends winsorization and the per-variant totals. Ratio metrics carry
 * {@code numerator_value} and {@code denominator_value} instead of {@code value}.
 */
abstract class AbstractPlanBuilder implements PlanBuilder {
    protected final MetricQueryRequest request;
    protected final CompilationContext context;

    protected AbstractPlanBuilder(final MetricQueryRequest request, final CompilationContext context) {
        this.request = Objects.requireNonNull(request, "request");
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public final SelectQuery build() {
        final List<SelectQuery.Cte> ctes = new ArrayList<>(entityStages());
        return switch (request.metric().kind()) {
            case MEAN -> {
                final MeanMetric mean = (MeanMetric) request.metric();
                String source = PlanColumns.ENTITY_METRICS;
                if (mean.needsWinsorization()) {
                    ctes.add(new SelectQuery.Cte(PlanColumns.PERCENTILES, FinalAggregation.percentiles(mean, source)));
                    ctes.add(new SelectQuery.Cte(
                            PlanColumns.WINSORIZED_ENTITY_METRICS, FinalAggregation.winsorized(source)));
                    source = PlanColumns.WINSORIZED_ENTITY_METRICS;
                }
                yield FinalAggregation.meanTotals(ctes, source).build();
            }
            case FUNNEL -> FinalAggregation.funnelTotals(
                            ctes,
                            PlanColumns.ENTITY_METRICS,
                            (FunnelMetric) request.metric(),
                            context.options().funnelStepCounts())
                    .build();
            case RATIO -> FinalAggregation.ratioTotals(ctes, PlanColumns.ENTITY_METRICS).build();
        };
    }

    /**
     * Stages ending with a CTE named {@link PlanColumns#ENTITY_METRICS}.
     */
    protected abstract List<SelectQuery.Cte> entityStages();

    /**
     * Timestamp column of a source's rows: the events timestamp, or the configured warehouse column.
     */
    protected final Expr sourceTimestamp(final MetricSource source) {
        if (source instanceof WarehouseSource warehouse) {
            return SourceFilters.warehouseField(warehouse.tableName(), warehouse.timestampField());
        }
        return Exprs.field(PlanColumns.TIMESTAMP);
    }

    /**
     * Candidate metric rows: inside the experiment window extended by the conversion window, and
     * matching the metric source (or any funnel step, or either side of a ratio).
     */
    protected final Expr metricPredicate() {
        return switch (request.metric().kind()) {
            case MEAN -> sourcePredicate(meanSource());
            case FUNNEL -> windowed(
                    Exprs.field(PlanColumns.TIMESTAMP),
                    FunnelEvaluator.anyStepFilter(((FunnelMetric) request.metric()).series(), context.actions()));
            case RATIO -> Exprs.or(sourcePredicate(ratio().numerator()), sourcePredicate(ratio().denominator()));
        };
    }

    /**
     * Rows of one source inside the experiment window extended by the conversion window.
     */
    protected final Expr sourcePredicate(final MetricSource source) {
        return windowed(sourceTimestamp(source), SourceFilters.sourceFilter(source, context.actions()));
    }

    private Expr windowed(final Expr timestamp, final Expr sourceFilter) {
        return Exprs.and(
                Exprs.gte(timestamp, Exprs.constant(request.dateRange().from())),
                Exprs.lt(timestamp, Exprs.plusSeconds(
                        Exprs.constant(request.dateRange().to()), request.metric().conversionWindowSeconds())),
                sourceFilter);
    }

    /**
     * Metric row at {@code timestamp} counts for an entity first exposed at {@code firstExposure}.
     */
    protected final Expr attributionWindow(final Expr timestamp, final Expr firstExposure) {
        final long window = request.metric().conversionWindowSeconds();
        final Expr afterExposure = Exprs.gte(timestamp, firstExposure);
        if (window <= 0) {
            return afterExposure;
        }
        return Exprs.and(afterExposure, Exprs.lt(timestamp, Exprs.plusSeconds(firstExposure, window)));
    }

    protected final Expr stepLevel() {
        return FunnelEvaluator.stepLevelExpression(((FunnelMetric) request.metric()).series(), context.actions());
    }

    protected final MetricSource meanSource() {
        return ((MeanMetric) request.metric()).source();
    }

    protected final RatioMetric ratio() {
        return (RatioMetric) request.metric();
    }
}
