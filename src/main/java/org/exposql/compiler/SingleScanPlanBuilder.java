package org.exposql.compiler;

import java.util.List;
import org.exposql.expr.Expr;
import org.exposql.expr.Exprs;
import org.exposql.expr.SelectQuery;
import org.exposql.expr.UnsupportedFeatureException;
import org.exposql.model.FunnelMetric;
import org.exposql.model.MeanMetric;
import org.exposql.model.MetricKind;
import org.exposql.model.MetricSource;
import org.exposql.model.RatioMetric;
import org.exposql.model.SourceKind;

/**
 * Reads the events table once, collecting exposure fields and metric rows per entity with
 * conditional aggregates, and applies the exposure-time filter afterwards on the collected arrays.
 *
 * <pre>
 * entity_scan (WHERE exposure OR metric) -> entity_metrics (exposed entities, filtered arrays)
 * </pre>
 *
 * A ratio metric collects one array per side, each with its own source predicate.
 *
 * Warehouse metrics live in another table and cannot share the scan.
 */
public final class SingleScanPlanBuilder extends AbstractPlanBuilder {
    private static final String TUPLE_PARAM = "x";

    public SingleScanPlanBuilder(final MetricQueryRequest request, final CompilationContext context) {
        super(request, context);
        if (request.metric() instanceof MeanMetric mean && mean.source().kind() == SourceKind.WAREHOUSE
                || request.metric() instanceof RatioMetric ratio && ratio.readsWarehouse()) {
            throw UnsupportedFeatureException.plan(
                    "single_scan.warehouse", "single-scan plan does not support warehouse metric sources");
        }
    }

    @Override
    public PlanStrategy strategy() {
        return PlanStrategy.SINGLE_SCAN;
    }

    @Override
    protected List<SelectQuery.Cte> entityStages() {
        return List.of(
                new SelectQuery.Cte(PlanColumns.ENTITY_SCAN, entityScan()),
                new SelectQuery.Cte(PlanColumns.ENTITY_METRICS, entityMetrics()));
    }

    private SelectQuery entityScan() {
        final Expr exposure = ExposureResolver.exposurePredicate(request, context);
        final Expr metric = metricPredicate();
        final Expr entity = Exprs.field(request.entityKey().chain());
        final Expr timestamp = Exprs.field(PlanColumns.TIMESTAMP);
        final Expr variantProperty = ExposureResolver.variantProperty(
                request.criteria().effectiveExposureConfig(), request.featureFlagKey());
        final SelectQuery.Builder builder = SelectQuery.builder()
                .select(PlanColumns.ENTITY_ID, entity)
                .select(PlanColumns.VARIANT, ExposureResolver.variantAssignmentExpression(
                        request.criteria().multipleVariantHandling(), variantProperty, exposure))
                .select(PlanColumns.FIRST_EXPOSURE_TIME, Exprs.call("minIf", timestamp, exposure))
                .select(PlanColumns.EXPOSURE_EVENT_UUID, Exprs.call("argMinIf", Exprs.field("uuid"), timestamp, exposure))
                .select(PlanColumns.EXPOSURE_SESSION_ID,
                        Exprs.call("argMinIf", Exprs.field("$session_id"), timestamp, exposure));
        if (request.metric() instanceof RatioMetric ratio) {
            builder.select(PlanColumns.NUMERATOR_VALUES, collected(ratio.numerator(), sourcePredicate(ratio.numerator())))
                    .select(PlanColumns.DENOMINATOR_VALUES,
                            collected(ratio.denominator(), sourcePredicate(ratio.denominator())));
        } else {
            builder.select(PlanColumns.METRIC_VALUES, Exprs.call(
                    "groupArrayIf", Exprs.call("tuple", timestamp, collectedValue()), metric));
        }
        return builder
                .from(PlanColumns.EVENTS_TABLE)
                .where(Exprs.or(exposure, metric))
                .groupBy(entity)
                .build();
    }

    private Expr collectedValue() {
        if (request.metric().kind() == MetricKind.FUNNEL) {
            return stepLevel();
        }
        return ExpressionSynthesizer.valueExpression(meanSource(), request.entityKey());
    }

    private Expr collected(final MetricSource source, final Expr predicate) {
        return Exprs.call(
                "groupArrayIf",
                Exprs.call(
                        "tuple",
                        Exprs.field(PlanColumns.TIMESTAMP),
                        ExpressionSynthesizer.valueExpression(source, request.entityKey())),
                predicate);
    }

    private SelectQuery entityMetrics() {
        final Expr firstExposure = Exprs.field(PlanColumns.FIRST_EXPOSURE_TIME);
        final SelectQuery.Builder builder = SelectQuery.builder()
                .select(PlanColumns.ENTITY_ID, Exprs.field(PlanColumns.ENTITY_ID))
                .select(PlanColumns.VARIANT, Exprs.field(PlanColumns.VARIANT));
        switch (request.metric().kind()) {
            case MEAN -> builder.select(PlanColumns.VALUE, ExpressionSynthesizer.arrayAggregationExpression(
                    meanSource(), attributed(PlanColumns.METRIC_VALUES, firstExposure)));
            case FUNNEL -> builder.select(PlanColumns.VALUE, FunnelEvaluator.funnelEvaluation(
                    (FunnelMetric) request.metric(), attributed(PlanColumns.METRIC_VALUES, firstExposure)));
            case RATIO -> builder
                    .select(PlanColumns.NUMERATOR_VALUE, ExpressionSynthesizer.arrayAggregationExpression(
                            ratio().numerator(), attributed(PlanColumns.NUMERATOR_VALUES, firstExposure)))
                    .select(PlanColumns.DENOMINATOR_VALUE, ExpressionSynthesizer.arrayAggregationExpression(
                            ratio().denominator(), attributed(PlanColumns.DENOMINATOR_VALUES, firstExposure)));
        }
        return builder
                .from(PlanColumns.ENTITY_SCAN)
                .where(Exprs.call("isNotNull", firstExposure))
                .build();
    }

    private Expr attributed(final String column, final Expr firstExposure) {
        return Exprs.call(
                "arrayFilter",
                Exprs.lambda(TUPLE_PARAM, attributionWindow(Exprs.element(Exprs.field(TUPLE_PARAM), 1), firstExposure)),
                Exprs.field(column));
    }
}
