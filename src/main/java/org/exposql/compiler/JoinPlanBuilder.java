package org.exposql.compiler;

import java.util.List;
import java.util.Optional;
import org.exposql.expr.Expr;
import org.exposql.expr.Exprs;
import org.exposql.expr.FromClause;
import org.exposql.expr.SelectQuery;
import org.exposql.model.FunnelMetric;
import org.exposql.model.MetricKind;
import org.exposql.model.MetricSource;
import org.exposql.model.RatioMetric;
import org.exposql.model.WarehouseSource;

/**
 * Computes exposures and metric rows separately and joins them per entity.
 *
 * <pre>
 * exposures -> metric_events -> entity_metrics (exposures LEFT JOIN metric_events)
 * </pre>
 *
 * Ratio metrics join each side separately and then pair them per entity:
 *
 * <pre>
 * exposures -> numerator_events, denominator_events -> numerator_aggregated, denominator_aggregated
 *           -> entity_metrics (numerator_aggregated LEFT JOIN denominator_aggregated)
 * </pre>
 */
public final class JoinPlanBuilder extends AbstractPlanBuilder {
    public JoinPlanBuilder(final MetricQueryRequest request, final CompilationContext context) {
        super(request, context);
    }

    @Override
    public PlanStrategy strategy() {
        return PlanStrategy.JOIN;
    }

    @Override
    protected List<SelectQuery.Cte> entityStages() {
        final SelectQuery exposures = ExposureResolver.exposureSelect(request, context);
        if (request.metric() instanceof RatioMetric ratio) {
            return List.of(
                    new SelectQuery.Cte(PlanColumns.EXPOSURES, exposures),
                    new SelectQuery.Cte(PlanColumns.NUMERATOR_EVENTS, sourceEvents(ratio.numerator())),
                    new SelectQuery.Cte(PlanColumns.DENOMINATOR_EVENTS, sourceEvents(ratio.denominator())),
                    new SelectQuery.Cte(PlanColumns.NUMERATOR_AGGREGATED, aggregated(
                            ratio.numerator(),
                            PlanColumns.NUMERATOR_EVENTS,
                            PlanColumns.NUMERATOR_VALUE,
                            PlanColumns.EXPOSURE_IDENTIFIER_NUM)),
                    new SelectQuery.Cte(PlanColumns.DENOMINATOR_AGGREGATED, aggregated(
                            ratio.denominator(),
                            PlanColumns.DENOMINATOR_EVENTS,
                            PlanColumns.DENOMINATOR_VALUE,
                            PlanColumns.EXPOSURE_IDENTIFIER_DENOM)),
                    new SelectQuery.Cte(PlanColumns.ENTITY_METRICS, ratioEntityMetrics()));
        }
        return List.of(
                new SelectQuery.Cte(PlanColumns.EXPOSURES, exposures),
                new SelectQuery.Cte(PlanColumns.METRIC_EVENTS, metricEvents()),
                new SelectQuery.Cte(PlanColumns.ENTITY_METRICS, entityMetrics()));
    }

    private SelectQuery metricEvents() {
        return request.metric().kind() == MetricKind.FUNNEL ? funnelMetricEvents() : sourceEvents(meanSource());
    }

    /**
     * {@code (entity_id, timestamp, value)} rows of one source.
     */
    private SelectQuery sourceEvents(final MetricSource source) {
        final SelectQuery.Builder builder = SelectQuery.builder();
        if (source instanceof WarehouseSource warehouse) {
            builder.select(
                            PlanColumns.ENTITY_ID,
                            SourceFilters.warehouseField(warehouse.tableName(), warehouse.dataWarehouseJoinKey()))
                    .from(warehouse.tableName());
        } else {
            builder.select(PlanColumns.ENTITY_ID, Exprs.field(request.entityKey().chain()))
                    .from(PlanColumns.EVENTS_TABLE);
        }
        return builder.select(PlanColumns.TIMESTAMP, sourceTimestamp(source))
                .select(PlanColumns.VALUE, ExpressionSynthesizer.valueExpression(source, request.entityKey()))
                .where(sourcePredicate(source))
                .build();
    }

    private SelectQuery funnelMetricEvents() {
        return SelectQuery.builder()
                .select(PlanColumns.ENTITY_ID, Exprs.field(request.entityKey().chain()))
                .select(PlanColumns.TIMESTAMP, Exprs.field(PlanColumns.TIMESTAMP))
                .select(PlanColumns.STEP_LEVEL, stepLevel())
                .from(PlanColumns.EVENTS_TABLE)
                .where(metricPredicate())
                .build();
    }

    private SelectQuery entityMetrics() {
        final Expr eventTimestamp = Exprs.field(PlanColumns.METRIC_EVENTS, PlanColumns.TIMESTAMP);
        final Optional<String> identifier = ExposureResolver.exposureIdentifier(request).isPresent()
                ? Optional.of(PlanColumns.EXPOSURE_IDENTIFIER)
                : Optional.empty();
        return exposuresJoin(PlanColumns.METRIC_EVENTS, identifier, PlanColumns.VALUE, entityValue(eventTimestamp));
    }

    /**
     * One side of a ratio aggregated per exposed entity.
     */
    private SelectQuery aggregated(
            final MetricSource source, final String events, final String valueColumn, final String identifierColumn) {
        final Optional<String> identifier = source instanceof WarehouseSource
                ? Optional.of(identifierColumn)
                : Optional.empty();
        return exposuresJoin(
                events,
                identifier,
                valueColumn,
                ExpressionSynthesizer.aggregationExpression(source, Exprs.field(events, PlanColumns.VALUE)));
    }

    private SelectQuery exposuresJoin(
            final String events, final Optional<String> identifier, final String valueColumn, final Expr value) {
        final Expr exposureEntity = Exprs.field(PlanColumns.EXPOSURES, PlanColumns.ENTITY_ID);
        final Expr exposureVariant = Exprs.field(PlanColumns.EXPOSURES, PlanColumns.VARIANT);
        final Expr joinCondition = Exprs.and(
                entityMatch(events, identifier),
                attributionWindow(
                        Exprs.field(events, PlanColumns.TIMESTAMP),
                        Exprs.field(PlanColumns.EXPOSURES, PlanColumns.FIRST_EXPOSURE_TIME)));
        return SelectQuery.builder()
                .select(PlanColumns.ENTITY_ID, exposureEntity)
                .select(PlanColumns.VARIANT, exposureVariant)
                .select(valueColumn, value)
                .from(new FromClause.Join(
                        FromClause.Table.of(PlanColumns.EXPOSURES),
                        FromClause.Table.of(events),
                        FromClause.JoinType.LEFT,
                        joinCondition))
                .groupBy(exposureEntity, exposureVariant)
                .build();
    }

    /**
     * Warehouse rows match on the exposure identifier, compared as strings since the two sides
     * are typed independently.
     */
    private static Expr entityMatch(final String events, final Optional<String> identifier) {
        final Expr eventEntity = Exprs.field(events, PlanColumns.ENTITY_ID);
        if (identifier.isPresent()) {
            return Exprs.eq(
                    Exprs.call("toString", Exprs.field(PlanColumns.EXPOSURES, identifier.get())),
                    Exprs.call("toString", eventEntity));
        }
        return Exprs.eq(Exprs.field(PlanColumns.EXPOSURES, PlanColumns.ENTITY_ID), eventEntity);
    }

    private SelectQuery ratioEntityMetrics() {
        final Expr numeratorEntity = Exprs.field(PlanColumns.NUMERATOR_AGGREGATED, PlanColumns.ENTITY_ID);
        final Expr numeratorVariant = Exprs.field(PlanColumns.NUMERATOR_AGGREGATED, PlanColumns.VARIANT);
        final Expr pairing = Exprs.and(
                Exprs.eq(numeratorEntity, Exprs.field(PlanColumns.DENOMINATOR_AGGREGATED, PlanColumns.ENTITY_ID)),
                Exprs.eq(numeratorVariant, Exprs.field(PlanColumns.DENOMINATOR_AGGREGATED, PlanColumns.VARIANT)));
        return SelectQuery.builder()
                .select(PlanColumns.ENTITY_ID, numeratorEntity)
                .select(PlanColumns.VARIANT, numeratorVariant)
                .select(PlanColumns.NUMERATOR_VALUE,
                        Exprs.field(PlanColumns.NUMERATOR_AGGREGATED, PlanColumns.NUMERATOR_VALUE))
                .select(PlanColumns.DENOMINATOR_VALUE, Exprs.call(
                        "coalesce",
                        Exprs.field(PlanColumns.DENOMINATOR_AGGREGATED, PlanColumns.DENOMINATOR_VALUE),
                        Exprs.constant(0.0d)))
                .from(new FromClause.Join(
                        FromClause.Table.of(PlanColumns.NUMERATOR_AGGREGATED),
                        FromClause.Table.of(PlanColumns.DENOMINATOR_AGGREGATED),
                        FromClause.JoinType.LEFT,
                        pairing))
                .build();
    }

    private Expr entityValue(final Expr eventTimestamp) {
        if (request.metric().kind() == MetricKind.FUNNEL) {
            return FunnelEvaluator.funnelEvaluation(
                    (FunnelMetric) request.metric(),
                    Exprs.call(
                            "groupArrayIf",
                            Exprs.call(
                                    "tuple",
                                    eventTimestamp,
                                    Exprs.field(PlanColumns.METRIC_EVENTS, PlanColumns.STEP_LEVEL)),
                            Exprs.call("isNotNull", eventTimestamp)));
        }
        return ExpressionSynthesizer.aggregationExpression(
                meanSource(), Exprs.field(PlanColumns.METRIC_EVENTS, PlanColumns.VALUE));
    }
}
