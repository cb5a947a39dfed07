package org.exposql.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.exposql.expr.SelectQuery;
import org.exposql.expr.SqlRenderer;
import org.exposql.expr.UnsupportedFeatureException;
import org.exposql.model.EntityKey;
import org.exposql.model.EventSource;
import org.exposql.model.ExperimentDateRange;
import org.exposql.model.ExposureCriteria;
import org.exposql.model.FunnelMetric;
import org.exposql.model.MathType;
import org.exposql.model.MeanMetric;
import org.exposql.model.MetricSource;
import org.exposql.model.MetricSpecification;
import org.exposql.model.RatioMetric;
import org.exposql.model.VariantSet;
import org.exposql.model.WarehouseSource;
import org.junit.jupiter.api.Test;

class PlanBuildersTest {
    private static final CompilationContext JOIN = CompilationContext.defaults();
    private static final List<String> RATIO_COLUMNS = List.of(
        "variant", "num_users", "total_sum", "total_sum_of_squares",
        "denominator_sum", "denominator_sum_squares", "numerator_denominator_sum_product");
    private static final CompilationContext SINGLE_SCAN = CompilationContext.defaults()
        .withOptions(CompilerOptions.defaults().withPlanStrategy(PlanStrategy.SINGLE_SCAN));

    @Test
    void configuredStrategyPicksTheBuilder() {
        MetricQueryRequest request = request(MeanMetric.of(EventSource.of("purchase")));

        assertInstanceOf(JoinPlanBuilder.class, PlanBuilders.create(request, JOIN));
        assertInstanceOf(SingleScanPlanBuilder.class, PlanBuilders.create(request, SINGLE_SCAN));
        assertEquals(PlanStrategy.SINGLE_SCAN, PlanBuilders.create(request, SINGLE_SCAN).strategy());
    }

    @Test
    void joinPlanComputesExposuresAndMetricEventsSeparately() {
        SelectQuery plan = PlanBuilders.create(request(MeanMetric.of(EventSource.of("purchase"))), JOIN).build();

        assertEquals(List.of("exposures", "metric_events", "entity_metrics"), cteNames(plan));
        assertEquals(List.of("variant", "num_users", "total_sum", "total_sum_of_squares"), plan.columnNames());
    }

    @Test
    void singleScanPlanReadsEventsOnce() {
        SelectQuery plan = PlanBuilders.create(request(MeanMetric.of(EventSource.of("purchase"))), SINGLE_SCAN).build();

        assertEquals(List.of("entity_scan", "entity_metrics"), cteNames(plan));
        assertEquals(List.of("variant", "num_users", "total_sum", "total_sum_of_squares"), plan.columnNames());
    }

    @Test
    void boundsAddPercentileAndWinsorizedStages() {
        MeanMetric metric = MeanMetric.of(EventSource.of("purchase").withMath(MathType.SUM, "amount"))
            .withBounds(0.05d, 0.95d)
            .withIgnoreZeros(true);

        for (CompilationContext context : List.of(JOIN, SINGLE_SCAN)) {
            SelectQuery plan = PlanBuilders.create(request(metric), context).build();
            List<String> names = cteNames(plan);

            assertEquals(
                List.of("percentiles", "winsorized_entity_metrics"),
                names.subList(names.size() - 2, names.size()));
            String percentiles = new SqlRenderer().render(plan.cte("percentiles").orElseThrow().query());
            assertTrue(percentiles.contains("quantile(0.05)(value) AS lower_bound"), percentiles);
            assertTrue(
                percentiles.contains(
                    "coalesce(quantile(0.95)(if(value != 0, value, NULL)), max(value)) AS upper_bound"),
                percentiles);
        }
    }

    @Test
    void singleScanRejectsWarehouseSources() {
        MetricQueryRequest request = request(MeanMetric.of(
            WarehouseSource.of("payments", "paid_at", "customer_id", "properties.customer_id", MathType.TOTAL, null)));

        UnsupportedFeatureException error =
            assertThrows(UnsupportedFeatureException.class, () -> PlanBuilders.create(request, SINGLE_SCAN));
        assertEquals("plan.single_scan.warehouse", error.featureKey());
        assertEquals(
            List.of("exposures", "metric_events", "entity_metrics"),
            cteNames(PlanBuilders.create(request, JOIN).build()));
    }

    @Test
    void funnelPlansReportSuccessAndFailure() {
        List<MetricSource> series = List.of(EventSource.of("signup"), EventSource.of("purchase"));
        MetricQueryRequest request = request(FunnelMetric.of(series));

        assertEquals(
            List.of("variant", "num_users", "success_count", "failure_count"),
            PlanBuilders.create(request, JOIN).build().columnNames());
        CompilationContext withStepCounts =
            SINGLE_SCAN.withOptions(SINGLE_SCAN.options().withFunnelStepCounts(true));
        assertEquals(
            List.of("variant", "num_users", "success_count", "failure_count", "step_counts"),
            PlanBuilders.create(request, withStepCounts).build().columnNames());
    }

    @Test
    void funnelMetricEventsCarryOnlyWhatTheEvaluationReads() {
        List<MetricSource> series = List.of(EventSource.of("signup"), EventSource.of("purchase"));
        SelectQuery plan = PlanBuilders.create(request(FunnelMetric.of(series)), JOIN).build();

        assertEquals(
            List.of("entity_id", "timestamp", "step_level"),
            plan.cte("metric_events").orElseThrow().query().columnNames());
    }

    @Test
    void joinPlanAggregatesRatioSidesSeparately() {
        RatioMetric metric = RatioMetric.of(
            EventSource.of("purchase").withMath(MathType.SUM, "amount"), EventSource.of("$pageview"));
        SelectQuery plan = PlanBuilders.create(request(metric), JOIN).build();

        assertEquals(
            List.of(
                "exposures", "numerator_events", "denominator_events",
                "numerator_aggregated", "denominator_aggregated", "entity_metrics"),
            cteNames(plan));
        assertEquals(RATIO_COLUMNS, plan.columnNames());
        String entityMetrics = new SqlRenderer().render(plan.cte("entity_metrics").orElseThrow().query());
        assertTrue(
            entityMetrics.contains("coalesce(denominator_aggregated.denominator_value, 0"),
            entityMetrics);
    }

    @Test
    void singleScanCollectsOneArrayPerRatioSide() {
        RatioMetric metric = RatioMetric.of(EventSource.of("purchase"), EventSource.of("$pageview"));
        SelectQuery plan = PlanBuilders.create(request(metric), SINGLE_SCAN).build();

        assertEquals(List.of("entity_scan", "entity_metrics"), cteNames(plan));
        assertEquals(RATIO_COLUMNS, plan.columnNames());
        List<String> scanColumns = plan.cte("entity_scan").orElseThrow().query().columnNames();
        assertTrue(scanColumns.containsAll(List.of("numerator_values", "denominator_values")), scanColumns.toString());
        assertEquals(
            List.of("entity_id", "variant", "numerator_value", "denominator_value"),
            plan.cte("entity_metrics").orElseThrow().query().columnNames());
    }

    @Test
    void warehouseRatiosCarryOneIdentifierPerWarehouseSide() {
        RatioMetric metric = RatioMetric.of(
            WarehouseSource.of("payments", "paid_at", "customer_id", "properties.customer_id", MathType.SUM, "amount"),
            EventSource.of("$pageview"));
        MetricQueryRequest request = request(metric);

        SelectQuery exposures = PlanBuilders.create(request, JOIN).build().cte("exposures").orElseThrow().query();
        assertTrue(exposures.columnNames().contains("exposure_identifier_num"));
        assertFalse(exposures.columnNames().contains("exposure_identifier_denom"));
        UnsupportedFeatureException error =
            assertThrows(UnsupportedFeatureException.class, () -> PlanBuilders.create(request, SINGLE_SCAN));
        assertEquals("plan.single_scan.warehouse", error.featureKey());
    }

    @Test
    void compiledPlanIsDeterministic() {
        MetricQueryRequest request = request(MeanMetric.of(EventSource.of("purchase").withMath(MathType.AVERAGE, "amount")));
        SqlRenderer renderer = new SqlRenderer();

        assertEquals(
            renderer.render(PlanBuilders.create(request, JOIN).build()),
            renderer.render(PlanBuilders.create(request, JOIN).build()));
    }

    private static List<String> cteNames(SelectQuery plan) {
        List<String> names = new ArrayList<>();
        for (SelectQuery.Cte cte : plan.ctes()) {
            names.add(cte.name());
        }
        return names;
    }

    private static MetricQueryRequest request(MetricSpecification metric) {
        return new MetricQueryRequest(
            "new-checkout",
            VariantSet.of("control", "test"),
            ExperimentDateRange.utc(Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-15T00:00:00Z")),
            EntityKey.person(),
            metric,
            ExposureCriteria.defaults());
    }
}
