package org.exposql.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.exposql.expr.Expr;
import org.exposql.expr.Exprs;
import org.exposql.expr.SelectQuery;
import org.exposql.expr.SqlRenderer;
import org.exposql.model.EntityKey;
import org.exposql.model.EventSource;
import org.exposql.model.ExperimentDateRange;
import org.exposql.model.ExposureConfig;
import org.exposql.model.ExposureCriteria;
import org.exposql.model.MathType;
import org.exposql.model.MeanMetric;
import org.exposql.model.MultipleVariantHandling;
import org.exposql.model.PropertyFilter;
import org.exposql.model.RatioMetric;
import org.exposql.model.TeamSettings;
import org.exposql.model.VariantSet;
import org.exposql.model.WarehouseSource;
import org.junit.jupiter.api.Test;

class ExposureResolverTest {
    private static final Instant FROM = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2024-03-15T00:00:00Z");

    private final SqlRenderer renderer = new SqlRenderer();

    @Test
    void defaultExposureEventCarriesTheFlagResponse() {
        assertEquals(
            "properties.`$feature_flag_response`",
            renderer.render(ExposureResolver.variantProperty(ExposureConfig.defaultEvent(), "new-checkout")));
        assertEquals(
            "properties.`$feature/new-checkout`",
            renderer.render(ExposureResolver.variantProperty(
                new ExposureConfig.Event("$pageview", List.of()), "new-checkout")));
        assertEquals(
            "properties.`$feature/new-checkout`",
            renderer.render(ExposureResolver.variantProperty(new ExposureConfig.Action(3L), "new-checkout")));
    }

    @Test
    void multipleVariantHandlingPicksTheAssignment() {
        Expr variant = Exprs.field("v");

        assertEquals(
            "argMin(v, timestamp)",
            renderer.render(ExposureResolver.variantAssignmentExpression(MultipleVariantHandling.FIRST_SEEN, variant)));
        assertEquals(
            "if(uniqExact(v) > 1, '$multiple', any(v))",
            renderer.render(ExposureResolver.variantAssignmentExpression(MultipleVariantHandling.EXCLUDE, variant)));
        assertEquals(
            "argMinIf(v, timestamp, ok)",
            renderer.render(ExposureResolver.variantAssignmentExpression(
                MultipleVariantHandling.FIRST_SEEN, variant, Exprs.field("ok"))));
    }

    @Test
    void defaultExposurePredicateMatchesTheFlagAndItsVariants() {
        String sql = renderer.render(ExposureResolver.exposurePredicate(request(ExposureCriteria.defaults()), context()));

        assertEquals(
            "timestamp >= toDateTime64('2024-03-01 00:00:00.000000', 6, 'UTC')"
                + " AND timestamp <= toDateTime64('2024-03-15 00:00:00.000000', 6, 'UTC')"
                + " AND event = '$feature_flag_called'"
                + " AND properties.`$feature_flag` = 'new-checkout'"
                + " AND properties.`$feature_flag_response` IN ('control', 'test')",
            sql);
    }

    @Test
    void testAccountFiltersApplyOnlyWhenRequested() {
        CompilationContext context = context().withTeam(new TeamSettings(
            TeamSettings.defaults().timeZone(), List.of(PropertyFilter.exact("is_internal", false))));

        String without = renderer.render(ExposureResolver.exposurePredicate(request(ExposureCriteria.defaults()), context));
        String with = renderer.render(ExposureResolver.exposurePredicate(
            request(ExposureCriteria.defaults().withFilterTestAccounts(true)), context));

        assertFalse(without.contains("is_internal"), without);
        assertTrue(with.endsWith(" AND properties.is_internal = false"), with);
    }

    @Test
    void missingExposureActionExposesNobody() {
        ExposureCriteria criteria = ExposureCriteria.defaults().withExposureConfig(new ExposureConfig.Action(42L));

        assertEquals(Exprs.FALSE, ExposureResolver.exposurePredicate(request(criteria), context()));
    }

    @Test
    void exposureStageGroupsByEntity() {
        SelectQuery exposures = ExposureResolver.exposureSelect(request(ExposureCriteria.defaults()), context());

        assertEquals(
            List.of("entity_id", "variant", "first_exposure_time", "exposure_event_uuid", "exposure_session_id"),
            exposures.columnNames());
        assertEquals(List.of(Exprs.field("person_id")), exposures.groupBy());
    }

    @Test
    void warehouseMetricsCarryTheJoinIdentifier() {
        MeanMetric metric = MeanMetric.of(
            WarehouseSource.of("payments", "paid_at", "customer_id", "properties.customer_id", MathType.SUM, "amount"));
        MetricQueryRequest request = request(ExposureCriteria.defaults()).withMetric(metric);

        assertEquals(Optional.of(Exprs.path("properties.customer_id")), ExposureResolver.exposureIdentifier(request));
        SelectQuery exposures = ExposureResolver.exposureSelect(request, context());
        assertTrue(exposures.columnNames().contains("exposure_identifier"));
        assertEquals(2, exposures.groupBy().size());
    }

    @Test
    void ratioWarehouseSidesGetSeparateIdentifiers() {
        RatioMetric metric = RatioMetric.of(
            WarehouseSource.of("payments", "paid_at", "customer_id", "properties.customer_id", MathType.SUM, "amount"),
            WarehouseSource.of("sessions", "started_at", "account_id", "properties.account_id", MathType.TOTAL, null));
        MetricQueryRequest request = request(ExposureCriteria.defaults()).withMetric(metric);

        assertEquals(Optional.empty(), ExposureResolver.exposureIdentifier(request));
        assertEquals(
            List.of("exposure_identifier_num", "exposure_identifier_denom"),
            List.copyOf(ExposureResolver.exposureIdentifiers(request).keySet()));
        SelectQuery exposures = ExposureResolver.exposureSelect(request, context());
        assertEquals(
            List.of(Exprs.field("person_id"), Exprs.path("properties.customer_id"), Exprs.path("properties.account_id")),
            exposures.groupBy());
    }

    private static MetricQueryRequest request(ExposureCriteria criteria) {
        return new MetricQueryRequest(
            "new-checkout",
            VariantSet.of("control", "test"),
            ExperimentDateRange.utc(FROM, TO),
            EntityKey.person(),
            MeanMetric.of(EventSource.of("purchase")),
            criteria);
    }

    private static CompilationContext context() {
        return CompilationContext.defaults();
    }
}
