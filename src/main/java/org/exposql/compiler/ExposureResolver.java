package org.exposql.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.exposql.expr.Expr;
import org.exposql.expr.Exprs;
import org.exposql.expr.SelectQuery;
import org.exposql.model.ExposureConfig;
import org.exposql.model.ExposureCriteria;
import org.exposql.model.MeanMetric;
import org.exposql.model.MultipleVariantHandling;
import org.exposql.model.RatioMetric;
import org.exposql.model.VariantSet;
import org.exposql.model.WarehouseSource;

/**
 * Decides which events are exposures and which variant each entity was exposed to.
 */
public final class ExposureResolver {
    private static final String FLAG_PROPERTY = "$feature_flag";
    private static final String FLAG_RESPONSE_PROPERTY = "$feature_flag_response";
    private static final String FLAG_PROPERTY_PREFIX = "$feature/";

    private ExposureResolver() {}

    /**
     * Property carrying the variant on exposure events. The default flag-called event reports the
     * response directly; any other exposure event carries the flag's value under {@code $feature/<flag>}.
     */
    public static Expr variantProperty(final ExposureConfig config, final String featureFlagKey) {
        if (config instanceof ExposureConfig.Event event && event.isDefaultEvent()) {
            return Exprs.field("properties", FLAG_RESPONSE_PROPERTY);
        }
        return Exprs.field("properties", FLAG_PROPERTY_PREFIX + featureFlagKey);
    }

    /**
     * Row predicate selecting qualifying exposure events inside the experiment window.
     */
    public static Expr exposurePredicate(final MetricQueryRequest request, final CompilationContext context) {
        final ExposureCriteria criteria = request.criteria();
        final ExposureConfig config = criteria.effectiveExposureConfig();
        final Expr timestamp = Exprs.field(PlanColumns.TIMESTAMP);
        return Exprs.and(
                Exprs.gte(timestamp, Exprs.constant(request.dateRange().from())),
                Exprs.lte(timestamp, Exprs.constant(request.dateRange().to())),
                exposureEventMatch(config, request.featureFlagKey(), context),
                Exprs.in(variantProperty(config, request.featureFlagKey()), request.variants().keys()),
                criteria.filterTestAccounts()
                        ? SourceFilters.propertiesFilter(context.team().testAccountFilters())
                        : Exprs.TRUE);
    }

    /**
     * Variant of an entity across all its exposure rows.
     */
    public static Expr variantAssignmentExpression(
            final MultipleVariantHandling handling, final Expr variantProperty) {
        return switch (handling) {
            case FIRST_SEEN -> Exprs.call("argMin", variantProperty, Exprs.field(PlanColumns.TIMESTAMP));
            case EXCLUDE -> Exprs.call(
                    "if",
                    Exprs.gt(Exprs.call("uniqExact", variantProperty), Exprs.constant(1L)),
                    Exprs.constant(VariantSet.MULTIPLE_VARIANT_KEY),
                    Exprs.call("any", variantProperty));
        };
    }

    /**
     * Conditional form of {@link #variantAssignmentExpression(MultipleVariantHandling, Expr)} that
     * only looks at rows matching {@code condition}, for scans that also carry non-exposure rows.
     */
    public static Expr variantAssignmentExpression(
            final MultipleVariantHandling handling, final Expr variantProperty, final Expr condition) {
        return switch (handling) {
            case FIRST_SEEN -> Exprs.call(
                    "argMinIf", variantProperty, Exprs.field(PlanColumns.TIMESTAMP), condition);
            case EXCLUDE -> Exprs.call(
                    "if",
                    Exprs.gt(Exprs.call("uniqExactIf", variantProperty, condition), Exprs.constant(1L)),
                    Exprs.constant(VariantSet.MULTIPLE_VARIANT_KEY),
                    Exprs.call("anyIf", variantProperty, condition));
        };
    }

    /**
     * Exposures stage: one row per exposed entity (per join identifier for warehouse metrics).
     */
    public static SelectQuery exposureSelect(final MetricQueryRequest request, final CompilationContext context) {
        final ExposureConfig config = request.criteria().effectiveExposureConfig();
        final Expr entity = Exprs.field(request.entityKey().chain());
        final Expr timestamp = Exprs.field(PlanColumns.TIMESTAMP);
        final SelectQuery.Builder builder = SelectQuery.builder()
                .select(PlanColumns.ENTITY_ID, entity)
                .select(PlanColumns.VARIANT, variantAssignmentExpression(
                        request.criteria().multipleVariantHandling(),
                        variantProperty(config, request.featureFlagKey())))
                .select(PlanColumns.FIRST_EXPOSURE_TIME, Exprs.call("min", timestamp))
                .select(PlanColumns.EXPOSURE_EVENT_UUID, Exprs.call("argMin", Exprs.field("uuid"), timestamp))
                .select(PlanColumns.EXPOSURE_SESSION_ID, Exprs.call("argMin", Exprs.field("$session_id"), timestamp))
                .from(PlanColumns.EVENTS_TABLE)
                .where(exposurePredicate(request, context));
        final List<Expr> groupBy = new ArrayList<>();
        groupBy.add(entity);
        for (final Map.Entry<String, Expr> identifier : exposureIdentifiers(request).entrySet()) {
            builder.select(identifier.getKey(), identifier.getValue());
            groupBy.add(identifier.getValue());
        }
        return builder.groupBy(groupBy.toArray(new Expr[0])).build();
    }

    /**
     * Path on exposure events holding the identifier warehouse rows are joined on.
     */
    static Optional<Expr> exposureIdentifier(final MetricQueryRequest request) {
        return Optional.ofNullable(exposureIdentifiers(request).get(PlanColumns.EXPOSURE_IDENTIFIER));
    }

    /**
     * Identifier columns of the exposures stage keyed by alias. A ratio metric gets one per
     * warehouse side.
     */
    static Map<String, Expr> exposureIdentifiers(final MetricQueryRequest request) {
        final Map<String, Expr> identifiers = new LinkedHashMap<>();
        if (request.metric() instanceof MeanMetric mean && mean.source() instanceof WarehouseSource warehouse) {
            identifiers.put(PlanColumns.EXPOSURE_IDENTIFIER, Exprs.path(warehouse.eventsJoinKey()));
        } else if (request.metric() instanceof RatioMetric ratio) {
            if (ratio.numerator() instanceof WarehouseSource numerator) {
                identifiers.put(PlanColumns.EXPOSURE_IDENTIFIER_NUM, Exprs.path(numerator.eventsJoinKey()));
            }
            if (ratio.denominator() instanceof WarehouseSource denominator) {
                identifiers.put(PlanColumns.EXPOSURE_IDENTIFIER_DENOM, Exprs.path(denominator.eventsJoinKey()));
            }
        }
        return identifiers;
    }

    private static Expr exposureEventMatch(
            final ExposureConfig config, final String featureFlagKey, final CompilationContext context) {
        if (config instanceof ExposureConfig.Action action) {
            return SourceFilters.actionFilter(action.actionId(), context.actions());
        }
        final ExposureConfig.Event event = (ExposureConfig.Event) config;
        final Expr match = SourceFilters.eventFilter(event.event(), event.properties());
        if (event.isDefaultEvent()) {
            return Exprs.and(match, Exprs.eq(Exprs.field("properties", FLAG_PROPERTY), Exprs.constant(featureFlagKey)));
        }
        return match;
    }
}
