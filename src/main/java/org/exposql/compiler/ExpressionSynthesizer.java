package org.exposql.compiler;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.exposql.expr.Expr;
import org.exposql.expr.ExpressionParser;
import org.exposql.expr.Exprs;
import org.exposql.model.EntityKey;
import org.exposql.model.MetricSource;
import org.exposql.model.WarehouseSource;

/**
 * Derives per-event values and per-entity aggregations from a metric source.
 *
 * <p>Every method is a pure function of its arguments. Aggregations fall back to {@code 0} when
 * an entity has no metric rows, so the final sums are always numeric.
 */
public final class ExpressionSynthesizer {
    private static final Set<String> AGGREGATION_FUNCTIONS = Set.of("sum", "avg", "count", "min", "max");
    private static final String TUPLE_PARAM = "x";

    private ExpressionSynthesizer() {}

    /**
     * Per-row value collected for the metric. Count-like math without a property is the constant 1.
     */
    public static Expr valueExpression(final MetricSource source, final EntityKey entityKey) {
        return switch (source.math()) {
            case UNIQUE_SESSION -> Exprs.field("$session_id");
            case UNIQUE_GROUP, DISTINCT_ACTIVE_USER -> entityIdentifier(source, entityKey);
            case EXPRESSION -> extractAggregationAndInnerExpr(source.mathExpression().orElseThrow()).inner();
            default -> source.mathProperty().isPresent() ? metricValue(source) : Exprs.constant(1L);
        };
    }

    /**
     * Property reference for property math. Warehouse columns are typed and read as is; event
     * properties are untyped JSON and are cast to a number.
     */
    public static Expr metricValue(final MetricSource source) {
        final String property = source.mathProperty()
                .orElseThrow(() -> new IllegalArgumentException("math " + source.math().wireName()
                        + " requires a math property"));
        if (source instanceof WarehouseSource warehouse) {
            return SourceFilters.warehouseField(warehouse.tableName(), property);
        }
        return Exprs.call("toFloat", Exprs.field("properties", property));
    }

    /**
     * SQL aggregate over the per-row {@code value} of all metric rows joined to one entity.
     */
    public static Expr aggregationExpression(final MetricSource source, final Expr value) {
        return switch (source.math()) {
            case MIN -> coalesced("min", value);
            case MAX -> coalesced("max", value);
            case AVERAGE -> coalesced("avg", value);
            case UNIQUE_SESSION, UNIQUE_GROUP, DISTINCT_ACTIVE_USER -> distinctCount(value);
            case EXPRESSION -> expressionAggregation(
                    extractAggregationAndInnerExpr(source.mathExpression().orElseThrow()), value);
            default -> coalesced("sum", value);
        };
    }

    /**
     * Same aggregation as {@link #aggregationExpression} over an array of {@code (timestamp, value)}
     * tuples. Empty arrays reduce to 0.
     */
    public static Expr arrayAggregationExpression(final MetricSource source, final Expr tuples) {
        return switch (source.math()) {
            case MIN -> arrayReduction("arrayMin", tuples);
            case MAX -> arrayReduction("arrayMax", tuples);
            case AVERAGE -> arrayReduction("arrayAvg", tuples);
            case UNIQUE_SESSION, UNIQUE_GROUP, DISTINCT_ACTIVE_USER -> arrayDistinctCount(tuples);
            case EXPRESSION -> arrayExpressionAggregation(
                    extractAggregationAndInnerExpr(source.mathExpression().orElseThrow()), tuples);
            default -> arraySum(tuples);
        };
    }

    /**
     * Splits {@code sum(a - b)} into {@code sum} and {@code a - b}. Expressions without an outer
     * aggregation come back unchanged with no function.
     */
    public static AggregationExtraction extractAggregationAndInnerExpr(final String expression) {
        final Expr parsed = ExpressionParser.parse(expression);
        if (parsed instanceof Expr.Call call && call.params().isEmpty() && call.args().size() == 1) {
            final String name = call.name().toLowerCase(Locale.ROOT);
            if (AGGREGATION_FUNCTIONS.contains(name)) {
                return new AggregationExtraction(Optional.of(name), call.args().get(0), call.distinct());
            }
        }
        return AggregationExtraction.none(parsed);
    }

    private static Expr entityIdentifier(final MetricSource source, final EntityKey entityKey) {
        if (source instanceof WarehouseSource warehouse) {
            return SourceFilters.warehouseField(warehouse.tableName(), warehouse.dataWarehouseJoinKey());
        }
        return Exprs.field(entityKey.chain());
    }

    private static Expr expressionAggregation(final AggregationExtraction extraction, final Expr value) {
        final String function = extraction.function().orElse("sum");
        if ("count".equals(function)) {
            return extraction.distinct() ? distinctCount(value) : Exprs.call("toFloat", Exprs.call("count", value));
        }
        return coalesced(function, value);
    }

    private static Expr arrayExpressionAggregation(final AggregationExtraction extraction, final Expr tuples) {
        return switch (extraction.function().orElse("sum")) {
            case "count" -> extraction.distinct()
                    ? arrayDistinctCount(tuples)
                    : Exprs.call("toFloat", Exprs.call(
                            "arrayCount",
                            Exprs.lambda(TUPLE_PARAM, Exprs.call("isNotNull", tupleValue())),
                            tuples));
            case "min" -> arrayReduction("arrayMin", tuples);
            case "max" -> arrayReduction("arrayMax", tuples);
            case "avg" -> arrayReduction("arrayAvg", tuples);
            default -> arraySum(tuples);
        };
    }

    private static Expr coalesced(final String function, final Expr value) {
        return Exprs.call(function, numericOrZero(value));
    }

    private static Expr distinctCount(final Expr value) {
        final Expr blankAsNull = Exprs.call(
                "multiIf",
                Exprs.eq(Exprs.call("toString", value), Exprs.constant("")),
                Exprs.constant(null),
                value);
        return Exprs.call("toFloat", Exprs.countDistinct(blankAsNull));
    }

    private static Expr arraySum(final Expr tuples) {
        return Exprs.call("arraySum", numericValues(tuples));
    }

    private static Expr arrayReduction(final String function, final Expr tuples) {
        return Exprs.call(
                "if",
                Exprs.call("empty", tuples),
                Exprs.constant(0.0d),
                Exprs.call(function, numericValues(tuples)));
    }

    private static Expr arrayDistinctCount(final Expr tuples) {
        final Expr values = Exprs.call("arrayMap", Exprs.lambda(TUPLE_PARAM, tupleValue()), tuples);
        final Expr present = Exprs.and(
                Exprs.call("isNotNull", Exprs.field("v")),
                Exprs.compare(Expr.CompareOp.NOT_EQ, Exprs.call("toString", Exprs.field("v")), Exprs.constant("")));
        return Exprs.call(
                "toFloat",
                Exprs.call("length", Exprs.call(
                        "arrayDistinct", Exprs.call("arrayFilter", Exprs.lambda("v", present), values))));
    }

    private static Expr numericValues(final Expr tuples) {
        return Exprs.call("arrayMap", Exprs.lambda(TUPLE_PARAM, numericOrZero(tupleValue())), tuples);
    }

    private static Expr numericOrZero(final Expr value) {
        return Exprs.call("coalesce", Exprs.call("toFloat", value), Exprs.constant(0.0d));
    }

    private static Expr tupleValue() {
        return Exprs.element(Exprs.field(TUPLE_PARAM), 2);
    }
}
