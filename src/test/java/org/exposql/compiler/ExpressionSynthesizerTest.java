package org.exposql.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.exposql.expr.Expr;
import org.exposql.expr.ExpressionParser;
import org.exposql.expr.ExpressionSyntaxException;
import org.exposql.expr.Exprs;
import org.exposql.expr.SqlRenderer;
import org.exposql.model.ActionSource;
import org.exposql.model.EntityKey;
import org.exposql.model.EventSource;
import org.exposql.model.MathType;
import org.exposql.model.MetricSource;
import org.exposql.model.WarehouseSource;
import org.junit.jupiter.api.Test;

class ExpressionSynthesizerTest {
    private final SqlRenderer renderer = new SqlRenderer();

    @Test
    void extractsOuterAggregationAndItsOperand() {
        AggregationExtraction extraction = ExpressionSynthesizer.extractAggregationAndInnerExpr("sum(a - b)");

        assertEquals(Optional.of("sum"), extraction.function());
        assertEquals(ExpressionParser.parse("a - b"), extraction.inner());
        assertFalse(extraction.distinct());
    }

    @Test
    void expressionWithoutAggregationComesBackWhole() {
        AggregationExtraction extraction = ExpressionSynthesizer.extractAggregationAndInnerExpr("a + b");

        assertEquals(Optional.empty(), extraction.function());
        assertEquals(ExpressionParser.parse("a + b"), extraction.inner());
    }

    @Test
    void innerExpressionIsNeverAbsent() {
        for (String text : List.of(
            "count(distinct properties.id)",
            "count(*)",
            "avg(properties.price * 2)",
            "coalesce(properties.a, 0)",
            "sum(a, b)",
            "quantile(0.5)(x)",
            "properties.amount",
            "max(toFloat(properties.value))"
        )) {
            assertNotNull(ExpressionSynthesizer.extractAggregationAndInnerExpr(text).inner(), text);
        }
    }

    @Test
    void countDistinctKeepsTheDistinctFlag() {
        AggregationExtraction extraction =
            ExpressionSynthesizer.extractAggregationAndInnerExpr("COUNT(DISTINCT properties.order_id)");

        assertEquals(Optional.of("count"), extraction.function());
        assertTrue(extraction.distinct());
        assertEquals(Exprs.field("properties", "order_id"), extraction.inner());
    }

    @Test
    void countStarCountsRows() {
        AggregationExtraction extraction = ExpressionSynthesizer.extractAggregationAndInnerExpr("count(*)");

        assertEquals(Optional.of("count"), extraction.function());
        assertFalse(extraction.distinct());
        assertEquals(Exprs.constant(1L), extraction.inner());
    }

    @Test
    void invalidExpressionsAreSyntaxErrors() {
        assertThrows(
            ExpressionSyntaxException.class,
            () -> ExpressionSynthesizer.extractAggregationAndInnerExpr("sum(a -"));
    }

    @Test
    void totalWithoutPropertyIsTheConstantOneForEverySourceKind() {
        List<MetricSource> sources = List.of(
            EventSource.of("purchase"),
            ActionSource.of(3L),
            WarehouseSource.of("payments", "paid_at", "customer_id", "properties.customer_id", MathType.TOTAL, null)
        );
        for (MetricSource source : sources) {
            assertEquals(Exprs.constant(1L), ExpressionSynthesizer.valueExpression(source, EntityKey.person()));
        }
    }

    @Test
    void valueExpressionFollowsMathType() {
        EventSource purchase = EventSource.of("purchase");

        assertEquals(
            "toFloat(properties.amount)",
            render(ExpressionSynthesizer.valueExpression(purchase.withMath(MathType.SUM, "amount"), EntityKey.person())));
        assertEquals(
            "`$session_id`",
            render(ExpressionSynthesizer.valueExpression(purchase.withMath(MathType.UNIQUE_SESSION, null), EntityKey.person())));
        assertEquals(
            "`$group_1`",
            render(ExpressionSynthesizer.valueExpression(
                purchase.withMath(MathType.UNIQUE_GROUP, null), EntityKey.group(1))));
        assertEquals(
            "properties.a - properties.b",
            render(ExpressionSynthesizer.valueExpression(
                purchase.withExpression("sum(properties.a - properties.b)"), EntityKey.person())));
    }

    @Test
    void warehousePropertiesAreReadRaw() {
        WarehouseSource payments =
            WarehouseSource.of("payments", "paid_at", "customer_id", "properties.customer_id", MathType.SUM, "amount");

        assertEquals("payments.amount", render(ExpressionSynthesizer.metricValue(payments)));
        assertEquals(
            "payments.customer_id",
            render(ExpressionSynthesizer.valueExpression(
                WarehouseSource.of("payments", "paid_at", "customer_id", "properties.customer_id",
                    MathType.DISTINCT_ACTIVE_USER, null),
                EntityKey.person())));
    }

    @Test
    void propertyMathWithoutPropertyIsAConfigurationError() {
        assertThrows(
            IllegalArgumentException.class,
            () -> ExpressionSynthesizer.metricValue(EventSource.of("purchase")));
    }

    @Test
    void aggregationExpressionsCoalesceMissingValuesToZero() {
        Expr value = Exprs.field("value");
        EventSource purchase = EventSource.of("purchase");

        assertEquals("sum(coalesce(toFloat(value), 0))", render(ExpressionSynthesizer.aggregationExpression(purchase, value)));
        assertEquals(
            "min(coalesce(toFloat(value), 0))",
            render(ExpressionSynthesizer.aggregationExpression(purchase.withMath(MathType.MIN, "amount"), value)));
        assertEquals(
            "avg(coalesce(toFloat(value), 0))",
            render(ExpressionSynthesizer.aggregationExpression(purchase.withMath(MathType.AVERAGE, "amount"), value)));
        assertEquals(
            "toFloat(count(DISTINCT multiIf(toString(value) = '', NULL, value)))",
            render(ExpressionSynthesizer.aggregationExpression(purchase.withMath(MathType.UNIQUE_SESSION, null), value)));
        assertEquals(
            "toFloat(count(value))",
            render(ExpressionSynthesizer.aggregationExpression(purchase.withExpression("count(properties.id)"), value)));
        assertEquals(
            "max(coalesce(toFloat(value), 0))",
            render(ExpressionSynthesizer.aggregationExpression(purchase.withExpression("max(properties.id)"), value)));
    }

    @Test
    void arrayAggregationsFallBackToZeroOnEmptyArrays() {
        Expr tuples = Exprs.field("metric_values");

        assertEquals(
            "arraySum(arrayMap(x -> coalesce(toFloat(x.2), 0), metric_values))",
            render(ExpressionSynthesizer.arrayAggregationExpression(EventSource.of("purchase"), tuples)));
        assertEquals(
            "if(empty(metric_values), 0, arrayMax(arrayMap(x -> coalesce(toFloat(x.2), 0), metric_values)))",
            render(ExpressionSynthesizer.arrayAggregationExpression(
                EventSource.of("purchase").withMath(MathType.MAX, "amount"), tuples)));
    }

    private String render(Expr expr) {
        return renderer.render(expr);
    }
}
