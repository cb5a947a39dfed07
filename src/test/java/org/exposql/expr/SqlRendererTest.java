package org.exposql.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

class SqlRendererTest {
    private final SqlRenderer renderer = new SqlRenderer();

    @Test
    void quotesIdentifiersThatAreNotPlain() {
        assertEquals("properties.`$browser`", renderer.render(Exprs.field("properties", "$browser")));
        assertEquals("`a\\`b`", renderer.render(Exprs.field("a`b")));
    }

    @Test
    void escapesStringConstants() {
        assertEquals("'it\\'s'", renderer.render(Exprs.constant("it's")));
        assertEquals("NULL", renderer.render(Exprs.constant(null)));
        assertEquals("0.5", renderer.render(Exprs.constant(0.5d)));
    }

    @Test
    void rendersInstantsInTheConfiguredZone() {
        Instant instant = Instant.parse("2024-01-01T12:00:00Z");

        assertEquals(
            "toDateTime64('2024-01-01 12:00:00.000000', 6, 'UTC')",
            renderer.render(Exprs.constant(instant)));
        assertEquals(
            "toDateTime64('2024-01-01 13:00:00.000000', 6, 'Europe/Berlin')",
            new SqlRenderer(ZoneId.of("Europe/Berlin")).render(Exprs.constant(instant)));
    }

    @Test
    void wrapsLowerPrecedenceOperands() {
        Expr expr = Exprs.and(
            Exprs.or(Exprs.eq(Exprs.field("a"), Exprs.constant(1L)), Exprs.eq(Exprs.field("b"), Exprs.constant(2L))),
            Exprs.in(Exprs.field("c"), List.of("x", "y")));

        assertEquals("(a = 1 OR b = 2) AND c IN ('x', 'y')", renderer.render(expr));
    }

    @Test
    void rendersParametricDistinctAndLambdaCalls() {
        assertEquals(
            "quantile(0.9)(value)",
            renderer.render(Exprs.parametric("quantile", List.of(Exprs.constant(0.9d)), Exprs.field("value"))));
        assertEquals("count(DISTINCT x)", renderer.render(Exprs.countDistinct(Exprs.field("x"))));
        assertEquals(
            "arrayFilter(x -> x.1 >= first_exposure_time, metric_values)",
            renderer.render(Exprs.call(
                "arrayFilter",
                Exprs.lambda("x", Exprs.gte(Exprs.element(Exprs.field("x"), 1), Exprs.field("first_exposure_time"))),
                Exprs.field("metric_values"))));
    }

    @Test
    void rendersQueriesWithCtesJoinsAndGrouping() {
        SelectQuery inner = SelectQuery.builder()
            .select("entity_id", Exprs.field("person_id"))
            .from("events")
            .where(Exprs.eq(Exprs.field("event"), Exprs.constant("purchase")))
            .build();
        SelectQuery query = SelectQuery.builder()
            .with("metric_events", inner)
            .select("entity_id", Exprs.field("metric_events", "entity_id"))
            .select("total", Exprs.call("count"))
            .from(new FromClause.Join(
                FromClause.Table.of("exposures"),
                FromClause.Table.of("metric_events"),
                FromClause.JoinType.LEFT,
                Exprs.eq(Exprs.field("exposures", "entity_id"), Exprs.field("metric_events", "entity_id"))))
            .groupBy(Exprs.field("metric_events", "entity_id"))
            .build();

        String sql = renderer.render(query);

        assertTrue(sql.startsWith("WITH\n    metric_events AS (\n"), sql);
        assertTrue(sql.contains("WHERE event = 'purchase'"), sql);
        assertTrue(sql.contains("metric_events.entity_id,\n"), sql);
        assertTrue(sql.contains("count() AS total"), sql);
        assertTrue(sql.contains("LEFT JOIN metric_events ON exposures.entity_id = metric_events.entity_id"), sql);
        assertTrue(sql.endsWith("GROUP BY metric_events.entity_id"), sql);
    }

    @Test
    void renderingIsDeterministic() {
        Expr expr = Exprs.call("sum", Exprs.call("coalesce", Exprs.call("toFloat", Exprs.field("value")), Exprs.constant(0.0d)));

        assertEquals(renderer.render(expr), renderer.render(expr));
        assertEquals("sum(coalesce(toFloat(value), 0))", renderer.render(expr));
    }
}
