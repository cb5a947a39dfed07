package org.exposql.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.bson.Document;
import org.exposql.expr.Expr;
import org.exposql.expr.Exprs;
import org.exposql.expr.FromClause;
import org.exposql.expr.SelectQuery;
import org.exposql.expr.UnsupportedFeatureException;
import org.junit.jupiter.api.Test;

class InMemoryQueryEngineTest {
    private final EventStore store = EventStore.builder()
        .event(event("u1", "purchase", 10))
        .event(event("u1", "purchase", 5))
        .event(event("u2", "purchase", 7))
        .event(event("u3", "pageview", null))
        .table("people", List.of(
            new Document("person_id", "u1").append("plan", "pro"),
            new Document("person_id", "u2").append("plan", "free"),
            new Document("person_id", "u4").append("plan", "pro")))
        .build();
    private final InMemoryQueryEngine engine = new InMemoryQueryEngine(store);

    @Test
    void filtersAndProjectsRows() {
        SelectQuery query = SelectQuery.builder()
            .select("person_id", Exprs.field("person_id"))
            .select("amount", Exprs.call("toFloat", Exprs.field("properties", "amount")))
            .from("events")
            .where(Exprs.eq(Exprs.field("event"), Exprs.constant("purchase")))
            .build();

        List<ResultRow> rows = engine.execute(query);

        assertEquals(3, rows.size());
        assertEquals("u1", rows.get(0).getString("person_id"));
        assertEquals(10d, rows.get(0).getDouble("amount"));
        assertEquals(List.of("person_id", "amount"), rows.get(2).columns());
    }

    @Test
    void groupsInOrderOfFirstAppearance() {
        SelectQuery query = SelectQuery.builder()
            .select("person_id", Exprs.field("person_id"))
            .select("events", Exprs.call("count"))
            .select("total", Exprs.call("sum", Exprs.field("properties", "amount")))
            .from("events")
            .groupBy(Exprs.field("person_id"))
            .build();

        List<ResultRow> rows = engine.execute(query);

        assertEquals(3, rows.size());
        assertEquals("u1", rows.get(0).getString("person_id"));
        assertEquals(2L, rows.get(0).getLong("events"));
        assertEquals(15L, rows.get(0).get("total"));
        assertEquals("u3", rows.get(2).getString("person_id"));
        assertEquals(0L, rows.get(2).get("total"));
    }

    @Test
    void aggregatesWithoutGroupByProduceOneRowEvenWhenEmpty() {
        SelectQuery query = SelectQuery.builder()
            .select("events", Exprs.call("count"))
            .select("largest", Exprs.call("max", Exprs.field("properties", "amount")))
            .from("events")
            .where(Exprs.eq(Exprs.field("event"), Exprs.constant("refund")))
            .build();

        List<ResultRow> rows = engine.execute(query);

        assertEquals(1, rows.size());
        assertEquals(0L, rows.get(0).getLong("events"));
        assertNull(rows.get(0).get("largest"));
    }

    @Test
    void havingFiltersGroups() {
        SelectQuery query = SelectQuery.builder()
            .select("person_id", Exprs.field("person_id"))
            .from("events")
            .groupBy(Exprs.field("person_id"))
            .having(Exprs.gt(Exprs.call("count"), Exprs.constant(1L)))
            .build();

        List<ResultRow> rows = engine.execute(query);

        assertEquals(1, rows.size());
        assertEquals("u1", rows.get(0).getString("person_id"));
    }

    @Test
    void leftJoinKeepsUnmatchedRowsWithNulls() {
        Expr on = Exprs.eq(Exprs.field("people", "person_id"), Exprs.field("buyers", "person_id"));
        SelectQuery query = SelectQuery.builder()
            .with("buyers", SelectQuery.builder()
                .select("person_id", Exprs.field("person_id"))
                .select("spent", Exprs.call("sum", Exprs.field("properties", "amount")))
                .from("events")
                .where(Exprs.eq(Exprs.field("event"), Exprs.constant("purchase")))
                .groupBy(Exprs.field("person_id"))
                .build())
            .select("person_id", Exprs.field("people", "person_id"))
            .select("spent", Exprs.call("coalesce", Exprs.field("buyers", "spent"), Exprs.constant(0L)))
            .from(new FromClause.Join(
                FromClause.Table.of("people"), FromClause.Table.of("buyers"), FromClause.JoinType.LEFT, on))
            .build();

        List<ResultRow> rows = engine.execute(query);

        assertEquals(3, rows.size());
        assertEquals(15L, rows.get(0).getLong("spent"));
        assertEquals(7L, rows.get(1).getLong("spent"));
        assertEquals("u4", rows.get(2).getString("person_id"));
        assertEquals(0L, rows.get(2).getLong("spent"));
    }

    @Test
    void innerJoinDropsUnmatchedRows() {
        Expr on = Exprs.eq(Exprs.field("people", "person_id"), Exprs.field("e", "person_id"));
        SelectQuery query = SelectQuery.builder()
            .select("plan", Exprs.field("people", "plan"))
            .select("events", Exprs.call("count"))
            .from(new FromClause.Join(
                FromClause.Table.of("people"), new FromClause.Table("events", "e"), FromClause.JoinType.INNER, on))
            .groupBy(Exprs.field("people", "plan"))
            .build();

        List<ResultRow> rows = engine.execute(query);

        assertEquals(2, rows.size());
        assertEquals("pro", rows.get(0).getString("plan"));
        assertEquals(2L, rows.get(0).getLong("events"));
        assertEquals("free", rows.get(1).getString("plan"));
        assertEquals(1L, rows.get(1).getLong("events"));
    }

    @Test
    void unknownFunctionsAndTablesFailFast() {
        SelectQuery unknownFunction = SelectQuery.builder()
            .select("x", Exprs.call("sipHash64", Exprs.field("person_id")))
            .from("events")
            .build();
        SelectQuery unknownTable = SelectQuery.builder().select("x", Exprs.field("x")).from("missing").build();

        UnsupportedFeatureException error =
            assertThrows(UnsupportedFeatureException.class, () -> engine.execute(unknownFunction));
        assertEquals("function.sipHash64", error.featureKey());
        assertThrows(IllegalArgumentException.class, () -> engine.execute(unknownTable));
    }

    private static Document event(String person, String name, Integer amount) {
        Document properties = new Document();
        if (amount != null) {
            properties.append("amount", amount);
        }
        return new Document("person_id", person).append("event", name).append("properties", properties);
    }
}
