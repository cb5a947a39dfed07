package org.exposql.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Optional;
import org.exposql.expr.Exprs;
import org.exposql.expr.SqlRenderer;
import org.exposql.model.ActionCatalog;
import org.exposql.model.ActionDefinition;
import org.exposql.model.ActionSource;
import org.exposql.model.ActionStep;
import org.exposql.model.EventSource;
import org.exposql.model.MathType;
import org.exposql.model.PropertyFilter;
import org.exposql.model.WarehouseSource;
import org.junit.jupiter.api.Test;

class SourceFiltersTest {
    private final SqlRenderer renderer = new SqlRenderer();

    @Test
    void missingOrDeletedActionsMatchNothing() {
        ActionCatalog actions = ActionCatalog.of(List.of(
            new ActionDefinition(4L, "Deleted", List.of(new ActionStep("purchase", List.of())), true)));

        assertEquals(Exprs.FALSE, SourceFilters.actionFilter(4L, actions));
        assertEquals(Exprs.FALSE, SourceFilters.actionFilter(99L, actions));
        assertEquals(Exprs.FALSE, SourceFilters.sourceFilter(ActionSource.of(99L), actions));
    }

    @Test
    void actionStepsAreAlternatives() {
        ActionCatalog actions = ActionCatalog.of(List.of(new ActionDefinition(
            7L,
            "Converted",
            List.of(
                new ActionStep("purchase", List.of(PropertyFilter.exact("plan", "pro"))),
                new ActionStep("refund", List.of())),
            false)));

        assertEquals(
            "event = 'purchase' AND properties.plan = 'pro' OR event = 'refund'",
            renderer.render(SourceFilters.actionFilter(7L, actions)));
    }

    @Test
    void eventWithoutNameMatchesEveryEvent() {
        assertEquals(Exprs.TRUE, SourceFilters.eventFilter(null, List.of()));
        assertEquals(
            "event = 'signup'",
            renderer.render(SourceFilters.sourceFilter(EventSource.of("signup"), ActionCatalog.empty())));
    }

    @Test
    void operatorsMapToSqlPredicates() {
        assertEquals(
            "properties.plan IN ('pro', 'team')",
            render(new PropertyFilter("plan", PropertyFilter.Operator.EXACT, List.of("pro", "team"), PropertyFilter.Type.EVENT)));
        assertEquals(
            "ifNull(properties.plan != 'free', true)",
            render(new PropertyFilter("plan", PropertyFilter.Operator.IS_NOT, "free", PropertyFilter.Type.EVENT)));
        assertEquals(
            "properties.name ILIKE '%50\\\\%%'",
            render(new PropertyFilter("name", PropertyFilter.Operator.ICONTAINS, "50%", PropertyFilter.Type.EVENT)));
        assertEquals(
            "toFloat(properties.amount) > 10",
            render(new PropertyFilter("amount", PropertyFilter.Operator.GT, "10", PropertyFilter.Type.EVENT)));
        assertEquals(
            "isNull(person.properties.email)",
            render(new PropertyFilter("email", PropertyFilter.Operator.IS_NOT_SET, null, PropertyFilter.Type.PERSON)));
    }

    @Test
    void numericOperatorRejectsNonNumericValue() {
        PropertyFilter filter = new PropertyFilter("amount", PropertyFilter.Operator.LTE, "lots", PropertyFilter.Type.EVENT);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> render(filter));
        assertEquals("property filter 'amount' with operator lte needs a numeric value: lots", error.getMessage());
    }

    @Test
    void warehouseFiltersReadTableColumns() {
        WarehouseSource source = new WarehouseSource(
            "payments",
            "paid_at",
            "customer_id",
            "properties.customer_id",
            MathType.TOTAL,
            Optional.empty(),
            Optional.empty(),
            List.of(new PropertyFilter("status", PropertyFilter.Operator.EXACT, "paid", PropertyFilter.Type.WAREHOUSE)));

        assertEquals("payments.status = 'paid'", renderer.render(SourceFilters.warehouseFilter(source)));
    }

    private String render(PropertyFilter filter) {
        return renderer.render(SourceFilters.propertyFilter(filter, SourceFilters.propertyField(filter)));
    }
}
