package org.exposql.compiler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.exposql.expr.Expr;
import org.exposql.expr.Exprs;
import org.exposql.model.ActionCatalog;
import org.exposql.model.ActionDefinition;
import org.exposql.model.ActionSource;
import org.exposql.model.ActionStep;
import org.exposql.model.EventSource;
import org.exposql.model.MetricSource;
import org.exposql.model.PropertyFilter;
import org.exposql.model.WarehouseSource;

/**
 * Turns event names, actions and property filters into predicates over raw rows.
 */
final class SourceFilters {
    private SourceFilters() {}

    /**
     * Row predicate of a metric or funnel step source, without any time bounds.
     */
    static Expr sourceFilter(final MetricSource source, final ActionCatalog actions) {
        return switch (source.kind()) {
            case EVENT -> eventFilter(((EventSource) source).event(), source.properties());
            case ACTION -> Exprs.and(
                    actionFilter(((ActionSource) source).actionId(), actions), propertiesFilter(source.properties()));
            case WAREHOUSE -> warehouseFilter((WarehouseSource) source);
        };
    }

    static Expr eventFilter(final String event, final List<PropertyFilter> properties) {
        final Expr eventMatch = event == null ? Exprs.TRUE : Exprs.eq(Exprs.field("event"), Exprs.constant(event));
        return Exprs.and(eventMatch, propertiesFilter(properties));
    }

    /**
     * A missing or deleted action matches nothing rather than failing the compilation.
     */
    static Expr actionFilter(final long actionId, final ActionCatalog actions) {
        final Optional<ActionDefinition> action = actions.find(actionId);
        if (action.isEmpty() || action.get().deleted()) {
            return Exprs.FALSE;
        }
        final List<Expr> alternatives = new ArrayList<>();
        for (final ActionStep step : action.get().steps()) {
            alternatives.add(eventFilter(step.event(), step.properties()));
        }
        return Exprs.or(alternatives);
    }

    static Expr warehouseFilter(final WarehouseSource source) {
        final List<Expr> clauses = new ArrayList<>();
        for (final PropertyFilter filter : source.properties()) {
            clauses.add(propertyFilter(filter, warehouseField(source.tableName(), filter.key())));
        }
        return Exprs.and(clauses);
    }

    static Expr propertiesFilter(final List<PropertyFilter> filters) {
        final List<Expr> clauses = new ArrayList<>(filters.size());
        for (final PropertyFilter filter : filters) {
            clauses.add(propertyFilter(filter, propertyField(filter)));
        }
        return Exprs.and(clauses);
    }

    static Expr propertyField(final PropertyFilter filter) {
        return switch (filter.type()) {
            case EVENT -> Exprs.field("properties", filter.key());
            case PERSON -> Exprs.field("person", "properties", filter.key());
            case WAREHOUSE -> Exprs.path(filter.key());
        };
    }

    static Expr warehouseField(final String table, final String dottedPath) {
        final List<String> chain = new ArrayList<>();
        chain.add(table);
        chain.addAll(Arrays.asList(dottedPath.split("\\.")));
        return Exprs.field(chain);
    }

    static Expr propertyFilter(final PropertyFilter filter, final Expr field) {
        final Object value = filter.value();
        return switch (filter.operator()) {
            case EXACT -> value instanceof List<?> values
                    ? Exprs.in(field, values)
                    : Exprs.eq(field, Exprs.constant(value));
            case IS_NOT -> Exprs.call(
                    "ifNull",
                    value instanceof List<?> values
                            ? Exprs.compare(Expr.CompareOp.NOT_IN, field, Exprs.constant(values))
                            : Exprs.compare(Expr.CompareOp.NOT_EQ, field, Exprs.constant(value)),
                    Exprs.TRUE);
            case ICONTAINS -> Exprs.compare(Expr.CompareOp.ILIKE, field, Exprs.constant(likePattern(value)));
            case NOT_ICONTAINS -> Exprs.call(
                    "ifNull",
                    Exprs.compare(Expr.CompareOp.NOT_ILIKE, field, Exprs.constant(likePattern(value))),
                    Exprs.TRUE);
            case GT -> Exprs.gt(Exprs.call("toFloat", field), numericConstant(filter));
            case GTE -> Exprs.gte(Exprs.call("toFloat", field), numericConstant(filter));
            case LT -> Exprs.lt(Exprs.call("toFloat", field), numericConstant(filter));
            case LTE -> Exprs.lte(Exprs.call("toFloat", field), numericConstant(filter));
            case IS_SET -> Exprs.call("isNotNull", field);
            case IS_NOT_SET -> Exprs.call("isNull", field);
        };
    }

    private static String likePattern(final Object value) {
        final String text = String.valueOf(value).replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return "%" + text + "%";
    }

    private static Expr numericConstant(final PropertyFilter filter) {
        final Object value = filter.value();
        if (value instanceof Number number) {
            return Exprs.constant(number.doubleValue());
        }
        try {
            return Exprs.constant(Double.parseDouble(String.valueOf(value).trim()));
        } catch (final NumberFormatException exception) {
            throw new IllegalArgumentException("property filter '" + filter.key() + "' with operator "
                    + filter.operator().wireName() + " needs a numeric value: " + value, exception);
        }
    }
}
