package org.exposql.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rows of the events table with the given event name. A null event name matches every event.
 */
public record EventSource(
        String event,
        MathType math,
        Optional<String> mathProperty,
        Optional<String> mathExpression,
        List<PropertyFilter> properties) implements MetricSource {
    public EventSource {
        event = ModelDocuments.normalize(event);
        Objects.requireNonNull(math, "math");
        Objects.requireNonNull(mathProperty, "mathProperty");
        Objects.requireNonNull(mathExpression, "mathExpression");
        properties = ModelDocuments.copyList(properties, "properties");
        if (math == MathType.EXPRESSION && mathExpression.isEmpty()) {
            throw new IllegalArgumentException("expression math requires an expression");
        }
    }

    EventSource(
            final String event,
            final MathType math,
            final String mathProperty,
            final String mathExpression,
            final List<PropertyFilter> properties) {
        this(event, math, Optional.ofNullable(mathProperty), Optional.ofNullable(mathExpression), properties);
    }

    public static EventSource of(final String event) {
        return new EventSource(event, MathType.TOTAL, Optional.empty(), Optional.empty(), List.of());
    }

    public static EventSource of(final String event, final List<PropertyFilter> properties) {
        return new EventSource(event, MathType.TOTAL, Optional.empty(), Optional.empty(), properties);
    }

    public EventSource withMath(final MathType newMath, final String newMathProperty) {
        return new EventSource(event, newMath, Optional.ofNullable(newMathProperty), mathExpression, properties);
    }

    public EventSource withExpression(final String expression) {
        return new EventSource(event, MathType.EXPRESSION, mathProperty, Optional.of(expression), properties);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.EVENT;
    }
}
