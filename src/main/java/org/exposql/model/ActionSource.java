package org.exposql.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rows matching a saved action. Resolved through an {@link ActionCatalog} at compile time.
 */
public record ActionSource(
        long actionId,
        MathType math,
        Optional<String> mathProperty,
        Optional<String> mathExpression,
        List<PropertyFilter> properties) implements MetricSource {
    public ActionSource {
        Objects.requireNonNull(math, "math");
        Objects.requireNonNull(mathProperty, "mathProperty");
        Objects.requireNonNull(mathExpression, "mathExpression");
        properties = ModelDocuments.copyList(properties, "properties");
        if (math == MathType.EXPRESSION && mathExpression.isEmpty()) {
            throw new IllegalArgumentException("expression math requires an expression");
        }
    }

    ActionSource(
            final long actionId,
            final MathType math,
            final String mathProperty,
            final String mathExpression,
            final List<PropertyFilter> properties) {
        this(actionId, math, Optional.ofNullable(mathProperty), Optional.ofNullable(mathExpression), properties);
    }

    public static ActionSource of(final long actionId) {
        return new ActionSource(actionId, MathType.TOTAL, Optional.empty(), Optional.empty(), List.of());
    }

    public ActionSource withMath(final MathType newMath, final String newMathProperty) {
        return new ActionSource(actionId, newMath, Optional.ofNullable(newMathProperty), mathExpression, properties);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.ACTION;
    }
}
