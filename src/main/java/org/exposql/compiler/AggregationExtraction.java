package org.exposql.compiler;

import java.util.Objects;
import java.util.Optional;
import org.exposql.expr.Expr;

/**
 * Outer aggregation function of a user expression and the per-event operand it aggregates.
 * {@code function} is empty when the expression has no recognised outer aggregation.
 */
public record AggregationExtraction(Optional<String> function, Expr inner, boolean distinct) {
    public AggregationExtraction {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(inner, "inner");
    }

    public static AggregationExtraction none(final Expr expr) {
        return new AggregationExtraction(Optional.empty(), expr, false);
    }
}
