package org.exposql.runner;

import java.util.Objects;
import org.exposql.compiler.MetricQueryRequest;
import org.exposql.compiler.PlanStrategy;
import org.exposql.expr.SelectQuery;

/**
 * A compiled plan together with the request it was compiled from.
 */
public record CompiledQuery(MetricQueryRequest request, PlanStrategy strategy, SelectQuery plan) {
    public CompiledQuery {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(plan, "plan");
    }
}
