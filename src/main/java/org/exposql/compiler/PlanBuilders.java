package org.exposql.compiler;

import java.util.Objects;

/**
 * Picks the plan builder configured in {@link CompilerOptions#planStrategy()}.
 */
public final class PlanBuilders {
    private PlanBuilders() {}

    public static PlanBuilder create(final MetricQueryRequest request, final CompilationContext context) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(context, "context");
        return create(context.options().planStrategy(), request, context);
    }

    public static PlanBuilder create(
            final PlanStrategy strategy, final MetricQueryRequest request, final CompilationContext context) {
        return switch (Objects.requireNonNull(strategy, "strategy")) {
            case JOIN -> new JoinPlanBuilder(request, context);
            case SINGLE_SCAN -> new SingleScanPlanBuilder(request, context);
        };
    }
}
