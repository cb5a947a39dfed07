package org.exposql.compiler;

import org.exposql.expr.SelectQuery;

/**
 * Compiles one metric request into an executable plan. Instances are built per request and are
 * not reused.
 */
public interface PlanBuilder {
    PlanStrategy strategy();

    /**
     * Plan whose rows are {@code (variant, num_users, total_sum, total_sum_of_squares)} for mean
     * metrics, or {@code (variant, num_users, success_count, failure_count[, step_counts])} for funnels.
     */
    SelectQuery build();
}
