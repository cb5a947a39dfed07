package org.exposql.testkit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.exposql.compiler.CompilationContext;
import org.exposql.compiler.CompilerOptions;
import org.exposql.compiler.PlanBuilders;
import org.exposql.compiler.PlanColumns;
import org.exposql.compiler.PlanStrategy;
import org.exposql.engine.InMemoryQueryEngine;
import org.exposql.engine.ResultRow;
import org.exposql.expr.SelectQuery;

/**
 * Compiles with one {@link PlanStrategy} and runs the plan on {@link InMemoryQueryEngine}.
 * Rows are sorted by variant since the two strategies group entities in different scan orders.
 */
public final class StrategyPlanBackend implements PlanBackend {
    private final PlanStrategy strategy;
    private final CompilerOptions options;

    public StrategyPlanBackend(PlanStrategy strategy) {
        this(strategy, CompilerOptions.defaults());
    }

    public StrategyPlanBackend(PlanStrategy strategy, CompilerOptions options) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.options = Objects.requireNonNull(options, "options").withPlanStrategy(strategy);
    }

    @Override
    public String name() {
        return strategy.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public PlanOutcome execute(EquivalenceScenario scenario) {
        Objects.requireNonNull(scenario, "scenario");
        List<ResultRow> rows;
        try {
            CompilationContext context = new CompilationContext(scenario.fixture().actions(), scenario.team(), options);
            SelectQuery plan = PlanBuilders.create(strategy, scenario.request(), context).build();
            rows = new InMemoryQueryEngine(scenario.fixture().store()).execute(plan);
        } catch (IllegalArgumentException e) {
            return PlanOutcome.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        List<Map<String, Object>> normalized = new ArrayList<>(rows.size());
        for (ResultRow row : rows) {
            normalized.add(new LinkedHashMap<>(row.values()));
        }
        normalized.sort(Comparator.comparing(row -> String.valueOf(row.get(PlanColumns.VARIANT))));
        return PlanOutcome.success(normalized);
    }
}
