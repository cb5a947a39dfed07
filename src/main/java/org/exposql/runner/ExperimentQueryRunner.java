package org.exposql.runner;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.exposql.compiler.CompilationContext;
import org.exposql.compiler.MetricQueryRequest;
import org.exposql.compiler.PlanBuilder;
import org.exposql.compiler.PlanBuilders;
import org.exposql.engine.QueryExecutor;
import org.exposql.engine.ResultRow;
import org.exposql.expr.SelectQuery;
import org.exposql.model.ExperimentDateRange;
import org.exposql.model.ExperimentDefinition;
import org.exposql.model.MetricSpecification;
import org.exposql.obs.CorrelationContext;
import org.exposql.obs.JsonLinesLogger;

/**
 * Compiles the primary metric of an experiment, executes the plan and assembles per-variant
 * results. Executor failures are logged and rethrown unchanged.
 */
public final class ExperimentQueryRunner {
    private final QueryExecutor executor;
    private final CompilationContext context;
    private final Clock clock;
    private final JsonLinesLogger logger;
    private final AtomicLong requestSequence = new AtomicLong();

    public ExperimentQueryRunner(final QueryExecutor executor, final CompilationContext context) {
        this(executor, context, Clock.systemUTC(), JsonLinesLogger.noop());
    }

    public ExperimentQueryRunner(
            final QueryExecutor executor,
            final CompilationContext context,
            final Clock clock,
            final JsonLinesLogger logger) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.context = Objects.requireNonNull(context, "context");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public MetricQueryRequest request(final ExperimentDefinition experiment) {
        Objects.requireNonNull(experiment, "experiment");
        return new MetricQueryRequest(
                experiment.featureFlagKey(),
                experiment.variantSet(),
                ExperimentDateRange.forExperiment(
                        experiment.start(), experiment.end().orElse(null), context.team().timeZone(), clock),
                experiment.entityKey(),
                experiment.primaryMetric(),
                experiment.exposureCriteria());
    }

    public CompiledQuery compile(final ExperimentDefinition experiment) {
        final MetricQueryRequest request = request(experiment);
        return compile(request, correlation(experiment.id(), request.metric(), "compile"));
    }

    public ExperimentQueryResult run(final ExperimentDefinition experiment) {
        final MetricQueryRequest request = request(experiment);
        final CorrelationContext correlation = correlation(experiment.id(), request.metric(), "run");
        final CompiledQuery compiled = compile(request, correlation);

        final List<ResultRow> rows;
        try {
            rows = executor.execute(compiled.plan());
        } catch (final RuntimeException exception) {
            final Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("errorType", exception.getClass().getSimpleName());
            fields.put("error", String.valueOf(exception.getMessage()));
            logger.error("execute.failed", correlation, fields);
            throw exception;
        }
        logger.info("execute.done", correlation, Map.of("rowCount", rows.size()));

        final List<VariantResult> variants =
                ExperimentResultAssembler.assemble(rows, request.metric().kind(), request.variants());
        ExperimentResultAssembler.validate(variants, request.variants());
        return new ExperimentQueryResult(experiment.id(), request.metric().kind(), variants);
    }

    private CompiledQuery compile(final MetricQueryRequest request, final CorrelationContext correlation) {
        final PlanBuilder builder = PlanBuilders.create(request, context);
        logger.info("compile.start", correlation, Map.of("strategy", builder.strategy()));
        final SelectQuery plan = builder.build();
        final List<String> stages = new ArrayList<>();
        for (final SelectQuery.Cte cte : plan.ctes()) {
            stages.add(cte.name());
        }
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("strategy", builder.strategy());
        fields.put("stages", stages);
        logger.info("compile.done", correlation, fields);
        return new CompiledQuery(request, builder.strategy(), plan);
    }

    private CorrelationContext correlation(
            final long experimentId, final MetricSpecification metric, final String operation) {
        return CorrelationContext.builder("exp-" + experimentId + "-" + requestSequence.incrementAndGet(), operation)
                .experimentId(experimentId)
                .metricKind(metric.kind().name())
                .build();
    }
}
