package org.exposql.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.exposql.expr.Exprs;
import org.exposql.expr.SqlRenderer;
import org.exposql.model.ActionCatalog;
import org.exposql.model.ConversionWindowUnit;
import org.exposql.model.EventSource;
import org.exposql.model.FunnelMetric;
import org.exposql.model.MetricSource;
import org.exposql.model.StepOrder;
import org.junit.jupiter.api.Test;

class FunnelEvaluatorTest {
    private static final List<MetricSource> SERIES =
        List.of(EventSource.of("signup"), EventSource.of("activate"), EventSource.of("purchase"));

    private final SqlRenderer renderer = new SqlRenderer();

    @Test
    void stepLevelResolvesToTheEarliestMatchingStep() {
        assertEquals(
            "multiIf(event = 'signup', 'step_0', event = 'activate', 'step_1', event = 'purchase', 'step_2', 'step_unknown')",
            renderer.render(FunnelEvaluator.stepLevelExpression(SERIES, ActionCatalog.empty())));
    }

    @Test
    void completionNeedsEveryStep() {
        FunnelMetric metric = FunnelMetric.of(SERIES);

        assertEquals(3, FunnelEvaluator.completionThreshold(metric));
        assertEquals("steps = 3", renderer.render(FunnelEvaluator.completionPredicate(metric, Exprs.field("steps"))));
    }

    @Test
    void missingWindowIsUnbounded() {
        assertEquals(FunnelEvaluator.UNBOUNDED_WINDOW_SECONDS, FunnelEvaluator.windowSeconds(FunnelMetric.of(SERIES)));
        assertEquals(
            7_200L,
            FunnelEvaluator.windowSeconds(FunnelMetric.of(SERIES).withConversionWindow(2, ConversionWindowUnit.HOUR)));
    }

    @Test
    void evaluationCallCarriesStepCountWindowAndOrder() {
        FunnelMetric metric = FunnelMetric.of(SERIES)
            .withConversionWindow(1, ConversionWindowUnit.DAY)
            .withStepOrder(StepOrder.UNORDERED);

        assertEquals(
            "aggregate_funnel_steps(3, 86400, 'unordered', tuples)",
            renderer.render(FunnelEvaluator.funnelEvaluation(metric, Exprs.field("tuples"))));
    }
}
