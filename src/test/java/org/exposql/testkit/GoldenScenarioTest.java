package org.exposql.testkit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.exposql.compiler.CompilationContext;
import org.exposql.compiler.CompilerOptions;
import org.exposql.compiler.PlanStrategy;
import org.exposql.engine.InMemoryQueryEngine;
import org.exposql.model.MeanMetric;
import org.exposql.model.MetricSpecification;
import org.exposql.model.RatioMetric;
import org.exposql.model.WarehouseSource;
import org.exposql.obs.JsonLinesLogger;
import org.exposql.runner.ExperimentNoResultsException;
import org.exposql.runner.ExperimentQueryResult;
import org.exposql.runner.ExperimentQueryRunner;
import org.exposql.runner.NoResultsErrorKey;
import org.exposql.runner.VariantResult;
import org.junit.jupiter.api.Test;

class GoldenScenarioTest {
    private static final double TOLERANCE = 1e-9;

    @Test
    void meanSumsOnlyAttributedEventsInsideTheExperimentWindow() throws IOException {
        assertScenario("golden/mean-basic.yaml");
    }

    @Test
    void funnelWithActionStepRespectsTheConversionWindow() throws IOException {
        assertScenario("golden/funnel-action-step.yaml");
    }

    @Test
    void entitiesSeeingSeveralVariantsAreExcluded() throws IOException {
        assertScenario("golden/exclude-multiple-variants.yaml");
    }

    @Test
    void missingControlRaisesNoResults() throws IOException {
        assertScenario("golden/no-control.yaml");
    }

    @Test
    void customExposureJoinsWarehouseRowsOnTheExposureIdentifier() throws IOException {
        assertScenario("golden/custom-exposure-warehouse.yaml");
    }

    @Test
    void ratioJoinsAWarehouseNumeratorWithAnEventDenominator() throws IOException {
        assertScenario("golden/ratio-warehouse-numerator.yaml");
    }

    @Test
    void loaderReadsExpectedErrorsAndFixtureInstants() throws IOException {
        GoldenScenario scenario = GoldenScenarioLoader.loadResource("golden/no-control.yaml");

        assertEquals("no-control", scenario.id());
        assertEquals(List.of("no-control-variant"), scenario.expectedErrors());
        assertTrue(scenario.expected().isEmpty());
        assertEquals(2, scenario.fixture().store().table("events").size());
        assertTrue(scenario.experiment().end().isEmpty());
    }

    @Test
    void loaderRejectsScenarioWithoutExperiment() {
        IllegalArgumentException error = assertThrows(
            IllegalArgumentException.class,
            () -> GoldenScenarioLoader.parse("""
                id: broken
                now: "2024-03-20T00:00:00Z"
                """)
        );
        assertTrue(error.getMessage().contains("experiment"));
    }

    @Test
    void loaderReportsMissingResource() {
        assertThrows(IOException.class, () -> GoldenScenarioLoader.loadResource("golden/does-not-exist.yaml"));
    }

    private static void assertScenario(String resource) throws IOException {
        GoldenScenario scenario = GoldenScenarioLoader.loadResource(resource);
        for (PlanStrategy strategy : PlanStrategy.values()) {
            if (strategy == PlanStrategy.SINGLE_SCAN && readsWarehouse(scenario)) {
                continue;
            }
            CompilationContext context = new CompilationContext(
                scenario.fixture().actions(),
                scenario.team(),
                CompilerOptions.defaults().withPlanStrategy(strategy)
            );
            ExperimentQueryRunner runner = new ExperimentQueryRunner(
                new InMemoryQueryEngine(scenario.fixture().store()),
                context,
                Clock.fixed(scenario.now(), ZoneOffset.UTC),
                JsonLinesLogger.noop()
            );
            String label = scenario.id() + "/" + strategy;

            if (!scenario.expectedErrors().isEmpty()) {
                ExperimentNoResultsException error =
                    assertThrows(ExperimentNoResultsException.class, () -> runner.run(scenario.experiment()), label);
                List<String> raised = new ArrayList<>();
                for (NoResultsErrorKey key : NoResultsErrorKey.values()) {
                    if (error.has(key)) {
                        raised.add(key.jsonKey());
                    }
                }
                assertEquals(scenario.expectedErrors(), raised, label);
                continue;
            }

            ExperimentQueryResult result = runner.run(scenario.experiment());
            assertEquals(scenario.expected().size(), result.variants().size(), label);
            for (Document expected : scenario.expected()) {
                VariantResult variant = result.variant(expected.getString("key"));
                assertMatches(expected, variant.toDocument(), label + "/" + variant.key());
            }
        }
    }

    private static boolean readsWarehouse(GoldenScenario scenario) {
        MetricSpecification metric = scenario.experiment().primaryMetric();
        return metric instanceof MeanMetric mean && mean.source() instanceof WarehouseSource
            || metric instanceof RatioMetric ratio && ratio.readsWarehouse();
    }

    private static void assertMatches(Document expected, Document actual, String label) {
        for (Map.Entry<String, Object> entry : expected.entrySet()) {
            String field = entry.getKey();
            assertTrue(actual.containsKey(field), label + " is missing " + field);
            Object expectedValue = entry.getValue();
            Object actualValue = actual.get(field);
            if (expectedValue instanceof Number expectedNumber && actualValue instanceof Number actualNumber) {
                assertEquals(expectedNumber.doubleValue(), actualNumber.doubleValue(), TOLERANCE, label + "." + field);
            } else {
                assertFalse(expectedValue instanceof Number, label + "." + field + " is not numeric");
                assertEquals(expectedValue, actualValue, label + "." + field);
            }
        }
    }
}
