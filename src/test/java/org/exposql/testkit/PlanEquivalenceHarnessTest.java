package org.exposql.testkit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.exposql.compiler.CompilerOptions;
import org.exposql.compiler.PlanStrategy;
import org.exposql.model.RatioMetric;
import org.junit.jupiter.api.Test;

class PlanEquivalenceHarnessTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-20T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void joinAndSingleScanPlansAgreeOnSyntheticScenarios() {
        PlanEquivalenceHarness harness = new PlanEquivalenceHarness(
            new StrategyPlanBackend(PlanStrategy.JOIN),
            new StrategyPlanBackend(PlanStrategy.SINGLE_SCAN),
            CLOCK);

        for (long seed : new long[] {1L, 7L, 42L, 2024L}) {
            EquivalenceReport report = harness.run(new SyntheticScenarioGenerator(seed).generate(40));

            assertEquals(40, report.totalScenarios());
            assertTrue(report.allMatched(), "seed " + seed + ": " + report.failures());
        }
    }

    @Test
    void ratioScenariosAgreeAcrossPlans() {
        PlanEquivalenceHarness harness = new PlanEquivalenceHarness(
            new StrategyPlanBackend(PlanStrategy.JOIN),
            new StrategyPlanBackend(PlanStrategy.SINGLE_SCAN),
            CLOCK);
        List<EquivalenceScenario> ratios = new ArrayList<>();
        for (EquivalenceScenario scenario : new SyntheticScenarioGenerator(11L).generate(120)) {
            if (scenario.request().metric() instanceof RatioMetric) {
                ratios.add(scenario);
            }
        }

        assertFalse(ratios.isEmpty());
        EquivalenceReport report = harness.run(ratios);
        assertTrue(report.allMatched(), report.failures().toString());
    }

    @Test
    void stepCountsAgreeAcrossPlans() {
        CompilerOptions options = CompilerOptions.defaults().withFunnelStepCounts(true);
        PlanEquivalenceHarness harness = new PlanEquivalenceHarness(
            new StrategyPlanBackend(PlanStrategy.JOIN, options),
            new StrategyPlanBackend(PlanStrategy.SINGLE_SCAN, options),
            CLOCK);

        EquivalenceReport report = harness.run(new SyntheticScenarioGenerator(99L).generate(30));

        assertTrue(report.allMatched(), report.failures().toString());
        assertEquals("join", report.leftBackend());
        assertEquals("single_scan", report.rightBackend());
        assertEquals(Instant.parse("2024-03-20T00:00:00Z"), report.generatedAt());
    }

    @Test
    void generatorIsDeterministicForASeed() {
        List<EquivalenceScenario> first = new SyntheticScenarioGenerator(5L).generate(3);
        List<EquivalenceScenario> second = new SyntheticScenarioGenerator(5L).generate(3);

        assertEquals(first.get(2).request(), second.get(2).request());
        assertEquals(
            first.get(2).fixture().store().table("events"),
            second.get(2).fixture().store().table("events"));
    }

    @Test
    void reportsValueDifferencesWithTheirPath() {
        EquivalenceScenario scenario = new SyntheticScenarioGenerator(3L).generate(1).get(0);
        PlanBackend left = fixed("left", PlanOutcome.success(List.of(row("control", 5, 50d), row("test", 7, 0d))));
        PlanBackend right = fixed("right", PlanOutcome.success(List.of(row("control", 5, 50.5d), row("test", 7, 0d))));

        DiffResult result = new PlanEquivalenceHarness(left, right, CLOCK).runScenario(scenario);

        assertEquals(DiffStatus.MISMATCH, result.status());
        assertEquals(1, result.entries().size());
        assertEquals("$.rows[0].total_sum", result.entries().get(0).path());
        assertEquals(50d, result.entries().get(0).leftValue());
    }

    @Test
    void toleratesFloatingPointSummationOrder() {
        EquivalenceScenario scenario = new SyntheticScenarioGenerator(3L).generate(1).get(0);
        PlanBackend left = fixed("left", PlanOutcome.success(List.of(row("control", 3, 0.1d + 0.2d + 0.3d))));
        PlanBackend right = fixed("right", PlanOutcome.success(List.of(row("control", 3, 0.3d + 0.2d + 0.1d))));

        assertEquals(DiffStatus.MATCH, new PlanEquivalenceHarness(left, right, CLOCK).runScenario(scenario).status());
        assertFalse(PlanEquivalenceHarness.numericEquals(1d, 1.001d));
        assertTrue(PlanEquivalenceHarness.numericEquals(1e12, 1e12 + 1d));
    }

    @Test
    void failuresAndExceptionsAreReported() {
        EquivalenceScenario scenario = new SyntheticScenarioGenerator(3L).generate(1).get(0);
        PlanBackend ok = fixed("ok", PlanOutcome.success(List.of()));
        PlanBackend failing = fixed("failing", PlanOutcome.failure("UnsupportedFeatureException: nope"));
        PlanBackend throwing = new PlanBackend() {
            @Override
            public String name() {
                return "throwing";
            }

            @Override
            public PlanOutcome execute(EquivalenceScenario ignored) {
                throw new IllegalStateException("boom");
            }
        };

        DiffResult mismatch = new PlanEquivalenceHarness(ok, failing, CLOCK).runScenario(scenario);
        assertEquals(DiffStatus.MISMATCH, mismatch.status());
        assertEquals("$.success", mismatch.entries().get(0).path());

        DiffResult error = new PlanEquivalenceHarness(ok, throwing, CLOCK).runScenario(scenario);
        assertEquals(DiffStatus.ERROR, error.status());
        assertEquals("IllegalStateException: boom", error.errorMessage().orElseThrow());

        EquivalenceReport report = new PlanEquivalenceHarness(ok, throwing, CLOCK).run(List.of(scenario));
        assertEquals(1, report.errorCount());
        assertFalse(report.allMatched());
    }

    private static PlanBackend fixed(String name, PlanOutcome outcome) {
        return new PlanBackend() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public PlanOutcome execute(EquivalenceScenario scenario) {
                return outcome;
            }
        };
    }

    private static Map<String, Object> row(String variant, long users, double sum) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("variant", variant);
        row.put("num_users", users);
        row.put("total_sum", sum);
        return row;
    }
}
