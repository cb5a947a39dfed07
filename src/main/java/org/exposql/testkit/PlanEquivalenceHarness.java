package org.exposql.testkit;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Runs scenarios through two plan backends and computes structural diffs of their final rows.
 *
 * <p>Numbers are compared with a relative tolerance since the two plans may sum floating point
 * values in a different entity order.
 */
public final class PlanEquivalenceHarness {
    private static final double RELATIVE_TOLERANCE = 1e-9;

    private final PlanBackend leftBackend;
    private final PlanBackend rightBackend;
    private final Clock clock;

    public PlanEquivalenceHarness(PlanBackend leftBackend, PlanBackend rightBackend) {
        this(leftBackend, rightBackend, Clock.systemUTC());
    }

    public PlanEquivalenceHarness(PlanBackend leftBackend, PlanBackend rightBackend, Clock clock) {
        this.leftBackend = Objects.requireNonNull(leftBackend, "leftBackend");
        this.rightBackend = Objects.requireNonNull(rightBackend, "rightBackend");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public EquivalenceReport run(List<EquivalenceScenario> scenarios) {
        Objects.requireNonNull(scenarios, "scenarios");
        List<DiffResult> results = new ArrayList<>(scenarios.size());
        for (EquivalenceScenario scenario : scenarios) {
            results.add(runScenario(scenario));
        }
        return new EquivalenceReport(clock.instant(), leftBackend.name(), rightBackend.name(), results);
    }

    public DiffResult runScenario(EquivalenceScenario scenario) {
        Objects.requireNonNull(scenario, "scenario");
        PlanOutcome leftOutcome;
        PlanOutcome rightOutcome;
        try {
            leftOutcome = leftBackend.execute(scenario);
            rightOutcome = rightBackend.execute(scenario);
        } catch (RuntimeException e) {
            return DiffResult.error(scenario.id(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        List<DiffEntry> entries = compareOutcomes(leftOutcome, rightOutcome);
        if (entries.isEmpty()) {
            return DiffResult.match(scenario.id());
        }
        return DiffResult.mismatch(scenario.id(), entries);
    }

    private static List<DiffEntry> compareOutcomes(PlanOutcome leftOutcome, PlanOutcome rightOutcome) {
        List<DiffEntry> entries = new ArrayList<>();
        compareValue("$.success", leftOutcome.success(), rightOutcome.success(), entries);
        if (leftOutcome.success() && rightOutcome.success()) {
            compareValue("$.rows", leftOutcome.rows(), rightOutcome.rows(), entries);
            return entries;
        }
        compareValue(
            "$.errorMessage",
            leftOutcome.errorMessage().orElse(null),
            rightOutcome.errorMessage().orElse(null),
            entries
        );
        return entries;
    }

    private static void compareValue(String path, Object left, Object right, List<DiffEntry> entries) {
        if (valuesEqual(left, right)) {
            return;
        }
        if (left instanceof Map<?, ?> leftMap && right instanceof Map<?, ?> rightMap) {
            compareMap(path, leftMap, rightMap, entries);
            return;
        }
        if (left instanceof List<?> leftList && right instanceof List<?> rightList) {
            compareList(path, leftList, rightList, entries);
            return;
        }
        entries.add(new DiffEntry(path, left, right, "value mismatch"));
    }

    private static void compareMap(String path, Map<?, ?> leftMap, Map<?, ?> rightMap, List<DiffEntry> entries) {
        Map<String, Object> leftNormalized = normalizeKeyMap(leftMap);
        Map<String, Object> rightNormalized = normalizeKeyMap(rightMap);
        TreeSet<String> keys = new TreeSet<>();
        keys.addAll(leftNormalized.keySet());
        keys.addAll(rightNormalized.keySet());
        for (String key : keys) {
            if (!leftNormalized.containsKey(key) || !rightNormalized.containsKey(key)) {
                entries.add(new DiffEntry(
                    path + "." + key,
                    leftNormalized.get(key),
                    rightNormalized.get(key),
                    "missing column"
                ));
                continue;
            }
            compareValue(path + "." + key, leftNormalized.get(key), rightNormalized.get(key), entries);
        }
    }

    private static void compareList(String path, List<?> leftList, List<?> rightList, List<DiffEntry> entries) {
        if (leftList.size() != rightList.size()) {
            entries.add(new DiffEntry(path + ".length", leftList.size(), rightList.size(), "row count mismatch"));
        }
        int limit = Math.min(leftList.size(), rightList.size());
        for (int i = 0; i < limit; i++) {
            compareValue(path + "[" + i + "]", leftList.get(i), rightList.get(i), entries);
        }
    }

    private static boolean valuesEqual(Object left, Object right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Number leftNumber && right instanceof Number rightNumber) {
            return numericEquals(leftNumber.doubleValue(), rightNumber.doubleValue());
        }
        if (left instanceof Map<?, ?> || left instanceof List<?>) {
            List<DiffEntry> nested = new ArrayList<>();
            if (left instanceof Map<?, ?> leftMap && right instanceof Map<?, ?> rightMap) {
                compareMap("$", leftMap, rightMap, nested);
                return nested.isEmpty();
            }
            if (left instanceof List<?> leftList && right instanceof List<?> rightList) {
                compareList("$", leftList, rightList, nested);
                return nested.isEmpty();
            }
            return false;
        }
        return Objects.equals(left, right);
    }

    static boolean numericEquals(double left, double right) {
        if (left == right) {
            return true;
        }
        double scale = Math.max(1d, Math.max(Math.abs(left), Math.abs(right)));
        return Math.abs(left - right) <= RELATIVE_TOLERANCE * scale;
    }

    private static Map<String, Object> normalizeKeyMap(Map<?, ?> source) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return normalized;
    }
}
