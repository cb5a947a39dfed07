package org.exposql.testkit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of running a batch of scenarios through two plan backends.
 */
public final class EquivalenceReport {
    private final Instant generatedAt;
    private final String leftBackend;
    private final String rightBackend;
    private final List<DiffResult> results;

    public EquivalenceReport(Instant generatedAt, String leftBackend, String rightBackend, List<DiffResult> results) {
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt");
        this.leftBackend = Objects.requireNonNull(leftBackend, "leftBackend");
        this.rightBackend = Objects.requireNonNull(rightBackend, "rightBackend");
        this.results = List.copyOf(Objects.requireNonNull(results, "results"));
    }

    public Instant generatedAt() {
        return generatedAt;
    }

    public String leftBackend() {
        return leftBackend;
    }

    public String rightBackend() {
        return rightBackend;
    }

    public List<DiffResult> results() {
        return results;
    }

    public int totalScenarios() {
        return results.size();
    }

    public int matchCount() {
        return countByStatus(DiffStatus.MATCH);
    }

    public int mismatchCount() {
        return countByStatus(DiffStatus.MISMATCH);
    }

    public int errorCount() {
        return countByStatus(DiffStatus.ERROR);
    }

    public boolean allMatched() {
        return matchCount() == results.size();
    }

    /**
     * Results that are not a match, for assertion messages.
     */
    public List<DiffResult> failures() {
        List<DiffResult> failures = new ArrayList<>();
        for (DiffResult result : results) {
            if (result.status() != DiffStatus.MATCH) {
                failures.add(result);
            }
        }
        return failures;
    }

    private int countByStatus(DiffStatus status) {
        int count = 0;
        for (DiffResult result : results) {
            if (result.status() == status) {
                count++;
            }
        }
        return count;
    }
}
