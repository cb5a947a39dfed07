package org.exposql.testkit;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Comparison output for a single scenario.
 */
public final class DiffResult {
    private final String scenarioId;
    private final DiffStatus status;
    private final List<DiffEntry> entries;
    private final String errorMessage;

    private DiffResult(String scenarioId, DiffStatus status, List<DiffEntry> entries, String errorMessage) {
        if (scenarioId == null || scenarioId.isBlank()) {
            throw new IllegalArgumentException("scenarioId must not be blank");
        }
        this.scenarioId = scenarioId.trim();
        this.status = Objects.requireNonNull(status, "status");
        this.entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
        this.errorMessage = errorMessage;
    }

    public static DiffResult match(String scenarioId) {
        return new DiffResult(scenarioId, DiffStatus.MATCH, List.of(), null);
    }

    public static DiffResult mismatch(String scenarioId, List<DiffEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("entries must not be empty for mismatches");
        }
        return new DiffResult(scenarioId, DiffStatus.MISMATCH, entries, null);
    }

    public static DiffResult error(String scenarioId, String errorMessage) {
        return new DiffResult(scenarioId, DiffStatus.ERROR, List.of(), errorMessage);
    }

    public String scenarioId() {
        return scenarioId;
    }

    public DiffStatus status() {
        return status;
    }

    public List<DiffEntry> entries() {
        return entries;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        return switch (status) {
            case MATCH -> scenarioId + ": match";
            case MISMATCH -> scenarioId + ": " + entries;
            case ERROR -> scenarioId + ": error " + errorMessage;
        };
    }
}
