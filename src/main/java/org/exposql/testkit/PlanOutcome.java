package org.exposql.testkit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Final-stage rows of a plan, or the failure that prevented them.
 */
public final class PlanOutcome {
    private final boolean success;
    private final List<Map<String, Object>> rows;
    private final String errorMessage;

    private PlanOutcome(boolean success, List<Map<String, Object>> rows, String errorMessage) {
        this.success = success;
        this.rows = List.copyOf(rows);
        this.errorMessage = errorMessage;
    }

    public static PlanOutcome success(List<Map<String, Object>> rows) {
        return new PlanOutcome(true, new ArrayList<>(Objects.requireNonNull(rows, "rows")), null);
    }

    public static PlanOutcome failure(String errorMessage) {
        return new PlanOutcome(false, List.of(), Objects.requireNonNull(errorMessage, "errorMessage"));
    }

    public boolean success() {
        return success;
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(errorMessage);
    }
}
