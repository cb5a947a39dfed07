package org.exposql.compiler;

import java.util.Locale;

/**
 * Which of the two equivalent plan shapes to compile.
 */
public enum PlanStrategy {
    /** Exposures and metric events computed separately, then joined. */
    JOIN,
    /** One scan of the events table with conditional aggregation, filtered afterwards. */
    SINGLE_SCAN;

    public static PlanStrategy fromText(final String value) {
        if (value == null || value.isBlank()) {
            return JOIN;
        }
        final String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (final IllegalArgumentException exception) {
            throw new IllegalArgumentException("unsupported plan strategy: " + value, exception);
        }
    }
}
