package org.exposql.model;

import java.util.Locale;

public enum StepOrder {
    ORDERED,
    UNORDERED;

    public static StepOrder fromText(final String value) {
        if (value == null || value.isBlank()) {
            return ORDERED;
        }
        final String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("STRICT".equals(normalized)) {
            throw new IllegalArgumentException("strict funnel step order is not supported");
        }
        return valueOf(normalized);
    }
}
