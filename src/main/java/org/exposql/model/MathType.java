package org.exposql.model;

import java.util.Locale;

/**
 * How raw metric events are valued and aggregated per entity.
 */
public enum MathType {
    TOTAL("total"),
    SUM("sum"),
    AVERAGE("avg"),
    MIN("min"),
    MAX("max"),
    UNIQUE_SESSION("unique_session"),
    UNIQUE_GROUP("unique_group"),
    DISTINCT_ACTIVE_USER("dau"),
    EXPRESSION("hogql");

    private final String wireName;

    MathType(final String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Distinct-count math types value each event by an identifier instead of a number.
     */
    public boolean countsDistinct() {
        return this == UNIQUE_SESSION || this == UNIQUE_GROUP || this == DISTINCT_ACTIVE_USER;
    }

    /**
     * Unknown or missing names fall back to {@link #TOTAL}.
     */
    public static MathType fromText(final String value) {
        if (value == null || value.isBlank()) {
            return TOTAL;
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (final MathType candidate : values()) {
            if (candidate.wireName.equals(normalized) || candidate.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return candidate;
            }
        }
        if ("average".equals(normalized)) {
            return AVERAGE;
        }
        if ("distinct_active_user".equals(normalized)) {
            return DISTINCT_ACTIVE_USER;
        }
        return TOTAL;
    }
}
