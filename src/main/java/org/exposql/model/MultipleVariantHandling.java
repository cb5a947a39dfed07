package org.exposql.model;

import java.util.Locale;

/**
 * Policy for entities that were exposed to more than one variant.
 */
public enum MultipleVariantHandling {
    /** Assign the sentinel variant, which is later dropped from results. */
    EXCLUDE,
    /** Keep the variant of the earliest exposure. */
    FIRST_SEEN;

    public static MultipleVariantHandling fromText(final String value) {
        if (value == null || value.isBlank()) {
            return EXCLUDE;
        }
        final String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (final MultipleVariantHandling candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("unsupported multiple_variant_handling: " + value);
    }
}
