package org.exposql.model;

import java.util.Locale;

public enum ConversionWindowUnit {
    SECOND(1L),
    MINUTE(60L),
    HOUR(3_600L),
    DAY(86_400L),
    WEEK(7L * 86_400L),
    MONTH(30L * 86_400L);

    private final long seconds;

    ConversionWindowUnit(final long seconds) {
        this.seconds = seconds;
    }

    public long toSeconds(final long amount) {
        return Math.multiplyExact(amount, seconds);
    }

    public static ConversionWindowUnit fromText(final String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("conversion window unit must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException exception) {
            throw new IllegalArgumentException("unsupported conversion window unit: " + value, exception);
        }
    }
}
