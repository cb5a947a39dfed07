package org.exposql.model;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Inclusive experiment window in absolute time, with the team zone used when rendering.
 */
public record ExperimentDateRange(Instant from, Instant to, ZoneId zone) {
    public ExperimentDateRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(zone, "zone");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("date range end " + to + " is before start " + from);
        }
    }

    public static ExperimentDateRange utc(final Instant from, final Instant to) {
        return new ExperimentDateRange(from, to, ZoneId.of("UTC"));
    }

    /**
     * A running experiment has no end date yet; it is measured up to now.
     */
    public static ExperimentDateRange forExperiment(
            final Instant start, final Instant end, final ZoneId zone, final Clock clock) {
        Objects.requireNonNull(start, "experiment start");
        Objects.requireNonNull(clock, "clock");
        return new ExperimentDateRange(start, end == null ? clock.instant() : end, zone);
    }
}
