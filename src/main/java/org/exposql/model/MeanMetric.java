package org.exposql.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-entity value aggregated with the source's math type, optionally winsorized.
 */
public record MeanMetric(
        MetricSource source,
        Optional<ConversionWindow> conversionWindow,
        Optional<Double> lowerBoundPercentile,
        Optional<Double> upperBoundPercentile,
        boolean ignoreZeros) implements MetricSpecification {
    public MeanMetric {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(conversionWindow, "conversionWindow");
        Objects.requireNonNull(lowerBoundPercentile, "lowerBoundPercentile");
        Objects.requireNonNull(upperBoundPercentile, "upperBoundPercentile");
        lowerBoundPercentile.ifPresent(value -> requirePercentile(value, "lowerBoundPercentile"));
        upperBoundPercentile.ifPresent(value -> requirePercentile(value, "upperBoundPercentile"));
        if (lowerBoundPercentile.isPresent()
                && upperBoundPercentile.isPresent()
                && lowerBoundPercentile.get() >= upperBoundPercentile.get()) {
            throw new IllegalArgumentException("lowerBoundPercentile must be below upperBoundPercentile");
        }
    }

    public static MeanMetric of(final MetricSource source) {
        return new MeanMetric(source, Optional.empty(), Optional.empty(), Optional.empty(), false);
    }

    public MeanMetric withConversionWindow(final long amount, final ConversionWindowUnit unit) {
        return new MeanMetric(
                source,
                Optional.of(new ConversionWindow(amount, unit)),
                lowerBoundPercentile,
                upperBoundPercentile,
                ignoreZeros);
    }

    public MeanMetric withBounds(final Double lower, final Double upper) {
        return new MeanMetric(
                source, conversionWindow, Optional.ofNullable(lower), Optional.ofNullable(upper), ignoreZeros);
    }

    public MeanMetric withIgnoreZeros(final boolean value) {
        return new MeanMetric(source, conversionWindow, lowerBoundPercentile, upperBoundPercentile, value);
    }

    public boolean needsWinsorization() {
        return lowerBoundPercentile.isPresent() || upperBoundPercentile.isPresent();
    }

    @Override
    public MetricKind kind() {
        return MetricKind.MEAN;
    }

    private static void requirePercentile(final double value, final String fieldName) {
        if (!(value > 0d && value < 1d)) {
            throw new IllegalArgumentException(fieldName + " must be strictly between 0 and 1: " + value);
        }
    }
}
