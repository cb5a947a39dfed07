package org.exposql.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-entity numerator and denominator, each aggregated with its own source's math type. The
 * ratio itself is formed downstream from the per-variant sums.
 */
public record RatioMetric(
        MetricSource numerator,
        MetricSource denominator,
        Optional<ConversionWindow> conversionWindow) implements MetricSpecification {
    public RatioMetric {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        Objects.requireNonNull(conversionWindow, "conversionWindow");
    }

    public static RatioMetric of(final MetricSource numerator, final MetricSource denominator) {
        return new RatioMetric(numerator, denominator, Optional.empty());
    }

    public RatioMetric withConversionWindow(final long amount, final ConversionWindowUnit unit) {
        return new RatioMetric(numerator, denominator, Optional.of(new ConversionWindow(amount, unit)));
    }

    public boolean readsWarehouse() {
        return numerator.kind() == SourceKind.WAREHOUSE || denominator.kind() == SourceKind.WAREHOUSE;
    }

    @Override
    public MetricKind kind() {
        return MetricKind.RATIO;
    }
}
