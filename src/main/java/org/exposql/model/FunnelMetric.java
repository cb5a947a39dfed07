package org.exposql.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered funnel of event or action steps; step {@code i} must precede step {@code i + 1}.
 */
public record FunnelMetric(
        List<MetricSource> series,
        Optional<ConversionWindow> conversionWindow,
        StepOrder stepOrder) implements MetricSpecification {
    public FunnelMetric {
        series = ModelDocuments.copyList(series, "series");
        Objects.requireNonNull(conversionWindow, "conversionWindow");
        Objects.requireNonNull(stepOrder, "stepOrder");
        if (series.isEmpty()) {
            throw new IllegalArgumentException("funnel series must not be empty");
        }
        for (final MetricSource step : series) {
            if (step.kind() == SourceKind.WAREHOUSE) {
                throw new IllegalArgumentException("funnel steps must be events or actions");
            }
        }
    }

    public static FunnelMetric of(final List<MetricSource> series) {
        return new FunnelMetric(series, Optional.empty(), StepOrder.ORDERED);
    }

    public FunnelMetric withConversionWindow(final long amount, final ConversionWindowUnit unit) {
        return new FunnelMetric(series, Optional.of(new ConversionWindow(amount, unit)), stepOrder);
    }

    public FunnelMetric withStepOrder(final StepOrder order) {
        return new FunnelMetric(series, conversionWindow, order);
    }

    @Override
    public MetricKind kind() {
        return MetricKind.FUNNEL;
    }
}
