package org.exposql.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.bson.Document;

/**
 * What is measured for an experiment. Consumers switch on {@link #kind()}.
 */
public sealed interface MetricSpecification permits MeanMetric, FunnelMetric, RatioMetric {
    MetricKind kind();

    Optional<ConversionWindow> conversionWindow();

    /**
     * Conversion window length in seconds, or 0 when no window is configured.
     */
    default long conversionWindowSeconds() {
        return conversionWindow().map(ConversionWindow::seconds).orElse(0L);
    }

    static MetricSpecification fromDocument(final Document document) {
        Objects.requireNonNull(document, "document");
        final String metricType = ModelDocuments.readText(document, "metric_type");
        final Optional<ConversionWindow> window = ConversionWindow.fromDocument(document);
        if (metricType == null || "mean".equals(metricType)) {
            final Document source = ModelDocuments.readDocument(document, "source");
            if (source == null) {
                throw new IllegalArgumentException("mean metric requires a source");
            }
            return new MeanMetric(
                    MetricSource.fromDocument(source),
                    window,
                    Optional.ofNullable(ModelDocuments.readDouble(document, "lower_bound_percentile")),
                    Optional.ofNullable(ModelDocuments.readDouble(document, "upper_bound_percentile")),
                    ModelDocuments.readBoolean(document, "ignore_zeros", false));
        }
        if ("funnel".equals(metricType)) {
            final List<MetricSource> series = new ArrayList<>();
            for (final Document step : ModelDocuments.readDocuments(document, "series")) {
                series.add(MetricSource.fromDocument(step));
            }
            return new FunnelMetric(
                    series,
                    window,
                    StepOrder.fromText(ModelDocuments.readText(document, "funnel_order_type")));
        }
        if ("ratio".equals(metricType)) {
            return new RatioMetric(ratioSource(document, "numerator"), ratioSource(document, "denominator"), window);
        }
        throw new IllegalArgumentException("unsupported metric type: " + metricType);
    }

    private static MetricSource ratioSource(final Document document, final String key) {
        final Document source = ModelDocuments.readDocument(document, key);
        if (source == null) {
            throw new IllegalArgumentException("ratio metric requires a " + key);
        }
        return MetricSource.fromDocument(source);
    }
}
