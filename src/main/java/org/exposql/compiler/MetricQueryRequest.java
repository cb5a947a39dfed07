package org.exposql.compiler;

import java.util.Objects;
import org.exposql.model.EntityKey;
import org.exposql.model.ExperimentDateRange;
import org.exposql.model.ExposureCriteria;
import org.exposql.model.MetricSpecification;
import org.exposql.model.VariantSet;

/**
 * Everything one compilation is about: the flag, its variants, the window, the unit, the metric
 * and the exposure criteria.
 */
public record MetricQueryRequest(
        String featureFlagKey,
        VariantSet variants,
        ExperimentDateRange dateRange,
        EntityKey entityKey,
        MetricSpecification metric,
        ExposureCriteria criteria) {
    public MetricQueryRequest {
        Objects.requireNonNull(featureFlagKey, "featureFlagKey");
        if (featureFlagKey.isBlank()) {
            throw new IllegalArgumentException("featureFlagKey must not be blank");
        }
        Objects.requireNonNull(variants, "variants");
        Objects.requireNonNull(dateRange, "dateRange");
        Objects.requireNonNull(entityKey, "entityKey");
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(criteria, "criteria");
    }

    public MetricQueryRequest withMetric(final MetricSpecification value) {
        return new MetricQueryRequest(featureFlagKey, variants, dateRange, entityKey, value, criteria);
    }

    public MetricQueryRequest withCriteria(final ExposureCriteria value) {
        return new MetricQueryRequest(featureFlagKey, variants, dateRange, entityKey, metric, value);
    }
}
