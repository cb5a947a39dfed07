package org.exposql.runner;

import java.util.List;
import java.util.Objects;
import org.exposql.model.MetricKind;

public record ExperimentQueryResult(long experimentId, MetricKind kind, List<VariantResult> variants) {
    public ExperimentQueryResult {
        Objects.requireNonNull(kind, "kind");
        variants = List.copyOf(Objects.requireNonNull(variants, "variants"));
    }

    public VariantResult variant(final String key) {
        for (final VariantResult result : variants) {
            if (result.key().equals(key)) {
                return result;
            }
        }
        throw new IllegalArgumentException("no result for variant: " + key);
    }
}
