package org.exposql.model;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.bson.Document;

/**
 * Experiment fields the compiler consumes from the persistence layer.
 */
public record ExperimentDefinition(
        long id,
        String featureFlagKey,
        List<String> variantKeys,
        Optional<Long> holdoutId,
        Optional<Integer> aggregationGroupTypeIndex,
        ExposureCriteria exposureCriteria,
        List<MetricSpecification> metrics,
        Instant start,
        Optional<Instant> end) {
    public ExperimentDefinition {
        featureFlagKey = ModelDocuments.requireText(featureFlagKey, "featureFlagKey");
        variantKeys = ModelDocuments.copyList(variantKeys, "variantKeys");
        Objects.requireNonNull(holdoutId, "holdoutId");
        Objects.requireNonNull(aggregationGroupTypeIndex, "aggregationGroupTypeIndex");
        Objects.requireNonNull(exposureCriteria, "exposureCriteria");
        metrics = ModelDocuments.copyList(metrics, "metrics");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public VariantSet variantSet() {
        return VariantSet.of(variantKeys, holdoutId.orElse(null));
    }

    public EntityKey entityKey() {
        return EntityKey.forGroupTypeIndex(aggregationGroupTypeIndex.orElse(null));
    }

    /**
     * Only the first metric is needed for a single-metric computation.
     */
    public MetricSpecification primaryMetric() {
        if (metrics.isEmpty()) {
            throw new IllegalArgumentException("experiment " + id + " has no metrics");
        }
        return metrics.get(0);
    }

    public static ExperimentDefinition fromJson(final String json) {
        return fromDocument(Document.parse(Objects.requireNonNull(json, "json")));
    }

    public static ExperimentDefinition fromDocument(final Document document) {
        Objects.requireNonNull(document, "document");
        final Long id = ModelDocuments.readLong(document, "id");
        final Long groupTypeIndex = ModelDocuments.readLong(document, "aggregation_group_type_index");
        final List<MetricSpecification> metrics = new ArrayList<>();
        for (final Document metric : ModelDocuments.readDocuments(document, "metrics")) {
            metrics.add(MetricSpecification.fromDocument(metric));
        }
        final String end = ModelDocuments.readText(document, "end_date");
        return new ExperimentDefinition(
                id == null ? 0L : id,
                ModelDocuments.readText(document, "feature_flag_key"),
                ModelDocuments.readTexts(document, "variants"),
                Optional.ofNullable(ModelDocuments.readLong(document, "holdout_id")),
                Optional.ofNullable(groupTypeIndex == null ? null : Math.toIntExact(groupTypeIndex)),
                ExposureCriteria.fromDocument(ModelDocuments.readDocument(document, "exposure_criteria")),
                metrics,
                parseInstant(ModelDocuments.requireText(ModelDocuments.readText(document, "start_date"), "start_date")),
                Optional.ofNullable(end == null ? null : parseInstant(end)));
    }

    private static Instant parseInstant(final String value) {
        try {
            return Instant.parse(value);
        } catch (final DateTimeParseException exception) {
            throw new IllegalArgumentException("invalid timestamp: " + value, exception);
        }
    }
}
