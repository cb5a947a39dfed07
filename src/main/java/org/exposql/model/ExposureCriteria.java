package org.exposql.model;

import java.util.Objects;
import java.util.Optional;
import org.bson.Document;

/**
 * Which events count as exposures, and how ambiguous exposures are resolved.
 */
public record ExposureCriteria(
        Optional<ExposureConfig> exposureConfig,
        boolean filterTestAccounts,
        MultipleVariantHandling multipleVariantHandling) {
    public ExposureCriteria {
        Objects.requireNonNull(exposureConfig, "exposureConfig");
        Objects.requireNonNull(multipleVariantHandling, "multipleVariantHandling");
    }

    public static ExposureCriteria defaults() {
        return new ExposureCriteria(Optional.empty(), false, MultipleVariantHandling.EXCLUDE);
    }

    public ExposureCriteria withHandling(final MultipleVariantHandling handling) {
        return new ExposureCriteria(exposureConfig, filterTestAccounts, handling);
    }

    public ExposureCriteria withExposureConfig(final ExposureConfig config) {
        return new ExposureCriteria(Optional.of(config), filterTestAccounts, multipleVariantHandling);
    }

    public ExposureCriteria withFilterTestAccounts(final boolean value) {
        return new ExposureCriteria(exposureConfig, value, multipleVariantHandling);
    }

    /**
     * The configured exposure event, or the default flag-called event.
     */
    public ExposureConfig effectiveExposureConfig() {
        return exposureConfig.orElseGet(ExposureConfig::defaultEvent);
    }

    /**
     * Parses the nullable JSON-shaped criteria stored on an experiment.
     */
    public static ExposureCriteria fromJson(final String json) {
        if (json == null || json.isBlank() || "null".equals(json.trim())) {
            return defaults();
        }
        return fromDocument(Document.parse(json));
    }

    public static ExposureCriteria fromDocument(final Document document) {
        if (document == null) {
            return defaults();
        }
        final Document config = ModelDocuments.readDocument(document, "exposure_config");
        return new ExposureCriteria(
                config == null ? Optional.empty() : Optional.of(ExposureConfig.fromDocument(config)),
                ModelDocuments.readBoolean(document, "filterTestAccounts", false),
                MultipleVariantHandling.fromText(ModelDocuments.readText(document, "multiple_variant_handling")));
    }
}
