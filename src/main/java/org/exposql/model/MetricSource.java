package org.exposql.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.bson.Document;

/**
 * Where metric (or funnel step) rows come from, and how each row is valued.
 */
public sealed interface MetricSource permits EventSource, ActionSource, WarehouseSource {
    SourceKind kind();

    MathType math();

    Optional<String> mathProperty();

    /**
     * Aggregated expression text, only meaningful for {@link MathType#EXPRESSION}.
     */
    Optional<String> mathExpression();

    List<PropertyFilter> properties();

    static MetricSource fromDocument(final Document document) {
        Objects.requireNonNull(document, "document");
        final String kind = ModelDocuments.readText(document, "kind");
        final MathType math = MathType.fromText(ModelDocuments.readText(document, "math"));
        final String mathProperty = ModelDocuments.readText(document, "math_property");
        final String mathExpression = ModelDocuments.readText(document, "math_hogql");
        final List<PropertyFilter> properties = ModelDocuments.readFilters(document, "properties");
        if (kind == null || "EventsNode".equals(kind)) {
            return new EventSource(
                    ModelDocuments.readText(document, "event"), math, mathProperty, mathExpression, properties);
        }
        if ("ActionsNode".equals(kind)) {
            final Long id = ModelDocuments.readLong(document, "id");
            if (id == null) {
                throw new IllegalArgumentException("ActionsNode requires an id");
            }
            return new ActionSource(id, math, mathProperty, mathExpression, properties);
        }
        if ("ExperimentDataWarehouseNode".equals(kind)) {
            return new WarehouseSource(
                    ModelDocuments.readText(document, "table_name"),
                    ModelDocuments.readText(document, "timestamp_field"),
                    ModelDocuments.readText(document, "data_warehouse_join_key"),
                    ModelDocuments.readText(document, "events_join_key"),
                    math,
                    mathProperty,
                    mathExpression,
                    properties);
        }
        throw new IllegalArgumentException("unsupported metric source kind: " + kind);
    }
}
