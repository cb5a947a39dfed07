package org.exposql.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rows of an external warehouse table, joined back to exposures through {@code eventsJoinKey}.
 *
 * <p>{@code dataWarehouseJoinKey} is the column of the warehouse table holding the identifier, and
 * {@code eventsJoinKey} is the (possibly dotted) path on exposure events holding the same identifier.
 */
public record WarehouseSource(
        String tableName,
        String timestampField,
        String dataWarehouseJoinKey,
        String eventsJoinKey,
        MathType math,
        Optional<String> mathProperty,
        Optional<String> mathExpression,
        List<PropertyFilter> properties) implements MetricSource {
    public WarehouseSource {
        tableName = ModelDocuments.requireText(tableName, "tableName");
        timestampField = ModelDocuments.requireText(timestampField, "timestampField");
        dataWarehouseJoinKey = ModelDocuments.requireText(dataWarehouseJoinKey, "dataWarehouseJoinKey");
        eventsJoinKey = ModelDocuments.requireText(eventsJoinKey, "eventsJoinKey");
        Objects.requireNonNull(math, "math");
        Objects.requireNonNull(mathProperty, "mathProperty");
        Objects.requireNonNull(mathExpression, "mathExpression");
        properties = ModelDocuments.copyList(properties, "properties");
        if (math == MathType.EXPRESSION && mathExpression.isEmpty()) {
            throw new IllegalArgumentException("expression math requires an expression");
        }
    }

    WarehouseSource(
            final String tableName,
            final String timestampField,
            final String dataWarehouseJoinKey,
            final String eventsJoinKey,
            final MathType math,
            final String mathProperty,
            final String mathExpression,
            final List<PropertyFilter> properties) {
        this(
                tableName,
                timestampField,
                dataWarehouseJoinKey,
                eventsJoinKey,
                math,
                Optional.ofNullable(mathProperty),
                Optional.ofNullable(mathExpression),
                properties);
    }

    public static WarehouseSource of(
            final String tableName,
            final String timestampField,
            final String dataWarehouseJoinKey,
            final String eventsJoinKey,
            final MathType math,
            final String mathProperty) {
        return new WarehouseSource(
                tableName,
                timestampField,
                dataWarehouseJoinKey,
                eventsJoinKey,
                math,
                Optional.ofNullable(mathProperty),
                Optional.empty(),
                List.of());
    }

    @Override
    public SourceKind kind() {
        return SourceKind.WAREHOUSE;
    }
}
