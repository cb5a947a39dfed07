package org.exposql.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;

/**
 * Shared helpers for reading model objects out of JSON-shaped documents.
 */
final class ModelDocuments {
    private ModelDocuments() {}

    static String requireText(final String value, final String fieldName) {
        final String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    static String normalize(final String value) {
        if (value == null) {
            return null;
        }
        final String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static String readText(final Document document, final String key) {
        final Object value = document.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException(key + " must be a string");
        }
        return normalize(text);
    }

    static Double readDouble(final Document document, final String key) {
        final Object value = document.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException(key + " must be numeric");
        }
        return number.doubleValue();
    }

    static Long readLong(final Document document, final String key) {
        final Object value = document.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException(key + " must be numeric");
        }
        final double numeric = number.doubleValue();
        if (!Double.isFinite(numeric) || Math.rint(numeric) != numeric) {
            throw new IllegalArgumentException(key + " must be an integer");
        }
        return number.longValue();
    }

    static boolean readBoolean(final Document document, final String key, final boolean defaultValue) {
        final Object value = document.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean flag)) {
            throw new IllegalArgumentException(key + " must be a boolean");
        }
        return flag;
    }

    static Document readDocument(final Document document, final String key) {
        final Object value = document.get(key);
        if (value == null) {
            return null;
        }
        return asDocument(value, key);
    }

    static List<Document> readDocuments(final Document document, final String key) {
        final Object value = document.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            throw new IllegalArgumentException(key + " must be an array");
        }
        final List<Document> output = new ArrayList<>(items.size());
        for (final Object item : items) {
            output.add(asDocument(item, key + "[]"));
        }
        return List.copyOf(output);
    }

    static List<String> readTexts(final Document document, final String key) {
        final Object value = document.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            throw new IllegalArgumentException(key + " must be an array");
        }
        final List<String> output = new ArrayList<>(items.size());
        for (final Object item : items) {
            if (!(item instanceof String text)) {
                throw new IllegalArgumentException(key + " must only contain strings");
            }
            output.add(requireText(text, key + "[]"));
        }
        return List.copyOf(output);
    }

    static List<PropertyFilter> readFilters(final Document document, final String key) {
        final List<PropertyFilter> filters = new ArrayList<>();
        for (final Document item : readDocuments(document, key)) {
            filters.add(PropertyFilter.fromDocument(item));
        }
        return List.copyOf(filters);
    }

    static Document asDocument(final Object value, final String fieldName) {
        if (value instanceof Document document) {
            return document;
        }
        if (!(value instanceof Map<?, ?> mapValue)) {
            throw new IllegalArgumentException(fieldName + " must be an object");
        }
        final Document output = new Document();
        for (final Map.Entry<?, ?> entry : mapValue.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new IllegalArgumentException(fieldName + " keys must be strings");
            }
            output.put(key, entry.getValue());
        }
        return output;
    }

    static <T> List<T> copyList(final List<T> values, final String fieldName) {
        Objects.requireNonNull(values, fieldName);
        for (final T value : values) {
            Objects.requireNonNull(value, fieldName + " must not contain null");
        }
        return List.copyOf(values);
    }
}
