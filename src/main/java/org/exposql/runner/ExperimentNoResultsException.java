package org.exposql.runner;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;

/**
 * Raised when the results lack exposures, the control variant or every test variant. The message
 * is a JSON object with one boolean per {@link NoResultsErrorKey}.
 */
public final class ExperimentNoResultsException extends RuntimeException {
    private final Map<NoResultsErrorKey, Boolean> errors;

    public ExperimentNoResultsException(final Map<NoResultsErrorKey, Boolean> errors) {
        super(toJson(errors));
        this.errors = copy(errors);
    }

    public Map<NoResultsErrorKey, Boolean> errors() {
        return errors;
    }

    public boolean has(final NoResultsErrorKey key) {
        return errors.getOrDefault(key, false);
    }

    public Document detail() {
        final Document detail = new Document();
        for (final Map.Entry<NoResultsErrorKey, Boolean> entry : errors.entrySet()) {
            detail.append(entry.getKey().jsonKey(), entry.getValue());
        }
        return detail;
    }

    private static String toJson(final Map<NoResultsErrorKey, Boolean> errors) {
        final Document detail = new Document();
        for (final NoResultsErrorKey key : NoResultsErrorKey.values()) {
            detail.append(key.jsonKey(), Boolean.TRUE.equals(errors.get(key)));
        }
        return detail.toJson();
    }

    private static Map<NoResultsErrorKey, Boolean> copy(final Map<NoResultsErrorKey, Boolean> errors) {
        Objects.requireNonNull(errors, "errors");
        final EnumMap<NoResultsErrorKey, Boolean> copy = new EnumMap<>(NoResultsErrorKey.class);
        for (final NoResultsErrorKey key : NoResultsErrorKey.values()) {
            copy.put(key, Boolean.TRUE.equals(errors.get(key)));
        }
        return Map.copyOf(copy);
    }
}
