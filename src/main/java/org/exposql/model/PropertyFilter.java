package org.exposql.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.bson.Document;

/**
 * One property condition attached to an event, action step, exposure config or team.
 */
public record PropertyFilter(String key, Operator operator, Object value, Type type) {
    public PropertyFilter {
        key = ModelDocuments.requireText(key, "key");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(type, "type");
        if (value instanceof List<?> listValue) {
            value = List.copyOf(listValue);
        }
        if (operator.requiresValue() && value == null) {
            throw new IllegalArgumentException("property filter '" + key + "' with operator "
                    + operator.wireName() + " requires a value");
        }
    }

    public static PropertyFilter exact(final String key, final Object value) {
        return new PropertyFilter(key, Operator.EXACT, value, Type.EVENT);
    }

    public static PropertyFilter fromDocument(final Document document) {
        Objects.requireNonNull(document, "document");
        return new PropertyFilter(
                ModelDocuments.readText(document, "key"),
                Operator.fromText(ModelDocuments.readText(document, "operator")),
                document.get("value"),
                Type.fromText(ModelDocuments.readText(document, "type")));
    }

    public enum Operator {
        EXACT("exact", true),
        IS_NOT("is_not", true),
        ICONTAINS("icontains", true),
        NOT_ICONTAINS("not_icontains", true),
        GT("gt", true),
        GTE("gte", true),
        LT("lt", true),
        LTE("lte", true),
        IS_SET("is_set", false),
        IS_NOT_SET("is_not_set", false);

        private final String wireName;
        private final boolean requiresValue;

        Operator(final String wireName, final boolean requiresValue) {
            this.wireName = wireName;
            this.requiresValue = requiresValue;
        }

        public String wireName() {
            return wireName;
        }

        boolean requiresValue() {
            return requiresValue;
        }

        static Operator fromText(final String value) {
            if (value == null) {
                return EXACT;
            }
            final String normalized = value.toLowerCase(Locale.ROOT);
            for (final Operator candidate : values()) {
                if (candidate.wireName.equals(normalized)) {
                    return candidate;
                }
            }
            throw new IllegalArgumentException("unsupported property operator: " + value);
        }
    }

    public enum Type {
        EVENT,
        PERSON,
        WAREHOUSE;

        static Type fromText(final String value) {
            if (value == null) {
                return EVENT;
            }
            final String normalized = value.toUpperCase(Locale.ROOT);
            if ("DATA_WAREHOUSE".equals(normalized)) {
                return WAREHOUSE;
            }
            try {
                return valueOf(normalized);
            } catch (final IllegalArgumentException exception) {
                throw new IllegalArgumentException("unsupported property filter type: " + value, exception);
            }
        }
    }
}
