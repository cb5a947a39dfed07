package org.exposql.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every structured log event.
 */
public final class CorrelationContext {
    private final String requestId;
    private final String operation;
    private final Long experimentId;
    private final String metricKind;

    private CorrelationContext(Builder builder) {
        this.requestId = requireText(builder.requestId, "requestId");
        this.operation = requireText(builder.operation, "operation");
        this.experimentId = builder.experimentId;
        this.metricKind = normalize(builder.metricKind);
    }

    public static CorrelationContext of(String requestId, String operation) {
        return builder(requestId, operation).build();
    }

    public static Builder builder(String requestId, String operation) {
        return new Builder(requestId, operation);
    }

    public String requestId() {
        return requestId;
    }

    public String operation() {
        return operation;
    }

    public Optional<Long> experimentId() {
        return Optional.ofNullable(experimentId);
    }

    public Optional<String> metricKind() {
        return Optional.ofNullable(metricKind);
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("requestId", requestId);
        fields.put("operation", operation);
        if (experimentId != null) {
            fields.put("experimentId", experimentId);
        }
        if (metricKind != null) {
            fields.put("metricKind", metricKind);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String requestId;
        private final String operation;
        private Long experimentId;
        private String metricKind;

        private Builder(String requestId, String operation) {
            this.requestId = Objects.requireNonNull(requestId, "requestId");
            this.operation = Objects.requireNonNull(operation, "operation");
        }

        public Builder experimentId(Long experimentId) {
            this.experimentId = experimentId;
            return this;
        }

        public Builder metricKind(String metricKind) {
            this.metricKind = metricKind;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}
