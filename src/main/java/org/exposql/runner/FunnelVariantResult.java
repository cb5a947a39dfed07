package org.exposql.runner;

import java.util.List;
import java.util.Objects;
import org.bson.Document;

/**
 * Completion counts of a funnel metric. {@code stepCounts} is empty unless step counts were requested.
 */
public record FunnelVariantResult(String key, long successCount, long failureCount, List<Long> stepCounts)
        implements VariantResult {
    public FunnelVariantResult {
        Objects.requireNonNull(key, "key");
        stepCounts = List.copyOf(Objects.requireNonNull(stepCounts, "stepCounts"));
        if (successCount < 0 || failureCount < 0) {
            throw new IllegalArgumentException("funnel counts must not be negative for variant " + key);
        }
    }

    public long total() {
        return successCount + failureCount;
    }

    @Override
    public Document toDocument() {
        final Document document = new Document("key", key)
                .append("success_count", successCount)
                .append("failure_count", failureCount);
        if (!stepCounts.isEmpty()) {
            document.append("step_counts", stepCounts);
        }
        return document;
    }
}
