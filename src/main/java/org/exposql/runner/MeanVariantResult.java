package org.exposql.runner;

import java.util.Objects;
import org.bson.Document;

/**
 * Sample statistics of a mean metric. {@code absoluteExposure}, {@code exposure} and {@code count}
 * are all the number of exposed entities.
 */
public record MeanVariantResult(
        String key, long absoluteExposure, long exposure, long count, double sum, double sumSquares)
        implements VariantResult {
    public MeanVariantResult {
        Objects.requireNonNull(key, "key");
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
    }

    public static MeanVariantResult of(final String key, final long numUsers, final double sum, final double sumSquares) {
        return new MeanVariantResult(key, numUsers, numUsers, numUsers, sum, sumSquares);
    }

    public double mean() {
        return count == 0 ? 0d : sum / count;
    }

    @Override
    public Document toDocument() {
        return new Document("key", key)
                .append("absolute_exposure", absoluteExposure)
                .append("exposure", exposure)
                .append("count", count)
                .append("sum", sum)
                .append("sum_squares", sumSquares);
    }
}
