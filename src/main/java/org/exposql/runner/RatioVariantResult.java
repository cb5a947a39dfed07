package org.exposql.runner;

import java.util.Objects;
import org.bson.Document;

/**
 * Sample statistics of a ratio metric: the numerator sums under {@code sum} and {@code sumSquares},
 * plus the denominator sums and the cross product needed for the delta method.
 */
public record RatioVariantResult(
        String key,
        long count,
        double sum,
        double sumSquares,
        double denominatorSum,
        double denominatorSumSquares,
        double numeratorDenominatorSumProduct) implements VariantResult {
    public RatioVariantResult {
        Objects.requireNonNull(key, "key");
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
    }

    public double ratio() {
        return denominatorSum == 0d ? 0d : sum / denominatorSum;
    }

    @Override
    public Document toDocument() {
        return new Document("key", key)
                .append("absolute_exposure", count)
                .append("exposure", count)
                .append("count", count)
                .append("sum", sum)
                .append("sum_squares", sumSquares)
                .append("denominator_sum", denominatorSum)
                .append("denominator_sum_squares", denominatorSumSquares)
                .append("numerator_denominator_sum_product", numeratorDenominatorSumProduct);
    }
}
