package org.exposql.runner;

import org.bson.Document;

/**
 * Per-variant aggregate handed to significance testing.
 */
public sealed interface VariantResult permits MeanVariantResult, FunnelVariantResult, RatioVariantResult {
    String key();

    Document toDocument();
}
