package org.exposql.model;

import java.util.Objects;
import java.util.Optional;
import org.bson.Document;

public record ConversionWindow(long amount, ConversionWindowUnit unit) {
    public ConversionWindow {
        Objects.requireNonNull(unit, "unit");
        if (amount <= 0) {
            throw new IllegalArgumentException("conversion window must be positive: " + amount);
        }
    }

    public long seconds() {
        return unit.toSeconds(amount);
    }

    static Optional<ConversionWindow> fromDocument(final Document document) {
        final Long amount = ModelDocuments.readLong(document, "conversion_window");
        final String unit = ModelDocuments.readText(document, "conversion_window_unit");
        if (amount == null || unit == null) {
            return Optional.empty();
        }
        return Optional.of(new ConversionWindow(amount, ConversionWindowUnit.fromText(unit)));
    }
}
