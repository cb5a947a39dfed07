package org.exposql.model;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import org.bson.Document;

/**
 * Team-level settings the compiler reads: time zone and the test account filters.
 */
public record TeamSettings(ZoneId timeZone, List<PropertyFilter> testAccountFilters) {
    public TeamSettings {
        Objects.requireNonNull(timeZone, "timeZone");
        testAccountFilters = ModelDocuments.copyList(testAccountFilters, "testAccountFilters");
    }

    public static TeamSettings defaults() {
        return new TeamSettings(ZoneId.of("UTC"), List.of());
    }

    public static TeamSettings fromJson(final String json) {
        return fromDocument(Document.parse(Objects.requireNonNull(json, "json")));
    }

    public static TeamSettings fromDocument(final Document document) {
        final String zone = ModelDocuments.readText(document, "timezone");
        final ZoneId zoneId;
        try {
            zoneId = zone == null ? ZoneId.of("UTC") : ZoneId.of(zone);
        } catch (final DateTimeException exception) {
            throw new IllegalArgumentException("invalid team timezone: " + zone, exception);
        }
        return new TeamSettings(zoneId, ModelDocuments.readFilters(document, "test_account_filters"));
    }
}
