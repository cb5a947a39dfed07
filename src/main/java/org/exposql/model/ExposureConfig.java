package org.exposql.model;

import java.util.List;
import java.util.Objects;
import org.bson.Document;

/**
 * Custom definition of the exposure event, replacing the default flag-called event.
 */
public sealed interface ExposureConfig permits ExposureConfig.Event, ExposureConfig.Action {
    String DEFAULT_EXPOSURE_EVENT = "$feature_flag_called";

    static ExposureConfig defaultEvent() {
        return new Event(DEFAULT_EXPOSURE_EVENT, List.of());
    }

    static ExposureConfig fromDocument(final Document document) {
        Objects.requireNonNull(document, "document");
        final String kind = ModelDocuments.readText(document, "kind");
        if ("ActionsNode".equals(kind)) {
            final Long id = ModelDocuments.readLong(document, "id");
            if (id == null) {
                throw new IllegalArgumentException("exposure action requires an id");
            }
            return new Action(id);
        }
        if (kind == null || "ExperimentEventExposureConfig".equals(kind)) {
            return new Event(
                    ModelDocuments.readText(document, "event"), ModelDocuments.readFilters(document, "properties"));
        }
        throw new IllegalArgumentException("unsupported exposure config kind: " + kind);
    }

    record Event(String event, List<PropertyFilter> properties) implements ExposureConfig {
        public Event {
            event = ModelDocuments.requireText(event, "event");
            properties = ModelDocuments.copyList(properties, "properties");
        }

        public boolean isDefaultEvent() {
            return DEFAULT_EXPOSURE_EVENT.equals(event);
        }
    }

    record Action(long actionId) implements ExposureConfig {}
}
