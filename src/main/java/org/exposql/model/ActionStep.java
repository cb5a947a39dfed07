package org.exposql.model;

import java.util.List;

/**
 * One alternative of an action: an event name (null for any event) plus property filters.
 */
public record ActionStep(String event, List<PropertyFilter> properties) {
    public ActionStep {
        event = ModelDocuments.normalize(event);
        properties = ModelDocuments.copyList(properties, "properties");
    }
}
