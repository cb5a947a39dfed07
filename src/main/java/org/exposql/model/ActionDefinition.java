package org.exposql.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bson.Document;

/**
 * Saved action: matches an event when any of its steps matches.
 */
public record ActionDefinition(long id, String name, List<ActionStep> steps, boolean deleted) {
    public ActionDefinition {
        name = Objects.requireNonNullElse(ModelDocuments.normalize(name), "action " + id);
        steps = ModelDocuments.copyList(steps, "steps");
    }

    public static ActionDefinition fromDocument(final Document document) {
        final Long id = ModelDocuments.readLong(document, "id");
        if (id == null) {
            throw new IllegalArgumentException("action requires an id");
        }
        final List<ActionStep> steps = new ArrayList<>();
        for (final Document step : ModelDocuments.readDocuments(document, "steps")) {
            steps.add(new ActionStep(
                    ModelDocuments.readText(step, "event"), ModelDocuments.readFilters(step, "properties")));
        }
        return new ActionDefinition(
                id,
                ModelDocuments.readText(document, "name"),
                steps,
                ModelDocuments.readBoolean(document, "deleted", false));
    }
}
