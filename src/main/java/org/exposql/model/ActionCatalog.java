package org.exposql.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup seam for saved actions owned by the persistence layer.
 */
public interface ActionCatalog {
    Optional<ActionDefinition> find(long actionId);

    static ActionCatalog empty() {
        return actionId -> Optional.empty();
    }

    static ActionCatalog of(final Collection<ActionDefinition> actions) {
        final Map<Long, ActionDefinition> byId = new LinkedHashMap<>();
        for (final ActionDefinition action : actions) {
            if (byId.putIfAbsent(action.id(), action) != null) {
                throw new IllegalArgumentException("duplicate action id: " + action.id());
            }
        }
        final Map<Long, ActionDefinition> snapshot = Map.copyOf(byId);
        return actionId -> Optional.ofNullable(snapshot.get(actionId));
    }
}
