package org.exposql.engine;

import java.util.Objects;
import org.exposql.model.ActionCatalog;

/**
 * Event data and the saved actions that refer to it, as loaded from a fixture file.
 */
public record EventFixture(EventStore store, ActionCatalog actions) {
    public EventFixture {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(actions, "actions");
    }
}
