package org.exposql.testkit;

import java.util.Objects;
import org.exposql.compiler.MetricQueryRequest;
import org.exposql.engine.EventFixture;
import org.exposql.model.TeamSettings;

/**
 * One compile-and-execute case: the request, the data it runs over and the team settings.
 */
public record EquivalenceScenario(String id, MetricQueryRequest request, EventFixture fixture, TeamSettings team) {
    public EquivalenceScenario {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(fixture, "fixture");
        Objects.requireNonNull(team, "team");
    }
}
