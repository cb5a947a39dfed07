package org.exposql.testkit;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.bson.Document;
import org.exposql.engine.EventFixture;
import org.exposql.model.ExperimentDefinition;
import org.exposql.model.TeamSettings;

/**
 * A hand-written dataset with the per-variant results it must produce. {@code expectedErrors}, when
 * present, names the no-results keys that must be raised instead.
 */
public record GoldenScenario(
    String id,
    ExperimentDefinition experiment,
    TeamSettings team,
    EventFixture fixture,
    Instant now,
    List<Document> expected,
    List<String> expectedErrors
) {
    public GoldenScenario {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(experiment, "experiment");
        Objects.requireNonNull(team, "team");
        Objects.requireNonNull(fixture, "fixture");
        Objects.requireNonNull(now, "now");
        expected = List.copyOf(Objects.requireNonNull(expected, "expected"));
        expectedErrors = List.copyOf(Objects.requireNonNull(expectedErrors, "expectedErrors"));
    }
}
