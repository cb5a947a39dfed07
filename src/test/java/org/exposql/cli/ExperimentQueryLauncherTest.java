package org.exposql.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.bson.Document;
import org.exposql.compiler.PlanStrategy;
import org.exposql.obs.JsonLinesLogger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExperimentQueryLauncherTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-20T00:00:00Z"), ZoneOffset.UTC);
    private static final String EXPERIMENT = """
        {"id": 9, "feature_flag_key": "new-checkout", "variants": ["control", "test"],
         "start_date": "2024-03-01T00:00:00Z", "end_date": "2024-03-15T00:00:00Z",
         "metrics": [{"metric_type": "mean", "source": {"event": "purchase", "math": "sum", "math_property": "amount"}}]}
        """;
    private static final String EVENTS = """
        events:
          - {uuid: e1, person_id: c1, event: $feature_flag_called, timestamp: "2024-03-02T09:00:00Z",
             properties: {$feature_flag: new-checkout, $feature_flag_response: control}}
          - {uuid: e2, person_id: c1, event: purchase, timestamp: "2024-03-02T10:00:00Z",
             properties: {amount: 4}}
          - {uuid: e3, person_id: t1, event: $feature_flag_called, timestamp: "2024-03-02T09:00:00Z",
             properties: {$feature_flag: new-checkout, $feature_flag_response: test}}
        """;

    @Test
    void printsCompiledSqlWithoutEvents(@TempDir final Path tempDir) throws Exception {
        Path experiment = write(tempDir, "experiment.json", EXPERIMENT);
        Path team = write(tempDir, "team.json", "{\"timezone\": \"Europe/Berlin\"}");
        Captured captured = new Captured();

        int status = ExperimentQueryLauncher.run(
            new String[] {"--experiment=" + experiment, "--team=" + team, "--strategy=single-scan"},
            captured.out, captured.err, CLOCK, JsonLinesLogger.noop());

        assertEquals(0, status, captured.err());
        Document line = Document.parse(captured.out().trim());
        assertEquals("SINGLE_SCAN", line.getString("strategy"));
        String sql = line.getString("sql");
        assertTrue(sql.startsWith("WITH\n    entity_scan AS ("), sql);
        assertTrue(sql.contains("'Europe/Berlin'"), sql);
    }

    @Test
    void runsAgainstAnEventFixture(@TempDir final Path tempDir) throws Exception {
        Path experiment = write(tempDir, "experiment.json", EXPERIMENT);
        Path events = write(tempDir, "events.yaml", EVENTS);
        Captured captured = new Captured();

        int status = ExperimentQueryLauncher.run(
            new String[] {"--experiment=" + experiment, "--events=" + events},
            captured.out, captured.err, CLOCK, JsonLinesLogger.noop());

        assertEquals(0, status, captured.err());
        String[] lines = captured.out().trim().split("\\R");
        assertEquals(2, lines.length);
        Document control = Document.parse(lines[0]);
        assertEquals("control", control.getString("key"));
        assertEquals(1L, ((Number) control.get("count")).longValue());
        assertEquals(4d, control.getDouble("sum"));
        assertEquals("test", Document.parse(lines[1]).getString("key"));
    }

    @Test
    void printSqlAlsoRunsWhenEventsAreGiven(@TempDir final Path tempDir) throws Exception {
        Path experiment = write(tempDir, "experiment.json", EXPERIMENT);
        Path events = write(tempDir, "events.yaml", EVENTS);
        Captured captured = new Captured();

        int status = ExperimentQueryLauncher.run(
            new String[] {"--experiment=" + experiment, "--events=" + events, "--print-sql"},
            captured.out, captured.err, CLOCK, JsonLinesLogger.noop());

        assertEquals(0, status, captured.err());
        String[] lines = captured.out().trim().split("\\R");
        assertEquals(3, lines.length);
        assertEquals("JOIN", Document.parse(lines[0]).getString("strategy"));
    }

    @Test
    void noResultsAreReportedAsFailure(@TempDir final Path tempDir) throws Exception {
        Path experiment = write(tempDir, "experiment.json", EXPERIMENT);
        Path events = write(tempDir, "events.yaml", "events: []\n");
        Captured captured = new Captured();

        int status = ExperimentQueryLauncher.run(
            new String[] {"--experiment=" + experiment, "--events=" + events},
            captured.out, captured.err, CLOCK, JsonLinesLogger.noop());

        assertEquals(1, status);
        assertEquals(
            "EXPOSQL_FAILURE={\"no-exposures\": true, \"no-control-variant\": true, \"no-test-variant\": true}",
            captured.err().trim());
    }

    @Test
    void missingFilesAndBadArgumentsFail(@TempDir final Path tempDir) {
        Captured missing = new Captured();
        int status = ExperimentQueryLauncher.run(
            new String[] {"--experiment=" + tempDir.resolve("absent.json")},
            missing.out, missing.err, CLOCK, JsonLinesLogger.noop());

        assertEquals(1, status);
        assertTrue(missing.err().startsWith("EXPOSQL_FAILURE="), missing.err());

        Captured unknown = new Captured();
        assertEquals(1, ExperimentQueryLauncher.run(
            new String[] {"--experiment=x.json", "--verbose"}, unknown.out, unknown.err, CLOCK, JsonLinesLogger.noop()));
        assertEquals("EXPOSQL_FAILURE=unsupported argument: --verbose", unknown.err().trim());
    }

    @Test
    void parsesLaunchConfig() {
        ExperimentQueryLauncher.LaunchConfig config = ExperimentQueryLauncher.LaunchConfig.parse(new String[] {
            "--experiment=exp.json", "--events=events.yaml", "--strategy=single_scan", "--funnel-step-counts=true"});

        assertEquals(Path.of("exp.json"), config.experimentPath());
        assertEquals(Path.of("events.yaml"), config.eventsPath());
        assertEquals(PlanStrategy.SINGLE_SCAN, config.options().planStrategy());
        assertTrue(config.options().funnelStepCounts());

        IllegalArgumentException missing = assertThrows(
            IllegalArgumentException.class, () -> ExperimentQueryLauncher.LaunchConfig.parse(new String[] {"--print-sql"}));
        assertEquals("--experiment=<path> is required", missing.getMessage());
        IllegalArgumentException empty = assertThrows(
            IllegalArgumentException.class,
            () -> ExperimentQueryLauncher.LaunchConfig.parse(new String[] {"--experiment= "}));
        assertEquals("argument value is empty for --experiment=", empty.getMessage());
    }

    private static Path write(Path dir, String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static final class Captured {
        private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
        private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        private final PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        private final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

        String out() {
            return outBytes.toString(StandardCharsets.UTF_8);
        }

        String err() {
            return errBytes.toString(StandardCharsets.UTF_8);
        }
    }
}
