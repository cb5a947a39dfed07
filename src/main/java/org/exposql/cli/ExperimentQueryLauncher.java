package org.exposql.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bson.Document;
import org.exposql.compiler.CompilationContext;
import org.exposql.compiler.CompilerOptions;
import org.exposql.engine.EventFixture;
import org.exposql.engine.EventFixtureLoader;
import org.exposql.engine.InMemoryQueryEngine;
import org.exposql.expr.SqlRenderer;
import org.exposql.model.ActionCatalog;
import org.exposql.model.ExperimentDefinition;
import org.exposql.model.TeamSettings;
import org.exposql.obs.JsonLinesLogger;
import org.exposql.runner.CompiledQuery;
import org.exposql.runner.ExperimentQueryResult;
import org.exposql.runner.ExperimentQueryRunner;
import org.exposql.runner.VariantResult;

/**
 * Command-line entry point: compiles an experiment's primary metric and, when an event fixture is
 * given, runs it on the in-memory engine.
 *
 * <p>Output is JSON lines on stdout: an optional {@code sql} line, then one line per variant.
 * Failures print a single {@code EXPOSQL_FAILURE=<message>} line on stderr and exit with 1.
 */
public final class ExperimentQueryLauncher {
    private static final String FAILURE_PREFIX = "EXPOSQL_FAILURE=";

    private ExperimentQueryLauncher() {}

    public static void main(final String[] args) {
        final int status;
        try (JsonLinesLogger logger = JsonLinesLogger.stderr()) {
            status = run(args, System.out, System.err, Clock.systemUTC(), logger);
        }
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(
            final String[] args,
            final PrintStream out,
            final PrintStream err,
            final Clock clock,
            final JsonLinesLogger logger) {
        try {
            final LaunchConfig config = LaunchConfig.parse(args);
            final ExperimentDefinition experiment = ExperimentDefinition.fromJson(read(config.experimentPath()));
            final TeamSettings team = config.teamPath() == null
                    ? TeamSettings.defaults()
                    : TeamSettings.fromJson(read(config.teamPath()));
            final EventFixture fixture = config.eventsPath() == null ? null : EventFixtureLoader.load(config.eventsPath());
            final CompilationContext context = new CompilationContext(
                    fixture == null ? ActionCatalog.empty() : fixture.actions(), team, config.options());

            if (fixture == null || config.printSql()) {
                final ExperimentQueryRunner compiler =
                        new ExperimentQueryRunner(query -> List.of(), context, clock, logger);
                final CompiledQuery compiled = compiler.compile(experiment);
                out.println(new Document("strategy", compiled.strategy().name())
                        .append("sql", new SqlRenderer(team.timeZone()).render(compiled.plan()))
                        .toJson());
            }
            if (fixture != null) {
                final ExperimentQueryRunner runner =
                        new ExperimentQueryRunner(new InMemoryQueryEngine(fixture.store()), context, clock, logger);
                final ExperimentQueryResult result = runner.run(experiment);
                for (final VariantResult variant : result.variants()) {
                    out.println(variant.toDocument().toJson());
                }
            }
            out.flush();
            return 0;
        } catch (final IOException | RuntimeException exception) {
            err.println(FAILURE_PREFIX + exception.getMessage());
            err.flush();
            return 1;
        }
    }

    private static String read(final Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    record LaunchConfig(
            Path experimentPath, Path eventsPath, Path teamPath, boolean printSql, CompilerOptions options) {
        LaunchConfig {
            Objects.requireNonNull(experimentPath, "experimentPath");
            Objects.requireNonNull(options, "options");
        }

        static LaunchConfig parse(final String[] args) {
            Path experimentPath = null;
            Path eventsPath = null;
            Path teamPath = null;
            boolean printSql = false;
            final List<String> optionArgs = new ArrayList<>();

            for (final String arg : Objects.requireNonNull(args, "args")) {
                if (arg == null || arg.isBlank()) {
                    continue;
                }
                if (arg.startsWith("--experiment=")) {
                    experimentPath = Path.of(requireValue(arg, "--experiment="));
                    continue;
                }
                if (arg.startsWith("--events=")) {
                    eventsPath = Path.of(requireValue(arg, "--events="));
                    continue;
                }
                if (arg.startsWith("--team=")) {
                    teamPath = Path.of(requireValue(arg, "--team="));
                    continue;
                }
                if (arg.equals("--print-sql")) {
                    printSql = true;
                    continue;
                }
                if (arg.startsWith("--" + CompilerOptions.PLAN_STRATEGY_KEY + "=")
                        || arg.startsWith("--" + CompilerOptions.FUNNEL_STEP_COUNTS_KEY)) {
                    optionArgs.add(arg);
                    continue;
                }
                throw new IllegalArgumentException("unsupported argument: " + arg);
            }
            if (experimentPath == null) {
                throw new IllegalArgumentException("--experiment=<path> is required");
            }
            return new LaunchConfig(
                    experimentPath, eventsPath, teamPath, printSql,
                    CompilerOptions.fromArgs(optionArgs.toArray(new String[0])));
        }

        private static String requireValue(final String arg, final String prefix) {
            final String value = arg.substring(prefix.length()).trim();
            if (value.isEmpty()) {
                throw new IllegalArgumentException("argument value is empty for " + prefix);
            }
            return value;
        }
    }
}
