package org.exposql.compiler;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Compiler configuration. Read from {@code --key=value} arguments or a plain string map.
 */
public record CompilerOptions(PlanStrategy planStrategy, boolean funnelStepCounts) {
    public static final String PLAN_STRATEGY_KEY = "strategy";
    public static final String FUNNEL_STEP_COUNTS_KEY = "funnel-step-counts";

    public CompilerOptions {
        Objects.requireNonNull(planStrategy, "planStrategy");
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(PlanStrategy.JOIN, false);
    }

    public CompilerOptions withPlanStrategy(final PlanStrategy strategy) {
        return new CompilerOptions(strategy, funnelStepCounts);
    }

    public CompilerOptions withFunnelStepCounts(final boolean enabled) {
        return new CompilerOptions(planStrategy, enabled);
    }

    public static CompilerOptions fromMap(final Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        return new CompilerOptions(
                PlanStrategy.fromText(values.get(PLAN_STRATEGY_KEY)),
                parseBoolean(values.get(FUNNEL_STEP_COUNTS_KEY), FUNNEL_STEP_COUNTS_KEY));
    }

    /**
     * Picks the {@code --strategy=} and {@code --funnel-step-counts=} arguments and ignores the rest.
     */
    public static CompilerOptions fromArgs(final String[] args) {
        final Map<String, String> values = new LinkedHashMap<>();
        for (final String arg : Objects.requireNonNull(args, "args")) {
            if (arg == null || !arg.startsWith("--")) {
                continue;
            }
            final int separator = arg.indexOf('=');
            final String key = separator < 0 ? arg.substring(2) : arg.substring(2, separator);
            final String value = separator < 0 ? "true" : arg.substring(separator + 1).trim();
            if (PLAN_STRATEGY_KEY.equals(key) || FUNNEL_STEP_COUNTS_KEY.equals(key)) {
                if (value.isEmpty()) {
                    throw new IllegalArgumentException("argument value is empty for --" + key);
                }
                values.put(key, value);
            }
        }
        return fromMap(values);
    }

    private static boolean parseBoolean(final String value, final String key) {
        if (value == null) {
            return false;
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false: " + value);
    }
}
