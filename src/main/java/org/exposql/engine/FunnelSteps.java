package org.exposql.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.exposql.compiler.FunnelEvaluator;

/**
 * Evaluation of {@code aggregate_funnel_steps(n, windowSeconds, order, [(timestamp, step_level)])}.
 * Returns the number of funnel steps an entity reached, from 0 to {@code n}.
 */
final class FunnelSteps {
    private FunnelSteps() {}

    static long evaluate(final int steps, final long windowSeconds, final String order, final List<?> tuples) {
        if (steps <= 0) {
            throw new IllegalArgumentException("funnel needs at least one step: " + steps);
        }
        final List<StepEvent> events = parse(tuples);
        final Duration window = Duration.ofSeconds(windowSeconds);
        return switch (order.toLowerCase(Locale.ROOT)) {
            case "ordered" -> ordered(steps, window, events);
            case "unordered" -> unordered(steps, window, events);
            default -> throw new IllegalArgumentException("unsupported funnel order: " + order);
        };
    }

    /**
     * Every step-0 event starts an attempt that advances through later events in timestamp order.
     */
    private static long ordered(final int steps, final Duration window, final List<StepEvent> events) {
        long best = 0;
        for (int start = 0; start < events.size() && best < steps; start++) {
            if (events.get(start).step() != 0) {
                continue;
            }
            final Instant startedAt = events.get(start).timestamp();
            int reached = 1;
            for (int next = start + 1; next < events.size() && reached < steps; next++) {
                final StepEvent event = events.get(next);
                if (!withinWindow(startedAt, event.timestamp(), window)) {
                    break;
                }
                if (event.step() == reached) {
                    reached++;
                }
            }
            best = Math.max(best, reached);
        }
        return best;
    }

    /**
     * Distinct steps seen inside the window opened by any matched event.
     */
    private static long unordered(final int steps, final Duration window, final List<StepEvent> events) {
        long best = 0;
        for (int start = 0; start < events.size() && best < steps; start++) {
            final Instant startedAt = events.get(start).timestamp();
            final Set<Integer> seen = new HashSet<>();
            for (int next = start; next < events.size(); next++) {
                final StepEvent event = events.get(next);
                if (!withinWindow(startedAt, event.timestamp(), window)) {
                    break;
                }
                if (event.step() < steps) {
                    seen.add(event.step());
                }
            }
            best = Math.max(best, seen.size());
        }
        return best;
    }

    private static boolean withinWindow(final Instant start, final Instant candidate, final Duration window) {
        return Duration.between(start, candidate).compareTo(window) < 0;
    }

    private static List<StepEvent> parse(final List<?> tuples) {
        final List<StepEvent> events = new ArrayList<>();
        if (tuples == null) {
            return events;
        }
        for (final Object tuple : tuples) {
            if (!(tuple instanceof List<?> pair) || pair.size() < 2) {
                throw new IllegalArgumentException("funnel input must be (timestamp, step_level) tuples");
            }
            if (!(pair.get(0) instanceof Instant timestamp)) {
                continue;
            }
            final int step = stepIndex(pair.get(1));
            if (step >= 0) {
                events.add(new StepEvent(timestamp, step));
            }
        }
        events.sort(Comparator.comparing(StepEvent::timestamp));
        return events;
    }

    private static int stepIndex(final Object label) {
        if (!(label instanceof String text)
                || !text.startsWith(FunnelEvaluator.STEP_LABEL_PREFIX)
                || FunnelEvaluator.UNKNOWN_STEP_LABEL.equals(text)) {
            return -1;
        }
        try {
            return Integer.parseInt(text.substring(FunnelEvaluator.STEP_LABEL_PREFIX.length()));
        } catch (final NumberFormatException exception) {
            return -1;
        }
    }

    private record StepEvent(Instant timestamp, int step) {}
}
