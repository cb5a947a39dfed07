package org.exposql.testkit;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import org.bson.Document;
import org.exposql.compiler.MetricQueryRequest;
import org.exposql.engine.EventFixture;
import org.exposql.engine.EventStore;
import org.exposql.model.ActionCatalog;
import org.exposql.model.ActionDefinition;
import org.exposql.model.ActionSource;
import org.exposql.model.ActionStep;
import org.exposql.model.ConversionWindowUnit;
import org.exposql.model.EntityKey;
import org.exposql.model.EventSource;
import org.exposql.model.ExperimentDateRange;
import org.exposql.model.ExposureConfig;
import org.exposql.model.ExposureCriteria;
import org.exposql.model.FunnelMetric;
import org.exposql.model.MathType;
import org.exposql.model.MeanMetric;
import org.exposql.model.MetricSource;
import org.exposql.model.MetricSpecification;
import org.exposql.model.MultipleVariantHandling;
import org.exposql.model.PropertyFilter;
import org.exposql.model.RatioMetric;
import org.exposql.model.StepOrder;
import org.exposql.model.TeamSettings;
import org.exposql.model.VariantSet;

/**
 * Seeded generator of random event logs and metric configurations. The same seed always yields the
 * same scenarios.
 */
public final class SyntheticScenarioGenerator {
    public static final String FLAG_KEY = "synthetic-flag";
    public static final long PURCHASE_ACTION_ID = 7L;

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-03-15T00:00:00Z");
    private static final List<String> FUNNEL_EVENTS = List.of("signup", "activate", "purchase");
    private static final List<String> NOISE_EVENTS = List.of("pageview", "purchase", "refund", "signup");

    private final long seed;

    public SyntheticScenarioGenerator(long seed) {
        this.seed = seed;
    }

    public List<EquivalenceScenario> generate(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        Random random = new Random(seed);
        List<EquivalenceScenario> scenarios = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            EventFixture fixture = fixture(random);
            MetricSpecification metric = metric(random);
            ExposureCriteria criteria = ExposureCriteria.defaults().withHandling(
                random.nextBoolean() ? MultipleVariantHandling.EXCLUDE : MultipleVariantHandling.FIRST_SEEN
            );
            if (random.nextInt(5) == 0) {
                criteria = criteria.withExposureConfig(new ExposureConfig.Event("$pageview", List.of()));
            }
            MetricQueryRequest request = new MetricQueryRequest(
                FLAG_KEY,
                VariantSet.of("control", "test"),
                ExperimentDateRange.utc(START, END),
                EntityKey.person(),
                metric,
                criteria
            );
            scenarios.add(new EquivalenceScenario(
                "synthetic-" + seed + "-" + i,
                request,
                fixture,
                TeamSettings.defaults()
            ));
        }
        return List.copyOf(scenarios);
    }

    private static EventFixture fixture(Random random) {
        EventStore.Builder store = EventStore.builder();
        int entities = 4 + random.nextInt(12);
        int sequence = 0;
        for (int entity = 0; entity < entities; entity++) {
            String personId = "person-" + entity;
            String session = "session-" + entity + "-" + random.nextInt(3);
            int exposures = random.nextInt(4);
            for (int e = 0; e < exposures; e++) {
                String variant = pickVariant(random);
                Document properties = new Document("$feature_flag", FLAG_KEY)
                    .append("$feature_flag_response", variant)
                    .append("$feature/" + FLAG_KEY, variant);
                boolean pageview = random.nextInt(3) == 0;
                store.event(event(
                    "ev-" + sequence++,
                    pageview ? "$pageview" : "$feature_flag_called",
                    personId,
                    session,
                    randomInstant(random),
                    properties
                ));
            }
            int metricEvents = random.nextInt(8);
            for (int e = 0; e < metricEvents; e++) {
                String name = random.nextInt(2) == 0
                    ? FUNNEL_EVENTS.get(random.nextInt(FUNNEL_EVENTS.size()))
                    : NOISE_EVENTS.get(random.nextInt(NOISE_EVENTS.size()));
                Document properties = new Document("amount", random.nextInt(5) == 0 ? 0 : random.nextInt(200))
                    .append("plan", random.nextBoolean() ? "pro" : "free");
                if (random.nextInt(6) == 0) {
                    properties.remove("amount");
                }
                store.event(event(
                    "ev-" + sequence++,
                    name,
                    personId,
                    "session-" + entity + "-" + random.nextInt(3),
                    randomInstant(random),
                    properties
                ));
            }
        }
        ActionDefinition purchases = new ActionDefinition(
            PURCHASE_ACTION_ID,
            "paid purchase",
            List.of(
                new ActionStep("purchase", List.of(PropertyFilter.exact("plan", "pro"))),
                new ActionStep("refund", List.of())
            ),
            false
        );
        return new EventFixture(store.build(), ActionCatalog.of(List.of(purchases)));
    }

    private static MetricSpecification metric(Random random) {
        if (random.nextInt(3) == 0) {
            List<MetricSource> series = new ArrayList<>();
            int steps = 1 + random.nextInt(FUNNEL_EVENTS.size());
            for (int i = 0; i < steps; i++) {
                series.add(EventSource.of(FUNNEL_EVENTS.get(i)));
            }
            FunnelMetric funnel = FunnelMetric.of(series)
                .withStepOrder(random.nextBoolean() ? StepOrder.ORDERED : StepOrder.UNORDERED);
            if (random.nextBoolean()) {
                funnel = funnel.withConversionWindow(1 + random.nextInt(72), ConversionWindowUnit.HOUR);
            }
            return funnel;
        }

        if (random.nextInt(5) == 0) {
            RatioMetric ratio = RatioMetric.of(
                meanSource(random),
                EventSource.of(FUNNEL_EVENTS.get(random.nextInt(FUNNEL_EVENTS.size()))));
            if (random.nextBoolean()) {
                ratio = ratio.withConversionWindow(1 + random.nextInt(5), ConversionWindowUnit.DAY);
            }
            return ratio;
        }

        MeanMetric mean = MeanMetric.of(meanSource(random));
        if (random.nextBoolean()) {
            mean = mean.withConversionWindow(1 + random.nextInt(5), ConversionWindowUnit.DAY);
        }
        if (random.nextInt(3) == 0) {
            mean = mean.withBounds(0.1, 0.9).withIgnoreZeros(random.nextBoolean());
        }
        return mean;
    }

    private static MetricSource meanSource(Random random) {
        MathType[] maths = {
            MathType.TOTAL, MathType.SUM, MathType.AVERAGE, MathType.MIN, MathType.MAX,
            MathType.UNIQUE_SESSION, MathType.DISTINCT_ACTIVE_USER
        };
        MathType math = maths[random.nextInt(maths.length)];
        String property = switch (math) {
            case SUM, AVERAGE, MIN, MAX -> "amount";
            default -> null;
        };
        MetricSource source = random.nextInt(4) == 0
            ? ActionSource.of(PURCHASE_ACTION_ID).withMath(math, property)
            : EventSource.of("purchase").withMath(math, property);
        if (random.nextInt(5) == 0) {
            source = EventSource.of("purchase").withExpression(
                random.nextBoolean() ? "sum(properties.amount)" : "count(*)");
        }
        return source;
    }

    private static String pickVariant(Random random) {
        int roll = random.nextInt(10);
        if (roll < 4) {
            return "control";
        }
        if (roll < 9) {
            return "test";
        }
        return "unknown-variant";
    }

    private static Instant randomInstant(Random random) {
        // a little outside the window on both sides so boundary filtering is exercised
        long span = Duration.between(START, END).getSeconds() + 2 * 86_400L;
        return START.minusSeconds(86_400L).plusSeconds((long) (random.nextDouble() * span));
    }

    private static Document event(
        String uuid,
        String name,
        String personId,
        String session,
        Instant timestamp,
        Map<String, Object> properties
    ) {
        return new Document("uuid", uuid)
            .append("event", name)
            .append("person_id", personId)
            .append("$session_id", session)
            .append("timestamp", timestamp)
            .append("properties", new Document(properties));
    }
}
