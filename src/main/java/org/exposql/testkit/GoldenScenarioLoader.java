package org.exposql.testkit;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;
import org.exposql.engine.EventFixture;
import org.exposql.engine.EventFixtureLoader;
import org.exposql.model.ExperimentDefinition;
import org.exposql.model.TeamSettings;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads golden scenarios from YAML documents of the form:
 *
 * <pre>
 * id: mean-basic
 * now: "2024-02-01T00:00:00Z"
 * experiment: { ... experiment JSON fields ... }
 * team: { timezone: UTC }
 * fixture: { events: [...], tables: {...}, actions: [...] }
 * expected: [ { key: control, count: 5, sum: 50.0 }, ... ]
 * expected_errors: [ no-control-variant ]
 * </pre>
 *
 * Experiment and team fields are read verbatim; fixture strings that look like instants become
 * {@link Instant} values.
 */
public final class GoldenScenarioLoader {
    private GoldenScenarioLoader() {}

    public static GoldenScenario loadResource(String resourcePath) throws IOException {
        Objects.requireNonNull(resourcePath, "resourcePath");
        try (InputStream input = GoldenScenarioLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (input == null) {
                throw new IOException("golden scenario resource not found: " + resourcePath);
            }
            return parse(new String(input.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    public static GoldenScenario parse(String content) {
        Object root = new Yaml().load(Objects.requireNonNull(content, "content"));
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new IllegalArgumentException("golden scenario root must be an object");
        }
        Map<String, Object> map = normalizeKeys(rawMap);

        Object experiment = map.get("experiment");
        if (!(experiment instanceof Map<?, ?> experimentMap)) {
            throw new IllegalArgumentException("golden scenario requires an experiment object");
        }
        Object team = map.get("team");
        Object fixture = map.get("fixture");
        EventFixture eventFixture = fixture instanceof Map<?, ?> fixtureMap
            ? EventFixtureLoader.fromDocument(EventFixtureLoader.toDocument(fixtureMap))
            : EventFixtureLoader.parse("");

        List<Document> expected = new ArrayList<>();
        for (Object item : list(map.get("expected"), "expected")) {
            if (!(item instanceof Map<?, ?> itemMap)) {
                throw new IllegalArgumentException("expected entries must be objects");
            }
            expected.add(plainDocument(itemMap));
        }
        List<String> expectedErrors = new ArrayList<>();
        for (Object item : list(map.get("expected_errors"), "expected_errors")) {
            expectedErrors.add(String.valueOf(item));
        }

        return new GoldenScenario(
            String.valueOf(map.get("id")),
            ExperimentDefinition.fromDocument(plainDocument(experimentMap)),
            team instanceof Map<?, ?> teamMap ? TeamSettings.fromDocument(plainDocument(teamMap)) : TeamSettings.defaults(),
            eventFixture,
            instant(map.get("now")),
            expected,
            expectedErrors
        );
    }

    private static Instant instant(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("golden scenario requires 'now'");
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return Instant.parse(String.valueOf(value));
    }

    private static List<?> list(Object value, String name) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            throw new IllegalArgumentException(name + " must be a list");
        }
        return items;
    }

    private static Document plainDocument(Map<?, ?> map) {
        Document document = new Document();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            document.put(String.valueOf(entry.getKey()), plainValue(entry.getValue()));
        }
        return document;
    }

    private static Object plainValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return plainDocument(map);
        }
        if (value instanceof List<?> items) {
            List<Object> converted = new ArrayList<>(items.size());
            for (Object item : items) {
                converted.add(plainValue(item));
            }
            return converted;
        }
        return value;
    }

    private static Map<String, Object> normalizeKeys(Map<?, ?> rawMap) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : rawMap.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return normalized;
    }
}
