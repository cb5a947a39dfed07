package org.exposql.engine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.bson.Document;
import org.exposql.model.ActionCatalog;
import org.exposql.model.ActionDefinition;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads event fixtures from YAML.
 *
 * <p>The root is either a list of events or an object with {@code events}, {@code tables}
 * (warehouse table name to rows) and {@code actions}. String values that look like ISO-8601
 * instants are stored as {@link Instant}.
 */
public final class EventFixtureLoader {
    private static final Pattern INSTANT_TEXT = Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}(:\\d{2}(\\.\\d+)?)?Z");

    private EventFixtureLoader() {}

    public static EventFixture load(final Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static EventFixture parse(final String yamlText) {
        final Object root = new Yaml().load(Objects.requireNonNull(yamlText, "yamlText"));
        if (root == null) {
            return new EventFixture(EventStore.builder().build(), ActionCatalog.empty());
        }
        if (root instanceof List<?> events) {
            return new EventFixture(EventStore.ofEvents(rows(events, "events")), ActionCatalog.empty());
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("event fixture root must be a list or an object");
        }
        return fromDocument(toDocument(map));
    }

    public static EventFixture fromDocument(final Document document) {
        final EventStore.Builder store = EventStore.builder();
        store.table(EventStore.EVENTS_TABLE, rows(listValue(document.get("events"), "events"), "events"));

        final Object tables = document.get("tables");
        if (tables != null) {
            if (!(tables instanceof Map<?, ?> byName)) {
                throw new IllegalArgumentException("tables must be an object of table name to rows");
            }
            for (final Map.Entry<?, ?> entry : byName.entrySet()) {
                final String name = String.valueOf(entry.getKey());
                store.table(name, rows(listValue(entry.getValue(), name), name));
            }
        }

        final List<ActionDefinition> actions = new ArrayList<>();
        for (final Document action : rows(listValue(document.get("actions"), "actions"), "actions")) {
            actions.add(ActionDefinition.fromDocument(action));
        }
        return new EventFixture(store.build(), ActionCatalog.of(actions));
    }

    /**
     * Converts a parsed YAML mapping into a document, recursively, with instant-like strings
     * turned into {@link Instant}.
     */
    public static Document toDocument(final Map<?, ?> map) {
        final Document document = new Document();
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            document.put(String.valueOf(entry.getKey()), convert(entry.getValue()));
        }
        return document;
    }

    private static Object convert(final Object value) {
        if (value instanceof Map<?, ?> map) {
            return toDocument(map);
        }
        if (value instanceof List<?> list) {
            final List<Object> converted = new ArrayList<>(list.size());
            for (final Object item : list) {
                converted.add(convert(item));
            }
            return converted;
        }
        if (value instanceof String text && INSTANT_TEXT.matcher(text).matches()) {
            try {
                return Instant.parse(text);
            } catch (final DateTimeParseException exception) {
                return text;
            }
        }
        return value;
    }

    private static List<?> listValue(final Object value, final String name) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(name + " must be a list");
        }
        return list;
    }

    private static List<Document> rows(final List<?> items, final String name) {
        final List<Document> rows = new ArrayList<>(items.size());
        for (final Object item : items) {
            if (item instanceof Document document) {
                rows.add(document);
            } else if (item instanceof Map<?, ?> map) {
                rows.add(toDocument(map));
            } else {
                throw new IllegalArgumentException(name + " entries must be objects");
            }
        }
        return rows;
    }
}
