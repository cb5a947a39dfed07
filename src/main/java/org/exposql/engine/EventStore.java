package org.exposql.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.bson.Document;

/**
 * Read-only named tables of row documents: the {@code events} table plus any warehouse tables.
 *
 * <p>Rows are copied on the way in. {@link Date} values (as produced by BSON and YAML parsers)
 * are stored as {@link Instant}.
 */
public final class EventStore {
    public static final String EVENTS_TABLE = "events";

    private final Map<String, List<Document>> tables;

    private EventStore(final Map<String, List<Document>> tables) {
        this.tables = tables;
    }

    public static EventStore ofEvents(final Collection<Document> events) {
        return builder().table(EVENTS_TABLE, events).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasTable(final String name) {
        return tables.containsKey(name);
    }

    public Set<String> tableNames() {
        return tables.keySet();
    }

    /**
     * Rows of {@code name} in insertion order. Unknown tables fail fast.
     */
    public List<Document> table(final String name) {
        final List<Document> rows = tables.get(Objects.requireNonNull(name, "name"));
        if (rows == null) {
            throw new IllegalArgumentException("unknown table: " + name);
        }
        return rows;
    }

    public int size(final String name) {
        return table(name).size();
    }

    public static final class Builder {
        private final Map<String, List<Document>> tables = new LinkedHashMap<>();

        private Builder() {
            tables.put(EVENTS_TABLE, new ArrayList<>());
        }

        public Builder table(final String name, final Collection<Document> rows) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(rows, "rows");
            final List<Document> target = tables.computeIfAbsent(name, key -> new ArrayList<>());
            for (final Document row : rows) {
                if (row == null) {
                    throw new IllegalArgumentException("table " + name + " must not contain null rows");
                }
                target.add(normalize(row));
            }
            return this;
        }

        public Builder event(final Document event) {
            return table(EVENTS_TABLE, List.of(event));
        }

        public EventStore build() {
            final Map<String, List<Document>> snapshot = new LinkedHashMap<>();
            for (final Map.Entry<String, List<Document>> entry : tables.entrySet()) {
                snapshot.put(entry.getKey(), List.copyOf(entry.getValue()));
            }
            return new EventStore(Map.copyOf(snapshot));
        }

        private static Document normalize(final Document row) {
            final Document copy = RowCopies.copy(row);
            normalizeDates(copy);
            return copy;
        }

        private static void normalizeDates(final Document document) {
            for (final Map.Entry<String, Object> entry : document.entrySet()) {
                final Object value = entry.getValue();
                if (value instanceof Date date) {
                    entry.setValue(date.toInstant());
                } else if (value instanceof Document nested) {
                    normalizeDates(nested);
                }
            }
        }
    }
}
