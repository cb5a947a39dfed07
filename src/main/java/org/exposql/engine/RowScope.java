package org.exposql.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;

/**
 * Row being evaluated: one document per source alias (null for the unmatched side of a LEFT
 * JOIN) plus lambda parameter bindings.
 */
final class RowScope {
    static final RowScope EMPTY = new RowScope(Map.of(), Map.of());

    private final Map<String, Document> sources;
    private final Map<String, Object> bindings;

    private RowScope(final Map<String, Document> sources, final Map<String, Object> bindings) {
        this.sources = sources;
        this.bindings = bindings;
    }

    static RowScope of(final String alias, final Document row) {
        final Map<String, Document> sources = new LinkedHashMap<>();
        sources.put(alias, row);
        return new RowScope(Collections.unmodifiableMap(sources), Map.of());
    }

    RowScope merge(final RowScope other) {
        final Map<String, Document> merged = new LinkedHashMap<>(sources);
        merged.putAll(other.sources);
        return new RowScope(Collections.unmodifiableMap(merged), bindings);
    }

    RowScope withNull(final List<String> aliases) {
        final Map<String, Document> merged = new LinkedHashMap<>(sources);
        for (final String alias : aliases) {
            merged.put(alias, null);
        }
        return new RowScope(Collections.unmodifiableMap(merged), bindings);
    }

    RowScope bind(final String name, final Object value) {
        final Map<String, Object> layered = new LinkedHashMap<>(bindings);
        layered.put(name, value);
        return new RowScope(sources, Collections.unmodifiableMap(layered));
    }

    /**
     * Lambda parameters first, then {@code alias.column...}, then the first source that has the
     * leading column. Unknown names resolve to null.
     */
    Object resolve(final List<String> chain) {
        final String head = chain.get(0);
        final List<String> rest = chain.subList(1, chain.size());
        if (bindings.containsKey(head)) {
            return Values.navigate(bindings.get(head), rest);
        }
        if (chain.size() > 1 && sources.containsKey(head)) {
            return Values.navigate(sources.get(head), rest);
        }
        for (final Document row : sources.values()) {
            if (row != null && row.containsKey(head)) {
                return Values.navigate(row.get(head), rest);
            }
        }
        return null;
    }
}
