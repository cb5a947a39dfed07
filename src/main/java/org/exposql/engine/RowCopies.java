package org.exposql.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;

/**
 * Deep copies that keep stored rows and returned rows independent of caller mutation.
 */
final class RowCopies {
    private RowCopies() {}

    static Document copy(final Document source) {
        Objects.requireNonNull(source, "source");
        final Document copy = new Document();
        for (final Map.Entry<String, Object> entry : source.entrySet()) {
            copy.put(entry.getKey(), copyAny(entry.getValue()));
        }
        return copy;
    }

    static Object copyAny(final Object value) {
        if (value instanceof Document document) {
            return copy(document);
        }
        if (value instanceof Map<?, ?> map) {
            final Document copy = new Document();
            for (final Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), copyAny(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            final List<Object> copy = new ArrayList<>(list.size());
            for (final Object item : list) {
                copy.add(copyAny(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
