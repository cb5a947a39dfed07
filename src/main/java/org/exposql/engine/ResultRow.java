package org.exposql.engine;

import java.util.List;
import java.util.Objects;
import org.bson.Document;

/**
 * One output row, columns in select order.
 */
public record ResultRow(Document values) {
    public ResultRow {
        values = RowCopies.copy(Objects.requireNonNull(values, "values"));
    }

    public List<String> columns() {
        return List.copyOf(values.keySet());
    }

    public Object get(final String column) {
        requireColumn(column);
        return values.get(column);
    }

    public String getString(final String column) {
        final Object value = get(column);
        return value == null ? null : Values.toText(value);
    }

    public long getLong(final String column) {
        final Double value = Values.toDouble(get(column));
        return value == null ? 0L : Math.round(value);
    }

    public double getDouble(final String column) {
        final Double value = Values.toDouble(get(column));
        return value == null ? 0d : value;
    }

    public List<?> getList(final String column) {
        final Object value = get(column);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("column " + column + " is not an array");
        }
        return list;
    }

    public String toJson() {
        return values.toJson();
    }

    private void requireColumn(final String column) {
        if (!values.containsKey(column)) {
            throw new IllegalArgumentException("unknown result column: " + column + " (have " + values.keySet() + ")");
        }
    }
}
