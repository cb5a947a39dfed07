package org.exposql.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregate functions over the rows of one group. Arguments arrive already evaluated per row;
 * {@code -If} variants receive the condition as their last argument.
 */
final class Aggregates {
    private static final Set<String> NAMES = Set.of(
            "count", "countIf", "sum", "sumIf", "min", "minIf", "max", "maxIf", "avg", "argMin", "argMinIf",
            "argMax", "any", "anyIf", "uniqExact", "uniqExactIf", "groupArray", "groupArrayIf", "quantile");

    private Aggregates() {}

    static boolean isAggregate(final String name) {
        return NAMES.contains(name);
    }

    /**
     * @param rows per-row argument values; rows.get(i).get(j) is argument j of row i
     */
    static Object apply(final String name, final List<Object> params, final boolean distinct, final List<List<Object>> rows) {
        return switch (name) {
            case "count" -> count(rows, distinct);
            case "countIf" -> (long) conditioned(rows).size();
            case "sum" -> sum(column(rows, 0));
            case "sumIf" -> sum(column(conditioned(rows), 0));
            case "min" -> extreme(column(rows, 0), false);
            case "minIf" -> extreme(column(conditioned(rows), 0), false);
            case "max" -> extreme(column(rows, 0), true);
            case "maxIf" -> extreme(column(conditioned(rows), 0), true);
            case "avg" -> avg(column(rows, 0));
            case "argMin" -> argExtreme(rows, false);
            case "argMinIf" -> argExtreme(conditioned(rows), false);
            case "argMax" -> argExtreme(rows, true);
            case "any" -> first(column(rows, 0));
            case "anyIf" -> first(column(conditioned(rows), 0));
            case "uniqExact" -> (long) distinctValues(column(rows, 0)).size();
            case "uniqExactIf" -> (long) distinctValues(column(conditioned(rows), 0)).size();
            case "groupArray" -> nonNull(column(rows, 0));
            case "groupArrayIf" -> nonNull(column(conditioned(rows), 0));
            case "quantile" -> quantile(level(params), column(rows, 0));
            default -> throw new IllegalArgumentException("not an aggregate function: " + name);
        };
    }

    private static long count(final List<List<Object>> rows, final boolean distinct) {
        if (rows.isEmpty() || rows.get(0).isEmpty()) {
            return rows.size();
        }
        final List<Object> values = column(rows, 0);
        return distinct ? distinctValues(values).size() : nonNull(values).size();
    }

    /**
     * Rows whose trailing condition argument is true.
     */
    private static List<List<Object>> conditioned(final List<List<Object>> rows) {
        final List<List<Object>> kept = new ArrayList<>();
        for (final List<Object> row : rows) {
            if (row.isEmpty()) {
                throw new IllegalArgumentException("conditional aggregate requires a condition argument");
            }
            if (Values.isTruthy(row.get(row.size() - 1))) {
                kept.add(row);
            }
        }
        return kept;
    }

    private static List<Object> column(final List<List<Object>> rows, final int index) {
        final List<Object> values = new ArrayList<>(rows.size());
        for (final List<Object> row : rows) {
            if (row.size() <= index) {
                throw new IllegalArgumentException("aggregate is missing argument " + (index + 1));
            }
            values.add(row.get(index));
        }
        return values;
    }

    private static List<Object> nonNull(final List<Object> values) {
        final List<Object> kept = new ArrayList<>();
        for (final Object value : values) {
            if (value != null) {
                kept.add(value);
            }
        }
        return kept;
    }

    private static Set<Object> distinctValues(final List<Object> values) {
        final Set<Object> distinct = new LinkedHashSet<>();
        for (final Object value : values) {
            if (value != null) {
                distinct.add(Values.groupingKey(value));
            }
        }
        return distinct;
    }

    private static Object sum(final List<Object> values) {
        boolean integral = true;
        long longTotal = 0L;
        double doubleTotal = 0d;
        for (final Object value : values) {
            if (value == null) {
                continue;
            }
            if (value instanceof Long || value instanceof Integer) {
                longTotal += ((Number) value).longValue();
                doubleTotal += ((Number) value).doubleValue();
                continue;
            }
            final Double numeric = Values.toDouble(value);
            if (numeric == null) {
                continue;
            }
            integral = false;
            doubleTotal += numeric;
        }
        return integral ? (Object) longTotal : (Object) doubleTotal;
    }

    private static Object avg(final List<Object> values) {
        double total = 0d;
        int count = 0;
        for (final Object value : values) {
            final Double numeric = Values.toDouble(value);
            if (numeric != null) {
                total += numeric;
                count++;
            }
        }
        return count == 0 ? null : total / count;
    }

    private static Object extreme(final List<Object> values, final boolean max) {
        Object best = null;
        for (final Object value : values) {
            if (value == null) {
                continue;
            }
            if (best == null) {
                best = value;
                continue;
            }
            final Integer compared = Values.compare(value, best);
            if (compared != null && (max ? compared > 0 : compared < 0)) {
                best = value;
            }
        }
        return best;
    }

    /**
     * Value of the first row with the smallest (or largest) key. Rows with a null key are skipped.
     */
    private static Object argExtreme(final List<List<Object>> rows, final boolean max) {
        Object bestKey = null;
        Object bestValue = null;
        for (final List<Object> row : rows) {
            if (row.size() < 2) {
                throw new IllegalArgumentException("argMin/argMax require a value and a key");
            }
            final Object key = row.get(1);
            if (key == null) {
                continue;
            }
            final Integer compared = bestKey == null ? null : Values.compare(key, bestKey);
            if (bestKey == null || (compared != null && (max ? compared > 0 : compared < 0))) {
                bestKey = key;
                bestValue = row.get(0);
            }
        }
        return bestValue;
    }

    private static Object first(final List<Object> values) {
        for (final Object value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Exact quantile with linear interpolation between the closest ranks.
     */
    private static Object quantile(final double level, final List<Object> values) {
        final List<Double> numbers = new ArrayList<>();
        for (final Object value : values) {
            final Double numeric = Values.toDouble(value);
            if (numeric != null) {
                numbers.add(numeric);
            }
        }
        if (numbers.isEmpty()) {
            return null;
        }
        numbers.sort(Double::compare);
        final double position = level * (numbers.size() - 1);
        final int lower = (int) Math.floor(position);
        final int upper = (int) Math.ceil(position);
        final double fraction = position - lower;
        return numbers.get(lower) + (numbers.get(upper) - numbers.get(lower)) * fraction;
    }

    private static double level(final List<Object> params) {
        if (params.size() != 1) {
            throw new IllegalArgumentException("quantile requires exactly one level parameter");
        }
        final Double level = Values.toDouble(params.get(0));
        if (level == null || level < 0d || level > 1d) {
            throw new IllegalArgumentException("quantile level must be between 0 and 1: " + params.get(0));
        }
        return level;
    }
}
