package org.exposql.engine;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Value semantics of the in-memory engine: comparison, truthiness and numeric coercion.
 * SQL nulls are Java nulls and propagate through comparisons.
 */
final class Values {
    private Values() {}

    /**
     * Ordering of two non-null values, or null when they are not comparable.
     */
    static Integer compare(final Object left, final Object right) {
        if (left == null || right == null) {
            return null;
        }
        if (left instanceof Number leftNumber && right instanceof Number rightNumber) {
            return compareNumbers(leftNumber, rightNumber);
        }
        if (left instanceof Number leftNumber && right instanceof String rightString) {
            final Double parsed = parseDouble(rightString);
            return parsed == null ? String.valueOf(left).compareTo(rightString) : compareNumbers(leftNumber, parsed);
        }
        if (left instanceof String leftString && right instanceof Number rightNumber) {
            final Integer reversed = compare(rightNumber, leftString);
            return reversed == null ? null : -reversed;
        }
        if (left instanceof String leftString && right instanceof String rightString) {
            return leftString.compareTo(rightString);
        }
        if (left instanceof Boolean leftBoolean && right instanceof Boolean rightBoolean) {
            return Boolean.compare(leftBoolean, rightBoolean);
        }
        if (left instanceof Instant leftInstant && right instanceof Instant rightInstant) {
            return leftInstant.compareTo(rightInstant);
        }
        if (left.getClass().equals(right.getClass()) && left instanceof Comparable<?> comparableLeft) {
            @SuppressWarnings("unchecked")
            final Comparable<Object> castComparable = (Comparable<Object>) comparableLeft;
            return castComparable.compareTo(right);
        }
        return null;
    }

    /**
     * SQL equality: null when either side is null, loose across number representations.
     */
    static Boolean sqlEquals(final Object left, final Object right) {
        if (left == null || right == null) {
            return null;
        }
        final Integer compared = compare(left, right);
        if (compared != null) {
            return compared == 0;
        }
        return Objects.deepEquals(left, right);
    }

    static boolean isTruthy(final Object value) {
        if (value instanceof Boolean booleanValue) {
            return booleanValue;
        }
        if (value instanceof Number numberValue) {
            return numberValue.doubleValue() != 0d;
        }
        return false;
    }

    /**
     * Lenient numeric cast: unparsable strings become null rather than failing the query.
     */
    static Double toDouble(final Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean booleanValue) {
            return booleanValue ? 1d : 0d;
        }
        if (value instanceof String text) {
            return parseDouble(text);
        }
        return null;
    }

    static String toText(final Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            final double numeric = ((Number) value).doubleValue();
            if (Double.isFinite(numeric) && Math.rint(numeric) == numeric && Math.abs(numeric) < 1e15) {
                return Long.toString((long) numeric);
            }
        }
        return String.valueOf(value);
    }

    /**
     * Normalized form used for grouping and distinct counting, so that {@code 1} and {@code 1.0}
     * fall into the same bucket.
     */
    static Object groupingKey(final Object value) {
        if (value instanceof Number number && !(value instanceof BigDecimal) && !(value instanceof BigInteger)) {
            final double numeric = number.doubleValue();
            if (Double.isFinite(numeric) && Math.rint(numeric) == numeric && Math.abs(numeric) < 1e15) {
                return (long) numeric;
            }
            return numeric;
        }
        if (value instanceof List<?> list) {
            final List<Object> normalized = new ArrayList<>(list.size());
            for (final Object item : list) {
                normalized.add(groupingKey(item));
            }
            return normalized;
        }
        return value;
    }

    static Object add(final Object left, final Object right) {
        if (left instanceof Instant instant && right instanceof Duration duration) {
            return instant.plus(duration);
        }
        if (left instanceof Duration duration && right instanceof Instant instant) {
            return instant.plus(duration);
        }
        return arithmetic(left, right, '+');
    }

    static Object subtract(final Object left, final Object right) {
        if (left instanceof Instant instant && right instanceof Duration duration) {
            return instant.minus(duration);
        }
        return arithmetic(left, right, '-');
    }

    static Object arithmetic(final Object left, final Object right, final char op) {
        if (left == null || right == null) {
            return null;
        }
        if (isIntegral(left) && isIntegral(right) && op != '/') {
            final long l = ((Number) left).longValue();
            final long r = ((Number) right).longValue();
            return switch (op) {
                case '+' -> l + r;
                case '-' -> l - r;
                case '*' -> l * r;
                default -> throw new IllegalArgumentException("unsupported arithmetic operator: " + op);
            };
        }
        final Double l = toDouble(left);
        final Double r = toDouble(right);
        if (l == null || r == null) {
            return null;
        }
        return switch (op) {
            case '+' -> l + r;
            case '-' -> l - r;
            case '*' -> l * r;
            case '/' -> l / r;
            default -> throw new IllegalArgumentException("unsupported arithmetic operator: " + op);
        };
    }

    static Object navigate(final Object root, final List<String> path) {
        Object current = root;
        for (final String segment : path) {
            if (!(current instanceof Map<?, ?> mapValue)) {
                return null;
            }
            current = mapValue.get(segment);
        }
        return current;
    }

    static String describeType(final Object value) {
        return value == null ? "null" : value.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    }

    private static boolean isIntegral(final Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    private static Double parseDouble(final String text) {
        final String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (final NumberFormatException exception) {
            return null;
        }
    }

    private static int compareNumbers(final Number left, final Number right) {
        if (isSpecialFloating(left) || isSpecialFloating(right)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        try {
            return toBigDecimal(left).compareTo(toBigDecimal(right));
        } catch (final NumberFormatException error) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
    }

    private static boolean isSpecialFloating(final Number value) {
        if (value instanceof Double doubleValue) {
            return Double.isNaN(doubleValue) || Double.isInfinite(doubleValue);
        }
        if (value instanceof Float floatValue) {
            return Float.isNaN(floatValue) || Float.isInfinite(floatValue);
        }
        return false;
    }

    private static BigDecimal toBigDecimal(final Number value) {
        if (value instanceof BigDecimal bigDecimal) {
            return bigDecimal;
        }
        if (value instanceof BigInteger bigInteger) {
            return new BigDecimal(bigInteger);
        }
        if (isIntegral(value)) {
            return BigDecimal.valueOf(value.longValue());
        }
        if (value instanceof Float || value instanceof Double) {
            return BigDecimal.valueOf(value.doubleValue());
        }
        return new BigDecimal(value.toString());
    }
}
