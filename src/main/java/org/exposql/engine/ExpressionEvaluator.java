package org.exposql.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;
import org.exposql.compiler.FunnelEvaluator;
import org.exposql.expr.Expr;
import org.exposql.expr.UnsupportedFeatureException;

/**
 * Evaluates expression trees against one row, or against a group of rows when aggregates are
 * involved. Boolean logic is three-valued: comparisons with null yield null.
 */
final class ExpressionEvaluator {
    private final Map<String, Pattern> likePatterns = new ConcurrentHashMap<>();

    /**
     * Row evaluation. Aggregate calls are rejected.
     */
    Object evaluate(final Expr expr, final RowScope row) {
        return evaluate(expr, row, null);
    }

    /**
     * Group evaluation: aggregate calls run over {@code group}, everything else reads
     * {@code representative} (the first row of the group, or an empty scope).
     */
    Object evaluateGroup(final Expr expr, final RowScope representative, final List<RowScope> group) {
        return evaluate(expr, representative, group);
    }

    static boolean containsAggregate(final Expr expr) {
        if (expr instanceof Expr.Call call) {
            if (Aggregates.isAggregate(call.name())) {
                return true;
            }
            return anyContainsAggregate(call.args());
        }
        if (expr instanceof Expr.And and) {
            return anyContainsAggregate(and.exprs());
        }
        if (expr instanceof Expr.Or or) {
            return anyContainsAggregate(or.exprs());
        }
        if (expr instanceof Expr.Not not) {
            return containsAggregate(not.expr());
        }
        if (expr instanceof Expr.Compare compare) {
            return containsAggregate(compare.left()) || containsAggregate(compare.right());
        }
        if (expr instanceof Expr.Arithmetic arithmetic) {
            return containsAggregate(arithmetic.left()) || containsAggregate(arithmetic.right());
        }
        if (expr instanceof Expr.TupleElement element) {
            return containsAggregate(element.tuple());
        }
        if (expr instanceof Expr.Lambda lambda) {
            return containsAggregate(lambda.body());
        }
        return false;
    }

    private static boolean anyContainsAggregate(final List<Expr> exprs) {
        for (final Expr expr : exprs) {
            if (containsAggregate(expr)) {
                return true;
            }
        }
        return false;
    }

    private Object evaluate(final Expr expr, final RowScope row, final List<RowScope> group) {
        if (expr instanceof Expr.Constant constant) {
            return constant.value();
        }
        if (expr instanceof Expr.Field field) {
            return row.resolve(field.chain());
        }
        if (expr instanceof Expr.Call call) {
            return evaluateCall(call, row, group);
        }
        if (expr instanceof Expr.And and) {
            boolean sawNull = false;
            for (final Expr operand : and.exprs()) {
                final Object value = evaluate(operand, row, group);
                if (value == null) {
                    sawNull = true;
                } else if (!Values.isTruthy(value)) {
                    return Boolean.FALSE;
                }
            }
            return sawNull ? null : Boolean.TRUE;
        }
        if (expr instanceof Expr.Or or) {
            boolean sawNull = false;
            for (final Expr operand : or.exprs()) {
                final Object value = evaluate(operand, row, group);
                if (value == null) {
                    sawNull = true;
                } else if (Values.isTruthy(value)) {
                    return Boolean.TRUE;
                }
            }
            return sawNull ? null : Boolean.FALSE;
        }
        if (expr instanceof Expr.Not not) {
            final Object value = evaluate(not.expr(), row, group);
            return value == null ? null : !Values.isTruthy(value);
        }
        if (expr instanceof Expr.Compare compare) {
            return evaluateCompare(compare, row, group);
        }
        if (expr instanceof Expr.Arithmetic arithmetic) {
            final Object left = evaluate(arithmetic.left(), row, group);
            final Object right = evaluate(arithmetic.right(), row, group);
            return switch (arithmetic.op()) {
                case PLUS -> Values.add(left, right);
                case MINUS -> Values.subtract(left, right);
                case MULTIPLY -> Values.arithmetic(left, right, '*');
                case DIVIDE -> Values.arithmetic(left, right, '/');
            };
        }
        if (expr instanceof Expr.TupleElement element) {
            final Object tuple = evaluate(element.tuple(), row, group);
            if (!(tuple instanceof List<?> values)) {
                return null;
            }
            return element.index() <= values.size() ? values.get(element.index() - 1) : null;
        }
        throw new IllegalArgumentException("lambda is only valid as a function argument");
    }

    private Object evaluateCompare(final Expr.Compare compare, final RowScope row, final List<RowScope> group) {
        final Object left = evaluate(compare.left(), row, group);
        final Object right = evaluate(compare.right(), row, group);
        if (left == null) {
            return null;
        }
        return switch (compare.op()) {
            case EQ -> Values.sqlEquals(left, right);
            case NOT_EQ -> negate(Values.sqlEquals(left, right));
            case LT -> ordered(left, right, compared -> compared < 0);
            case LT_EQ -> ordered(left, right, compared -> compared <= 0);
            case GT -> ordered(left, right, compared -> compared > 0);
            case GT_EQ -> ordered(left, right, compared -> compared >= 0);
            case IN -> in(left, right);
            case NOT_IN -> negate(in(left, right));
            case ILIKE -> like(left, right);
            case NOT_ILIKE -> negate(like(left, right));
        };
    }

    private static Boolean ordered(
            final Object left, final Object right, final IntPredicate test) {
        final Integer compared = Values.compare(left, right);
        return compared == null ? null : test.test(compared);
    }

    private static Boolean in(final Object left, final Object right) {
        if (!(right instanceof List<?> candidates)) {
            throw new IllegalArgumentException("IN requires a list, got " + Values.describeType(right));
        }
        for (final Object candidate : candidates) {
            if (Boolean.TRUE.equals(Values.sqlEquals(left, candidate))) {
                return Boolean.TRUE;
            }
        }
        return Boolean.FALSE;
    }

    private Boolean like(final Object left, final Object right) {
        if (right == null) {
            return null;
        }
        final Pattern pattern = likePatterns.computeIfAbsent(String.valueOf(right), ExpressionEvaluator::compileLike);
        return pattern.matcher(Values.toText(left)).matches();
    }

    private static Boolean negate(final Boolean value) {
        return value == null ? null : !value;
    }

    /**
     * {@code %} and {@code _} are wildcards; a backslash escapes the next character.
     */
    private static Pattern compileLike(final String like) {
        final StringBuilder regex = new StringBuilder();
        for (int i = 0; i < like.length(); i++) {
            final char c = like.charAt(i);
            if (c == '\\' && i + 1 < like.length()) {
                regex.append(Pattern.quote(String.valueOf(like.charAt(++i))));
            } else if (c == '%') {
                regex.append(".*");
            } else if (c == '_') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    private Object evaluateCall(final Expr.Call call, final RowScope row, final List<RowScope> group) {
        if (Aggregates.isAggregate(call.name())) {
            if (group == null) {
                throw new IllegalArgumentException("aggregate function " + call.name() + " used outside of a group");
            }
            final List<Object> params = new ArrayList<>(call.params().size());
            for (final Expr param : call.params()) {
                params.add(evaluate(param, row, null));
            }
            final List<List<Object>> rows = new ArrayList<>(group.size());
            for (final RowScope member : group) {
                final List<Object> args = new ArrayList<>(call.args().size());
                for (final Expr arg : call.args()) {
                    args.add(evaluate(arg, member, null));
                }
                rows.add(args);
            }
            return Aggregates.apply(call.name(), params, call.distinct(), rows);
        }

        final List<Expr> args = call.args();
        switch (call.name()) {
            case "if":
                requireArity(call, 3);
                return Values.isTruthy(evaluate(args.get(0), row, group))
                        ? evaluate(args.get(1), row, group)
                        : evaluate(args.get(2), row, group);
            case "multiIf":
                if (args.size() % 2 == 0) {
                    throw new IllegalArgumentException("multiIf requires an odd number of arguments");
                }
                for (int i = 0; i + 1 < args.size(); i += 2) {
                    if (Values.isTruthy(evaluate(args.get(i), row, group))) {
                        return evaluate(args.get(i + 1), row, group);
                    }
                }
                return evaluate(args.get(args.size() - 1), row, group);
            case "arrayMap":
            case "arrayFilter":
            case "arrayCount":
                return evaluateHigherOrder(call, row, group);
            default:
                break;
        }

        final List<Object> values = new ArrayList<>(args.size());
        for (final Expr arg : args) {
            values.add(evaluate(arg, row, group));
        }
        return ScalarFunctions.apply(call.name(), values);
    }

    private Object evaluateHigherOrder(final Expr.Call call, final RowScope row, final List<RowScope> group) {
        requireArity(call, 2);
        if (!(call.args().get(0) instanceof Expr.Lambda lambda) || lambda.params().size() != 1) {
            throw new IllegalArgumentException(call.name() + " requires a one-parameter lambda");
        }
        final Object source = evaluate(call.args().get(1), row, group);
        if (source == null) {
            return null;
        }
        if (!(source instanceof List<?> elements)) {
            throw new IllegalArgumentException(call.name() + " requires an array, got " + Values.describeType(source));
        }
        final String param = lambda.params().get(0);
        final List<Object> mapped = new ArrayList<>();
        long matched = 0;
        for (final Object element : elements) {
            final Object result = evaluate(lambda.body(), row.bind(param, element), group);
            switch (call.name()) {
                case "arrayMap" -> mapped.add(result);
                case "arrayFilter" -> {
                    if (Values.isTruthy(result)) {
                        mapped.add(element);
                    }
                }
                default -> {
                    if (Values.isTruthy(result)) {
                        matched++;
                    }
                }
            }
        }
        if ("arrayCount".equals(call.name())) {
            return matched;
        }
        return Collections.unmodifiableList(mapped);
    }

    private static void requireArity(final Expr.Call call, final int arity) {
        if (call.args().size() != arity) {
            throw new IllegalArgumentException(call.name() + " requires " + arity + " arguments");
        }
    }

    /**
     * Stateless scalar functions over already evaluated arguments.
     */
    static final class ScalarFunctions {
        private ScalarFunctions() {}

        static Object apply(final String name, final List<Object> args) {
            switch (name) {
                case "coalesce":
                    for (final Object value : args) {
                        if (value != null) {
                            return value;
                        }
                    }
                    return null;
                case "ifNull":
                    return arg(name, args, 0) != null ? args.get(0) : arg(name, args, 1);
                case "isNull":
                    return arg(name, args, 0) == null;
                case "isNotNull":
                    return arg(name, args, 0) != null;
                case "toFloat":
                    return Values.toDouble(arg(name, args, 0));
                case "toString":
                    return Values.toText(arg(name, args, 0));
                case "toIntervalSecond": {
                    final Double seconds = Values.toDouble(arg(name, args, 0));
                    return seconds == null ? null : Duration.ofSeconds(seconds.longValue());
                }
                case "least":
                case "greatest":
                    return leastOrGreatest("greatest".equals(name), args);
                case "power": {
                    final Double base = Values.toDouble(arg(name, args, 0));
                    final Double exponent = Values.toDouble(arg(name, args, 1));
                    return base == null || exponent == null ? null : Math.pow(base, exponent);
                }
                case "tuple":
                case "array":
                    return Collections.unmodifiableList(new ArrayList<>(args));
                case "length": {
                    final Object value = arg(name, args, 0);
                    if (value instanceof List<?> list) {
                        return (long) list.size();
                    }
                    return value == null ? null : (long) Values.toText(value).length();
                }
                case "empty":
                    return isEmpty(arg(name, args, 0));
                case "notEmpty":
                    return !isEmpty(arg(name, args, 0));
                case "arraySum":
                    return arrayNumbers(name, args).stream().mapToDouble(Double::doubleValue).sum();
                case "arrayMin":
                    return arrayNumbers(name, args).stream().min(Double::compare).orElse(null);
                case "arrayMax":
                    return arrayNumbers(name, args).stream().max(Double::compare).orElse(null);
                case "arrayAvg": {
                    final List<Double> numbers = arrayNumbers(name, args);
                    return numbers.isEmpty()
                            ? null
                            : numbers.stream().mapToDouble(Double::doubleValue).sum() / numbers.size();
                }
                case "arrayDistinct":
                    return arrayDistinct(arg(name, args, 0));
                case FunnelEvaluator.FUNNEL_FUNCTION:
                    return funnelSteps(args);
                default:
                    throw UnsupportedFeatureException.function(name);
            }
        }

        private static Object arg(final String name, final List<Object> args, final int index) {
            if (index >= args.size()) {
                throw new IllegalArgumentException(name + " is missing argument " + (index + 1));
            }
            return args.get(index);
        }

        private static Object leastOrGreatest(final boolean greatest, final List<Object> args) {
            Object best = null;
            for (final Object value : args) {
                if (value == null) {
                    return null;
                }
                final Integer compared = best == null ? null : Values.compare(value, best);
                if (best == null || (compared != null && (greatest ? compared > 0 : compared < 0))) {
                    best = value;
                }
            }
            return best;
        }

        private static boolean isEmpty(final Object value) {
            if (value instanceof List<?> list) {
                return list.isEmpty();
            }
            return value == null || Values.toText(value).isEmpty();
        }

        private static List<Double> arrayNumbers(final String name, final List<Object> args) {
            final Object value = arg(name, args, 0);
            final List<Double> numbers = new ArrayList<>();
            if (value == null) {
                return numbers;
            }
            if (!(value instanceof List<?> list)) {
                throw new IllegalArgumentException(name + " requires an array");
            }
            for (final Object item : list) {
                final Double numeric = Values.toDouble(item);
                if (numeric != null) {
                    numbers.add(numeric);
                }
            }
            return numbers;
        }

        private static Object arrayDistinct(final Object value) {
            if (value == null) {
                return null;
            }
            if (!(value instanceof List<?> list)) {
                throw new IllegalArgumentException("arrayDistinct requires an array");
            }
            final Set<Object> seen = new LinkedHashSet<>();
            final List<Object> distinct = new ArrayList<>();
            for (final Object item : list) {
                if (item != null && seen.add(Values.groupingKey(item))) {
                    distinct.add(item);
                }
            }
            return Collections.unmodifiableList(distinct);
        }

        private static Object funnelSteps(final List<Object> args) {
            if (args.size() != 4) {
                throw new IllegalArgumentException(FunnelEvaluator.FUNNEL_FUNCTION + " requires 4 arguments, got "
                        + Arrays.toString(args.toArray()));
            }
            final Double steps = Values.toDouble(args.get(0));
            final Double window = Values.toDouble(args.get(1));
            if (steps == null || window == null || !(args.get(2) instanceof String order)) {
                throw new IllegalArgumentException(FunnelEvaluator.FUNNEL_FUNCTION
                        + " requires (steps, windowSeconds, order, tuples)");
            }
            final Object tuples = args.get(3);
            if (tuples != null && !(tuples instanceof List<?>)) {
                throw new IllegalArgumentException(FunnelEvaluator.FUNNEL_FUNCTION + " requires an array of tuples");
            }
            return FunnelSteps.evaluate(steps.intValue(), window.longValue(), order, (List<?>) tuples);
        }
    }
}
