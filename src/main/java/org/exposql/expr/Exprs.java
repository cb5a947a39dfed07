package org.exposql.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Factory helpers that keep builder code close to the query text it produces.
 */
public final class Exprs {
    public static final Expr TRUE = new Expr.Constant(Boolean.TRUE);
    public static final Expr FALSE = new Expr.Constant(Boolean.FALSE);

    private Exprs() {}

    public static Expr constant(final Object value) {
        return new Expr.Constant(value);
    }

    public static Expr field(final String... chain) {
        return new Expr.Field(Arrays.asList(chain));
    }

    public static Expr field(final List<String> chain) {
        return new Expr.Field(chain);
    }

    /**
     * Dotted path to field chain, {@code "properties.$user_id"} becomes {@code [properties, $user_id]}.
     */
    public static Expr path(final String dottedPath) {
        Objects.requireNonNull(dottedPath, "dottedPath");
        return new Expr.Field(Arrays.asList(dottedPath.split("\\.")));
    }

    public static Expr call(final String name, final Expr... args) {
        return new Expr.Call(name, List.of(), Arrays.asList(args), false);
    }

    public static Expr parametric(final String name, final List<Expr> params, final Expr... args) {
        return new Expr.Call(name, params, Arrays.asList(args), false);
    }

    public static Expr countDistinct(final Expr arg) {
        return new Expr.Call("count", List.of(), List.of(arg), true);
    }

    public static Expr lambda(final String param, final Expr body) {
        return new Expr.Lambda(List.of(param), body);
    }

    public static Expr element(final Expr tuple, final int index) {
        return new Expr.TupleElement(tuple, index);
    }

    public static Expr compare(final Expr.CompareOp op, final Expr left, final Expr right) {
        return new Expr.Compare(op, left, right);
    }

    public static Expr eq(final Expr left, final Expr right) {
        return new Expr.Compare(Expr.CompareOp.EQ, left, right);
    }

    public static Expr gte(final Expr left, final Expr right) {
        return new Expr.Compare(Expr.CompareOp.GT_EQ, left, right);
    }

    public static Expr gt(final Expr left, final Expr right) {
        return new Expr.Compare(Expr.CompareOp.GT, left, right);
    }

    public static Expr lt(final Expr left, final Expr right) {
        return new Expr.Compare(Expr.CompareOp.LT, left, right);
    }

    public static Expr lte(final Expr left, final Expr right) {
        return new Expr.Compare(Expr.CompareOp.LT_EQ, left, right);
    }

    public static Expr in(final Expr left, final List<?> values) {
        return new Expr.Compare(Expr.CompareOp.IN, left, new Expr.Constant(values));
    }

    public static Expr plus(final Expr left, final Expr right) {
        return new Expr.Arithmetic(Expr.ArithmeticOp.PLUS, left, right);
    }

    public static Expr minus(final Expr left, final Expr right) {
        return new Expr.Arithmetic(Expr.ArithmeticOp.MINUS, left, right);
    }

    public static Expr multiply(final Expr left, final Expr right) {
        return new Expr.Arithmetic(Expr.ArithmeticOp.MULTIPLY, left, right);
    }

    public static Expr not(final Expr expr) {
        return new Expr.Not(expr);
    }

    public static Expr plusSeconds(final Expr timestamp, final long seconds) {
        return plus(timestamp, call("toIntervalSecond", constant(seconds)));
    }

    /**
     * Conjunction with {@code true} constants removed and nested conjunctions flattened, so the
     * rendered predicate stays index friendly. A {@code false} operand collapses the whole chain.
     */
    public static Expr and(final Expr... exprs) {
        return and(Arrays.asList(exprs));
    }

    public static Expr and(final List<Expr> exprs) {
        final List<Expr> kept = new ArrayList<>();
        for (final Expr expr : exprs) {
            Objects.requireNonNull(expr, "and operand");
            if (isTrue(expr)) {
                continue;
            }
            if (isFalse(expr)) {
                return FALSE;
            }
            if (expr instanceof Expr.And nested) {
                kept.addAll(nested.exprs());
                continue;
            }
            kept.add(expr);
        }
        if (kept.isEmpty()) {
            return TRUE;
        }
        if (kept.size() == 1) {
            return kept.get(0);
        }
        return new Expr.And(kept);
    }

    /**
     * Disjunction with {@code false} constants removed. An empty disjunction matches nothing.
     */
    public static Expr or(final Expr... exprs) {
        return or(Arrays.asList(exprs));
    }

    public static Expr or(final List<Expr> exprs) {
        final List<Expr> kept = new ArrayList<>();
        for (final Expr expr : exprs) {
            Objects.requireNonNull(expr, "or operand");
            if (isFalse(expr)) {
                continue;
            }
            if (isTrue(expr)) {
                return TRUE;
            }
            if (expr instanceof Expr.Or nested) {
                kept.addAll(nested.exprs());
                continue;
            }
            kept.add(expr);
        }
        if (kept.isEmpty()) {
            return FALSE;
        }
        if (kept.size() == 1) {
            return kept.get(0);
        }
        return new Expr.Or(kept);
    }

    public static boolean isTrue(final Expr expr) {
        return expr instanceof Expr.Constant constant && Boolean.TRUE.equals(constant.value());
    }

    public static boolean isFalse(final Expr expr) {
        return expr instanceof Expr.Constant constant && Boolean.FALSE.equals(constant.value());
    }
}
