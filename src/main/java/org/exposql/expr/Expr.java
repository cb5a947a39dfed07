package org.exposql.expr;

import java.util.List;
import java.util.Objects;

/**
 * Immutable scalar/aggregate expression node. Rendering and evaluation both walk this tree.
 */
public sealed interface Expr
        permits Expr.Constant,
                Expr.Field,
                Expr.Call,
                Expr.And,
                Expr.Or,
                Expr.Not,
                Expr.Compare,
                Expr.Arithmetic,
                Expr.Lambda,
                Expr.TupleElement {

    /**
     * Literal value: null, Boolean, Number, String, {@link java.time.Instant} or a list of literals.
     */
    record Constant(Object value) implements Expr {
        public Constant {
            if (value instanceof List<?> listValue) {
                value = List.copyOf(listValue);
            }
        }
    }

    /**
     * Column or nested property reference, e.g. {@code [properties, $browser]} or {@code [exposures, entity_id]}.
     */
    record Field(List<String> chain) implements Expr {
        public Field {
            chain = List.copyOf(Objects.requireNonNull(chain, "chain"));
            if (chain.isEmpty()) {
                throw new IllegalArgumentException("field chain must not be empty");
            }
        }
    }

    /**
     * Function call. {@code params} carries parametric arguments such as the level of {@code quantile(0.9)(x)}.
     */
    record Call(String name, List<Expr> params, List<Expr> args, boolean distinct) implements Expr {
        public Call {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("function name must not be blank");
            }
            params = List.copyOf(Objects.requireNonNull(params, "params"));
            args = List.copyOf(Objects.requireNonNull(args, "args"));
        }
    }

    record And(List<Expr> exprs) implements Expr {
        public And {
            exprs = List.copyOf(Objects.requireNonNull(exprs, "exprs"));
        }
    }

    record Or(List<Expr> exprs) implements Expr {
        public Or {
            exprs = List.copyOf(Objects.requireNonNull(exprs, "exprs"));
        }
    }

    record Not(Expr expr) implements Expr {
        public Not {
            Objects.requireNonNull(expr, "expr");
        }
    }

    record Compare(CompareOp op, Expr left, Expr right) implements Expr {
        public Compare {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Arithmetic(ArithmeticOp op, Expr left, Expr right) implements Expr {
        public Arithmetic {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    /**
     * Lambda argument of higher-order array functions, e.g. {@code x -> x.1 >= first_exposure_time}.
     */
    record Lambda(List<String> params, Expr body) implements Expr {
        public Lambda {
            params = List.copyOf(Objects.requireNonNull(params, "params"));
            Objects.requireNonNull(body, "body");
            if (params.isEmpty()) {
                throw new IllegalArgumentException("lambda needs at least one parameter");
            }
        }
    }

    /**
     * One-based tuple access, {@code tuple.1}.
     */
    record TupleElement(Expr tuple, int index) implements Expr {
        public TupleElement {
            Objects.requireNonNull(tuple, "tuple");
            if (index < 1) {
                throw new IllegalArgumentException("tuple indexes are one-based: " + index);
            }
        }
    }

    enum CompareOp {
        EQ("="),
        NOT_EQ("!="),
        LT("<"),
        LT_EQ("<="),
        GT(">"),
        GT_EQ(">="),
        IN("IN"),
        NOT_IN("NOT IN"),
        ILIKE("ILIKE"),
        NOT_ILIKE("NOT ILIKE");

        private final String symbol;

        CompareOp(final String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum ArithmeticOp {
        PLUS("+"),
        MINUS("-"),
        MULTIPLY("*"),
        DIVIDE("/");

        private final String symbol;

        ArithmeticOp(final String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
