package org.exposql.expr;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Renders the expression tree as ClickHouse-flavoured SQL text. Output is deterministic so it can
 * be compared in tests and logged.
 */
public final class SqlRenderer {
    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");
    private static final String INDENT = "    ";

    private final ZoneId zone;

    public SqlRenderer() {
        this(ZoneId.of("UTC"));
    }

    public SqlRenderer(final ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public String render(final SelectQuery query) {
        final StringBuilder sb = new StringBuilder();
        appendQuery(sb, Objects.requireNonNull(query, "query"), 0);
        return sb.toString();
    }

    public String render(final Expr expr) {
        final StringBuilder sb = new StringBuilder();
        appendExpr(sb, Objects.requireNonNull(expr, "expr"), 0);
        return sb.toString();
    }

    private void appendQuery(final StringBuilder sb, final SelectQuery query, final int depth) {
        final String pad = INDENT.repeat(depth);
        if (!query.ctes().isEmpty()) {
            sb.append(pad).append("WITH\n");
            final List<SelectQuery.Cte> ctes = query.ctes();
            for (int i = 0; i < ctes.size(); i++) {
                final SelectQuery.Cte cte = ctes.get(i);
                sb.append(pad).append(INDENT).append(identifier(cte.name())).append(" AS (\n");
                appendQuery(sb, cte.query(), depth + 2);
                sb.append('\n').append(pad).append(INDENT).append(')');
                sb.append(i + 1 < ctes.size() ? ",\n" : "\n");
            }
        }

        sb.append(pad).append("SELECT\n");
        final List<SelectQuery.Alias> select = query.select();
        for (int i = 0; i < select.size(); i++) {
            final SelectQuery.Alias alias = select.get(i);
            sb.append(pad).append(INDENT);
            appendExpr(sb, alias.expr(), 0);
            if (!(alias.expr() instanceof Expr.Field field && lastSegment(field).equals(alias.name()))) {
                sb.append(" AS ").append(identifier(alias.name()));
            }
            sb.append(i + 1 < select.size() ? ",\n" : "\n");
        }

        sb.append(pad).append("FROM ");
        appendFrom(sb, query.from(), depth);
        query.where().ifPresent(where -> {
            sb.append('\n').append(pad).append("WHERE ");
            appendExpr(sb, where, 0);
        });
        if (!query.groupBy().isEmpty()) {
            sb.append('\n').append(pad).append("GROUP BY ");
            for (int i = 0; i < query.groupBy().size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                appendExpr(sb, query.groupBy().get(i), 0);
            }
        }
        query.having().ifPresent(having -> {
            sb.append('\n').append(pad).append("HAVING ");
            appendExpr(sb, having, 0);
        });
    }

    private void appendFrom(final StringBuilder sb, final FromClause from, final int depth) {
        if (from instanceof FromClause.Table table) {
            sb.append(identifier(table.name()));
            if (!table.alias().equals(table.name())) {
                sb.append(" AS ").append(identifier(table.alias()));
            }
            return;
        }
        if (from instanceof FromClause.Subquery subquery) {
            sb.append("(\n");
            appendQuery(sb, subquery.query(), depth + 1);
            sb.append('\n').append(INDENT.repeat(depth)).append(") AS ").append(identifier(subquery.alias()));
            return;
        }
        final FromClause.Join join = (FromClause.Join) from;
        appendFrom(sb, join.left(), depth);
        sb.append('\n').append(INDENT.repeat(depth)).append(join.type().keyword()).append(' ');
        appendFrom(sb, join.right(), depth);
        if (join.type() != FromClause.JoinType.CROSS) {
            sb.append(" ON ");
            appendExpr(sb, join.on(), 0);
        }
    }

    private void appendExpr(final StringBuilder sb, final Expr expr, final int parentPrecedence) {
        final int precedence = precedence(expr);
        final boolean wrap = precedence < parentPrecedence;
        if (wrap) {
            sb.append('(');
        }
        if (expr instanceof Expr.Constant constant) {
            appendConstant(sb, constant.value());
        } else if (expr instanceof Expr.Field field) {
            appendField(sb, field);
        } else if (expr instanceof Expr.Call call) {
            appendCall(sb, call);
        } else if (expr instanceof Expr.And and) {
            appendJoined(sb, and.exprs(), " AND ", precedence);
        } else if (expr instanceof Expr.Or or) {
            appendJoined(sb, or.exprs(), " OR ", precedence);
        } else if (expr instanceof Expr.Not not) {
            sb.append("NOT ");
            appendExpr(sb, not.expr(), precedence + 1);
        } else if (expr instanceof Expr.Compare compare) {
            appendExpr(sb, compare.left(), precedence + 1);
            sb.append(' ').append(compare.op().symbol()).append(' ');
            if ((compare.op() == Expr.CompareOp.IN || compare.op() == Expr.CompareOp.NOT_IN)
                    && compare.right() instanceof Expr.Constant constant
                    && constant.value() instanceof List<?> values) {
                appendTupleLiteral(sb, values);
            } else {
                appendExpr(sb, compare.right(), precedence + 1);
            }
        } else if (expr instanceof Expr.Arithmetic arithmetic) {
            appendExpr(sb, arithmetic.left(), precedence);
            sb.append(' ').append(arithmetic.op().symbol()).append(' ');
            appendExpr(sb, arithmetic.right(), precedence + 1);
        } else if (expr instanceof Expr.Lambda lambda) {
            if (lambda.params().size() == 1) {
                sb.append(identifier(lambda.params().get(0)));
            } else {
                sb.append('(');
                for (int i = 0; i < lambda.params().size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append(identifier(lambda.params().get(i)));
                }
                sb.append(')');
            }
            sb.append(" -> ");
            appendExpr(sb, lambda.body(), 0);
        } else if (expr instanceof Expr.TupleElement element) {
            if (element.tuple() instanceof Expr.Field) {
                appendExpr(sb, element.tuple(), 0);
                sb.append('.').append(element.index());
            } else {
                sb.append("tupleElement(");
                appendExpr(sb, element.tuple(), 0);
                sb.append(", ").append(element.index()).append(')');
            }
        }
        if (wrap) {
            sb.append(')');
        }
    }

    private void appendJoined(
            final StringBuilder sb, final List<Expr> exprs, final String separator, final int precedence) {
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            appendExpr(sb, exprs.get(i), precedence + 1);
        }
    }

    private void appendCall(final StringBuilder sb, final Expr.Call call) {
        sb.append(call.name());
        if (!call.params().isEmpty()) {
            sb.append('(');
            appendArguments(sb, call.params());
            sb.append(')');
        }
        sb.append('(');
        if (call.distinct()) {
            sb.append("DISTINCT ");
        }
        appendArguments(sb, call.args());
        sb.append(')');
    }

    private void appendArguments(final StringBuilder sb, final List<Expr> args) {
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            appendExpr(sb, args.get(i), 0);
        }
    }

    private void appendField(final StringBuilder sb, final Expr.Field field) {
        final List<String> chain = field.chain();
        for (int i = 0; i < chain.size(); i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(identifier(chain.get(i)));
        }
    }

    private void appendConstant(final StringBuilder sb, final Object value) {
        if (value == null) {
            sb.append("NULL");
        } else if (value instanceof Boolean flag) {
            sb.append(flag ? "true" : "false");
        } else if (value instanceof Double || value instanceof Float) {
            sb.append(BigDecimal.valueOf(((Number) value).doubleValue()).stripTrailingZeros().toPlainString());
        } else if (value instanceof Number number) {
            sb.append(number);
        } else if (value instanceof Instant instant) {
            sb.append("toDateTime64(")
                    .append(quote(TIMESTAMP_FORMAT.format(instant.atZone(zone))))
                    .append(", 6, ")
                    .append(quote(zone.getId()))
                    .append(')');
        } else if (value instanceof List<?> values) {
            sb.append('[');
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                appendConstant(sb, values.get(i));
            }
            sb.append(']');
        } else {
            sb.append(quote(String.valueOf(value)));
        }
    }

    private void appendTupleLiteral(final StringBuilder sb, final List<?> values) {
        sb.append('(');
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            appendConstant(sb, values.get(i));
        }
        sb.append(')');
    }

    private static int precedence(final Expr expr) {
        if (expr instanceof Expr.Lambda) {
            return 0;
        }
        if (expr instanceof Expr.Or) {
            return 1;
        }
        if (expr instanceof Expr.And) {
            return 2;
        }
        if (expr instanceof Expr.Not) {
            return 3;
        }
        if (expr instanceof Expr.Compare) {
            return 4;
        }
        if (expr instanceof Expr.Arithmetic arithmetic) {
            return arithmetic.op() == Expr.ArithmeticOp.PLUS || arithmetic.op() == Expr.ArithmeticOp.MINUS ? 5 : 6;
        }
        return 7;
    }

    private static String lastSegment(final Expr.Field field) {
        return field.chain().get(field.chain().size() - 1);
    }

    static String identifier(final String name) {
        if (PLAIN_IDENTIFIER.matcher(name).matches()) {
            return name;
        }
        return '`' + name.replace("\\", "\\\\").replace("`", "\\`") + '`';
    }

    static String quote(final String value) {
        return '\'' + value.replace("\\", "\\\\").replace("'", "\\'") + '\'';
    }
}
