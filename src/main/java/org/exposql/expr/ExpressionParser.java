package org.exposql.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Recursive-descent parser for the expression strings users type into metric definitions,
 * e.g. {@code sum(properties.price - properties.discount)} or {@code count(distinct properties.$session_id)}.
 */
public final class ExpressionParser {
    private final List<Token> tokens;
    private int index;

    private ExpressionParser(final String text) {
        this.tokens = tokenize(text);
        this.index = 0;
    }

    public static Expr parse(final String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            throw new ExpressionSyntaxException("expression must not be blank", 0);
        }
        final ExpressionParser parser = new ExpressionParser(text);
        final Expr expr = parser.parseOr();
        final Token trailing = parser.peek();
        if (trailing.type() != TokenType.END) {
            throw new ExpressionSyntaxException("unexpected '" + trailing.text() + "'", trailing.position());
        }
        return expr;
    }

    private Expr parseOr() {
        final List<Expr> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (acceptKeyword("OR")) {
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new Expr.Or(operands);
    }

    private Expr parseAnd() {
        final List<Expr> operands = new ArrayList<>();
        operands.add(parseNot());
        while (acceptKeyword("AND")) {
            operands.add(parseNot());
        }
        return operands.size() == 1 ? operands.get(0) : new Expr.And(operands);
    }

    private Expr parseNot() {
        if (acceptKeyword("NOT")) {
            return new Expr.Not(parseNot());
        }
        return parseComparison();
    }

    private Expr parseComparison() {
        final Expr left = parseAdditive();
        final Token token = peek();
        if (token.type() == TokenType.OPERATOR) {
            final Expr.CompareOp op = switch (token.text()) {
                case "=", "==" -> Expr.CompareOp.EQ;
                case "!=", "<>" -> Expr.CompareOp.NOT_EQ;
                case "<" -> Expr.CompareOp.LT;
                case "<=" -> Expr.CompareOp.LT_EQ;
                case ">" -> Expr.CompareOp.GT;
                case ">=" -> Expr.CompareOp.GT_EQ;
                default -> null;
            };
            if (op != null) {
                index++;
                return new Expr.Compare(op, left, parseAdditive());
            }
        }
        final boolean negated = acceptKeyword("NOT");
        if (acceptKeyword("IN")) {
            return new Expr.Compare(negated ? Expr.CompareOp.NOT_IN : Expr.CompareOp.IN, left, parseInList());
        }
        if (acceptKeyword("ILIKE")) {
            return new Expr.Compare(negated ? Expr.CompareOp.NOT_ILIKE : Expr.CompareOp.ILIKE, left, parseAdditive());
        }
        if (negated) {
            throw new ExpressionSyntaxException("expected IN or ILIKE after NOT", peek().position());
        }
        return left;
    }

    private Expr parseInList() {
        expect("(");
        final List<Object> values = new ArrayList<>();
        if (!accept(")")) {
            do {
                final Expr value = parseAdditive();
                if (!(value instanceof Expr.Constant constant)) {
                    throw new ExpressionSyntaxException("IN lists only accept literals", peek().position());
                }
                values.add(constant.value());
            } while (accept(","));
            expect(")");
        }
        return new Expr.Constant(values);
    }

    private Expr parseAdditive() {
        Expr left = parseMultiplicative();
        while (true) {
            if (accept("+")) {
                left = new Expr.Arithmetic(Expr.ArithmeticOp.PLUS, left, parseMultiplicative());
            } else if (accept("-")) {
                left = new Expr.Arithmetic(Expr.ArithmeticOp.MINUS, left, parseMultiplicative());
            } else {
                return left;
            }
        }
    }

    private Expr parseMultiplicative() {
        Expr left = parseUnary();
        while (true) {
            if (accept("*")) {
                left = new Expr.Arithmetic(Expr.ArithmeticOp.MULTIPLY, left, parseUnary());
            } else if (accept("/")) {
                left = new Expr.Arithmetic(Expr.ArithmeticOp.DIVIDE, left, parseUnary());
            } else {
                return left;
            }
        }
    }

    private Expr parseUnary() {
        if (accept("-")) {
            final Expr operand = parseUnary();
            if (operand instanceof Expr.Constant constant && constant.value() instanceof Long longValue) {
                return new Expr.Constant(-longValue);
            }
            if (operand instanceof Expr.Constant constant && constant.value() instanceof Double doubleValue) {
                return new Expr.Constant(-doubleValue);
            }
            return new Expr.Arithmetic(Expr.ArithmeticOp.MINUS, new Expr.Constant(0L), operand);
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        final Token token = next();
        switch (token.type()) {
            case NUMBER:
                return new Expr.Constant(parseNumber(token));
            case STRING:
                return new Expr.Constant(token.text());
            case OPERATOR:
                if ("(".equals(token.text())) {
                    final Expr inner = parseOr();
                    expect(")");
                    return inner;
                }
                throw new ExpressionSyntaxException("unexpected '" + token.text() + "'", token.position());
            case IDENTIFIER:
            case QUOTED_IDENTIFIER:
                return parseIdentifier(token);
            default:
                throw new ExpressionSyntaxException("unexpected end of expression", token.position());
        }
    }

    private Expr parseIdentifier(final Token first) {
        if (first.type() == TokenType.IDENTIFIER) {
            final String keyword = first.text().toUpperCase(Locale.ROOT);
            if ("TRUE".equals(keyword)) {
                return new Expr.Constant(Boolean.TRUE);
            }
            if ("FALSE".equals(keyword)) {
                return new Expr.Constant(Boolean.FALSE);
            }
            if ("NULL".equals(keyword)) {
                return new Expr.Constant(null);
            }
            if ("(".equals(peek().text()) && peek().type() == TokenType.OPERATOR) {
                return parseCall(first.text());
            }
        }

        final List<String> chain = new ArrayList<>();
        chain.add(first.text());
        while (accept(".")) {
            final Token segment = next();
            if (segment.type() == TokenType.NUMBER) {
                return new Expr.TupleElement(new Expr.Field(chain), Integer.parseInt(segment.text()));
            }
            if (segment.type() != TokenType.IDENTIFIER && segment.type() != TokenType.QUOTED_IDENTIFIER) {
                throw new ExpressionSyntaxException("expected identifier after '.'", segment.position());
            }
            chain.add(segment.text());
        }
        return new Expr.Field(chain);
    }

    private Expr parseCall(final String name) {
        expect("(");
        final boolean distinct = acceptKeyword("DISTINCT");
        if (!distinct && isStarArgument()) {
            // count(*) counts rows, so the operand is the constant 1
            index += 2;
            return new Expr.Call(name, List.of(), List.of(new Expr.Constant(1L)), false);
        }
        final List<Expr> first = parseArguments();
        if (!distinct && peek().type() == TokenType.OPERATOR && "(".equals(peek().text())) {
            expect("(");
            return new Expr.Call(name, first, parseArguments(), false);
        }
        return new Expr.Call(name, List.of(), first, distinct);
    }

    private List<Expr> parseArguments() {
        final List<Expr> args = new ArrayList<>();
        if (accept(")")) {
            return args;
        }
        do {
            args.add(parseOr());
        } while (accept(","));
        expect(")");
        return args;
    }

    private boolean isStarArgument() {
        final Token star = peek();
        final Token closing = tokens.get(Math.min(index + 1, tokens.size() - 1));
        return star.type() == TokenType.OPERATOR && "*".equals(star.text())
                && closing.type() == TokenType.OPERATOR && ")".equals(closing.text());
    }

    private static Object parseNumber(final Token token) {
        final String value = token.text();
        try {
            if (value.contains(".")) {
                return Double.parseDouble(value);
            }
            return Long.parseLong(value);
        } catch (final NumberFormatException exception) {
            throw new ExpressionSyntaxException("invalid number '" + value + "'", token.position());
        }
    }

    private boolean acceptKeyword(final String keyword) {
        final Token token = peek();
        if (token.type() == TokenType.IDENTIFIER && token.text().equalsIgnoreCase(keyword)) {
            index++;
            return true;
        }
        return false;
    }

    private boolean accept(final String operator) {
        final Token token = peek();
        if (token.type() == TokenType.OPERATOR && token.text().equals(operator)) {
            index++;
            return true;
        }
        return false;
    }

    private void expect(final String operator) {
        final Token token = peek();
        if (!accept(operator)) {
            final String found = token.type() == TokenType.END ? "end of expression" : "'" + token.text() + "'";
            throw new ExpressionSyntaxException("expected '" + operator + "' but found " + found, token.position());
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        final Token token = tokens.get(index);
        if (token.type() != TokenType.END) {
            index++;
        }
        return token;
    }

    private static List<Token> tokenize(final String text) {
        final List<Token> tokens = new ArrayList<>();
        int position = 0;
        while (position < text.length()) {
            final char c = text.charAt(position);
            if (Character.isWhitespace(c)) {
                position++;
                continue;
            }
            if (Character.isDigit(c)) {
                final int start = position;
                while (position < text.length()
                        && (Character.isDigit(text.charAt(position)) || text.charAt(position) == '.')) {
                    if (text.charAt(position) == '.'
                            && (position + 1 >= text.length() || !Character.isDigit(text.charAt(position + 1)))) {
                        break;
                    }
                    position++;
                }
                tokens.add(new Token(TokenType.NUMBER, text.substring(start, position), start));
                continue;
            }
            if (Character.isLetter(c) || c == '_' || c == '$') {
                final int start = position;
                while (position < text.length() && isIdentifierPart(text.charAt(position))) {
                    position++;
                }
                tokens.add(new Token(TokenType.IDENTIFIER, text.substring(start, position), start));
                continue;
            }
            if (c == '\'' || c == '`' || c == '"') {
                final int start = position;
                final StringBuilder value = new StringBuilder();
                position++;
                boolean closed = false;
                while (position < text.length()) {
                    final char current = text.charAt(position);
                    if (current == '\\' && position + 1 < text.length()) {
                        value.append(text.charAt(position + 1));
                        position += 2;
                        continue;
                    }
                    if (current == c) {
                        position++;
                        closed = true;
                        break;
                    }
                    value.append(current);
                    position++;
                }
                if (!closed) {
                    throw new ExpressionSyntaxException("unterminated quote", start);
                }
                tokens.add(new Token(c == '\'' ? TokenType.STRING : TokenType.QUOTED_IDENTIFIER, value.toString(), start));
                continue;
            }
            final String two = position + 1 < text.length() ? text.substring(position, position + 2) : "";
            if ("<=".equals(two) || ">=".equals(two) || "!=".equals(two) || "<>".equals(two) || "==".equals(two)) {
                tokens.add(new Token(TokenType.OPERATOR, two, position));
                position += 2;
                continue;
            }
            if ("()+-*/,.=<>".indexOf(c) >= 0) {
                tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), position));
                position++;
                continue;
            }
            throw new ExpressionSyntaxException("unexpected character '" + c + "'", position);
        }
        tokens.add(new Token(TokenType.END, "", text.length()));
        return tokens;
    }

    private static boolean isIdentifierPart(final char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private enum TokenType {
        NUMBER,
        STRING,
        IDENTIFIER,
        QUOTED_IDENTIFIER,
        OPERATOR,
        END
    }

    private record Token(TokenType type, String text, int position) {}
}
