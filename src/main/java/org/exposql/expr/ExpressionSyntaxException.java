package org.exposql.expr;

/**
 * Raised when a user-supplied expression string cannot be parsed.
 */
public final class ExpressionSyntaxException extends IllegalArgumentException {
    private final int position;

    public ExpressionSyntaxException(final String message, final int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
