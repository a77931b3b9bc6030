package org.opentimeline.expr;

/**
 * Thrown when a boolean tag expression is malformed.
 *
 * <p>{@link #position()} is the zero-based character offset where parsing stopped.
 */
public class ExpressionParseException extends IllegalArgumentException {

    private final int position;
    private final String reason;

    public ExpressionParseException(int position, String reason) {
        super("at position " + position + ": " + reason);
        this.position = position;
        this.reason = reason;
    }

    public int position() { return position; }

    public String reason() { return reason; }
}
