package org.opentimeline.resolve;

import org.opentimeline.expr.ExpressionParseException;

/**
 * Thrown when a contributing timeline carries a malformed tag expression.
 * {@link #timelineId()} names the timeline that owns the expression, which is not
 * necessarily the root being rendered.
 */
public class TimelineExpressionException extends ResolutionException {

    private final String expression;
    private final int position;
    private final String reason;

    public TimelineExpressionException(String timelineId, String expression, ExpressionParseException cause) {
        super(timelineId, "Timeline '" + timelineId + "' has an invalid expression "
                + "'" + expression + "' " + cause.getMessage(), cause);
        this.expression = expression;
        this.position = cause.position();
        this.reason = cause.reason();
    }

    public String expression() { return expression; }

    public int position() { return position; }

    public String reason() { return reason; }
}
