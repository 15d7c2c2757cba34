package io.topicvote.core.error;

/**
 * Thrown when a raw expression fails at runtime for a reason other than a missing variable or a
 * value of the wrong type, e.g. integer overflow, division by zero or an unknown function.
 */
public final class ExpressionEvalException extends VotingEvalException {

    private static final long serialVersionUID = 1L;

    private final String expression;

    public ExpressionEvalException(String message, String expression) {
        super(expression == null ? message : message + " in '" + expression + "'");
        this.expression = expression;
    }

    /** The expression source that failed, or {@code null}. */
    public String expression() {
        return expression;
    }
}
