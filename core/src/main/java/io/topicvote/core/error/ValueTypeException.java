package io.topicvote.core.error;

/** Thrown when a value does not have the type an operation requires. */
public final class ValueTypeException extends VotingEvalException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String actual;

    public ValueTypeException(String expected, String actual) {
        super("Expected a " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}
