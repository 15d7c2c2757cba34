package io.topicvote.core.error;

/** Thrown when a tuple index or range does not fit the tuple it is applied to. */
public final class TupleGetException extends VotingEvalException {

    private static final long serialVersionUID = 1L;

    private final String variableName;
    private final String indexOrRange;
    private final int length;

    public TupleGetException(String variableName, String indexOrRange, int length) {
        super(String.format(
                "Index %s is out of bounds for tuple '%s' of length %d", indexOrRange, variableName, length));
        this.variableName = variableName;
        this.indexOrRange = indexOrRange;
        this.length = length;
    }

    public String variableName() {
        return variableName;
    }

    /** The rendered index or range, e.g. {@code 1..=3}. */
    public String indexOrRange() {
        return indexOrRange;
    }

    public int length() {
        return length;
    }
}
