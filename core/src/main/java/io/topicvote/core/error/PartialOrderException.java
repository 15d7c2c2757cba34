package io.topicvote.core.error;

/**
 * Thrown by a strict partial-order scan when two values cannot be compared. {@code candidate} is
 * the best value found so far and {@code cause} the value that broke the scan; both are NaN when
 * the very first comparison failed.
 */
public final class PartialOrderException extends VotingEvalException {

    private static final long serialVersionUID = 1L;

    private final double candidate;
    private final double cause;

    public PartialOrderException(double candidate, double cause) {
        super("Values " + candidate + " and " + cause + " are not comparable");
        this.candidate = candidate;
        this.cause = cause;
    }

    public double candidate() {
        return candidate;
    }

    public double cause() {
        return cause;
    }
}
