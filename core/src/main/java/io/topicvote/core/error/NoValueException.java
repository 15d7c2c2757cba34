package io.topicvote.core.error;

/** Thrown by a voting method that has no value to offer. */
public final class NoValueException extends VotingEvalException {

    private static final long serialVersionUID = 1L;

    public NoValueException() {
        super("The voting method produced no value");
    }
}
