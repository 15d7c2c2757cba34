package io.topicvote.core.error;

/** Wraps a failure raised by a host-provided voting callable. */
public final class ForeignVotingException extends VotingEvalException {

    private static final long serialVersionUID = 1L;

    public ForeignVotingException(String message, Throwable cause) {
        super(message, cause);
    }
}
