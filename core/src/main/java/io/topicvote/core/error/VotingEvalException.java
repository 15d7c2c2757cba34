package io.topicvote.core.error;

/**
 * Abstract parent for errors raised while a voting runs against a global context and its voters.
 * Nothing is retried: the first failure aborts the enclosing list, operation and function.
 */
public abstract class VotingEvalException extends VotingException {

    private static final long serialVersionUID = 1L;

    protected VotingEvalException(String message) {
        super(message, null, Phase.EVALUATION);
    }

    protected VotingEvalException(String message, Throwable cause) {
        super(message, cause, null, Phase.EVALUATION);
    }
}
