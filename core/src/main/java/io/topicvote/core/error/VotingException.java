package io.topicvote.core.error;

/**
 * Abstract base for all topicvote exceptions. Never thrown directly; use the concrete subclasses
 * under {@link VotingDefinitionException} or {@link VotingEvalException}.
 */
public abstract class VotingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        REGISTRATION,
        EVALUATION
    }

    private final String votingName;
    private final Phase phase;

    protected VotingException(String message, String votingName, Phase phase) {
        super(message);
        this.votingName = votingName;
        this.phase = phase;
    }

    protected VotingException(String message, Throwable cause, String votingName, Phase phase) {
        super(message, cause);
        this.votingName = votingName;
        this.phase = phase;
    }

    /** The named voting that triggered the error, or {@code null} if not identified. */
    public String votingName() {
        return votingName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
