package io.topicvote.core.error;

/**
 * Abstract parent for errors raised while turning voting source text into an executable tree,
 * including registration. Carries the offending source text.
 */
public abstract class VotingDefinitionException extends VotingException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected VotingDefinitionException(String message, String votingName, Phase phase, String source) {
        super(message, votingName, phase);
        this.source = source;
    }

    protected VotingDefinitionException(
            String message, Throwable cause, String votingName, Phase phase, String source) {
        super(message, cause, votingName, phase);
        this.source = source;
    }

    /** The source text being processed, or {@code null} if unavailable. */
    public String source() {
        return source;
    }
}
