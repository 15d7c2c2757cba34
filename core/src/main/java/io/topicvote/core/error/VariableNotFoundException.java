package io.topicvote.core.error;

/** Thrown when a variable is read that neither the voter nor the global context defines. */
public final class VariableNotFoundException extends VotingEvalException {

    private static final long serialVersionUID = 1L;

    private final String identifier;

    public VariableNotFoundException(String identifier) {
        super("No value found for " + identifier + "!");
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
