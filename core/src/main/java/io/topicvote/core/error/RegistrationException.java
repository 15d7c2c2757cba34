package io.topicvote.core.error;

/**
 * Thrown when a voting cannot be stored in a registry. The registry is left unchanged whenever
 * this is thrown.
 */
public final class RegistrationException extends VotingDefinitionException {

    private static final long serialVersionUID = 1L;

    /** Why the registration was refused. */
    public enum Reason {
        BUILD_IN_NOT_REGISTRABLE("BuildIn functions can not be registered!"),
        ALREADY_REGISTERED("The name is already registered!"),
        MISSING_DECLARATION_NAME("Missing the name for the registration!"),
        LIMITED_NOT_REGISTRABLE("You can not register a limited method!");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Reason reason;

    public RegistrationException(Reason reason, String votingName, String source) {
        super(
                votingName == null ? reason.message() : reason.message() + " (" + votingName + ")",
                votingName,
                Phase.REGISTRATION,
                source);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
