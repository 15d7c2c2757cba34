package io.topicvote.core.error;

/** Thrown when an aggregation cannot produce a value from its inputs. */
public final class AggregationException extends VotingEvalException {

    private static final long serialVersionUID = 1L;

    /** The failure mode. */
    public enum Reason {
        NO_VALUES("No values to aggregate"),
        NO_MAX_FOUND("No maximum found"),
        NO_MIN_FOUND("No minimum found");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Reason reason;

    public AggregationException(Reason reason) {
        super(reason.message());
        this.reason = reason;
    }

    public AggregationException(Reason reason, Throwable cause) {
        super(reason.message(), cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
