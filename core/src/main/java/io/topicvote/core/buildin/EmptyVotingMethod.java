package io.topicvote.core.buildin;

import io.topicvote.core.error.NoValueException;
import io.topicvote.core.model.Value;
import io.topicvote.core.spi.VariableContext;
import io.topicvote.core.spi.VotingMethod;
import java.util.List;

/** Placeholder voting for hosts that have not configured one. Always fails with {@link NoValueException}. */
public final class EmptyVotingMethod implements VotingMethod {

    public static final EmptyVotingMethod INSTANCE = new EmptyVotingMethod();

    private EmptyVotingMethod() {}

    @Override
    public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
        throw new NoValueException();
    }

    @Override
    public String toString() {
        return "EmptyVotingMethod";
    }
}
