package io.topicvote.core.spi;

import io.topicvote.core.model.Value;
import java.util.List;

/**
 * Anything that turns a global context and a list of voter contexts into a single value: parsed
 * voting functions, build-ins, limited wrappers and host callables alike.
 */
public interface VotingMethod {

    /**
     * Runs the voting. The contexts are mutated in place; the method never adds or removes voters
     * from the caller's view except where documented (see {@code VotingWithLimit}).
     */
    <V extends VariableContext> Value execute(VariableContext global, List<V> voters);

    /**
     * Like {@link #execute} but also reports which voters took part in the result.
     */
    default <V extends VariableContext> VotingOutcome<V> executeWithVoters(VariableContext global, List<V> voters) {
        return new VotingOutcome<>(execute(global, voters), voters);
    }

    /** Runs the voting and coerces the result to a number. */
    default <V extends VariableContext> double executeToDouble(VariableContext global, List<V> voters) {
        return execute(global, voters).asNumber();
    }

    /** A voting result together with the voters that produced it. */
    record VotingOutcome<V extends VariableContext>(Value value, List<V> voters) {}
}
