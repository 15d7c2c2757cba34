package io.topicvote.core.engine;

import io.topicvote.core.display.IndentWriter;
import io.topicvote.core.display.SourceRenderable;
import io.topicvote.core.error.ValueTypeException;
import io.topicvote.core.model.Value;
import io.topicvote.core.model.VariableNames;
import io.topicvote.core.spi.VariableContext;
import io.topicvote.core.spi.VotingMethod;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Restricts a voting to the best-ranked voters. Written as a {@code (n)} suffix, e.g. {@code
 * CombSum(3)}.
 *
 * <p>When there are more voters than {@code limit}, the caller's list is sorted in place by the
 * integer {@value VariableNames#RANK} variable (ascending, stable) and the inner voting sees only
 * the first {@code limit} entries. The global {@value VariableNames#NUMBER_OF_VOTERS} is set to
 * the number of voters actually used in every case.
 */
public record VotingWithLimit<T extends VotingMethod>(int limit, T inner) implements VotingMethod, SourceRenderable {

    public VotingWithLimit {
        if (limit <= 0) {
            throw new IllegalArgumentException("Voter limit must be positive, got: " + limit);
        }
        Objects.requireNonNull(inner, "inner");
    }

    @Override
    public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
        return executeWithVoters(global, voters).value();
    }

    @Override
    public <V extends VariableContext> VotingOutcome<V> executeWithVoters(VariableContext global, List<V> voters) {
        List<V> used = voters;
        if (voters.size() > limit) {
            voters.sort(Comparator.comparingLong(VotingWithLimit::rankOf));
            used = voters.subList(0, limit);
        }
        global.set(VariableNames.NUMBER_OF_VOTERS, Value.of((long) used.size()));
        return new VotingOutcome<>(inner.execute(global, used), used);
    }

    private static long rankOf(VariableContext voter) {
        Value rank = voter.require(VariableNames.RANK);
        if (!(rank instanceof Value.IntValue)) {
            throw new ValueTypeException("Int rank", rank.typeName());
        }
        return rank.asInt();
    }

    @Override
    public void render(IndentWriter out) {
        if (inner instanceof SourceRenderable renderable) {
            out.render(renderable);
        } else {
            out.write(inner.toString());
        }
        out.write("(").write(Integer.toString(limit)).write(")");
    }

    @Override
    public String toString() {
        return toSource();
    }
}
