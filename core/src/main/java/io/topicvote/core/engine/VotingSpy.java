package io.topicvote.core.engine;

import io.topicvote.core.model.Value;
import io.topicvote.core.model.VariableNames;
import io.topicvote.core.spi.VariableContext;
import io.topicvote.core.spi.VotingMethod;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decorates a voting and records, for every successful evaluation, the candidate being scored,
 * the result and the score of each voter. Used to inspect how a fusion formula behaves across a
 * whole translation run.
 *
 * <p>Thread-safe.
 */
public final class VotingSpy implements VotingMethod {

    private final VotingMethod inner;
    private final List<SpyEntry> history = new ArrayList<>();

    public VotingSpy(VotingMethod inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    @Override
    public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
        return executeWithVoters(global, voters).value();
    }

    @Override
    public <V extends VariableContext> VotingOutcome<V> executeWithVoters(VariableContext global, List<V> voters) {
        VotingOutcome<V> outcome = inner.executeWithVoters(global, voters);
        List<VoterScore> scores = new ArrayList<>(outcome.voters().size());
        for (V voter : outcome.voters()) {
            scores.add(new VoterScore(
                    voter.get(VariableNames.VOTER_ID).orElse(Value.EMPTY),
                    voter.get(VariableNames.SCORE).orElse(Value.EMPTY)));
        }
        SpyEntry entry = new SpyEntry(
                global.get(VariableNames.TOPIC_ID).orElse(Value.EMPTY),
                global.get(VariableNames.CANDIDATE_ID).orElse(Value.EMPTY),
                global.get(VariableNames.SCORE_CANDIDATE).orElse(Value.EMPTY),
                outcome.value(),
                scores);
        synchronized (history) {
            history.add(entry);
        }
        return outcome;
    }

    /** Snapshot of the recorded evaluations in order. */
    public List<SpyEntry> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public void clear() {
        synchronized (history) {
            history.clear();
        }
    }

    public VotingMethod inner() {
        return inner;
    }

    /** One recorded evaluation. Missing variables are recorded as Empty. */
    public record SpyEntry(Value topicId, Value candidateId, Value candidateScore, Value result, List<VoterScore> voters) {
        public SpyEntry {
            voters = List.copyOf(voters);
        }
    }

    public record VoterScore(Value voterId, Value score) {}
}
