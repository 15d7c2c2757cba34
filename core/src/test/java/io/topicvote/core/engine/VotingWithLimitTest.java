package io.topicvote.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.topicvote.core.buildin.BuildInVoting;
import io.topicvote.core.error.ValueTypeException;
import io.topicvote.core.model.Value;
import io.topicvote.core.model.VariableNames;
import io.topicvote.core.model.VotingContext;
import io.topicvote.core.spi.VotingMethod.VotingOutcome;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VotingWithLimitTest {

    private VotingContext global;
    private List<VotingContext> voters;

    @BeforeEach
    void setUp() {
        global = VotingContext.empty();
        voters = new ArrayList<>();
        for (long rank : new long[] {4, 2, 5, 1, 3}) {
            voters.add(VotingContext.empty()
                    .with(VariableNames.RANK, Value.of(rank))
                    .with(VariableNames.SCORE, Value.of(rank * 10.0)));
        }
    }

    @Test
    void usesTheBestRankedVoters() {
        VotingWithLimit<BuildInVoting> limited = new VotingWithLimit<>(2, BuildInVoting.CombSum);

        VotingOutcome<VotingContext> outcome = limited.executeWithVoters(global, voters);

        assertThat(outcome.value()).isEqualTo(Value.of(30.0));
        assertThat(outcome.voters())
                .extracting(v -> v.require(VariableNames.RANK))
                .containsExactly(Value.of(1L), Value.of(2L));
        assertThat(global.require(VariableNames.NUMBER_OF_VOTERS)).isEqualTo(Value.of(2L));
    }

    @Test
    void sortsTheCallersListInPlace() {
        new VotingWithLimit<>(3, BuildInVoting.CombSum).execute(global, voters);

        assertThat(voters)
                .extracting(v -> v.require(VariableNames.RANK).asInt())
                .containsExactly(1L, 2L, 3L, 4L, 5L);
    }

    @Test
    void leavesOrderAloneWhenWithinTheLimit() {
        VotingOutcome<VotingContext> outcome =
                new VotingWithLimit<>(5, BuildInVoting.CombSum).executeWithVoters(global, voters);

        assertThat(outcome.value()).isEqualTo(Value.of(150.0));
        assertThat(voters)
                .extracting(v -> v.require(VariableNames.RANK).asInt())
                .containsExactly(4L, 2L, 5L, 1L, 3L);
        assertThat(global.require(VariableNames.NUMBER_OF_VOTERS)).isEqualTo(Value.of(5L));
    }

    @Test
    void isIdempotent() {
        VotingWithLimit<BuildInVoting> limited = new VotingWithLimit<>(3, BuildInVoting.CombSum);

        Value first = limited.execute(global, voters);
        Value second = limited.execute(global, voters);

        assertThat(second).isEqualTo(first).isEqualTo(Value.of(60.0));
    }

    @Test
    void rankMustBeAnInt() {
        voters.get(0).set(VariableNames.RANK, Value.of(1.5));

        assertThatThrownBy(() -> new VotingWithLimit<>(2, BuildInVoting.CombSum).execute(global, voters))
                .isInstanceOf(ValueTypeException.class)
                .hasMessageContaining("Float");
    }

    @Test
    void nestedLimitsApplyTheInnerLimitLast() {
        VotingWithLimit<VotingWithLimit<BuildInVoting>> nested =
                new VotingWithLimit<>(4, new VotingWithLimit<>(1, BuildInVoting.CombSum));

        assertThat(nested.execute(global, voters)).isEqualTo(Value.of(10.0));
        assertThat(global.require(VariableNames.NUMBER_OF_VOTERS)).isEqualTo(Value.of(1L));
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThatThrownBy(() -> new VotingWithLimit<>(0, BuildInVoting.CombSum))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }

    @Test
    void rendersAsSuffix() {
        assertThat(new VotingWithLimit<>(7, BuildInVoting.RR)).hasToString("RR(7)");
    }
}
