package io.topicvote.core.buildin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.topicvote.core.error.AggregationException;
import io.topicvote.core.error.NoValueException;
import io.topicvote.core.error.PartialOrderException;
import io.topicvote.core.error.VariableNotFoundException;
import io.topicvote.core.model.Value;
import io.topicvote.core.model.VariableNames;
import io.topicvote.core.model.VotingContext;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Tests for {@link BuildInVoting}. Three voters with scores 0.5, 0.25, 0.25 and reciprocal ranks
 * 1, 0.5, 0.25.
 */
@DisplayName("BuildInVoting")
class BuildInVotingTest {

    private VotingContext global;
    private List<VotingContext> voters;

    @BeforeEach
    void setUp() {
        global = VotingContext.empty()
                .with(VariableNames.NUMBER_OF_VOTERS, Value.of(3L))
                .with(VariableNames.SCORE_CANDIDATE, Value.of(0.7))
                .with(VariableNames.EPSILON, Value.of(1e-6));
        voters = new ArrayList<>(List.of(
                voter(3, 0.25, 0.25),
                voter(1, 0.5, 1.0),
                voter(2, 0.25, 0.5)));
    }

    private static VotingContext voter(long rank, double score, double rr) {
        return VotingContext.empty()
                .with(VariableNames.RANK, Value.of(rank))
                .with(VariableNames.SCORE, Value.of(score))
                .with(VariableNames.RECIPROCAL_RANK, Value.of(rr));
    }

    @ParameterizedTest(name = "{0} = {1}")
    @CsvSource({
        "CombSum, 1.0",
        "CombSumTop, 0.75",
        "CombSumPow2, 0.375",
        "CombMax, 0.5",
        "RR, 1.75",
        "RRPow2, 1.3125",
        "CombSumRR, 0.6875",
        "CombSumRRPow2, 0.578125",
        "CombSumPow2RR, 0.296875",
        "CombSumPow2RRPow2, 0.26953125",
        "ExpCombMnz, 3.375",
        "WCombSum, 0.3333333333333333",
        "PCombSum, 1.3333333333333333"
    })
    void formulas(String name, double expected) {
        BuildInVoting voting = BuildInVoting.fromName(name).orElseThrow();

        assertThat(voting.execute(global, voters).asNumber()).isCloseTo(expected, within(1e-12));
    }

    @Test
    void geometricFormulas() {
        double gavg = Math.cbrt(0.5 * 0.25 * 0.25);

        assertThat(BuildInVoting.GCombSum.execute(global, voters).asNumber()).isCloseTo(gavg, within(1e-12));
        assertThat(BuildInVoting.WCombSumG.execute(global, voters).asNumber())
                .isCloseTo((1.0 + gavg) / 4, within(1e-12));
        double lnSum = Math.log(0.5) + 2 * Math.log(0.25);
        assertThat(BuildInVoting.WGCombSum.execute(global, voters).asNumber())
                .isCloseTo(Math.exp((lnSum + Math.log(1.0 / 3)) / 4), within(1e-12));
    }

    @Test
    @DisplayName("OriginalScore and Voters pass the global value through unchanged")
    void passThrough() {
        assertThat(BuildInVoting.OriginalScore.execute(global, voters)).isEqualTo(Value.of(0.7));
        assertThat(BuildInVoting.Voters.execute(global, voters)).isEqualTo(Value.of(3L));
    }

    @Test
    @DisplayName("PCombSum without voters yields epsilon")
    void pCombSumWithoutVoters() {
        assertThat(BuildInVoting.PCombSum.execute(global, List.<VotingContext>of())).isEqualTo(Value.of(1e-6));
    }

    @Test
    void missingScoreIsReported() {
        List<VotingContext> withoutScore = List.of(VotingContext.empty().with(VariableNames.RECIPROCAL_RANK, Value.of(1.0)));

        assertThatThrownBy(() -> BuildInVoting.CombSum.execute(global, withoutScore))
                .isInstanceOf(VariableNotFoundException.class)
                .hasMessage("No value found for score!");
    }

    @Test
    void missingGlobalIsReported() {
        assertThatThrownBy(() -> BuildInVoting.OriginalScore.execute(VotingContext.empty(), voters))
                .isInstanceOf(VariableNotFoundException.class)
                .hasMessageContaining("score_candidate");
    }

    @Test
    @DisplayName("CombMax fails on incomparable scores")
    void combMaxOnNan() {
        voters.get(0).set(VariableNames.SCORE, Value.of(Double.NaN));

        assertThatThrownBy(() -> BuildInVoting.CombMax.execute(global, voters))
                .isInstanceOf(AggregationException.class)
                .hasCauseInstanceOf(PartialOrderException.class)
                .satisfies(e -> assertThat(((AggregationException) e).reason())
                        .isEqualTo(AggregationException.Reason.NO_MAX_FOUND));
    }

    @Test
    @DisplayName("CombSum without voters has no values")
    void combSumWithoutVoters() {
        assertThatThrownBy(() -> BuildInVoting.CombSum.execute(global, List.<VotingContext>of()))
                .isInstanceOf(AggregationException.class)
                .hasMessage("No values to aggregate");
    }

    @Nested
    @DisplayName("limit")
    class Limit {

        @Test
        @DisplayName("keeps the best-ranked voters and sets n_voters")
        void keepsBestRanked() {
            Value result = BuildInVoting.CombSum.limit(2).execute(global, voters);

            assertThat(result.asNumber()).isEqualTo(0.75);
            assertThat(global.require(VariableNames.NUMBER_OF_VOTERS)).isEqualTo(Value.of(2L));
        }

        @Test
        void rendersWithSuffix() {
            assertThat(BuildInVoting.PCombSum.limit(5).toSource()).isEqualTo("PCombSum(5)");
        }

        @Test
        void rejectsZero() {
            assertThatThrownBy(() -> BuildInVoting.CombSum.limit(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void lookupIsCaseSensitive() {
        assertThat(BuildInVoting.fromName("CombSum")).contains(BuildInVoting.CombSum);
        assertThat(BuildInVoting.fromName("combsum")).isEmpty();
        assertThat(BuildInVoting.values()).hasSize(18);
    }

    @Test
    void emptyVotingAlwaysFails() {
        assertThatThrownBy(() -> EmptyVotingMethod.INSTANCE.execute(global, voters))
                .isInstanceOf(NoValueException.class);
    }
}
