package io.topicvote.core.buildin;

import static io.topicvote.core.model.VariableNames.EPSILON;
import static io.topicvote.core.model.VariableNames.NUMBER_OF_VOTERS;
import static io.topicvote.core.model.VariableNames.RECIPROCAL_RANK;
import static io.topicvote.core.model.VariableNames.SCORE;
import static io.topicvote.core.model.VariableNames.SCORE_CANDIDATE;

import io.topicvote.core.aggregation.Aggregation;
import io.topicvote.core.aggregation.AggregationKind;
import io.topicvote.core.aggregation.PartialOrder;
import io.topicvote.core.ast.InterpretedVoting;
import io.topicvote.core.display.IndentWriter;
import io.topicvote.core.display.SourceRenderable;
import io.topicvote.core.engine.VotingWithLimit;
import io.topicvote.core.error.AggregationException;
import io.topicvote.core.error.AggregationException.Reason;
import io.topicvote.core.error.PartialOrderException;
import io.topicvote.core.model.Value;
import io.topicvote.core.spi.VariableContext;
import io.topicvote.core.spi.VotingMethod;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;
import java.util.stream.DoubleStream;

/**
 * The fixed table of score fusion formulas that can be referenced by name. Names are matched
 * case-sensitively against the enum constant names.
 *
 * <p>Voter formulas read {@code score} and {@code rr} from each voter; {@code n_voters}, {@code
 * score_candidate} and {@code epsilon} come from the global context.
 */
public enum BuildInVoting implements VotingMethod, SourceRenderable {

    /** The candidate's own score, unchanged. */
    OriginalScore {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return global.require(SCORE_CANDIDATE);
        }
    },
    /** The number of voters. */
    Voters {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return global.require(NUMBER_OF_VOTERS);
        }
    },
    CombSum {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return Value.of(AggregationKind.SUM_OF.aggregate(scores(voters)));
        }
    },
    /** Geometric mean of the scores. */
    GCombSum {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return Value.of(AggregationKind.GAVG_OF.aggregate(scores(voters)));
        }
    },
    /** Sum of the two highest scores. */
    CombSumTop {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return Value.of(TOP_TWO.calculateDesc(scores(voters)));
        }
    },
    CombSumPow2 {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return Value.of(sumOver(voters, v -> square(number(v, SCORE))));
        }
    },
    CombMax {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return Value.of(strictMax(scores(voters)));
        }
    },
    RR {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return Value.of(sumOver(voters, v -> number(v, RECIPROCAL_RANK)));
        }
    },
    RRPow2 {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return Value.of(sumOver(voters, v -> square(number(v, RECIPROCAL_RANK))));
        }
    },
    CombSumRR {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return Value.of(sumOver(voters, v -> number(v, SCORE) * number(v, RECIPROCAL_RANK)));
        }
    },
    CombSumRRPow2 {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return Value.of(sumOver(voters, v -> number(v, SCORE) * square(number(v, RECIPROCAL_RANK))));
        }
    },
    CombSumPow2RR {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return Value.of(sumOver(voters, v -> square(number(v, SCORE)) * number(v, RECIPROCAL_RANK)));
        }
    },
    CombSumPow2RRPow2 {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return Value.of(sumOver(voters, v -> square(number(v, SCORE)) * square(number(v, RECIPROCAL_RANK))));
        }
    },
    /** {@link #CombSumPow2} plus the number of voters. */
    ExpCombMnz {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            long n = global.require(NUMBER_OF_VOTERS).asInt();
            return Value.of(CombSumPow2.execute(global, voters).asNumber() + n);
        }
    },
    /** (sum + mean) / (n + 1) over the scores. */
    WCombSum {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            double n = global.require(NUMBER_OF_VOTERS).asNumber();
            double sum = AggregationKind.SUM_OF.aggregate(scores(voters));
            double avg = AggregationKind.AVG_OF.aggregate(scores(voters));
            return Value.of((sum + avg) / (n + 1));
        }
    },
    /** (sum + geometric mean) / (n + 1) over the scores. */
    WCombSumG {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            double n = global.require(NUMBER_OF_VOTERS).asNumber();
            double sum = AggregationKind.SUM_OF.aggregate(scores(voters));
            double gavg = AggregationKind.GAVG_OF.aggregate(scores(voters));
            return Value.of((sum + gavg) / (n + 1));
        }
    },
    /** exp((sum of ln score + ln mean) / (n + 1)). */
    WGCombSum {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            double n = global.require(NUMBER_OF_VOTERS).asNumber();
            double lnSum = AggregationKind.SUM_OF.aggregate(scores(voters).map(Math::log));
            double avg = AggregationKind.AVG_OF.aggregate(scores(voters));
            return Value.of(Math.exp((lnSum + Math.log(avg)) / (n + 1)));
        }
    },
    /** Mean score plus the highest reciprocal rank; {@code epsilon} when there are no voters. */
    PCombSum {
        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            if (voters.isEmpty()) {
                return global.require(EPSILON);
            }
            double n = global.require(NUMBER_OF_VOTERS).asNumber();
            double sum = AggregationKind.SUM_OF.aggregate(scores(voters));
            double maxRr = strictMax(column(voters, RECIPROCAL_RANK));
            return Value.of(sum / n + maxRr);
        }
    };

    private static final Aggregation TOP_TWO = Aggregation.limited(AggregationKind.SUM_OF, 2);

    /** Case-sensitive lookup by name. */
    public static Optional<BuildInVoting> fromName(String name) {
        for (BuildInVoting voting : values()) {
            if (voting.name().equals(name)) {
                return Optional.of(voting);
            }
        }
        return Optional.empty();
    }

    /** This build-in restricted to the {@code limit} best-ranked voters. */
    public InterpretedVoting limit(int limit) {
        return new InterpretedVoting.Limited(new VotingWithLimit<>(limit, new InterpretedVoting.BuildIn(this)));
    }

    @Override
    public void render(IndentWriter out) {
        out.write(name());
    }

    private static <V extends VariableContext> DoubleStream scores(List<V> voters) {
        return column(voters, SCORE);
    }

    private static <V extends VariableContext> DoubleStream column(List<V> voters, String name) {
        double[] values = new double[voters.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = number(voters.get(i), name);
        }
        return DoubleStream.of(values);
    }

    private static <V extends VariableContext> double sumOver(List<V> voters, ToDoubleFunction<V> term) {
        double[] values = new double[voters.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = term.applyAsDouble(voters.get(i));
        }
        return AggregationKind.SUM_OF.aggregate(DoubleStream.of(values));
    }

    private static double number(VariableContext voter, String name) {
        return voter.require(name).asNumber();
    }

    private static double square(double x) {
        return x * x;
    }

    private static double strictMax(DoubleStream values) {
        try {
            return PartialOrder.max(values).orElseThrow(() -> new AggregationException(Reason.NO_MAX_FOUND));
        } catch (PartialOrderException e) {
            throw new AggregationException(Reason.NO_MAX_FOUND, e);
        }
    }
}
