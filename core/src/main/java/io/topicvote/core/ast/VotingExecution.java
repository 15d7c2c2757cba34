package io.topicvote.core.ast;

import io.topicvote.core.buildin.BuildInVoting;
import io.topicvote.core.display.IndentWriter;
import io.topicvote.core.display.SourceRenderable;
import io.topicvote.core.engine.VotingWithLimit;
import io.topicvote.core.model.Value;
import io.topicvote.core.spi.VariableContext;
import io.topicvote.core.spi.VotingMethod;
import java.util.List;
import java.util.Objects;

/** The target of an {@code execute(...)} operation. */
public sealed interface VotingExecution extends VotingMethod, SourceRenderable {

    record BuildIn(BuildInVoting voting) implements VotingExecution {
        public BuildIn {
            Objects.requireNonNull(voting, "voting");
        }

        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return voting.execute(global, voters);
        }

        @Override
        public void render(IndentWriter out) {
            out.render(voting);
        }

        @Override
        public String toString() {
            return toSource();
        }
    }

    /** A registry entry, resolved when the calling voting was parsed. */
    record Registered(String name, VotingFunction function) implements VotingExecution {
        public Registered {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(function, "function");
        }

        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return function.execute(global, voters);
        }

        @Override
        public void render(IndentWriter out) {
            out.write(name);
        }

        @Override
        public String toString() {
            return toSource();
        }
    }

    record Limited(VotingWithLimit<VotingExecution> limited) implements VotingExecution {
        public Limited {
            Objects.requireNonNull(limited, "limited");
        }

        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return limited.execute(global, voters);
        }

        @Override
        public <V extends VariableContext> VotingOutcome<V> executeWithVoters(VariableContext global, List<V> voters) {
            return limited.executeWithVoters(global, voters);
        }

        @Override
        public void render(IndentWriter out) {
            out.render(limited);
        }

        @Override
        public String toString() {
            return toSource();
        }
    }
}
