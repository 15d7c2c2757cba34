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

/** What a top-level parse produced. Every variant can be executed directly. */
public sealed interface InterpretedVoting extends VotingMethod, SourceRenderable {

    /** A bare build-in name such as {@code CombSum}. */
    record BuildIn(BuildInVoting voting) implements InterpretedVoting {
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

    /** A bare name that resolved to a registry entry. */
    record FromRegistry(String name, VotingFunction function) implements InterpretedVoting {
        public FromRegistry {
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

    /** An anonymous voting function. Rendered inside braces so that a limit suffix stays attached. */
    record Parsed(VotingFunction function) implements InterpretedVoting {
        public Parsed {
            Objects.requireNonNull(function, "function");
        }

        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return function.execute(global, voters);
        }

        @Override
        public void render(IndentWriter out) {
            function.renderBraced(out);
        }

        @Override
        public String toString() {
            return toSource();
        }
    }

    /** A {@code declare} block, ready to be stored in a registry. */
    record ForRegistry(NamedVoting voting) implements InterpretedVoting {
        public ForRegistry {
            Objects.requireNonNull(voting, "voting");
        }

        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return voting.function().execute(global, voters);
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

    record Limited(VotingWithLimit<InterpretedVoting> limited) implements InterpretedVoting {
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
