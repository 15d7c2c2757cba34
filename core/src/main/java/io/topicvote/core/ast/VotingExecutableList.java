package io.topicvote.core.ast;

import io.topicvote.core.display.IndentWriter;
import io.topicvote.core.model.Value;
import io.topicvote.core.spi.VariableContext;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A non-empty sequence of executables run in order. The value of the last one is the value of the
 * list; the first failure aborts the rest.
 */
public sealed interface VotingExecutableList extends VotingExecutable {

    /** Packs {@code nodes} into a list, or returns empty when there are none. */
    static Optional<VotingExecutableList> of(List<VotingExecutable> nodes) {
        if (nodes.isEmpty()) {
            return Optional.empty();
        }
        if (nodes.size() == 1) {
            return Optional.of(new Single(nodes.get(0)));
        }
        return Optional.of(new Multiple(nodes));
    }

    /** The executables in order. */
    List<VotingExecutable> nodes();

    @Override
    default Value execute(VariableContext context) {
        Value last = Value.EMPTY;
        for (VotingExecutable node : nodes()) {
            last = node.execute(context);
        }
        return last;
    }

    /** Renders the list between braces regardless of its size. */
    default void renderBraced(IndentWriter out) {
        out.write("{").indent().newline();
        renderItems(out);
        out.dedent().newline().write("}");
    }

    private void renderItems(IndentWriter out) {
        List<VotingExecutable> nodes = nodes();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                out.newline();
            }
            out.render(nodes.get(i));
        }
    }

    record Single(VotingExecutable node) implements VotingExecutableList {
        public Single {
            Objects.requireNonNull(node, "node");
        }

        @Override
        public List<VotingExecutable> nodes() {
            return List.of(node);
        }

        @Override
        public Value execute(VariableContext context) {
            return node.execute(context);
        }

        @Override
        public void render(IndentWriter out) {
            out.render(node);
        }

        @Override
        public String toString() {
            return toSource();
        }
    }

    record Multiple(List<VotingExecutable> nodes) implements VotingExecutableList {
        public Multiple {
            nodes = List.copyOf(nodes);
            if (nodes.isEmpty()) {
                throw new IllegalArgumentException("An executable list must not be empty");
            }
        }

        @Override
        public void render(IndentWriter out) {
            renderBraced(out);
        }

        @Override
        public String toString() {
            return toSource();
        }
    }
}
