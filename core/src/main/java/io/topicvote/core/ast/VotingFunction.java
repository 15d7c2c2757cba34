package io.topicvote.core.ast;

import io.topicvote.core.display.IndentWriter;
import io.topicvote.core.display.SourceRenderable;
import io.topicvote.core.model.Value;
import io.topicvote.core.spi.VariableContext;
import io.topicvote.core.spi.VotingMethod;
import java.util.List;
import java.util.Objects;

/**
 * A parsed voting: one or more operations run in order, the last one's value being the result.
 * Instances are immutable and may be shared between registry names and threads.
 */
public sealed interface VotingFunction extends VotingMethod, SourceRenderable {

    /** The operations in order. */
    List<VotingOperation> operations();

    @Override
    default <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
        Value last = Value.EMPTY;
        for (VotingOperation operation : operations()) {
            last = operation.execute(global, voters);
        }
        return last;
    }

    /** Renders the operations one per line, without surrounding braces. */
    default void renderBody(IndentWriter out) {
        List<VotingOperation> operations = operations();
        for (int i = 0; i < operations.size(); i++) {
            if (i > 0) {
                out.newline();
            }
            out.render(operations.get(i));
        }
    }

    /** Renders the operations inside braces. */
    default void renderBraced(IndentWriter out) {
        out.write("{").indent().newline();
        renderBody(out);
        out.dedent().newline().write("}");
    }

    /**
     * A single operation. {@code wasRoot} records that the source wrapped it in braces and only
     * affects rendering.
     */
    record Single(VotingOperation operation, boolean wasRoot) implements VotingFunction {
        public Single {
            Objects.requireNonNull(operation, "operation");
        }

        @Override
        public List<VotingOperation> operations() {
            return List.of(operation);
        }

        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return operation.execute(global, voters);
        }

        @Override
        public void render(IndentWriter out) {
            if (wasRoot) {
                renderBraced(out);
            } else {
                renderBody(out);
            }
        }

        @Override
        public String toString() {
            return toSource();
        }
    }

    record Multi(List<VotingOperation> operations) implements VotingFunction {
        public Multi {
            operations = List.copyOf(operations);
            if (operations.isEmpty()) {
                throw new IllegalArgumentException("A voting function needs at least one operation");
            }
        }

        @Override
        public void render(IndentWriter out) {
            renderBody(out);
        }

        @Override
        public String toString() {
            return toSource();
        }
    }
}
