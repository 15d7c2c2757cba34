package io.topicvote.core.ast;

import io.topicvote.core.display.IndentWriter;
import io.topicvote.core.model.Value;
import io.topicvote.core.spi.VariableContext;
import java.util.Objects;

/** Nodes evaluated for their effect. Both yield {@link Value#EMPTY}. */
public sealed interface VotingStatement extends VotingExecutable {

    /** {@code if (condition) {...}} without an else branch. */
    record If(VotingExpression condition, VotingExecutableList block) implements VotingStatement {
        public If {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(block, "block");
        }

        @Override
        public Value execute(VariableContext context) {
            if (condition.execute(context).asBoolean()) {
                block.execute(context);
            }
            return Value.EMPTY;
        }

        @Override
        public void render(IndentWriter out) {
            out.write("if (").render(condition).write(") ");
            block.renderBraced(out);
        }

        @Override
        public String toString() {
            return toSource();
        }
    }

    /** {@code let name = ...}: binds the value in the current scope. */
    record SetVariable(String name, VotingExecutableList value) implements VotingStatement {
        public SetVariable {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Value execute(VariableContext context) {
            context.set(name, value.execute(context));
            return Value.EMPTY;
        }

        @Override
        public void render(IndentWriter out) {
            out.write("let ").write(name).write(" = ").render(value);
        }

        @Override
        public String toString() {
            return toSource();
        }
    }
}
