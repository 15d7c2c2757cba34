package io.topicvote.core.ast;

import io.topicvote.core.display.IndentWriter;
import io.topicvote.core.error.TupleGetException;
import io.topicvote.core.error.ValueTypeException;
import io.topicvote.core.error.VariableNotFoundException;
import io.topicvote.core.model.Value;
import io.topicvote.core.spi.CompiledExpression;
import io.topicvote.core.spi.VariableContext;
import java.util.Objects;

/** Value-producing nodes. */
public sealed interface VotingExpression extends VotingExecutable {

    /** A raw arithmetic/boolean/string expression compiled by the expression engine. */
    record Raw(CompiledExpression expression) implements VotingExpression {
        public Raw {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public Value execute(VariableContext context) {
            return expression.evaluate(context);
        }

        @Override
        public void render(IndentWriter out) {
            out.write(expression.source());
        }

        @Override
        public String toString() {
            return toSource();
        }
    }

    /** {@code if (condition) {...} else {...}}, yielding the value of the branch taken. */
    record IfElse(VotingExpression condition, VotingExecutableList ifBlock, VotingExecutableList elseBlock)
            implements VotingExpression {
        public IfElse {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(ifBlock, "ifBlock");
            Objects.requireNonNull(elseBlock, "elseBlock");
        }

        @Override
        public Value execute(VariableContext context) {
            if (condition.execute(context).asBoolean()) {
                return ifBlock.execute(context);
            }
            return elseBlock.execute(context);
        }

        @Override
        public void render(IndentWriter out) {
            out.write("if (").render(condition).write(") ");
            ifBlock.renderBraced(out);
            out.write(" else ");
            elseBlock.renderBraced(out);
        }

        @Override
        public String toString() {
            return toSource();
        }
    }

    /** {@code name[index]} on a tuple-valued variable. */
    record TupleGet(String variableName, IndexOrRange index) implements VotingExpression {
        public TupleGet {
            Objects.requireNonNull(variableName, "variableName");
            Objects.requireNonNull(index, "index");
        }

        @Override
        public Value execute(VariableContext context) {
            Value value = context.get(variableName).orElseThrow(() -> new VariableNotFoundException(variableName));
            if (!(value instanceof Value.TupleValue tuple)) {
                throw new ValueTypeException("Tuple", value.typeName());
            }
            return index.access(tuple.values())
                    .orElseThrow(() -> new TupleGetException(variableName, index.toString(), tuple.values().size()));
        }

        @Override
        public void render(IndentWriter out) {
            out.write(variableName).write("[").write(index.toString()).write("]");
        }

        @Override
        public String toString() {
            return toSource();
        }
    }
}
