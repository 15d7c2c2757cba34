package io.topicvote.core.ast;

import io.topicvote.core.aggregation.Aggregation;
import io.topicvote.core.display.IndentWriter;
import io.topicvote.core.display.SourceRenderable;
import io.topicvote.core.model.CombinedContext;
import io.topicvote.core.model.Value;
import io.topicvote.core.spi.VariableContext;
import java.util.List;
import java.util.Objects;

/** The top-level steps of a voting function; each decides which scope its body runs in. */
public sealed interface VotingOperation extends SourceRenderable {

    <V extends VariableContext> Value execute(VariableContext global, List<V> voters);

    /** {@code foreach: ...} runs the body once per voter. Yields Empty. */
    record ForEach(VotingExecutableList body) implements VotingOperation {
        public ForEach {
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            for (V voter : voters) {
                body.execute(new CombinedContext(global, voter));
            }
            return Value.EMPTY;
        }

        @Override
        public void render(IndentWriter out) {
            out.write("foreach: ").render(body);
        }

        @Override
        public String toString() {
            return toSource();
        }
    }

    /** {@code global: ...} runs the body once against the global scope. */
    record Global(VotingExecutableList body) implements VotingOperation {
        public Global {
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            return body.execute(global);
        }

        @Override
        public void render(IndentWriter out) {
            out.write("global: ").render(body);
        }

        @Override
        public String toString() {
            return toSource();
        }
    }

    /**
     * {@code aggregate(let name = sumOf(3)): ...} evaluates the body per voter, reduces the numbers
     * and binds the Float result to {@code name} in the global scope.
     */
    record Aggregate(String name, Aggregation aggregation, VotingExecutableList body) implements VotingOperation {
        public Aggregate {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(aggregation, "aggregation");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            double[] values = new double[voters.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = body.execute(new CombinedContext(global, voters.get(i))).asNumber();
            }
            Value result = Value.of(aggregation.calculateDesc(values));
            global.set(name, result);
            return result;
        }

        @Override
        public void render(IndentWriter out) {
            out.write("aggregate(let ")
                    .write(name)
                    .write(" = ")
                    .write(aggregation.toString())
                    .write("): ")
                    .render(body);
        }

        @Override
        public String toString() {
            return toSource();
        }
    }

    /** {@code execute(let name = CombSum);} runs another voting and binds its result globally. */
    record Execute(String name, VotingExecution execution) implements VotingOperation {
        public Execute {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(execution, "execution");
        }

        @Override
        public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
            Value result = execution.execute(global, voters);
            global.set(name, result);
            return result;
        }

        @Override
        public void render(IndentWriter out) {
            out.write("execute(let ").write(name).write(" = ").render(execution).write(");");
        }

        @Override
        public String toString() {
            return toSource();
        }
    }
}
