package io.topicvote.core.spi;

import io.topicvote.core.model.Value;

/**
 * An immutable, thread-safe compiled raw expression. Produced by {@link
 * ExpressionEngine#compile(String)}; a single instance is shared by every evaluation of the
 * voting that contains it.
 */
public interface CompiledExpression {

    /**
     * Evaluates this expression against the given context. Assignments write into the context.
     *
     * @param context the scope to read and write
     * @return the resulting value; an assignment yields the assigned value
     * @throws io.topicvote.core.error.VotingEvalException if evaluation fails at runtime
     */
    Value evaluate(VariableContext context);

    /** The expression text as compiled, without surrounding whitespace. */
    String source();
}
