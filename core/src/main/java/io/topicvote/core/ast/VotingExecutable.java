package io.topicvote.core.ast;

import io.topicvote.core.display.SourceRenderable;
import io.topicvote.core.model.Value;
import io.topicvote.core.spi.VariableContext;

/** Anything that can appear inside an executable list: expressions, statements and nested lists. */
public sealed interface VotingExecutable extends SourceRenderable
        permits VotingExpression, VotingStatement, VotingExecutableList {

    /** Runs against {@code context}, which is either the global scope or a voter over the global scope. */
    Value execute(VariableContext context);
}
