package io.topicvote.core.error;

/** Thrown when a raw expression fails to compile (syntax error in the expression engine). */
public final class ExpressionCompileException extends VotingDefinitionException {

    private static final long serialVersionUID = 1L;

    public ExpressionCompileException(String message, String source) {
        super(message, null, Phase.PARSE, source);
    }

    public ExpressionCompileException(String message, Throwable cause, String source) {
        super(message, cause, null, Phase.PARSE, source);
    }
}
