package io.topicvote.core.spi;

/**
 * Pluggable engine for the raw expressions embedded in voting source text (arithmetic, boolean
 * and string expressions, assignments). The voting parser hands every raw expression extent to
 * the configured engine.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface ExpressionEngine {

    /**
     * Returns the engine identifier, e.g. {@code "jexl"}.
     *
     * @return a non-null, non-empty engine identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Compiles the given expression string into an immutable, thread-safe handle.
     *
     * @param expression the expression source code
     * @return a compiled expression ready for evaluation
     * @throws io.topicvote.core.error.ExpressionCompileException if the expression has syntax
     *     errors
     */
    CompiledExpression compile(String expression);
}
