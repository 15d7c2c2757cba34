package io.topicvote.core.engine.jexl;

import io.topicvote.core.error.ExpressionCompileException;
import io.topicvote.core.error.ExpressionEvalException;
import io.topicvote.core.error.VariableNotFoundException;
import io.topicvote.core.error.VotingException;
import io.topicvote.core.model.Value;
import io.topicvote.core.spi.CompiledExpression;
import io.topicvote.core.spi.ExpressionEngine;
import io.topicvote.core.spi.VariableContext;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlException;
import org.apache.commons.jexl3.JexlFeatures;
import org.apache.commons.jexl3.JexlScript;
import org.apache.commons.jexl3.introspection.JexlPermissions;

/**
 * Default engine for raw expressions, backed by Apache Commons JEXL. Raw expressions are JEXL
 * scripts restricted to expressions, assignments and {@code ;} chains: loops, lambdas, local
 * variable declarations, {@code new}, pragmas and annotations are rejected at compile time.
 *
 * <p>Variables resolve against the {@link VariableContext} of the evaluation and assignments
 * write back into it. Tuples are JEXL array literals ({@code [1, 2]}). Numeric helpers are
 * top-level functions ({@link ExpressionFunctions}) and the {@code math:} namespace ({@link
 * MathFunctions}). Arithmetic follows {@link VotingArithmetic}.
 */
public final class JexlExpressionEngine implements ExpressionEngine {

    /** Engine identifier. */
    public static final String ENGINE_ID = "jexl";

    /** Namespace prefix of the {@link MathFunctions}, as in {@code math:ln(x)}. */
    public static final String MATH_NAMESPACE = "math";

    private static final JexlFeatures FEATURES = new JexlFeatures()
            .loops(false)
            .lambda(false)
            .localVar(false)
            .newInstance(false)
            .pragma(false)
            .annotation(false);

    private final JexlEngine jexl;

    public JexlExpressionEngine() {
        Map<String, Object> namespaces = new HashMap<>();
        namespaces.put(null, ExpressionFunctions.class);
        namespaces.put(MATH_NAMESPACE, MathFunctions.class);
        this.jexl = new JexlBuilder()
                .arithmetic(new VotingArithmetic(true))
                .namespaces(namespaces)
                .features(FEATURES)
                .permissions(JexlPermissions.RESTRICTED.compose(JexlExpressionEngine.class.getPackageName() + ".*"))
                .strict(true)
                .silent(false)
                .safe(false)
                .antish(false)
                .cache(512)
                .create();
    }

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledExpression compile(String expression) {
        String text = expression.strip();
        try {
            return new JexlCompiledExpression(jexl.createScript(text), text);
        } catch (JexlException e) {
            throw new ExpressionCompileException("Failed to compile expression: " + e.getMessage(), e, text);
        }
    }

    /** Thread-safe compiled script handle. */
    private static final class JexlCompiledExpression implements CompiledExpression {

        private final JexlScript script;
        private final String source;

        JexlCompiledExpression(JexlScript script, String source) {
            this.script = script;
            this.source = source;
        }

        @Override
        public Value evaluate(VariableContext context) {
            try {
                return Value.from(script.execute(new VotingJexlContext(context)));
            } catch (JexlException.Variable e) {
                if (e.isUndefined()) {
                    throw new VariableNotFoundException(e.getVariable());
                }
                throw new ExpressionEvalException(e.getMessage(), source);
            } catch (JexlException.Method e) {
                throw new ExpressionEvalException(
                        "Unknown function '" + e.getMethod() + "' or wrong number of arguments", source);
            } catch (JexlException e) {
                throw translate(e);
            }
        }

        private RuntimeException translate(JexlException e) {
            for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
                if (cause instanceof ExpressionEvalException eval && eval.expression() == null) {
                    return new ExpressionEvalException(eval.getMessage(), source);
                }
                if (cause instanceof VotingException voting) {
                    return voting;
                }
                if (cause instanceof ArithmeticException arithmetic && arithmetic.getMessage() != null) {
                    return new ExpressionEvalException(arithmetic.getMessage(), source);
                }
            }
            return new ExpressionEvalException("Evaluation failed: " + e.getMessage(), source);
        }

        @Override
        public String source() {
            return source;
        }

        @Override
        public String toString() {
            return source;
        }
    }
}
