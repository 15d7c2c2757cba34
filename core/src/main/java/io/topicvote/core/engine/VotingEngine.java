package io.topicvote.core.engine;

import io.topicvote.core.ast.InterpretedVoting;
import io.topicvote.core.ast.NamedVoting;
import io.topicvote.core.display.SourceRenderable;
import io.topicvote.core.engine.jexl.JexlExpressionEngine;
import io.topicvote.core.error.VotingEvalException;
import io.topicvote.core.parser.VotingParser;
import io.topicvote.core.spi.ExpressionEngine;
import io.topicvote.core.spi.VariableContext;
import io.topicvote.core.spi.VotingMethod;
import io.topicvote.core.spi.VotingMethod.VotingOutcome;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point for hosts: parses voting text against a shared registry and evaluates votings with
 * logging around failures.
 *
 * <p>Thread-safe. Parsed votings are immutable; the registry synchronises its own state.
 */
public final class VotingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(VotingEngine.class);

    /** MDC key carrying the rendered voting while it is evaluated. */
    public static final String MDC_VOTING = "voting";

    private final ExpressionEngine expressionEngine;
    private final VotingRegistry registry;
    private final VotingParser parser;

    public VotingEngine() {
        this(new JexlExpressionEngine());
    }

    public VotingEngine(ExpressionEngine expressionEngine) {
        this(expressionEngine, new VotingRegistry(expressionEngine));
    }

    public VotingEngine(ExpressionEngine expressionEngine, VotingRegistry registry) {
        this.expressionEngine = Objects.requireNonNull(expressionEngine, "expressionEngine");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.parser = new VotingParser(expressionEngine, registry);
        LOG.debug("Voting engine created with expression engine '{}'", expressionEngine.id());
    }

    public ExpressionEngine expressionEngine() {
        return expressionEngine;
    }

    public VotingRegistry registry() {
        return registry;
    }

    /** Parses voting text, resolving names against this engine's registry. */
    public InterpretedVoting parse(String text) {
        return parser.parse(text);
    }

    /** See {@link VotingRegistry#register(String)}. */
    public NamedVoting register(String text) {
        return registry.register(text);
    }

    /** See {@link VotingRegistry#registerAt(String, String)}. */
    public NamedVoting registerAt(String name, String text) {
        return registry.registerAt(name, text);
    }

    /**
     * Evaluates {@code voting}. Evaluation failures are logged and rethrown unchanged.
     */
    public <V extends VariableContext> VotingOutcome<V> evaluate(
            VotingMethod voting, VariableContext global, List<V> voters) {
        String rendered = describe(voting);
        MDC.put(MDC_VOTING, rendered);
        try {
            VotingOutcome<V> outcome = voting.executeWithVoters(global, voters);
            LOG.debug("Voting {} over {} voter(s) returned {}", rendered, outcome.voters().size(), outcome.value());
            return outcome;
        } catch (VotingEvalException e) {
            LOG.warn("Voting {} failed: {}", rendered, e.getMessage());
            throw e;
        } finally {
            MDC.remove(MDC_VOTING);
        }
    }

    /** Parses and evaluates in one step. */
    public <V extends VariableContext> VotingOutcome<V> evaluate(
            String votingText, VariableContext global, List<V> voters) {
        return evaluate(parse(votingText), global, voters);
    }

    private static String describe(VotingMethod voting) {
        String text = voting instanceof SourceRenderable renderable ? renderable.toSource() : voting.toString();
        return text.replaceAll("\\s+", " ").strip();
    }
}
