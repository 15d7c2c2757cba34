package io.topicvote.standalone;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.topicvote.core.engine.VotingEngine;
import io.topicvote.core.model.Value;
import io.topicvote.core.model.VariableNames;
import io.topicvote.core.model.VotingContext;
import io.topicvote.core.spi.VotingMethod.VotingOutcome;
import io.topicvote.standalone.config.VotingConfig;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds a {@link VotingEngine} prepared from a {@link VotingConfig} and evaluates context
 * documents against it.
 *
 * <p>Construction registers the configured declarations, then the aliases. A broken declaration
 * fails construction with the parser's or registry's exception.
 */
public final class VotingRunner {

    private static final Logger LOG = LoggerFactory.getLogger(VotingRunner.class);

    private final VotingConfig config;
    private final VotingEngine engine;

    public VotingRunner(VotingConfig config) {
        this(config, new VotingEngine());
    }

    VotingRunner(VotingConfig config, VotingEngine engine) {
        this.config = Objects.requireNonNull(config, "config");
        this.engine = Objects.requireNonNull(engine, "engine");
        config.declarations().forEach(engine::register);
        config.aliases().forEach(engine::registerAt);
        LOG.info(
                "Voting runner ready: {} declaration(s), {} alias(es), {} registered name(s)",
                config.declarations().size(),
                config.aliases().size(),
                engine.registry().size());
    }

    public VotingEngine engine() {
        return engine;
    }

    /**
     * Evaluates {@code votingText}, or the configured default when it is null, over the document.
     * The configured epsilon is bound in the global context unless the document provides one.
     *
     * @return the output document
     * @throws IllegalArgumentException if there is no voting to evaluate
     */
    public ObjectNode run(ContextDocument document, String votingText) {
        String text = votingText != null ? votingText : config.defaultVoting();
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException(
                    "No voting to evaluate: pass --voting <text>, set votings.default or TOPICVOTE_DEFAULT_VOTING");
        }
        VotingContext global = document.global();
        if (!global.contains(VariableNames.EPSILON)) {
            global.set(VariableNames.EPSILON, Value.of(config.epsilon()));
        }
        VotingOutcome<VotingContext> outcome = engine.evaluate(text, global, document.voters());
        return ContextDocument.toJson(outcome.value(), global, document.voters());
    }
}
