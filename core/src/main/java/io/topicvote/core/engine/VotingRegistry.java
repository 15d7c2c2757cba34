package io.topicvote.core.engine;

import io.topicvote.core.ast.InterpretedVoting;
import io.topicvote.core.ast.NamedVoting;
import io.topicvote.core.ast.VotingFunction;
import io.topicvote.core.buildin.BuildInVoting;
import io.topicvote.core.engine.jexl.JexlExpressionEngine;
import io.topicvote.core.error.RegistrationException;
import io.topicvote.core.error.RegistrationException.Reason;
import io.topicvote.core.parser.VotingParser;
import io.topicvote.core.spi.ExpressionEngine;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named voting functions that other votings can refer to by name. Names are unique: a bound name
 * is never rebound, and build-in names are never stored.
 *
 * <p>
 * Thread-safe: lookups share a read lock, registrations take the write lock. A failed
 * registration leaves the registry unchanged. Stored functions are immutable and shared, so
 * {@link #registerAt} binds both names to the same instance.
 */
public final class VotingRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(VotingRegistry.class);

    private final Map<String, VotingFunction> votings = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ExpressionEngine expressionEngine;

    /** A registry whose registrations compile raw expressions with the default engine. */
    public VotingRegistry() {
        this(new JexlExpressionEngine());
    }

    public VotingRegistry(ExpressionEngine expressionEngine) {
        this.expressionEngine = Objects.requireNonNull(expressionEngine, "expressionEngine");
    }

    /**
     * Looks up a voting by name.
     *
     * @return the shared function, or empty if nothing is bound to {@code name}
     */
    public Optional<VotingFunction> get(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(votings.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String name) {
        return get(name).isPresent();
    }

    /** The bound names in alphabetical order. */
    public Set<String> names() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(votings.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return votings.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Parses {@code text}, which must be a {@code declare name { ... }} block, and binds the
     * declared name.
     *
     * @return the registered voting
     * @throws RegistrationException if the text is not a declaration or the name is taken
     * @throws io.topicvote.core.error.VotingParseException if the text does not parse
     */
    public NamedVoting register(String text) {
        NamedVoting declared = declaration(text);
        bindAll(List.of(declared.name()), declared.function(), text);
        return declared;
    }

    /**
     * Like {@link #register(String)} but additionally binds {@code name}. Both names then refer
     * to the same function instance; either both bindings succeed or none is made.
     */
    public NamedVoting registerAt(String name, String text) {
        Objects.requireNonNull(name, "name");
        NamedVoting declared = declaration(text);
        List<String> names = declared.name().equals(name) ? List.of(name) : List.of(declared.name(), name);
        bindAll(names, declared.function(), text);
        return declared;
    }

    /**
     * Binds an already parsed function.
     *
     * @throws RegistrationException if {@code name} is a build-in name or already bound
     */
    public void bind(String name, VotingFunction function) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(function, "function");
        bindAll(List.of(name), function, null);
    }

    private NamedVoting declaration(String text) {
        InterpretedVoting parsed = new VotingParser(expressionEngine, this).parse(text);
        if (parsed instanceof InterpretedVoting.ForRegistry forRegistry) {
            return forRegistry.voting();
        }
        if (parsed instanceof InterpretedVoting.BuildIn buildIn) {
            throw new RegistrationException(Reason.BUILD_IN_NOT_REGISTRABLE, buildIn.voting().name(), text);
        }
        if (parsed instanceof InterpretedVoting.FromRegistry fromRegistry) {
            throw new RegistrationException(Reason.ALREADY_REGISTERED, fromRegistry.name(), text);
        }
        if (parsed instanceof InterpretedVoting.Limited) {
            throw new RegistrationException(Reason.LIMITED_NOT_REGISTRABLE, null, text);
        }
        throw new RegistrationException(Reason.MISSING_DECLARATION_NAME, null, text);
    }

    private void bindAll(List<String> names, VotingFunction function, String source) {
        lock.writeLock().lock();
        try {
            for (String name : names) {
                if (BuildInVoting.fromName(name).isPresent()) {
                    throw new RegistrationException(Reason.BUILD_IN_NOT_REGISTRABLE, name, source);
                }
                if (votings.containsKey(name)) {
                    throw new RegistrationException(Reason.ALREADY_REGISTERED, name, source);
                }
            }
            for (String name : names) {
                votings.put(name, function);
            }
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Registered voting {} ({} operation(s))", names, function.operations().size());
    }
}
