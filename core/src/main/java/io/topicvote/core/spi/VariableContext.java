package io.topicvote.core.spi;

import io.topicvote.core.error.VariableNotFoundException;
import io.topicvote.core.model.Value;
import java.util.Map;
import java.util.Optional;

/**
 * A mutable scope of named values that voting code reads and writes. Evaluation only needs this
 * port; hosts back it with whatever storage suits them.
 *
 * <p>
 * Implementations are not required to be thread-safe: a context belongs to a single evaluation.
 */
public interface VariableContext {

    /** The value bound to {@code name}, if any. */
    Optional<Value> get(String name);

    /** Binds {@code name} to {@code value}, replacing any existing binding. */
    void set(String name, Value value);

    boolean contains(String name);

    /** An immutable copy of every binding visible through this context. */
    Map<String, Value> snapshot();

    /**
     * The value bound to {@code name}.
     *
     * @throws VariableNotFoundException if nothing is bound
     */
    default Value require(String name) {
        return get(name).orElseThrow(() -> new VariableNotFoundException(name));
    }
}
