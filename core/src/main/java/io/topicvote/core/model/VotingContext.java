package io.topicvote.core.model;

import io.topicvote.core.spi.VariableContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Insertion-ordered {@link VariableContext} backed by a {@link LinkedHashMap}. This is the
 * context used for the global scope and for each voter unless a host brings its own.
 */
public final class VotingContext implements VariableContext {

    private final Map<String, Value> values;

    private VotingContext(Map<String, Value> values) {
        this.values = values;
    }

    /** A new context with no bindings. */
    public static VotingContext empty() {
        return new VotingContext(new LinkedHashMap<>());
    }

    /** A new context holding a copy of {@code values}. */
    public static VotingContext of(Map<String, Value> values) {
        Objects.requireNonNull(values, "values");
        return new VotingContext(new LinkedHashMap<>(values));
    }

    /**
     * Builds a context from plain Java objects, converting each with {@link Value#from(Object)}.
     */
    public static VotingContext fromJava(Map<String, ?> values) {
        VotingContext context = empty();
        values.forEach((name, value) -> context.set(name, Value.from(value)));
        return context;
    }

    /** Fluent variant of {@link #set(String, Value)}. */
    public VotingContext with(String name, Value value) {
        set(name, value);
        return this;
    }

    @Override
    public Optional<Value> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    @Override
    public void set(String name, Value value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        values.put(name, value);
    }

    @Override
    public boolean contains(String name) {
        return values.containsKey(name);
    }

    @Override
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "VotingContext" + values;
    }
}
