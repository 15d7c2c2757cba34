package io.topicvote.core.model;

import io.topicvote.core.spi.VariableContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Overlays a voter context on the global context. Reads consult the voter first and fall back to
 * the global scope; writes always land in the voter.
 */
public final class CombinedContext implements VariableContext {

    private final VariableContext global;
    private final VariableContext voter;

    public CombinedContext(VariableContext global, VariableContext voter) {
        this.global = Objects.requireNonNull(global, "global");
        this.voter = Objects.requireNonNull(voter, "voter");
    }

    @Override
    public Optional<Value> get(String name) {
        Optional<Value> local = voter.get(name);
        return local.isPresent() ? local : global.get(name);
    }

    @Override
    public void set(String name, Value value) {
        voter.set(name, value);
    }

    @Override
    public boolean contains(String name) {
        return voter.contains(name) || global.contains(name);
    }

    @Override
    public Map<String, Value> snapshot() {
        Map<String, Value> merged = new LinkedHashMap<>(global.snapshot());
        merged.putAll(voter.snapshot());
        return Collections.unmodifiableMap(merged);
    }
}
