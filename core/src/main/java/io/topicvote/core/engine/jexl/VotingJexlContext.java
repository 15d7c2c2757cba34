package io.topicvote.core.engine.jexl;

import io.topicvote.core.model.Value;
import io.topicvote.core.spi.VariableContext;
import org.apache.commons.jexl3.JexlContext;

/** Exposes a {@link VariableContext} to JEXL. Values cross the boundary as plain Java objects. */
final class VotingJexlContext implements JexlContext {

    private final VariableContext variables;

    VotingJexlContext(VariableContext variables) {
        this.variables = variables;
    }

    @Override
    public Object get(String name) {
        return variables.get(name).map(Value::toJava).orElse(null);
    }

    @Override
    public void set(String name, Object value) {
        variables.set(name, Value.from(value));
    }

    @Override
    public boolean has(String name) {
        return variables.contains(name);
    }
}
