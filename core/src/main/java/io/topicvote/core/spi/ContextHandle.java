package io.topicvote.core.spi;

import io.topicvote.core.model.Value;
import java.util.Map;

/**
 * Host-facing view of a context during a single foreign voting call. A handle is only valid while
 * the call that received it is running; any use afterwards fails with {@link
 * IllegalStateException}.
 */
public interface ContextHandle {

    /**
     * @throws io.topicvote.core.error.VariableNotFoundException if nothing is bound
     */
    Value get(String key);

    void set(String key, Value value);

    boolean contains(String key);

    /** Every binding, converted to plain Java objects. */
    Map<String, Object> snapshot();
}
