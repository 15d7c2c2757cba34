package io.topicvote.core.engine;

import io.topicvote.core.error.ForeignVotingException;
import io.topicvote.core.error.VotingException;
import io.topicvote.core.model.Value;
import io.topicvote.core.spi.ContextHandle;
import io.topicvote.core.spi.ForeignVoting;
import io.topicvote.core.spi.VariableContext;
import io.topicvote.core.spi.VotingMethod;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a host-provided {@link ForeignVoting} as a {@link VotingMethod}.
 *
 * <p>Each call opens a session and hands the callable {@link ContextHandle}s bound to it. The
 * session is closed when the call returns, after which every handle from that call refuses to be
 * used. Failures raised by the callable are wrapped in {@link ForeignVotingException}; voting
 * errors pass through unchanged.
 */
public final class ForeignVotingAdapter implements VotingMethod {

    private final String name;
    private final ForeignVoting callable;

    public ForeignVotingAdapter(String name, ForeignVoting callable) {
        this.name = Objects.requireNonNull(name, "name");
        this.callable = Objects.requireNonNull(callable, "callable");
    }

    public String name() {
        return name;
    }

    @Override
    public <V extends VariableContext> Value execute(VariableContext global, List<V> voters) {
        Session session = new Session();
        try {
            ContextHandle globalHandle = new SessionHandle(session, global);
            List<ContextHandle> voterHandles = new ArrayList<>(voters.size());
            for (V voter : voters) {
                voterHandles.add(new SessionHandle(session, voter));
            }
            Object result = callable.vote(globalHandle, Collections.unmodifiableList(voterHandles));
            return Value.from(result);
        } catch (VotingException e) {
            throw e;
        } catch (Exception e) {
            throw new ForeignVotingException("Foreign voting '" + name + "' failed: " + e.getMessage(), e);
        } finally {
            session.close();
        }
    }

    @Override
    public String toString() {
        return "foreign:" + name;
    }

    /** Liveness token shared by the handles of one call. */
    private static final class Session {
        private volatile boolean open = true;

        void close() {
            open = false;
        }

        void check() {
            if (!open) {
                throw new IllegalStateException("Context handle used outside of its voting call");
            }
        }
    }

    private static final class SessionHandle implements ContextHandle {
        private final Session session;
        private final VariableContext context;

        SessionHandle(Session session, VariableContext context) {
            this.session = session;
            this.context = context;
        }

        @Override
        public Value get(String key) {
            session.check();
            return context.require(key);
        }

        @Override
        public void set(String key, Value value) {
            session.check();
            context.set(key, value);
        }

        @Override
        public boolean contains(String key) {
            session.check();
            return context.contains(key);
        }

        @Override
        public Map<String, Object> snapshot() {
            session.check();
            Map<String, Object> values = new LinkedHashMap<>();
            context.snapshot().forEach((key, value) -> values.put(key, value.toJava()));
            return Collections.unmodifiableMap(values);
        }
    }
}
