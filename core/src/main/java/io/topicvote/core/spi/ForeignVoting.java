package io.topicvote.core.spi;

import java.util.List;

/**
 * A voting implemented by the host instead of in the voting language. The result may be a {@link
 * io.topicvote.core.model.Value} or any plain object that {@link
 * io.topicvote.core.model.Value#from(Object)} accepts.
 */
@FunctionalInterface
public interface ForeignVoting {

    Object vote(ContextHandle global, List<ContextHandle> voters) throws Exception;
}
