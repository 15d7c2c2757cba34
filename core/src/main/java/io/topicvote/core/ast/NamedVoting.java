package io.topicvote.core.ast;

import io.topicvote.core.display.IndentWriter;
import io.topicvote.core.display.SourceRenderable;
import java.util.Objects;

/** The result of {@code declare name { ... }}: a function together with its registry name. */
public record NamedVoting(String name, VotingFunction function) implements SourceRenderable {

    public NamedVoting {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(function, "function");
    }

    @Override
    public void render(IndentWriter out) {
        out.write("declare ").write(name).write(" ");
        function.renderBraced(out);
    }

    @Override
    public String toString() {
        return toSource();
    }
}
