package io.topicvote.core.display;

/** A tree node that can write itself back as voting source text. */
public interface SourceRenderable {

    void render(IndentWriter out);

    default String toSource() {
        IndentWriter out = new IndentWriter();
        render(out);
        return out.toString();
    }
}
