package io.topicvote.core.display;

/**
 * Text sink that indents every line after a newline by the current depth. Used to render voting
 * trees back to source.
 */
public final class IndentWriter {

    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();
    private int depth;
    private boolean lineStart = true;

    public IndentWriter write(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                out.append('\n');
                lineStart = true;
            } else {
                if (lineStart) {
                    out.append(INDENT.repeat(depth));
                    lineStart = false;
                }
                out.append(c);
            }
        }
        return this;
    }

    public IndentWriter newline() {
        return write("\n");
    }

    public IndentWriter indent() {
        depth++;
        return this;
    }

    public IndentWriter dedent() {
        if (depth == 0) {
            throw new IllegalStateException("Cannot dedent below zero");
        }
        depth--;
        return this;
    }

    /** Renders {@code node} at the current position. */
    public IndentWriter render(SourceRenderable node) {
        node.render(this);
        return this;
    }

    /** Writes an opening brace, the node on indented lines, and a closing brace on its own line. */
    public IndentWriter block(SourceRenderable node) {
        write("{").indent().newline();
        node.render(this);
        dedent().newline().write("}");
        return this;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
