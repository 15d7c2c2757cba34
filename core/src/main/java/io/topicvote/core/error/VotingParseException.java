package io.topicvote.core.error;

import java.util.List;

/**
 * Thrown when voting source text does not match the grammar. Carries the offset of the failure,
 * the derived line and column, and the stack of grammar contexts that were open when parsing
 * stopped (outermost first).
 */
public final class VotingParseException extends VotingDefinitionException {

    private static final long serialVersionUID = 1L;

    private final int offset;
    private final int line;
    private final int column;
    private final List<String> contexts;

    public VotingParseException(String message, String source, int offset, List<String> contexts) {
        super(format(message, source, offset, contexts), null, Phase.PARSE, source);
        this.offset = offset;
        this.line = lineOf(source, offset);
        this.column = columnOf(source, offset);
        this.contexts = List.copyOf(contexts);
    }

    public int offset() {
        return offset;
    }

    /** 1-based line of the failure. */
    public int line() {
        return line;
    }

    /** 1-based column of the failure. */
    public int column() {
        return column;
    }

    public List<String> contexts() {
        return contexts;
    }

    private static String format(String message, String source, int offset, List<String> contexts) {
        StringBuilder sb = new StringBuilder(message);
        sb.append(" at line ")
                .append(lineOf(source, offset))
                .append(", column ")
                .append(columnOf(source, offset));
        if (!contexts.isEmpty()) {
            sb.append(" (in ").append(String.join(" > ", contexts)).append(')');
        }
        return sb.toString();
    }

    private static int lineOf(String source, int offset) {
        if (source == null) {
            return 1;
        }
        int line = 1;
        for (int i = 0; i < Math.min(offset, source.length()); i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static int columnOf(String source, int offset) {
        if (source == null) {
            return offset + 1;
        }
        int end = Math.min(offset, source.length());
        int lineStart = source.lastIndexOf('\n', end - 1) + 1;
        return end - lineStart + 1;
    }
}
