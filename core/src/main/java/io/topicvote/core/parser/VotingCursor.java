package io.topicvote.core.parser;

import io.topicvote.core.error.VotingParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Position in the voting source with backtracking support. Soft failures are remembered at the
 * furthest offset reached so that the final error points at the most plausible culprit; hard
 * failures abort parsing immediately.
 */
final class VotingCursor {

    private final String source;
    private final Deque<String> contexts = new ArrayDeque<>();
    private int pos;

    private int furthestOffset = -1;
    private String furthestExpected;
    private List<String> furthestContexts = List.of();

    VotingCursor(String source) {
        this.source = source;
    }

    String source() {
        return source;
    }

    int mark() {
        return pos;
    }

    void reset(int mark) {
        pos = mark;
    }

    boolean atEnd() {
        return pos >= source.length();
    }

    /** The current character, or {@code '\0'} at the end of input. */
    char peek() {
        return atEnd() ? '\0' : source.charAt(pos);
    }

    char peek(int ahead) {
        int at = pos + ahead;
        return at < source.length() ? source.charAt(at) : '\0';
    }

    void advance() {
        pos++;
    }

    boolean startsWith(String text) {
        return source.startsWith(text, pos);
    }

    /** Skips spaces, tabs and line breaks. */
    void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    /** Skips spaces and tabs only. */
    void skipInlineWhitespace() {
        while (!atEnd() && (peek() == ' ' || peek() == '\t')) {
            pos++;
        }
    }

    /** Consumes {@code c} after optional whitespace, or leaves the position untouched. */
    boolean tryChar(char c) {
        int start = pos;
        skipWhitespace();
        if (peek() == c && !atEnd()) {
            pos++;
            return true;
        }
        pos = start;
        return false;
    }

    /** Consumes {@code keyword} after optional whitespace when it is not followed by a name character. */
    boolean tryKeyword(String keyword) {
        int start = pos;
        skipWhitespace();
        if (startsWith(keyword) && !isNamePart(peek(keyword.length()))) {
            pos += keyword.length();
            return true;
        }
        pos = start;
        return false;
    }

    /** Reads {@code [A-Za-z_][A-Za-z0-9_]*} at the current position, or returns null. */
    String identifier() {
        if (!isNameStart(peek())) {
            return null;
        }
        int start = pos;
        while (!atEnd() && isNamePart(peek())) {
            pos++;
        }
        return source.substring(start, pos);
    }

    /** Reads a run of ASCII letters and digits, or returns null. */
    String alphanumeric() {
        int start = pos;
        while (!atEnd() && isAsciiAlphanumeric(peek())) {
            pos++;
        }
        return pos > start ? source.substring(start, pos) : null;
    }

    /** Reads a run of decimal digits, or returns null. */
    String digits() {
        int start = pos;
        while (!atEnd() && peek() >= '0' && peek() <= '9') {
            pos++;
        }
        return pos > start ? source.substring(start, pos) : null;
    }

    void enter(String context) {
        contexts.addLast(context);
    }

    void leave() {
        contexts.removeLast();
    }

    /** Records a soft failure and returns null so callers can {@code return cursor.fail(...)}. */
    <T> T fail(String expected) {
        if (pos > furthestOffset) {
            furthestOffset = pos;
            furthestExpected = expected;
            furthestContexts = new ArrayList<>(contexts);
        }
        return null;
    }

    /** A hard failure at the current position. */
    VotingParseException error(String message) {
        return new VotingParseException(message, source, pos, new ArrayList<>(contexts));
    }

    /** The error for the furthest soft failure, or for the current position if none was recorded. */
    VotingParseException furthestFailure() {
        if (furthestOffset < 0 || furthestOffset < pos) {
            String found = atEnd() ? "end of input" : "'" + peek() + "'";
            return new VotingParseException("Unexpected " + found, source, pos, List.of());
        }
        return new VotingParseException(
                "Expected " + furthestExpected, source, furthestOffset, furthestContexts);
    }

    static boolean isNameStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isNamePart(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }

    static boolean isAsciiAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
