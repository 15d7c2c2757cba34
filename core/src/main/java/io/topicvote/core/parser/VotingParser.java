package io.topicvote.core.parser;

import io.topicvote.core.aggregation.Aggregation;
import io.topicvote.core.aggregation.AggregationKind;
import io.topicvote.core.ast.IndexOrRange;
import io.topicvote.core.ast.InterpretedVoting;
import io.topicvote.core.ast.NamedVoting;
import io.topicvote.core.ast.VotingExecutable;
import io.topicvote.core.ast.VotingExecutableList;
import io.topicvote.core.ast.VotingExecution;
import io.topicvote.core.ast.VotingExpression;
import io.topicvote.core.ast.VotingFunction;
import io.topicvote.core.ast.VotingOperation;
import io.topicvote.core.ast.VotingStatement;
import io.topicvote.core.buildin.BuildInVoting;
import io.topicvote.core.engine.VotingRegistry;
import io.topicvote.core.engine.VotingWithLimit;
import io.topicvote.core.error.ExpressionCompileException;
import io.topicvote.core.error.VotingParseException;
import io.topicvote.core.model.VariableNames;
import io.topicvote.core.spi.ExpressionEngine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for voting source text.
 *
 * <p>A top-level text is, in order of preference: a limited wrapper ({@code X(n)}), a build-in
 * name, a registry name, a {@code declare name { ... }} block, or a voting function made of
 * {@code foreach:}, {@code global:}, {@code aggregate(...)} and {@code execute(...)} operations,
 * optionally wrapped in one pair of braces. Raw expressions inside the operations run until the
 * end of their line and are compiled by the configured {@link ExpressionEngine}.
 *
 * <p>Registry names are resolved while parsing, so the registry must already contain every name
 * the text refers to. Instances are immutable and thread-safe.
 */
public final class VotingParser {

    private static final Logger LOG = LoggerFactory.getLogger(VotingParser.class);

    /** Words that can never be used as variable or voting names. */
    public static final Set<String> KEYWORDS = Set.of("foreach", "global", "aggregate", "let", "execute", "declare");

    /** Non-alphanumeric characters that may appear in a raw expression outside of parentheses. */
    private static final String EXPRESSION_CHARS = "._+-*/%^=!<>&|,;:?~[] ";

    private final ExpressionEngine engine;
    private final VotingRegistry registry;

    /**
     * @param engine compiles raw expressions
     * @param registry resolves registry names, or {@code null} when no registry is available
     */
    public VotingParser(ExpressionEngine engine, VotingRegistry registry) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.registry = registry;
    }

    /**
     * Parses a complete voting text. Only whitespace may follow the parsed voting.
     *
     * @throws VotingParseException if the text does not match the grammar
     */
    public InterpretedVoting parse(String text) {
        Objects.requireNonNull(text, "text");
        VotingCursor cursor = new VotingCursor(text);
        InterpretedVoting result = topLevel(cursor);
        cursor.skipWhitespace();
        if (result == null || !cursor.atEnd()) {
            throw unresolvedNameOr(cursor, text);
        }
        LOG.debug("Parsed voting ({}): {}", result.getClass().getSimpleName(), result);
        return result;
    }

    /**
     * Parses a bare voting function, as found inside {@code declare} blocks.
     *
     * @throws VotingParseException if the text is not a voting function
     */
    public VotingFunction parseFunction(String text) {
        VotingCursor cursor = new VotingCursor(text);
        VotingFunction function = votingFunction(cursor, true);
        cursor.skipWhitespace();
        if (function == null || !cursor.atEnd()) {
            throw cursor.furthestFailure();
        }
        return function;
    }

    private VotingParseException unresolvedNameOr(VotingCursor cursor, String text) {
        String trimmed = text.strip();
        if (isVariableName(trimmed) && BuildInVoting.fromName(trimmed).isEmpty()) {
            if (registry == null) {
                return new VotingParseException(
                        "No registry provided to resolve the voting '" + trimmed + "'",
                        text,
                        text.indexOf(trimmed),
                        List.of("registry lookup"));
            }
            return new VotingParseException(
                    "No voting named '" + trimmed + "' found in the registry",
                    text,
                    text.indexOf(trimmed),
                    List.of("registry lookup"));
        }
        return cursor.furthestFailure();
    }

    // ── Top level ──

    private InterpretedVoting topLevel(VotingCursor c) {
        InterpretedVoting inner = internal(c);
        if (inner == null) {
            return null;
        }
        Integer limit = limitSuffix(c);
        return limit == null ? inner : new InterpretedVoting.Limited(new VotingWithLimit<>(limit, inner));
    }

    private InterpretedVoting internal(VotingCursor c) {
        int start = c.mark();
        c.skipWhitespace();
        Optional<BuildInVoting> buildIn = buildIn(c);
        if (buildIn.isPresent()) {
            return new InterpretedVoting.BuildIn(buildIn.get());
        }
        c.reset(start);
        c.skipWhitespace();
        String name = variableName(c);
        if (name != null) {
            Optional<VotingFunction> registered = lookup(name);
            if (registered.isPresent()) {
                return new InterpretedVoting.FromRegistry(name, registered.get());
            }
            c.fail("a registered voting name");
        }
        c.reset(start);
        NamedVoting declared = declaration(c);
        if (declared != null) {
            return new InterpretedVoting.ForRegistry(declared);
        }
        c.reset(start);
        VotingFunction function = votingFunction(c, false);
        if (function != null) {
            return new InterpretedVoting.Parsed(function);
        }
        c.reset(start);
        return null;
    }

    private Optional<BuildInVoting> buildIn(VotingCursor c) {
        int start = c.mark();
        String word = c.alphanumeric();
        if (word != null && !VotingCursor.isNamePart(c.peek())) {
            Optional<BuildInVoting> voting = BuildInVoting.fromName(word);
            if (voting.isPresent()) {
                return voting;
            }
        }
        c.reset(start);
        return Optional.empty();
    }

    private Optional<VotingFunction> lookup(String name) {
        return registry == null ? Optional.empty() : registry.get(name);
    }

    /** {@code (n)} after a voting; null when absent. */
    private Integer limitSuffix(VotingCursor c) {
        int start = c.mark();
        c.skipInlineWhitespace();
        if (c.peek() != '(') {
            c.reset(start);
            return null;
        }
        c.advance();
        c.skipInlineWhitespace();
        String digits = c.digits();
        c.skipInlineWhitespace();
        if (digits == null || c.peek() != ')') {
            c.reset(start);
            return c.fail("a voter limit like (10)");
        }
        int limit = positiveInt(c, digits, "voter limit");
        c.advance();
        return limit;
    }

    private NamedVoting declaration(VotingCursor c) {
        if (!c.tryKeyword("declare")) {
            return null;
        }
        return within(c, "declare", () -> {
            c.skipWhitespace();
            String name = letTarget(c);
            if (name == null) {
                return c.fail("a voting name");
            }
            if (!c.tryChar('{')) {
                return c.fail("'{'");
            }
            VotingFunction function = votingFunction(c, true);
            if (function == null) {
                return null;
            }
            if (!c.tryChar('}')) {
                throw c.error("Expected closing braces for declare block");
            }
            return new NamedVoting(name, function);
        });
    }

    // ── Voting functions and operations ──

    /**
     * One or more operations. With {@code bodyOnly} false the operations may be wrapped in a
     * single pair of braces.
     */
    private VotingFunction votingFunction(VotingCursor c, boolean bodyOnly) {
        int start = c.mark();
        if (!bodyOnly && c.tryChar('{')) {
            List<VotingOperation> operations = operations(c);
            if (operations.isEmpty()) {
                c.reset(start);
                return null;
            }
            if (!c.tryChar('}')) {
                c.skipWhitespace();
                throw c.error("Expected closing braces for voting function");
            }
            return operations.size() == 1
                    ? new VotingFunction.Single(operations.get(0), true)
                    : new VotingFunction.Multi(operations);
        }
        List<VotingOperation> operations = operations(c);
        if (operations.isEmpty()) {
            return null;
        }
        return operations.size() == 1
                ? new VotingFunction.Single(operations.get(0), false)
                : new VotingFunction.Multi(operations);
    }

    private List<VotingOperation> operations(VotingCursor c) {
        List<VotingOperation> operations = new ArrayList<>();
        while (true) {
            int start = c.mark();
            VotingOperation operation = operation(c);
            if (operation == null) {
                c.reset(start);
                return operations;
            }
            operations.add(operation);
        }
    }

    private VotingOperation operation(VotingCursor c) {
        if (c.tryKeyword("foreach")) {
            return within(c, "foreach", () -> {
                VotingExecutableList body = scopedBody(c);
                return body == null ? null : new VotingOperation.ForEach(body);
            });
        }
        if (c.tryKeyword("global")) {
            return within(c, "global", () -> {
                VotingExecutableList body = scopedBody(c);
                return body == null ? null : new VotingOperation.Global(body);
            });
        }
        if (c.tryKeyword("aggregate")) {
            return within(c, "aggregate", () -> aggregate(c));
        }
        if (c.tryKeyword("execute")) {
            return within(c, "execute", () -> execute(c));
        }
        return c.fail("one of foreach, global, aggregate, execute");
    }

    /** {@code : list} after {@code foreach} or {@code global}. */
    private VotingExecutableList scopedBody(VotingCursor c) {
        if (!c.tryChar(':')) {
            return c.fail("':'");
        }
        return executableList(c);
    }

    private VotingOperation aggregate(VotingCursor c) {
        if (!c.tryChar('(')) {
            return c.fail("'('");
        }
        c.tryKeyword("let");
        c.skipWhitespace();
        String name = letTarget(c);
        if (name == null) {
            return c.fail("a variable name");
        }
        if (!c.tryChar('=')) {
            return c.fail("'='");
        }
        c.skipWhitespace();
        Aggregation aggregation = aggregation(c);
        if (aggregation == null) {
            return null;
        }
        if (!c.tryChar(')')) {
            c.skipWhitespace();
            throw c.error("Expected closing parentheses for aggregate");
        }
        if (!c.tryChar(':')) {
            return c.fail("':'");
        }
        VotingExecutableList body = executableList(c);
        return body == null ? null : new VotingOperation.Aggregate(name, aggregation, body);
    }

    private VotingOperation execute(VotingCursor c) {
        if (!c.tryChar('(')) {
            return c.fail("'('");
        }
        if (!c.tryKeyword("let")) {
            return c.fail("'let'");
        }
        c.skipWhitespace();
        String name = letTarget(c);
        if (name == null) {
            return c.fail("a variable name");
        }
        if (!c.tryChar('=')) {
            return c.fail("'='");
        }
        c.skipWhitespace();
        VotingExecution call = call(c);
        if (call == null) {
            return null;
        }
        if (!c.tryChar(')')) {
            c.skipWhitespace();
            throw c.error("Expected closing parentheses for execute");
        }
        if (!c.tryChar(';')) {
            c.skipWhitespace();
            throw c.error("Expected ';' after execute(...)");
        }
        return new VotingOperation.Execute(name, call);
    }

    private VotingExecution call(VotingCursor c) {
        VotingExecution inner;
        Optional<BuildInVoting> buildIn = buildIn(c);
        if (buildIn.isPresent()) {
            inner = new VotingExecution.BuildIn(buildIn.get());
        } else {
            int start = c.mark();
            String name = variableName(c);
            if (name == null) {
                return c.fail("a build-in or registered voting name");
            }
            Optional<VotingFunction> registered = lookup(name);
            if (registered.isEmpty()) {
                c.reset(start);
                return c.fail(registry == null
                        ? "a build-in voting name (no registry provided)"
                        : "a build-in or registered voting name");
            }
            inner = new VotingExecution.Registered(name, registered.get());
        }
        Integer limit = limitSuffix(c);
        return limit == null ? inner : new VotingExecution.Limited(new VotingWithLimit<>(limit, inner));
    }

    /** {@code sumOf}, {@code sumOf(3)}, {@code sumOf(*)} or {@code sumOf limit(3)}. */
    Aggregation aggregation(VotingCursor c) {
        int start = c.mark();
        int end = start;
        while (Character.isLetter(c.peek()) && c.peek() < 128) {
            c.advance();
            end++;
        }
        Optional<AggregationKind> kind = AggregationKind.fromSourceName(c.source().substring(start, end));
        if (kind.isEmpty()) {
            c.reset(start);
            return c.fail("an aggregation (sumOf, maxOf, minOf, avgOf, gAvgOf)");
        }
        int afterKind = c.mark();
        boolean legacy = c.tryKeyword("limit");
        if (!c.tryChar('(')) {
            if (legacy) {
                return c.fail("'(' after limit");
            }
            c.reset(afterKind);
            return Aggregation.of(kind.get());
        }
        c.skipWhitespace();
        Aggregation result;
        if (c.peek() == '*') {
            c.advance();
            result = Aggregation.of(kind.get());
        } else {
            String digits = c.digits();
            if (digits == null) {
                return c.fail("a limit or '*'");
            }
            result = Aggregation.limited(kind.get(), positiveInt(c, digits, "aggregation limit"));
        }
        if (!c.tryChar(')')) {
            c.skipWhitespace();
            throw c.error("Expected closing parentheses for aggregation limit");
        }
        return result;
    }

    // ── Executable lists, statements and expressions ──

    private VotingExecutableList executableList(VotingCursor c) {
        int start = c.mark();
        if (c.tryChar('{')) {
            List<VotingExecutable> nodes = new ArrayList<>();
            while (true) {
                int before = c.mark();
                VotingExecutable node = expressionOrStatement(c);
                if (node == null) {
                    c.reset(before);
                    break;
                }
                nodes.add(node);
            }
            if (nodes.isEmpty()) {
                c.reset(start);
                return c.fail("at least one expression or statement");
            }
            if (!c.tryChar('}')) {
                c.skipWhitespace();
                throw c.error("Expected closing parentheses for block expr");
            }
            return VotingExecutableList.of(nodes).orElseThrow();
        }
        VotingExecutable node = expressionOrStatement(c);
        return node == null ? null : new VotingExecutableList.Single(node);
    }

    private VotingExecutable expressionOrStatement(VotingCursor c) {
        int start = c.mark();
        c.skipWhitespace();
        VotingStatement statement = statement(c);
        if (statement != null) {
            return statement;
        }
        c.reset(start);
        c.skipWhitespace();
        return expression(c);
    }

    private VotingStatement statement(VotingCursor c) {
        int start = c.mark();
        if (c.tryKeyword("if")) {
            VotingStatement.If ifStatement = within(c, "if", () -> {
                VotingExpression condition = condition(c);
                if (condition == null) {
                    return null;
                }
                VotingExecutableList block = executableList(c);
                return block == null ? null : new VotingStatement.If(condition, block);
            });
            if (ifStatement == null) {
                c.reset(start);
                return null;
            }
            int afterIf = c.mark();
            if (c.tryKeyword("else")) {
                // an if with an else branch is an expression
                c.reset(start);
                return null;
            }
            c.reset(afterIf);
            return ifStatement;
        }
        if (c.tryKeyword("let")) {
            return within(c, "let", () -> {
                c.skipWhitespace();
                String name = letTarget(c);
                if (name == null) {
                    return c.fail("a variable name");
                }
                if (!c.tryChar('=')) {
                    return c.fail("'='");
                }
                VotingExecutableList value = executableList(c);
                return value == null ? null : new VotingStatement.SetVariable(name, value);
            });
        }
        return null;
    }

    private VotingExpression expression(VotingCursor c) {
        int start = c.mark();
        VotingExpression tupleGet = tupleGet(c);
        if (tupleGet != null) {
            return tupleGet;
        }
        c.reset(start);
        VotingExpression ifElse = ifElse(c);
        if (ifElse != null) {
            return ifElse;
        }
        c.reset(start);
        return raw(c);
    }

    /** {@code (expression)} */
    private VotingExpression condition(VotingCursor c) {
        if (!c.tryChar('(')) {
            return c.fail("'('");
        }
        c.skipWhitespace();
        VotingExpression condition = expression(c);
        if (condition == null) {
            return null;
        }
        if (!c.tryChar(')')) {
            c.skipWhitespace();
            throw c.error("Expected closing parentheses for single expr");
        }
        return condition;
    }

    private VotingExpression ifElse(VotingCursor c) {
        if (!c.tryKeyword("if")) {
            return null;
        }
        return within(c, "if-else", () -> {
            VotingExpression condition = condition(c);
            if (condition == null) {
                return null;
            }
            VotingExecutableList ifBlock = executableList(c);
            if (ifBlock == null) {
                return null;
            }
            if (!c.tryKeyword("else")) {
                return c.fail("'else'");
            }
            VotingExecutableList elseBlock = executableList(c);
            return elseBlock == null ? null : new VotingExpression.IfElse(condition, ifBlock, elseBlock);
        });
    }

    private VotingExpression tupleGet(VotingCursor c) {
        String name = variableName(c);
        if (name == null) {
            return null;
        }
        c.skipInlineWhitespace();
        if (c.peek() != '[') {
            return c.fail("'['");
        }
        c.advance();
        return within(c, "tuple access", () -> {
            c.skipInlineWhitespace();
            IndexOrRange index = indexOrRange(c);
            if (index == null) {
                return null;
            }
            c.skipInlineWhitespace();
            if (c.peek() != ']') {
                throw c.error("Expected closing parentheses for tuple/array access (no newline)");
            }
            c.advance();
            return new VotingExpression.TupleGet(name, index);
        });
    }

    IndexOrRange indexOrRange(VotingCursor c) {
        if (c.startsWith("..=")) {
            c.reset(c.mark() + 3);
            c.skipInlineWhitespace();
            String to = c.digits();
            if (to == null) {
                throw c.error("A range to (..=) always needs a value");
            }
            return new IndexOrRange.RangeToInclusive(index(c, to));
        }
        if (c.startsWith("..")) {
            c.reset(c.mark() + 2);
            c.skipInlineWhitespace();
            String to = c.digits();
            return to == null ? new IndexOrRange.RangeFull() : new IndexOrRange.RangeTo(index(c, to));
        }
        String from = c.digits();
        if (from == null) {
            if (c.peek() == ']') {
                throw c.error("An empty index [] is not allowed");
            }
            return c.fail("an index or range");
        }
        int fromIndex = index(c, from);
        c.skipInlineWhitespace();
        if (c.startsWith("..=")) {
            c.reset(c.mark() + 3);
            c.skipInlineWhitespace();
            String to = c.digits();
            if (to == null) {
                throw c.error("A range to (..=) always needs a value");
            }
            return new IndexOrRange.RangeInclusive(fromIndex, index(c, to));
        }
        if (c.startsWith("..")) {
            c.reset(c.mark() + 2);
            c.skipInlineWhitespace();
            String to = c.digits();
            return to == null
                    ? new IndexOrRange.RangeFrom(fromIndex)
                    : new IndexOrRange.Range(fromIndex, index(c, to));
        }
        return new IndexOrRange.Index(fromIndex);
    }

    /** A raw expression running to the end of the line, compiled by the expression engine. */
    private VotingExpression raw(VotingCursor c) {
        int start = c.mark();
        String firstWord = c.identifier();
        c.reset(start);
        if (firstWord != null && (KEYWORDS.contains(firstWord) || firstWord.equals("else"))) {
            return c.fail("an expression");
        }
        while (!c.atEnd()) {
            char ch = c.peek();
            if (VotingCursor.isAsciiAlphanumeric(ch) || EXPRESSION_CHARS.indexOf(ch) >= 0) {
                c.advance();
            } else if (ch == '"' || ch == '\'') {
                stringLiteral(c);
            } else if (ch == '(') {
                parenthesised(c);
            } else {
                break;
            }
        }
        int end = c.mark();
        while (end > start && Character.isWhitespace(c.source().charAt(end - 1))) {
            end--;
        }
        if (end == start) {
            c.reset(start);
            return c.fail("an expression");
        }
        String text = c.source().substring(start, end);
        try {
            VotingExpression.Raw raw = new VotingExpression.Raw(engine.compile(text));
            c.reset(end);
            return raw;
        } catch (ExpressionCompileException e) {
            // reported at the end of the text so it outranks the alternatives tried at its start
            c.reset(end);
            c.fail("a valid expression (" + e.getMessage() + ")");
            c.reset(start);
            return null;
        }
    }

    private static void stringLiteral(VotingCursor c) {
        char quote = c.peek();
        c.advance();
        while (!c.atEnd() && c.peek() != '\n') {
            char ch = c.peek();
            c.advance();
            if (ch == '\\' && !c.atEnd()) {
                c.advance();
            } else if (ch == quote) {
                return;
            }
        }
    }

    private static void parenthesised(VotingCursor c) {
        c.advance();
        c.enter("parentheses");
        int depth = 1;
        while (depth > 0) {
            char ch = c.peek();
            if (c.atEnd() || ch == '\n' || ch == '\r') {
                throw c.error("Expected closing parentheses for single expr (no newline)");
            }
            if (ch == '"' || ch == '\'') {
                stringLiteral(c);
                continue;
            }
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
            }
            c.advance();
        }
        c.leave();
    }

    // ── Names and numbers ──

    /** A name that is not a keyword; null (without consuming) otherwise. */
    private static String variableName(VotingCursor c) {
        int start = c.mark();
        String name = c.identifier();
        if (name == null || KEYWORDS.contains(name)) {
            c.reset(start);
            return c.fail("a variable name");
        }
        return name;
    }

    /** A variable name that may be bound with {@code let}. Reserved names are a hard error. */
    private static String letTarget(VotingCursor c) {
        int start = c.mark();
        String name = variableName(c);
        if (name != null && VariableNames.isReserved(name)) {
            c.reset(start);
            throw c.error("The reserved variable name '" + name + "' can not be used as a let target");
        }
        return name;
    }

    private static boolean isVariableName(String text) {
        if (text.isEmpty() || !VotingCursor.isNameStart(text.charAt(0)) || KEYWORDS.contains(text)) {
            return false;
        }
        return text.chars().allMatch(ch -> VotingCursor.isNamePart((char) ch));
    }

    private static int positiveInt(VotingCursor c, String digits, String what) {
        int value = index(c, digits);
        if (value == 0) {
            throw c.error("The " + what + " must be positive");
        }
        return value;
    }

    private static int index(VotingCursor c, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw c.error("Invalid integer '" + digits + "'");
        }
    }

    private static <T> T within(VotingCursor c, String context, Supplier<T> body) {
        c.enter(context);
        try {
            return body.get();
        } finally {
            c.leave();
        }
    }
}
