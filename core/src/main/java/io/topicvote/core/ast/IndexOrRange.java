package io.topicvote.core.ast;

import io.topicvote.core.model.Value;
import java.util.List;
import java.util.Optional;

/**
 * The selector inside {@code name[...]}: a single index or one of the range forms. Single indices
 * yield the element; ranges yield a sub-tuple. Out-of-bounds access yields an empty result.
 */
public sealed interface IndexOrRange {

    /** Applies the selector, or returns empty when it does not fit {@code tuple}. */
    Optional<Value> access(List<Value> tuple);

    private static Optional<Value> slice(List<Value> tuple, int from, int to) {
        if (from > to || to > tuple.size()) {
            return Optional.empty();
        }
        return Optional.of(Value.tuple(tuple.subList(from, to)));
    }

    private static void requireNonNegative(int... bounds) {
        for (int bound : bounds) {
            if (bound < 0) {
                throw new IllegalArgumentException("Tuple indices must not be negative, got: " + bound);
            }
        }
    }

    /** {@code [i]} */
    record Index(int index) implements IndexOrRange {
        public Index {
            requireNonNegative(index);
        }

        @Override
        public Optional<Value> access(List<Value> tuple) {
            return index < tuple.size() ? Optional.of(tuple.get(index)) : Optional.empty();
        }

        @Override
        public String toString() {
            return Integer.toString(index);
        }
    }

    /** {@code [a..b]}, end exclusive. */
    record Range(int from, int to) implements IndexOrRange {
        public Range {
            requireNonNegative(from, to);
        }

        @Override
        public Optional<Value> access(List<Value> tuple) {
            return slice(tuple, from, to);
        }

        @Override
        public String toString() {
            return from + ".." + to;
        }
    }

    /** {@code [..b]} */
    record RangeTo(int to) implements IndexOrRange {
        public RangeTo {
            requireNonNegative(to);
        }

        @Override
        public Optional<Value> access(List<Value> tuple) {
            return slice(tuple, 0, to);
        }

        @Override
        public String toString() {
            return ".." + to;
        }
    }

    /** {@code [a..]} */
    record RangeFrom(int from) implements IndexOrRange {
        public RangeFrom {
            requireNonNegative(from);
        }

        @Override
        public Optional<Value> access(List<Value> tuple) {
            return slice(tuple, from, tuple.size());
        }

        @Override
        public String toString() {
            return from + "..";
        }
    }

    /** {@code [a..=b]} */
    record RangeInclusive(int from, int to) implements IndexOrRange {
        public RangeInclusive {
            requireNonNegative(from, to);
        }

        @Override
        public Optional<Value> access(List<Value> tuple) {
            if (to >= tuple.size()) {
                return Optional.empty();
            }
            return slice(tuple, from, to + 1);
        }

        @Override
        public String toString() {
            return from + "..=" + to;
        }
    }

    /** {@code [..=b]} */
    record RangeToInclusive(int to) implements IndexOrRange {
        public RangeToInclusive {
            requireNonNegative(to);
        }

        @Override
        public Optional<Value> access(List<Value> tuple) {
            if (to >= tuple.size()) {
                return Optional.empty();
            }
            return slice(tuple, 0, to + 1);
        }

        @Override
        public String toString() {
            return "..=" + to;
        }
    }

    /** {@code [..]} */
    record RangeFull() implements IndexOrRange {
        @Override
        public Optional<Value> access(List<Value> tuple) {
            return Optional.of(Value.tuple(tuple));
        }

        @Override
        public String toString() {
            return "..";
        }
    }
}
