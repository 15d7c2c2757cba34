package io.topicvote.core.model;

import io.topicvote.core.error.ValueTypeException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A value flowing through voting evaluation. The value domain is closed: strings, 64-bit floats,
 * 64-bit integers, booleans, tuples of values and the empty value.
 *
 * <p>
 * The {@code as*} accessors coerce or fail with a {@link ValueTypeException} naming the expected
 * and the actual type. {@link #toString()} renders the value as a literal the expression engine
 * reads back.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Value {

    /** Shared empty value. */
    Value EMPTY = new EmptyValue();

    /** Type name used in error messages, e.g. {@code "Int"}. */
    String typeName();

    /**
     * Numeric view of this value: Int and Float convert to {@code double}.
     *
     * @throws ValueTypeException for every other type
     */
    default double asNumber() {
        throw new ValueTypeException("number", typeName());
    }

    /** @throws ValueTypeException unless this is an Int */
    default long asInt() {
        throw new ValueTypeException("Int", typeName());
    }

    /** @throws ValueTypeException unless this is a Boolean */
    default boolean asBoolean() {
        throw new ValueTypeException("Boolean", typeName());
    }

    /** @throws ValueTypeException unless this is a String */
    default String asString() {
        throw new ValueTypeException("String", typeName());
    }

    /** @throws ValueTypeException unless this is a Tuple */
    default List<Value> asTuple() {
        throw new ValueTypeException("Tuple", typeName());
    }

    default boolean isNumber() {
        return false;
    }

    default boolean isEmpty() {
        return false;
    }

    /** Converts back into a plain Java object ({@code String, Double, Long, Boolean, List} or null). */
    Object toJava();

    // ── Factories ──

    static Value of(String value) {
        return new StringValue(value);
    }

    static Value of(double value) {
        return new FloatValue(value);
    }

    static Value of(long value) {
        return new IntValue(value);
    }

    static Value of(boolean value) {
        return new BooleanValue(value);
    }

    static Value tuple(Value... values) {
        return new TupleValue(List.of(values));
    }

    static Value tuple(List<Value> values) {
        return new TupleValue(values);
    }

    /**
     * Converts a host object into a value. Accepts {@code null} (Empty), {@link Value},
     * {@link CharSequence}, {@link Boolean}, integral numbers (Int), other numbers (Float) and
     * collections or arrays of those, primitive ones included (Tuple).
     *
     * @throws ValueTypeException if the object has no value equivalent
     */
    static Value from(Object object) {
        if (object == null) {
            return EMPTY;
        }
        if (object instanceof Value v) {
            return v;
        }
        if (object instanceof CharSequence s) {
            return new StringValue(s.toString());
        }
        if (object instanceof Boolean b) {
            return new BooleanValue(b);
        }
        if (object instanceof Long || object instanceof Integer || object instanceof Short || object instanceof Byte) {
            return new IntValue(((Number) object).longValue());
        }
        if (object instanceof Number n) {
            return new FloatValue(n.doubleValue());
        }
        if (object instanceof Collection<?> c) {
            List<Value> values = new ArrayList<>(c.size());
            for (Object element : c) {
                values.add(from(element));
            }
            return new TupleValue(values);
        }
        if (object instanceof Object[] array) {
            return from(Arrays.asList(array));
        }
        if (object instanceof int[] ints) {
            return new TupleValue(Arrays.stream(ints).mapToObj(i -> (Value) new IntValue(i)).toList());
        }
        if (object instanceof long[] longs) {
            return new TupleValue(Arrays.stream(longs).mapToObj(l -> (Value) new IntValue(l)).toList());
        }
        if (object instanceof double[] doubles) {
            return new TupleValue(Arrays.stream(doubles).mapToObj(d -> (Value) new FloatValue(d)).toList());
        }
        if (object instanceof boolean[] booleans) {
            List<Value> values = new ArrayList<>(booleans.length);
            for (boolean b : booleans) {
                values.add(new BooleanValue(b));
            }
            return new TupleValue(values);
        }
        throw new ValueTypeException("value-compatible object", object.getClass().getName());
    }

    // ── Implementations ──

    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String typeName() {
            return "String";
        }

        @Override
        public String asString() {
            return value;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("\"");
            for (char c : value.toCharArray()) {
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\t' -> sb.append("\\t");
                    default -> sb.append(c);
                }
            }
            return sb.append('"').toString();
        }
    }

    record FloatValue(double value) implements Value {
        @Override
        public String typeName() {
            return "Float";
        }

        @Override
        public double asNumber() {
            return value;
        }

        @Override
        public boolean isNumber() {
            return true;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    record IntValue(long value) implements Value {
        @Override
        public String typeName() {
            return "Int";
        }

        @Override
        public double asNumber() {
            return value;
        }

        @Override
        public long asInt() {
            return value;
        }

        @Override
        public boolean isNumber() {
            return true;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record BooleanValue(boolean value) implements Value {
        @Override
        public String typeName() {
            return "Boolean";
        }

        @Override
        public boolean asBoolean() {
            return value;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record TupleValue(List<Value> values) implements Value {
        public TupleValue {
            values = List.copyOf(values);
        }

        @Override
        public String typeName() {
            return "Tuple";
        }

        @Override
        public List<Value> asTuple() {
            return values;
        }

        @Override
        public Object toJava() {
            return values.stream().map(Value::toJava).collect(Collectors.toList());
        }

        @Override
        public String toString() {
            return values.stream().map(Value::toString).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    record EmptyValue() implements Value {
        @Override
        public String typeName() {
            return "Empty";
        }

        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public Object toJava() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }
}
