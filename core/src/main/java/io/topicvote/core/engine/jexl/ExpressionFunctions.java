package io.topicvote.core.engine.jexl;

import io.topicvote.core.error.ExpressionEvalException;
import io.topicvote.core.error.ValueTypeException;
import io.topicvote.core.model.Value;
import java.util.List;
import java.util.Locale;

/**
 * Functions callable without a namespace in raw expressions, e.g. {@code max(a, b)} or {@code
 * len(t)}. {@code min} and {@code max} take two numbers or a single tuple and return the winning
 * operand unchanged, so Int stays Int.
 */
public final class ExpressionFunctions {

    private ExpressionFunctions() {
        // utility class
    }

    public static Object min(Object left, Object right) {
        return extreme("min", List.of(Value.from(left), Value.from(right)), true);
    }

    public static Object min(Object tuple) {
        return extreme("min", Value.from(tuple).asTuple(), true);
    }

    public static Object max(Object left, Object right) {
        return extreme("max", List.of(Value.from(left), Value.from(right)), false);
    }

    public static Object max(Object tuple) {
        return extreme("max", Value.from(tuple).asTuple(), false);
    }

    public static double floor(Object x) {
        return Math.floor(number(x));
    }

    public static double ceil(Object x) {
        return Math.ceil(number(x));
    }

    /** Rounds half away from zero: {@code round(-2.5)} is {@code -3.0}. */
    public static double round(Object x) {
        double value = number(x);
        return Math.signum(value) * Math.floor(Math.abs(value) + 0.5);
    }

    public static Object abs(Object x) {
        if (VotingArithmetic.isInt(x)) {
            long value = ((Number) x).longValue();
            if (value == Long.MIN_VALUE) {
                throw new ArithmeticException("Integer overflow: abs(" + value + ")");
            }
            return Math.abs(value);
        }
        return Math.abs(number(x));
    }

    public static long len(Object x) {
        Value value = Value.from(x);
        if (value instanceof Value.StringValue s) {
            return s.value().length();
        }
        if (value instanceof Value.TupleValue t) {
            return t.values().size();
        }
        throw new ValueTypeException("String or Tuple", value.typeName());
    }

    /** Lower-case type name of the value, e.g. {@code "float"}. */
    public static String typeOf(Object x) {
        return Value.from(x).typeName().toLowerCase(Locale.ROOT);
    }

    public static boolean contains(Object tuple, Object element) {
        return Value.from(tuple).asTuple().contains(Value.from(element));
    }

    public static boolean isNan(Object x) {
        return Double.isNaN(number(x));
    }

    public static boolean isFinite(Object x) {
        return Double.isFinite(number(x));
    }

    static double number(Object x) {
        return Value.from(x).asNumber();
    }

    private static Object extreme(String name, List<Value> values, boolean min) {
        if (values.isEmpty()) {
            throw new ExpressionEvalException(name + "() needs at least one value", null);
        }
        Value best = null;
        for (Value value : values) {
            double candidate = value.asNumber();
            if (best == null || (min ? candidate < best.asNumber() : candidate > best.asNumber())) {
                best = value;
            }
        }
        return best.toJava();
    }
}
