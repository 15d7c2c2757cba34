package io.topicvote.core.engine.jexl;

import io.topicvote.core.error.ValueTypeException;
import io.topicvote.core.model.Value;
import java.math.MathContext;
import org.apache.commons.jexl3.JexlArithmetic;

/**
 * JEXL arithmetic over the voting value domain.
 *
 * <p>Integral operands stay 64-bit integers; overflow and integer division by zero raise an
 * {@link ArithmeticException}. A floating operand promotes the operation to IEEE doubles, so
 * {@code 1.0 / 0} is infinite and every ordering with NaN is false. {@code +} concatenates two
 * strings. Equality is structural over {@link Value}s: an Int never equals a Float and tuples
 * compare element-wise.
 */
public class VotingArithmetic extends JexlArithmetic {

    public VotingArithmetic(boolean strict) {
        super(strict);
    }

    public VotingArithmetic(boolean strict, MathContext bigdContext, int bigdScale) {
        super(strict, bigdContext, bigdScale);
    }

    @Override
    protected JexlArithmetic createWithOptions(boolean strict, MathContext bigdContext, int bigdScale) {
        return new VotingArithmetic(strict, bigdContext, bigdScale);
    }

    @Override
    public Object add(Object left, Object right) {
        if (left instanceof CharSequence && right instanceof CharSequence) {
            return left.toString() + right;
        }
        if (bothInts(left, right)) {
            long l = longOf(left);
            long r = longOf(right);
            try {
                return Math.addExact(l, r);
            } catch (ArithmeticException e) {
                throw overflow(l + " + " + r);
            }
        }
        return doubleOf(left) + doubleOf(right);
    }

    @Override
    public Object subtract(Object left, Object right) {
        if (bothInts(left, right)) {
            long l = longOf(left);
            long r = longOf(right);
            try {
                return Math.subtractExact(l, r);
            } catch (ArithmeticException e) {
                throw overflow(l + " - " + r);
            }
        }
        return doubleOf(left) - doubleOf(right);
    }

    @Override
    public Object multiply(Object left, Object right) {
        if (bothInts(left, right)) {
            long l = longOf(left);
            long r = longOf(right);
            try {
                return Math.multiplyExact(l, r);
            } catch (ArithmeticException e) {
                throw overflow(l + " * " + r);
            }
        }
        return doubleOf(left) * doubleOf(right);
    }

    @Override
    public Object divide(Object left, Object right) {
        if (bothInts(left, right)) {
            long l = longOf(left);
            long r = longOf(right);
            if (r == 0) {
                throw new ArithmeticException("Division by zero: " + l + " / " + r);
            }
            if (l == Long.MIN_VALUE && r == -1) {
                throw overflow(l + " / " + r);
            }
            return l / r;
        }
        return doubleOf(left) / doubleOf(right);
    }

    @Override
    public Object mod(Object left, Object right) {
        if (bothInts(left, right)) {
            long l = longOf(left);
            long r = longOf(right);
            if (r == 0) {
                throw new ArithmeticException("Division by zero: " + l + " % " + r);
            }
            return l % r;
        }
        return doubleOf(left) % doubleOf(right);
    }

    @Override
    public Object negate(Object operand) {
        if (isInt(operand)) {
            long value = ((Number) operand).longValue();
            if (value == Long.MIN_VALUE) {
                throw overflow("-(" + value + ")");
            }
            return -value;
        }
        return -doubleOf(operand);
    }

    @Override
    public boolean equals(Object left, Object right) {
        Value l = Value.from(left);
        Value r = Value.from(right);
        if (l instanceof Value.FloatValue lf && r instanceof Value.FloatValue rf) {
            return lf.value() == rf.value();
        }
        return l.equals(r);
    }

    @Override
    public boolean lessThan(Object left, Object right) {
        if (anyFloat(left, right)) {
            return doubleOf(left) < doubleOf(right);
        }
        return super.lessThan(left, right);
    }

    @Override
    public boolean lessThanOrEqual(Object left, Object right) {
        if (anyFloat(left, right)) {
            return doubleOf(left) <= doubleOf(right);
        }
        return super.lessThanOrEqual(left, right);
    }

    @Override
    public boolean greaterThan(Object left, Object right) {
        if (anyFloat(left, right)) {
            return doubleOf(left) > doubleOf(right);
        }
        return super.greaterThan(left, right);
    }

    @Override
    public boolean greaterThanOrEqual(Object left, Object right) {
        if (anyFloat(left, right)) {
            return doubleOf(left) >= doubleOf(right);
        }
        return super.greaterThanOrEqual(left, right);
    }

    static boolean isInt(Object operand) {
        return operand instanceof Long || operand instanceof Integer || operand instanceof Short || operand instanceof Byte;
    }

    private static String typeNameOf(Object operand) {
        try {
            return Value.from(operand).typeName();
        } catch (ValueTypeException e) {
            return operand.getClass().getSimpleName();
        }
    }

    private static boolean bothInts(Object left, Object right) {
        return isInt(left) && isInt(right);
    }

    private static boolean anyFloat(Object left, Object right) {
        return left instanceof Number && right instanceof Number && !bothInts(left, right);
    }

    private static long longOf(Object operand) {
        return ((Number) operand).longValue();
    }

    private static double doubleOf(Object operand) {
        if (operand instanceof Number n) {
            return n.doubleValue();
        }
        throw new ValueTypeException("number", typeNameOf(operand));
    }

    private static ArithmeticException overflow(String operation) {
        return new ArithmeticException("Integer overflow: " + operation);
    }
}
