package io.topicvote.core.aggregation;

import io.topicvote.core.error.PartialOrderException;
import java.util.OptionalDouble;
import java.util.PrimitiveIterator;
import java.util.stream.DoubleStream;

/**
 * Maximum and minimum scans over doubles that respect IEEE partial ordering: NaN is not
 * comparable with anything, itself included.
 *
 * <p>The strict scans fail on the first incomparable pair; the filtered scans drop incomparable
 * values and keep the earlier candidate.
 */
public final class PartialOrder {

    private PartialOrder() {
        // utility class
    }

    /**
     * Strict maximum.
     *
     * @return the maximum, or empty for an empty stream
     * @throws PartialOrderException when two values cannot be compared
     */
    public static OptionalDouble max(DoubleStream values) {
        return strict(values, true);
    }

    /**
     * Strict minimum.
     *
     * @return the minimum, or empty for an empty stream
     * @throws PartialOrderException when two values cannot be compared
     */
    public static OptionalDouble min(DoubleStream values) {
        return strict(values, false);
    }

    /** Maximum of the comparable values, or empty if there are none. */
    public static OptionalDouble maxFiltered(DoubleStream values) {
        return filtered(values, true);
    }

    /** Minimum of the comparable values, or empty if there are none. */
    public static OptionalDouble minFiltered(DoubleStream values) {
        return filtered(values, false);
    }

    private static OptionalDouble strict(DoubleStream values, boolean max) {
        PrimitiveIterator.OfDouble it = values.iterator();
        if (!it.hasNext()) {
            return OptionalDouble.empty();
        }
        double candidate = it.nextDouble();
        while (it.hasNext()) {
            double next = it.nextDouble();
            if (!comparable(candidate, next)) {
                throw new PartialOrderException(candidate, next);
            }
            if (max ? candidate < next : candidate > next) {
                candidate = next;
            }
        }
        return OptionalDouble.of(candidate);
    }

    private static OptionalDouble filtered(DoubleStream values, boolean max) {
        boolean found = false;
        double candidate = 0;
        PrimitiveIterator.OfDouble it = values.iterator();
        while (it.hasNext()) {
            double next = it.nextDouble();
            if (!comparable(next, next)) {
                continue;
            }
            if (!found) {
                candidate = next;
                found = true;
            } else if (max ? candidate < next : candidate > next) {
                candidate = next;
            }
        }
        return found ? OptionalDouble.of(candidate) : OptionalDouble.empty();
    }

    private static boolean comparable(double a, double b) {
        return !Double.isNaN(a) && !Double.isNaN(b);
    }
}
