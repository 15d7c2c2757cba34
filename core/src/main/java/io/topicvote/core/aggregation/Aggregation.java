package io.topicvote.core.aggregation;

import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.stream.DoubleStream;

/**
 * An aggregation over per-voter numbers, optionally restricted to the {@code limit} smallest
 * ({@link #calculateAsc}) or largest ({@link #calculateDesc}) normal values. Zeros, subnormals,
 * NaN and infinities never take part in a limited aggregation.
 *
 * <p>Written as {@code sumOf}, {@code sumOf(3)} or, in the legacy form, {@code sumOf limit(3)}.
 */
public record Aggregation(AggregationKind kind, OptionalInt limit) {

    public Aggregation {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(limit, "limit");
        if (limit.isPresent() && limit.getAsInt() <= 0) {
            throw new IllegalArgumentException("Aggregation limit must be positive, got: " + limit.getAsInt());
        }
    }

    public static Aggregation of(AggregationKind kind) {
        return new Aggregation(kind, OptionalInt.empty());
    }

    public static Aggregation limited(AggregationKind kind, int limit) {
        return new Aggregation(kind, OptionalInt.of(limit));
    }

    /** Aggregates, keeping the {@code limit} smallest normal values when a limit is set. */
    public double calculateAsc(DoubleStream values) {
        return kind.aggregate(select(values, false));
    }

    /** Aggregates, keeping the {@code limit} largest normal values when a limit is set. */
    public double calculateDesc(DoubleStream values) {
        return kind.aggregate(select(values, true));
    }

    public double calculateAsc(double... values) {
        return calculateAsc(DoubleStream.of(values));
    }

    public double calculateDesc(double... values) {
        return calculateDesc(DoubleStream.of(values));
    }

    private DoubleStream select(DoubleStream values, boolean descending) {
        if (limit.isEmpty()) {
            return values;
        }
        double[] sorted = values.filter(Aggregation::isNormal).sorted().toArray();
        int n = Math.min(limit.getAsInt(), sorted.length);
        if (!descending) {
            return Arrays.stream(sorted, 0, n);
        }
        double[] top = new double[n];
        for (int i = 0; i < n; i++) {
            top[i] = sorted[sorted.length - 1 - i];
        }
        return DoubleStream.of(top);
    }

    /** Finite, non-zero and not subnormal. */
    static boolean isNormal(double value) {
        return Double.isFinite(value) && Math.abs(value) >= Double.MIN_NORMAL;
    }

    @Override
    public String toString() {
        return limit.isPresent() ? kind.sourceName() + "(" + limit.getAsInt() + ")" : kind.sourceName();
    }
}
