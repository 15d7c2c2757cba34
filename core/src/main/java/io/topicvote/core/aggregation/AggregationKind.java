package io.topicvote.core.aggregation;

import io.topicvote.core.error.AggregationException;
import io.topicvote.core.error.AggregationException.Reason;
import java.util.Optional;
import java.util.PrimitiveIterator;
import java.util.stream.DoubleStream;

/** The reducers an {@link Aggregation} can apply, named as they are written in voting source. */
public enum AggregationKind {
    SUM_OF("sumOf"),
    MAX_OF("maxOf"),
    MIN_OF("minOf"),
    AVG_OF("avgOf"),
    GAVG_OF("gAvgOf");

    private final String sourceName;

    AggregationKind(String sourceName) {
        this.sourceName = sourceName;
    }

    /** The name as written in voting source, e.g. {@code gAvgOf}. */
    public String sourceName() {
        return sourceName;
    }

    /** Case-sensitive lookup by source name. */
    public static Optional<AggregationKind> fromSourceName(String name) {
        for (AggregationKind kind : values()) {
            if (kind.sourceName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Reduces {@code values} to a single number. A single value is returned unchanged.
     *
     * @throws AggregationException with {@link Reason#NO_VALUES} for an empty stream, or {@link
     *     Reason#NO_MAX_FOUND}/{@link Reason#NO_MIN_FOUND} when no value is comparable
     */
    public double aggregate(DoubleStream values) {
        double[] all = values.toArray();
        if (all.length == 0) {
            throw new AggregationException(Reason.NO_VALUES);
        }
        if (all.length == 1) {
            return all[0];
        }
        return switch (this) {
            case SUM_OF -> sum(all);
            case MAX_OF -> PartialOrder.maxFiltered(DoubleStream.of(all))
                    .orElseThrow(() -> new AggregationException(Reason.NO_MAX_FOUND));
            case MIN_OF -> PartialOrder.minFiltered(DoubleStream.of(all))
                    .orElseThrow(() -> new AggregationException(Reason.NO_MIN_FOUND));
            case AVG_OF -> average(DoubleStream.of(all));
            case GAVG_OF -> Math.exp(average(DoubleStream.of(all).map(Math::log)));
        };
    }

    private static double sum(double[] values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum;
    }

    private static double average(DoubleStream values) {
        double sum = 0;
        long count = 0;
        PrimitiveIterator.OfDouble it = values.iterator();
        while (it.hasNext()) {
            sum += it.nextDouble();
            count++;
        }
        return sum / count;
    }

    @Override
    public String toString() {
        return sourceName;
    }
}
