package io.topicvote.core.aggregation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import io.topicvote.core.error.PartialOrderException;
import java.util.stream.DoubleStream;
import org.junit.jupiter.api.Test;

/** Tests for {@link PartialOrder}. */
class PartialOrderTest {

    private static final double NAN = Double.NaN;
    private static final double[] LEADING_NANS = {
        NAN, NAN, 10, 1, 2, NAN, 3, 4, 5, 6, NAN, 7, 8, 9, NAN, 11, 12, NAN
    };
    private static final double[] SINGLE_LEADING_NAN = {NAN, 10, 1, 2, 3};

    @Test
    void strictScanOnComparableValues() {
        assertThat(PartialOrder.max(DoubleStream.of(3, 9, 1))).hasValue(9.0);
        assertThat(PartialOrder.min(DoubleStream.of(3, 9, 1))).hasValue(1.0);
        assertThat(PartialOrder.max(DoubleStream.empty())).isEmpty();
    }

    @Test
    void strictScanFailsWithBothNanWhenTheFirstPairIsIncomparable() {
        PartialOrderException error =
                catchThrowableOfType(PartialOrderException.class, () -> PartialOrder.min(DoubleStream.of(LEADING_NANS)));

        assertThat(error.candidate()).isNaN();
        assertThat(error.cause()).isNaN();
    }

    @Test
    void strictScanReportsTheBreakingValue() {
        PartialOrderException error = catchThrowableOfType(
                PartialOrderException.class, () -> PartialOrder.max(DoubleStream.of(SINGLE_LEADING_NAN)));

        assertThat(error.candidate()).isNaN();
        assertThat(error.cause()).isEqualTo(10.0);
    }

    @Test
    void strictScanReportsTheCandidateSoFar() {
        PartialOrderException error =
                catchThrowableOfType(PartialOrderException.class, () -> PartialOrder.max(DoubleStream.of(1, 5, NAN, 7)));

        assertThat(error.candidate()).isEqualTo(5.0);
        assertThat(error.cause()).isNaN();
    }

    @Test
    void filteredScanSkipsIncomparableValues() {
        assertThat(PartialOrder.minFiltered(DoubleStream.of(LEADING_NANS))).hasValue(1.0);
        assertThat(PartialOrder.maxFiltered(DoubleStream.of(LEADING_NANS))).hasValue(12.0);
        assertThat(PartialOrder.maxFiltered(DoubleStream.of(NAN, NAN))).isEmpty();
    }
}
