package com.podium.domain.curve;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SummationTest {

    @Test
    void smallValuesMatchClosedForm() {
        assertThat(Summation.of(0)).isZero();
        assertThat(Summation.of(1)).isEqualTo(1);
        assertThat(Summation.of(2)).isEqualTo(5);
        assertThat(Summation.of(3)).isEqualTo(14);
        assertThat(Summation.of(24)).isEqualTo(4900);
    }

    @Test
    void agreesWithRunningSumOfSquares() {
        long running = 0;
        for (long n = 1; n <= 500; n++) {
            running += n * n;
            assertThat(Summation.of(n)).as("n=%d", n).isEqualTo(running);
        }
    }

    @Test
    void largestInputStillFits() {
        long n = Summation.MAX_INPUT;
        assertThat(Summation.of(n)).isEqualTo(9_000_004_500_000_500_000L);
    }

    @Test
    void inputAboveLimitIsOverflow() {
        assertThatThrownBy(() -> Summation.of(Summation.MAX_INPUT + 1))
                .isInstanceOf(MarketException.class)
                .extracting(e -> ((MarketException) e).error())
                .isEqualTo(MarketError.ARITHMETIC_OVERFLOW);
    }

    @Test
    void negativeInputIsRejected() {
        assertThatThrownBy(() -> Summation.of(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
