package com.podium.domain.curve;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;

/**
 * Sum of squares {@code S(n) = n(n+1)(2n+1)/6} in 64-bit arithmetic.
 *
 * The factors 2 and 3 of the divisor are taken out of {@code n} or of
 * {@code inner = 2n^2 + 3n + 1} before the final multiplication, so the only
 * product that can grow large is the last one.
 */
public final class Summation {

    /** Largest n for which S(n) fits in a signed long. */
    public static final long MAX_INPUT = 3_000_000L;

    private Summation() {
    }

    public static long of(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got " + n);
        }
        if (n == 0) return 0;
        if (n > MAX_INPUT) {
            throw new MarketException(MarketError.ARITHMETIC_OVERFLOW,
                    "Summation input " + n + " exceeds limit " + MAX_INPUT);
        }

        long left = n;
        long inner = 2 * n * n + 3 * n + 1; // (n+1)(2n+1), below 2e13 for n <= MAX_INPUT

        if (left % 2 == 0) {
            left /= 2;
        } else {
            inner /= 2;
        }

        if (left % 3 == 0) {
            left /= 3;
        } else {
            inner /= 3;
        }

        try {
            return Math.multiplyExact(left, inner);
        } catch (ArithmeticException e) {
            throw new MarketException(MarketError.ARITHMETIC_OVERFLOW, "Summation overflow for n=" + n, e);
        }
    }
}
