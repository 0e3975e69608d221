package com.podium.domain.curve;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;

import java.util.Objects;

/**
 * Deterministic price of passes as a function of the outstanding supply.
 *
 * <p>A unit at supply level {@code s > 0} costs
 * {@code max(INITIAL_PRICE, ((S(s + c - 1) * a / BPS) * b / BPS) * UNIT_SCALE)}
 * where {@code S} is {@link Summation#of(long)}. Multi-unit prices are the sum of
 * unit prices over consecutive levels: a buy of unit {@code i} is priced at
 * {@code supply + i}, a sell of unit {@code i} at {@code supply - i - 1} (never
 * below zero), so buying and then selling the same units returns the same amount.
 */
public final class BondingCurve {

    public static final long BPS = 10_000L;
    /** Smallest settlement units per whole unit. */
    public static final long UNIT_SCALE = 100_000_000L;
    public static final long INITIAL_PRICE = UNIT_SCALE;
    /**
     * Hard supply cap per target; keeps every level inside {@link Summation#MAX_INPUT}.
     * The cap a buy actually meets is {@link #supplyCeiling(CurveWeights)}, which is
     * lower whenever the unit price outgrows a signed long first.
     */
    public static final long MAX_SUPPLY = 2_000_000L;

    private BondingCurve() {
    }

    public static long unitPrice(long supply, CurveWeights weights) {
        Objects.requireNonNull(weights, "weights");
        if (supply < 0) {
            throw new IllegalArgumentException("supply must be >= 0, got " + supply);
        }
        if (supply == 0) return INITIAL_PRICE;

        long n = supply + weights.c() - 1;
        if (n <= 1) return INITIAL_PRICE;

        long sum = Summation.of(n);
        try {
            long step1 = Math.multiplyExact(sum, weights.a()) / BPS;
            long step2 = Math.multiplyExact(step1, weights.b()) / BPS;
            long scaled = Math.multiplyExact(step2, UNIT_SCALE);
            return Math.max(INITIAL_PRICE, scaled);
        } catch (ArithmeticException e) {
            throw new MarketException(MarketError.ARITHMETIC_OVERFLOW,
                    "Unit price overflow at supply " + supply, e);
        }
    }

    public static long totalPrice(long supply, long amount, boolean isSell, CurveWeights weights) {
        if (supply < 0) {
            throw new IllegalArgumentException("supply must be >= 0, got " + supply);
        }
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0, got " + amount);
        }
        if (!isSell) {
            requireWithinCeiling(supply, amount, weights);
        }

        long total = 0;
        try {
            for (long i = 0; i < amount; i++) {
                long level = isSell ? sellLevel(supply, i) : supply + i;
                total = Math.addExact(total, unitPrice(level, weights));
            }
        } catch (ArithmeticException e) {
            throw new MarketException(MarketError.ARITHMETIC_OVERFLOW,
                    "Total price overflow for " + amount + " units at supply " + supply, e);
        }
        return total;
    }

    public static long buyPrice(long supply, long amount, CurveWeights weights) {
        return totalPrice(supply, amount, false, weights);
    }

    public static long sellPrice(long supply, long amount, CurveWeights weights) {
        return totalPrice(supply, amount, true, weights);
    }

    private static long sellLevel(long supply, long i) {
        long remaining = supply - i;
        return remaining <= 1 ? 0 : remaining - 1;
    }

    /**
     * Highest total supply a buy may reach under {@code weights}: every level
     * below it has a unit price that fits a long, and it never exceeds {@link #MAX_SUPPLY}.
     * With the default weights this is 85356.
     */
    public static long supplyCeiling(CurveWeights weights) {
        Objects.requireNonNull(weights, "weights");
        if (unitPriceFits(MAX_SUPPLY - 1, weights)) return MAX_SUPPLY;

        // Unit price is non-decreasing in the level: find the last level that fits.
        long lo = 0;
        long hi = MAX_SUPPLY - 1;
        while (hi - lo > 1) {
            long mid = (lo + hi) >>> 1;
            if (unitPriceFits(mid, weights)) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return lo + 1;
    }

    private static boolean unitPriceFits(long level, CurveWeights weights) {
        long n = level + weights.c() - 1;
        if (level == 0 || n <= 1) return true;
        long sum = Summation.of(n);
        if (sum > Long.MAX_VALUE / weights.a()) return false;
        long step1 = sum * weights.a() / BPS;
        if (step1 > Long.MAX_VALUE / weights.b()) return false;
        long step2 = step1 * weights.b() / BPS;
        return step2 <= Long.MAX_VALUE / UNIT_SCALE;
    }

    private static void requireWithinCeiling(long supply, long amount, CurveWeights weights) {
        long ceiling = supplyCeiling(weights);
        if (amount > ceiling || supply > ceiling - amount) {
            throw new MarketException(MarketError.INVALID_AMOUNT,
                    "Supply would exceed ceiling " + ceiling + " (supply=" + supply + ", amount=" + amount + ")");
        }
    }
}
