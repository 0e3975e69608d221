package com.podium.domain.curve;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;

/**
 * Bonding curve weights. {@code a} and {@code b} are basis points of 10000,
 * {@code c} shifts the curve along the supply axis.
 */
public record CurveWeights(long a, long b, long c) {

    public static final long MIN_AB = 1;
    public static final long MAX_AB = 10_000;
    public static final long MIN_C = 1;
    public static final long MAX_C = 100;

    public CurveWeights {
        if (a < MIN_AB || a > MAX_AB) {
            throw new MarketException(MarketError.INVALID_WEIGHT, "weight a out of [1,10000]: " + a);
        }
        if (b < MIN_AB || b > MAX_AB) {
            throw new MarketException(MarketError.INVALID_WEIGHT, "weight b out of [1,10000]: " + b);
        }
        if (c < MIN_C || c > MAX_C) {
            throw new MarketException(MarketError.INVALID_WEIGHT, "weight c out of [1,100]: " + c);
        }
    }

    public static CurveWeights defaults() {
        return new CurveWeights(173, 257, 23);
    }
}
