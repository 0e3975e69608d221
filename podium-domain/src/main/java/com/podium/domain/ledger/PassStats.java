package com.podium.domain.ledger;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.curve.BondingCurve;

/**
 * Supply and last trade price of one pass target.
 */
public record PassStats(long totalSupply, long lastPrice) {

    public PassStats {
        if (totalSupply < 0) {
            throw new IllegalArgumentException("totalSupply must be >= 0");
        }
    }

    public static PassStats initial() {
        return new PassStats(0L, BondingCurve.INITIAL_PRICE);
    }

    public PassStats afterBuy(long amount, long price) {
        return new PassStats(Math.addExact(totalSupply, amount), price);
    }

    public PassStats afterSell(long amount, long price) {
        if (amount > totalSupply) {
            throw new MarketException(MarketError.SUPPLY_UNDERFLOW,
                    "Cannot sell " + amount + " of " + totalSupply + " outstanding");
        }
        return new PassStats(totalSupply - amount, price);
    }
}
