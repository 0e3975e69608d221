package com.podium.domain.config;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;
import com.podium.domain.curve.CurveWeights;
import com.podium.domain.fee.FeeSchedule;
import com.podium.domain.outpost.Royalty;

import java.util.Objects;

/**
 * Protocol-wide settings. Immutable; an admin update produces a new instance
 * and trades in flight keep the instance they started with.
 */
public record ProtocolConfig(
        FeeSchedule fees,
        CurveWeights weights,
        Address treasury,
        long outpostPurchasePrice,
        Royalty outpostRoyalty
) {

    public ProtocolConfig {
        Objects.requireNonNull(fees, "fees");
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(treasury, "treasury");
        Objects.requireNonNull(outpostRoyalty, "outpostRoyalty");
        if (outpostPurchasePrice < 0) {
            throw new MarketException(MarketError.INVALID_AMOUNT,
                    "outpostPurchasePrice must be >= 0, got " + outpostPurchasePrice);
        }
    }

    public ProtocolConfig withFees(FeeSchedule newFees) {
        return new ProtocolConfig(newFees, weights, treasury, outpostPurchasePrice, outpostRoyalty);
    }

    public ProtocolConfig withWeights(CurveWeights newWeights) {
        return new ProtocolConfig(fees, newWeights, treasury, outpostPurchasePrice, outpostRoyalty);
    }

    public ProtocolConfig withTreasury(Address newTreasury) {
        return new ProtocolConfig(fees, weights, newTreasury, outpostPurchasePrice, outpostRoyalty);
    }

    public ProtocolConfig withOutpostPurchasePrice(long price) {
        return new ProtocolConfig(fees, weights, treasury, price, outpostRoyalty);
    }
}
