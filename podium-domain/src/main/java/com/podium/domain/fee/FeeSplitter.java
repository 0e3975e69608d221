package com.podium.domain.fee;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.curve.BondingCurve;

import java.util.Objects;

/**
 * Splits gross prices into protocol, subject and referral shares.
 * All shares are truncated toward zero; nothing is charged twice.
 */
public final class FeeSplitter {

    private FeeSplitter() {
    }

    public static BuySplit splitBuy(long price, boolean hasReferrer, FeeSchedule fees) {
        Objects.requireNonNull(fees, "fees");
        requireNonNegative(price);
        long protocolFee = share(price, fees.protocolFeeBps());
        long subjectFee = share(price, fees.subjectFeeBps());
        long referralFee = hasReferrer ? share(price, fees.referralFeeBps()) : 0L;
        BuySplit split = new BuySplit(price, protocolFee, subjectFee, referralFee);
        try {
            split.total();
        } catch (ArithmeticException e) {
            throw new MarketException(MarketError.ARITHMETIC_OVERFLOW, "Buyer payment overflow for price " + price, e);
        }
        return split;
    }

    public static SellSplit splitSell(long price, FeeSchedule fees) {
        Objects.requireNonNull(fees, "fees");
        requireNonNegative(price);
        long protocolFee = share(price, fees.protocolFeeBps());
        long subjectFee = share(price, fees.subjectFeeBps());
        long net = price - protocolFee - subjectFee;
        if (net <= 0) {
            throw new MarketException(MarketError.INVALID_AMOUNT,
                    "Sell proceeds after fees are not positive: " + net);
        }
        return new SellSplit(price, protocolFee, subjectFee, net);
    }

    public static SubscriptionSplit splitSubscription(long price, boolean hasReferrer, FeeSchedule fees) {
        Objects.requireNonNull(fees, "fees");
        requireNonNegative(price);
        long protocolFee = share(price, fees.subscriptionProtocolFeeBps());
        long referralFee = hasReferrer ? share(price, fees.subscriptionReferrerFeeBps()) : 0L;
        long ownerShare = price - protocolFee - referralFee;
        if (ownerShare <= 0) {
            throw new MarketException(MarketError.INVALID_AMOUNT,
                    "Owner share after subscription fees is not positive: " + ownerShare);
        }
        return new SubscriptionSplit(price, protocolFee, referralFee, ownerShare);
    }

    static long share(long price, int bps) {
        try {
            return Math.multiplyExact(price, (long) bps) / BondingCurve.BPS;
        } catch (ArithmeticException e) {
            throw new MarketException(MarketError.ARITHMETIC_OVERFLOW, "Fee overflow for price " + price, e);
        }
    }

    private static void requireNonNegative(long price) {
        if (price < 0) {
            throw new MarketException(MarketError.INVALID_AMOUNT, "price must be >= 0, got " + price);
        }
    }
}
