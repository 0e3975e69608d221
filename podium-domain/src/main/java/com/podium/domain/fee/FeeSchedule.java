package com.podium.domain.fee;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;

/**
 * Fee rates in basis points of 10000.
 * Trading fees apply to pass buys/sells, subscription fees to tier purchases.
 */
public record FeeSchedule(
        int protocolFeeBps,
        int subjectFeeBps,
        int referralFeeBps,
        int subscriptionProtocolFeeBps,
        int subscriptionReferrerFeeBps
) {

    public static final int MAX_BPS = 10_000;

    public FeeSchedule {
        requireBps("protocolFeeBps", protocolFeeBps);
        requireBps("subjectFeeBps", subjectFeeBps);
        requireBps("referralFeeBps", referralFeeBps);
        requireBps("subscriptionProtocolFeeBps", subscriptionProtocolFeeBps);
        requireBps("subscriptionReferrerFeeBps", subscriptionReferrerFeeBps);
    }

    public static FeeSchedule defaults() {
        return new FeeSchedule(400, 800, 200, 500, 1000);
    }

    public FeeSchedule withTradingFees(int protocol, int subject, int referral) {
        return new FeeSchedule(protocol, subject, referral, subscriptionProtocolFeeBps, subscriptionReferrerFeeBps);
    }

    public FeeSchedule withSubscriptionFees(int protocol, int referrer) {
        return new FeeSchedule(protocolFeeBps, subjectFeeBps, referralFeeBps, protocol, referrer);
    }

    private static void requireBps(String name, int value) {
        if (value < 0 || value > MAX_BPS) {
            throw new MarketException(MarketError.INVALID_FEE_VALUE, name + " out of [0,10000]: " + value);
        }
    }
}
