package com.podium.domain.fee;

/**
 * Buyer side of a trade: the base price goes to the redemption vault,
 * fees are charged on top of it.
 */
public record BuySplit(long base, long protocolFee, long subjectFee, long referralFee) {

    public long total() {
        return Math.addExact(Math.addExact(base, protocolFee), Math.addExact(subjectFee, referralFee));
    }

    public long fees() {
        return protocolFee + subjectFee + referralFee;
    }
}
