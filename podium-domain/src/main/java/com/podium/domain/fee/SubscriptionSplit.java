package com.podium.domain.fee;

public record SubscriptionSplit(long price, long protocolFee, long referralFee, long ownerShare) {
}
