package com.podium.domain.outpost;

import com.podium.domain.account.Address;

import java.util.Objects;

public record Subscription(Address subscriber, int tierId, long startTime, long endTime) {

    public Subscription {
        Objects.requireNonNull(subscriber, "subscriber");
        if (endTime < startTime) throw new IllegalArgumentException("endTime before startTime");
    }

    public static Subscription start(Address subscriber, SubscriptionTier tier, long now) {
        return new Subscription(subscriber, tier.id(), now, Math.addExact(now, tier.duration().seconds()));
    }

    public boolean isActiveAt(long now) {
        return now < endTime;
    }

    /** Strictly after {@code endTime}; at {@code endTime} itself the record is neither active nor expired. */
    public boolean isExpiredAt(long now) {
        return now > endTime;
    }
}
