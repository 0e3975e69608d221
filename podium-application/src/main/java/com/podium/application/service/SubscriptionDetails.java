package com.podium.application.service;

import com.podium.domain.outpost.Subscription;
import com.podium.domain.outpost.SubscriptionTier;

/**
 * A subscription record together with its tier and its state at {@code asOf}.
 */
public record SubscriptionDetails(Subscription subscription, SubscriptionTier tier, long asOf) {

    public boolean active() {
        return subscription.isActiveAt(asOf);
    }

    public boolean expired() {
        return subscription.isExpiredAt(asOf);
    }
}
