package com.podium.application.events;

import com.podium.domain.account.Address;

/**
 * Notifications emitted after a call has committed.
 */
public interface MarketEvent {

    /** Stable event name, e.g. {@code PassPurchased}. */
    String type();

    /** Epoch seconds at which the call committed. */
    long timestamp();

    record PassPurchased(Address buyer, Address target, Address referrer, long amount,
                         long basePrice, long protocolFee, long subjectFee, long referralFee,
                         long supplyAfter, long timestamp) implements MarketEvent {
        @Override public String type() { return "PassPurchased"; }
    }

    record PassSold(Address seller, Address target, long amount,
                    long basePrice, long protocolFee, long subjectFee, long netToSeller,
                    long supplyAfter, long timestamp) implements MarketEvent {
        @Override public String type() { return "PassSold"; }
    }

    record SubscriptionCreated(Address subscriber, Address outpost, int tierId, Address referrer,
                               long price, long protocolFee, long referralFee, long ownerShare,
                               long startTime, long endTime, long timestamp) implements MarketEvent {
        @Override public String type() { return "SubscriptionCreated"; }
    }

    record SubscriptionCancelled(Address subscriber, Address outpost, int tierId,
                                 long timestamp) implements MarketEvent {
        @Override public String type() { return "SubscriptionCancelled"; }
    }

    record TierCreated(Address outpost, int tierId, String name, long price, String duration,
                       long timestamp) implements MarketEvent {
        @Override public String type() { return "TierCreated"; }
    }

    record TierUpdated(Address outpost, int tierId, long price, String duration,
                       long timestamp) implements MarketEvent {
        @Override public String type() { return "TierUpdated"; }
    }

    record OutpostCreated(Address outpost, Address owner, String name, long pricePaid,
                          long timestamp) implements MarketEvent {
        @Override public String type() { return "OutpostCreated"; }
    }

    record OutpostPauseToggled(Address outpost, boolean paused, long timestamp) implements MarketEvent {
        @Override public String type() { return "OutpostPauseToggled"; }
    }

    record OutpostPriceUpdated(Address outpost, long price, long timestamp) implements MarketEvent {
        @Override public String type() { return "OutpostPriceUpdated"; }
    }

    record OwnershipTransferred(Address outpost, Address previousOwner, Address newOwner,
                                long timestamp) implements MarketEvent {
        @Override public String type() { return "OwnershipTransferred"; }
    }

    record FeesUpdated(int protocolFeeBps, int subjectFeeBps, int referralFeeBps,
                       int subscriptionProtocolFeeBps, int subscriptionReferrerFeeBps,
                       long timestamp) implements MarketEvent {
        @Override public String type() { return "FeesUpdated"; }
    }

    record ConfigUpdated(String field, String value, long timestamp) implements MarketEvent {
        @Override public String type() { return "ConfigUpdated"; }
    }
}
