package com.podium.domain.outpost;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;

import java.util.Objects;

/**
 * Named, priced plan of an outpost. {@code id} is the insertion index and never changes.
 */
public record SubscriptionTier(int id, String name, long price, TierDuration duration) {

    public SubscriptionTier {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(duration, "duration");
        if (id < 0) throw new IllegalArgumentException("id must be >= 0");
        if (name.isBlank()) throw new IllegalArgumentException("Tier name is blank");
        if (price <= 0) {
            throw new MarketException(MarketError.INVALID_AMOUNT, "Tier price must be > 0, got " + price);
        }
    }

    public SubscriptionTier withPrice(long newPrice) {
        return new SubscriptionTier(id, name, newPrice, duration);
    }

    public SubscriptionTier withDuration(TierDuration newDuration) {
        return new SubscriptionTier(id, name, price, newDuration);
    }
}
