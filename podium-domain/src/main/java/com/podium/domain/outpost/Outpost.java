package com.podium.domain.outpost;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ownable venue. Holds its tier table and the subscriptions sold against it.
 *
 * <p>Not thread-safe: callers serialize access per outpost.
 */
public final class Outpost {

    private final Address address;
    private final String name;
    private final String description;
    private final String uri;
    private final Royalty royalty;
    private final long createdAt;

    private Address owner;
    private long price;
    private boolean paused;

    private final List<SubscriptionTier> tiers = new ArrayList<>();
    private final Set<String> tierNames = new HashSet<>();
    private final Map<Address, Subscription> subscriptions = new LinkedHashMap<>();

    private Outpost(Address address, Address owner, String name, String description, String uri,
                    long price, Royalty royalty, long createdAt) {
        this.address = Objects.requireNonNull(address, "address");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.name = Objects.requireNonNull(name, "name");
        this.description = description == null ? "" : description;
        this.uri = uri == null ? "" : uri;
        this.royalty = Objects.requireNonNull(royalty, "royalty");
        this.createdAt = createdAt;
        this.price = price;
    }

    public static Outpost create(Address address, Address owner, String name, String description, String uri,
                                 long price, Royalty royalty, long createdAt) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Outpost name is blank");
        }
        if (price < 0) {
            throw new MarketException(MarketError.INVALID_AMOUNT, "Outpost price must be >= 0, got " + price);
        }
        return new Outpost(address, owner, name.trim(), description, uri, price, royalty, createdAt);
    }

    /* =========================
       Guards
       ========================= */

    public boolean isOwner(Address caller) {
        return owner.equals(caller);
    }

    public void requireOwner(Address caller) {
        if (caller == null || !isOwner(caller)) {
            throw new MarketException(MarketError.NOT_OWNER, "Caller is not the owner of outpost " + address);
        }
    }

    public void requireNotPaused() {
        if (paused) {
            throw new MarketException(MarketError.EMERGENCY_PAUSE, "Outpost is paused: " + address);
        }
    }

    /* =========================
       Lifecycle
       ========================= */

    public void updatePrice(long newPrice) {
        requireNotPaused();
        if (newPrice <= 0) {
            throw new MarketException(MarketError.INVALID_AMOUNT, "Outpost price must be > 0, got " + newPrice);
        }
        this.price = newPrice;
    }

    /** @return the new pause state */
    public boolean togglePause() {
        this.paused = !paused;
        return paused;
    }

    public Address transferOwnership(Address newOwner) {
        Objects.requireNonNull(newOwner, "newOwner");
        Address previous = owner;
        this.owner = newOwner;
        return previous;
    }

    /* =========================
       Tiers
       ========================= */

    public SubscriptionTier addTier(String tierName, long tierPrice, TierDuration duration) {
        requireNotPaused();
        if (tierName == null || tierName.isBlank()) {
            throw new IllegalArgumentException("Tier name is blank");
        }
        if (tierNames.contains(tierName)) {
            throw new MarketException(MarketError.TIER_NAME_EXISTS, "Tier name already exists: " + tierName);
        }
        if (duration == null) {
            throw new MarketException(MarketError.INVALID_DURATION, "Duration is missing");
        }
        SubscriptionTier tier = new SubscriptionTier(tiers.size(), tierName, tierPrice, duration);
        tiers.add(tier);
        tierNames.add(tierName);
        return tier;
    }

    public SubscriptionTier tier(int tierId) {
        if (tierId < 0 || tierId >= tiers.size()) {
            throw new MarketException(MarketError.TIER_NOT_FOUND, "No tier " + tierId + " on outpost " + address);
        }
        return tiers.get(tierId);
    }

    public SubscriptionTier updateTierPrice(int tierId, long newPrice) {
        requireNotPaused();
        SubscriptionTier updated = tier(tierId).withPrice(newPrice);
        tiers.set(tierId, updated);
        return updated;
    }

    public SubscriptionTier updateTierDuration(int tierId, TierDuration newDuration) {
        requireNotPaused();
        if (newDuration == null) {
            throw new MarketException(MarketError.INVALID_DURATION, "Duration is missing");
        }
        SubscriptionTier updated = tier(tierId).withDuration(newDuration);
        tiers.set(tierId, updated);
        return updated;
    }

    public List<SubscriptionTier> tiers() {
        return Collections.unmodifiableList(tiers);
    }

    public int tierCount() {
        return tiers.size();
    }

    /* =========================
       Subscriptions
       ========================= */

    public Optional<Subscription> subscription(Address subscriber) {
        return Optional.ofNullable(subscriptions.get(subscriber));
    }

    /**
     * Inserts a subscription. Any existing record blocks, expired or not.
     */
    public void addSubscription(Subscription subscription) {
        Objects.requireNonNull(subscription, "subscription");
        if (subscriptions.containsKey(subscription.subscriber())) {
            throw new MarketException(MarketError.ALREADY_SUBSCRIBED,
                    subscription.subscriber() + " already holds a subscription on " + address);
        }
        tier(subscription.tierId());
        subscriptions.put(subscription.subscriber(), subscription);
    }

    public Subscription removeSubscription(Address subscriber) {
        Subscription removed = subscriptions.remove(subscriber);
        if (removed == null) {
            throw new MarketException(MarketError.SUBSCRIPTION_NOT_FOUND,
                    "No subscription of " + subscriber + " on " + address);
        }
        return removed;
    }

    /** Puts back a removed record without any check; used when a call is rolled back. */
    public void restoreSubscription(Subscription subscription) {
        subscriptions.put(subscription.subscriber(), subscription);
    }

    public boolean isSubscriptionActive(Address subscriber, int tierId, long now) {
        Subscription s = subscriptions.get(subscriber);
        return s != null && s.tierId() == tierId && s.isActiveAt(now);
    }

    public Map<Address, Subscription> subscriptions() {
        return Collections.unmodifiableMap(subscriptions);
    }

    /* =========================
       Accessors
       ========================= */

    public Address address() { return address; }
    public Address owner() { return owner; }
    public String name() { return name; }
    public String description() { return description; }
    public String uri() { return uri; }
    public Royalty royalty() { return royalty; }
    public long createdAt() { return createdAt; }
    public long price() { return price; }
    public boolean paused() { return paused; }
}
