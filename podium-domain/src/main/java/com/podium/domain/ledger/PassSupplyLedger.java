package com.podium.domain.ledger;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-target supply book. Entries are created on first touch and never removed.
 */
public final class PassSupplyLedger {

    private final ConcurrentHashMap<Address, PassStats> byTarget = new ConcurrentHashMap<>();

    public PassStats getOrCreate(Address target) {
        Objects.requireNonNull(target, "target");
        return byTarget.computeIfAbsent(target, t -> PassStats.initial());
    }

    public Optional<PassStats> find(Address target) {
        if (target == null) return Optional.empty();
        return Optional.ofNullable(byTarget.get(target));
    }

    public long totalSupply(Address target) {
        return find(target).map(PassStats::totalSupply).orElse(0L);
    }

    public PassStats recordBuy(Address target, long amount, long price) {
        requirePositive(amount);
        PassStats next = getOrCreate(target).afterBuy(amount, price);
        byTarget.put(target, next);
        return next;
    }

    public PassStats recordSell(Address target, long amount, long price) {
        requirePositive(amount);
        PassStats next = getOrCreate(target).afterSell(amount, price);
        byTarget.put(target, next);
        return next;
    }

    /** Puts back a previously read entry; used when a call is rolled back. */
    public void restore(Address target, PassStats previous) {
        byTarget.put(Objects.requireNonNull(target, "target"), Objects.requireNonNull(previous, "previous"));
    }

    public Map<Address, PassStats> snapshot() {
        return Map.copyOf(byTarget);
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new MarketException(MarketError.INVALID_AMOUNT, "amount must be > 0, got " + amount);
        }
    }
}
