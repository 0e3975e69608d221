package com.podium.application.market;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;
import com.podium.domain.outpost.Outpost;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class OutpostRegistry {

    private final ConcurrentHashMap<Address, Outpost> byAddress = new ConcurrentHashMap<>();

    public void register(Outpost outpost) {
        Outpost previous = byAddress.putIfAbsent(outpost.address(), outpost);
        if (previous != null) {
            throw new MarketException(MarketError.OUTPOST_EXISTS, "Outpost already exists: " + outpost.address());
        }
    }

    public Optional<Outpost> find(Address address) {
        if (address == null) return Optional.empty();
        return Optional.ofNullable(byAddress.get(address));
    }

    public Outpost require(Address address) {
        return find(address).orElseThrow(() ->
                new MarketException(MarketError.OUTPOST_NOT_FOUND, "No outpost at " + address));
    }

    public boolean contains(Address address) {
        return address != null && byAddress.containsKey(address);
    }

    public List<Outpost> all() {
        List<Outpost> out = new ArrayList<>(byAddress.values());
        out.sort(Comparator.comparingLong(Outpost::createdAt).thenComparing(Outpost::address));
        return out;
    }

    /** Drops an entry; used when a create call is rolled back. */
    public void remove(Address address) {
        byAddress.remove(address);
    }
}
