package com.podium.application.market;

import com.podium.application.ports.PassTokenPort;
import com.podium.domain.account.Address;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Target address to pass handle. Handles are created on first use.
 */
public final class PassAssetRegistry {

    private final PassTokenPort token;
    private final ConcurrentHashMap<Address, PassAsset> byTarget = new ConcurrentHashMap<>();

    public PassAssetRegistry(PassTokenPort token) {
        this.token = Objects.requireNonNull(token, "token");
    }

    public PassAsset getOrCreate(Address target) {
        Objects.requireNonNull(target, "target");
        return byTarget.computeIfAbsent(target, t -> new PassAsset(t, symbolOf(t), token));
    }

    public static String symbolOf(Address target) {
        return "PASS:" + target.value();
    }
}
