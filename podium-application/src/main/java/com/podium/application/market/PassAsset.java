package com.podium.application.market;

import com.podium.application.ports.PassTokenPort;
import com.podium.domain.account.Address;

import java.util.Objects;

/**
 * Mint/burn/transfer handle for the passes of one target.
 */
public record PassAsset(Address target, String symbol, PassTokenPort token) {

    public PassAsset {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(token, "token");
    }

    public void mint(long amount) {
        token.mint(symbol, amount);
    }

    public void burn(long amount) {
        token.burn(symbol, amount);
    }

    public void transfer(Address from, Address to, long amount) {
        token.transfer(from, to, symbol, amount);
    }

    public long balance(Address account) {
        return token.balance(account, symbol);
    }
}
