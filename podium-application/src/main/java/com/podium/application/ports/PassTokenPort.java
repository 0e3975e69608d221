package com.podium.application.ports;

import com.podium.domain.account.Address;

/**
 * Fungible pass token primitive, keyed by a per-target symbol.
 * Minted units land in the engine's escrow account; burns take from it.
 */
public interface PassTokenPort {

    void mint(String symbol, long amount);

    void burn(String symbol, long amount);

    void transfer(Address from, Address to, String symbol, long amount);

    long balance(Address account, String symbol);
}
