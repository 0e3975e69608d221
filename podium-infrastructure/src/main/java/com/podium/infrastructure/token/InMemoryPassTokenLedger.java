package com.podium.infrastructure.token;

import com.podium.application.ports.PassTokenPort;
import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Pass balances per symbol. Mints credit the escrow account and burns debit it.
 */
public final class InMemoryPassTokenLedger implements PassTokenPort {

    private final Address escrow;
    private final Map<String, Map<Address, Long>> bySymbol = new HashMap<>();

    public InMemoryPassTokenLedger(Address escrow) {
        this.escrow = Objects.requireNonNull(escrow, "escrow");
    }

    @Override
    public synchronized void mint(String symbol, long amount) {
        requireNonNegative(amount);
        holders(symbol).merge(escrow, amount, Math::addExact);
    }

    @Override
    public synchronized void burn(String symbol, long amount) {
        requireNonNegative(amount);
        debit(holders(symbol), escrow, amount);
    }

    @Override
    public synchronized void transfer(Address from, Address to, String symbol, long amount) {
        requireNonNegative(amount);
        Map<Address, Long> holders = holders(symbol);
        debit(holders, from, amount);
        holders.merge(to, amount, Math::addExact);
    }

    @Override
    public synchronized long balance(Address account, String symbol) {
        Map<Address, Long> holders = bySymbol.get(symbol);
        return holders == null ? 0L : holders.getOrDefault(account, 0L);
    }

    /** Sum of all balances of a symbol, escrow included. */
    public synchronized long circulating(String symbol) {
        Map<Address, Long> holders = bySymbol.get(symbol);
        return holders == null ? 0L : holders.values().stream().mapToLong(Long::longValue).sum();
    }

    public Address escrow() {
        return escrow;
    }

    private Map<Address, Long> holders(String symbol) {
        return bySymbol.computeIfAbsent(Objects.requireNonNull(symbol, "symbol"), s -> new HashMap<>());
    }

    private static void debit(Map<Address, Long> holders, Address account, long amount) {
        long held = holders.getOrDefault(account, 0L);
        if (held < amount) {
            throw new MarketException(MarketError.INSUFFICIENT_CALLER_BALANCE,
                    account + " holds " + held + " passes, needs " + amount);
        }
        holders.put(account, held - amount);
    }

    private static void requireNonNegative(long amount) {
        if (amount < 0) throw new IllegalArgumentException("amount must be >= 0, got " + amount);
    }
}
