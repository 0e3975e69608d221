package com.podium.infrastructure.settlement;

import com.podium.application.ports.SettlementPort;
import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Settlement currency kept in memory. Accounts must be registered before
 * they can receive; transfers are atomic per call.
 */
public final class InMemorySettlementLedger implements SettlementPort {

    private static final Logger log = LoggerFactory.getLogger(InMemorySettlementLedger.class);

    private final Map<Address, Long> balances = new ConcurrentHashMap<>();

    @Override
    public boolean isRegistered(Address account) {
        return account != null && balances.containsKey(account);
    }

    @Override
    public void register(Address account) {
        balances.putIfAbsent(account, 0L);
    }

    @Override
    public synchronized void transfer(Address from, Address to, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("transfer amount must be >= 0, got " + amount);
        }
        if (!isRegistered(to)) {
            throw new IllegalStateException("Recipient is not registered: " + to);
        }
        long available = balances.getOrDefault(from, 0L);
        if (available < amount) {
            throw new MarketException(MarketError.INSUFFICIENT_CALLER_BALANCE,
                    from + " holds " + available + ", transfer of " + amount);
        }
        if (from.equals(to) || amount == 0) return;
        balances.put(from, available - amount);
        balances.merge(to, amount, Math::addExact);
    }

    @Override
    public long balance(Address account) {
        return balances.getOrDefault(account, 0L);
    }

    /** Creates funds out of thin air. Dev faucet and tests only. */
    public synchronized long credit(Address account, long amount) {
        if (amount <= 0) {
            throw new MarketException(MarketError.INVALID_AMOUNT, "credit must be > 0, got " + amount);
        }
        long next = balances.merge(account, amount, Math::addExact);
        log.info("[SETTLEMENT] action=CREDIT account={} amount={} balance={}", account.shortHex(), amount, next);
        return next;
    }

    public synchronized Map<Address, Long> snapshot() {
        return new TreeMap<>(balances);
    }
}
