package com.podium.application.service;

import com.podium.application.market.MarketTransaction;
import com.podium.application.ports.SettlementPort;
import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;

import java.util.Objects;

/**
 * Settlement transfers made inside a {@link MarketTransaction}.
 * Each transfer registers its reverse transfer as compensation.
 */
final class Payments {

    private final SettlementPort settlement;

    Payments(SettlementPort settlement) {
        this.settlement = Objects.requireNonNull(settlement, "settlement");
    }

    void requireBalance(Address payer, long amount) {
        long available = settlement.isRegistered(payer) ? settlement.balance(payer) : 0L;
        if (available < amount) {
            throw new MarketException(MarketError.INSUFFICIENT_CALLER_BALANCE,
                    payer + " holds " + available + ", needs " + amount);
        }
    }

    void pay(MarketTransaction tx, Address from, Address to, long amount) {
        if (amount == 0 || from.equals(to)) return;
        ensureRegistered(to);
        settlement.transfer(from, to, amount);
        tx.onRollback("refund " + to.shortHex(), () -> settlement.transfer(to, from, amount));
    }

    void ensureRegistered(Address account) {
        if (!settlement.isRegistered(account)) {
            settlement.register(account);
        }
    }
}
