package com.podium.domain.ledger;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;

/**
 * Pooled settlement funds backing sell-side payouts.
 * Only base prices flow in and out; fee portions never touch the vault.
 */
public final class RedemptionVault {

    private long balance;

    public RedemptionVault() {
        this(0L);
    }

    public RedemptionVault(long openingBalance) {
        if (openingBalance < 0) {
            throw new IllegalArgumentException("openingBalance must be >= 0");
        }
        this.balance = openingBalance;
    }

    public synchronized void deposit(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("deposit must be >= 0, got " + amount);
        }
        try {
            balance = Math.addExact(balance, amount);
        } catch (ArithmeticException e) {
            throw new MarketException(MarketError.ARITHMETIC_OVERFLOW, "Vault balance overflow", e);
        }
    }

    /**
     * Takes {@code amount} out of the pool, all or nothing.
     *
     * @return the withdrawn amount
     */
    public synchronized long withdraw(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("withdraw must be >= 0, got " + amount);
        }
        if (amount > balance) {
            throw new MarketException(MarketError.INSUFFICIENT_VAULT_BALANCE,
                    "Vault holds " + balance + ", requested " + amount);
        }
        balance -= amount;
        return amount;
    }

    public synchronized long balance() {
        return balance;
    }
}
