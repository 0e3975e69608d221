package com.podium.application.ports;

import com.podium.domain.account.Address;

/**
 * Settlement currency primitive. Amounts are smallest currency units.
 *
 * A recipient may not be registered yet; callers register it before transferring.
 */
public interface SettlementPort {

    boolean isRegistered(Address account);

    void register(Address account);

    void transfer(Address from, Address to, long amount);

    long balance(Address account);
}
