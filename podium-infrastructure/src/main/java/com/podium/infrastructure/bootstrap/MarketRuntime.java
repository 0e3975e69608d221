package com.podium.infrastructure.bootstrap;

import com.podium.application.service.MarketEngine;
import com.podium.domain.account.Address;
import com.podium.infrastructure.events.RecordingEventAdapter;
import com.podium.infrastructure.settlement.InMemorySettlementLedger;
import com.podium.infrastructure.token.InMemoryPassTokenLedger;

/**
 * A wired engine plus the in-memory adapters behind it.
 */
public record MarketRuntime(
        MarketEngine engine,
        InMemorySettlementLedger settlement,
        InMemoryPassTokenLedger passTokens,
        RecordingEventAdapter recentEvents,
        boolean faucetEnabled
) {

    public Address admin() {
        return engine.authorization().admin();
    }

    /**
     * Credits test funds. Engine accounts are refused so the vault account keeps
     * matching the vault ledger.
     */
    public long faucet(Address account, long amount) {
        engine.context().requireExternal("faucet account", account);
        return settlement.credit(account, amount);
    }
}
