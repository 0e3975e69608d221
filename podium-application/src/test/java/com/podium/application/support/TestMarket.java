package com.podium.application.support;

import com.podium.application.service.MarketEngine;
import com.podium.domain.account.Address;
import com.podium.domain.config.ProtocolConfig;
import com.podium.domain.curve.CurveWeights;
import com.podium.domain.fee.FeeSchedule;
import com.podium.domain.outpost.Royalty;

/**
 * Engine over in-memory ports with default fees and weights.
 */
public final class TestMarket {

    public static final Address ADMIN = Address.of("0xad");
    public static final Address TREASURY = Address.of("0x7e");
    public static final long OUTPOST_PRICE = 100_000_000L;

    public final FakeSettlement settlement = new FakeSettlement();
    public final FakePassTokens tokens = new FakePassTokens();
    public final MutableClock clock = new MutableClock(1_700_000_000L);
    public final CapturingEvents events = new CapturingEvents();
    public final MarketEngine engine;

    public TestMarket() {
        this(false);
    }

    public TestMarket(boolean autoClearExpired) {
        ProtocolConfig config = new ProtocolConfig(FeeSchedule.defaults(), CurveWeights.defaults(), TREASURY,
                OUTPOST_PRICE, Royalty.defaults());
        engine = MarketEngine.create(config, ADMIN, autoClearExpired, settlement, tokens, clock, events);
    }

    public Address funded(String hex, long amount) {
        Address a = Address.of(hex);
        settlement.fund(a, amount);
        return a;
    }
}
