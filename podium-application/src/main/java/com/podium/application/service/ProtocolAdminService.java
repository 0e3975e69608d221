package com.podium.application.service;

import com.podium.application.events.MarketEvent;
import com.podium.application.market.EntityLocks;
import com.podium.application.market.MarketContext;
import com.podium.application.ports.AuthorizationPort;
import com.podium.application.ports.ClockPort;
import com.podium.application.ports.MarketEventPort;
import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;
import com.podium.domain.config.ProtocolConfig;
import com.podium.domain.curve.CurveWeights;
import com.podium.domain.fee.FeeSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Admin-only updates of the protocol config. Each update swaps in a new
 * immutable snapshot; calls already running keep the one they started with.
 */
public class ProtocolAdminService {

    private static final Logger log = LoggerFactory.getLogger(ProtocolAdminService.class);

    private final MarketContext ctx;
    private final AuthorizationPort auth;
    private final ClockPort clock;
    private final MarketEvents events;

    public ProtocolAdminService(MarketContext ctx, AuthorizationPort auth, ClockPort clock, MarketEventPort events) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.auth = Objects.requireNonNull(auth, "auth");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = new MarketEvents(events);
    }

    public ProtocolConfig config() {
        return ctx.config();
    }

    public FeeSchedule updateTradingFees(Address caller, int protocolBps, int subjectBps, int referralBps) {
        ProtocolConfig updated = update(caller, "fees", cfg ->
                cfg.withFees(cfg.fees().withTradingFees(protocolBps, subjectBps, referralBps)));
        publishFees(updated.fees());
        return updated.fees();
    }

    public FeeSchedule updateSubscriptionFees(Address caller, int protocolBps, int referrerBps) {
        ProtocolConfig updated = update(caller, "subscription fees", cfg ->
                cfg.withFees(cfg.fees().withSubscriptionFees(protocolBps, referrerBps)));
        publishFees(updated.fees());
        return updated.fees();
    }

    public CurveWeights updateCurveWeights(Address caller, long a, long b, long c) {
        ProtocolConfig updated = update(caller, "weights", cfg -> cfg.withWeights(new CurveWeights(a, b, c)));
        events.publish(new MarketEvent.ConfigUpdated("curve.weights", a + "," + b + "," + c, clock.now()));
        return updated.weights();
    }

    public Address updateTreasury(Address caller, Address treasury) {
        Objects.requireNonNull(treasury, "treasury");
        update(caller, "treasury", cfg -> {
            ctx.requireExternal("treasury", treasury);
            return cfg.withTreasury(treasury);
        });
        events.publish(new MarketEvent.ConfigUpdated("protocol.treasury", treasury.value(), clock.now()));
        return treasury;
    }

    public long updateOutpostPurchasePrice(Address caller, long price) {
        update(caller, "outpost purchase price", cfg -> {
            if (price <= 0) {
                throw new MarketException(MarketError.INVALID_AMOUNT,
                        "Outpost purchase price must be > 0, got " + price);
            }
            return cfg.withOutpostPurchasePrice(price);
        });
        events.publish(new MarketEvent.ConfigUpdated("outpost.purchasePrice", Long.toString(price), clock.now()));
        return price;
    }

    private ProtocolConfig update(Address caller, String what, UnaryOperator<ProtocolConfig> change) {
        requireAdmin(caller);
        ProtocolConfig updated = ctx.locks().withLocks(List.of(EntityLocks.CONFIG), () -> {
            ProtocolConfig next = change.apply(ctx.config());
            return ctx.updateConfig(current -> next);
        });
        log.info("[ADMIN] action=UPDATE_CONFIG field={} by={}", what, caller.shortHex());
        return updated;
    }

    private void requireAdmin(Address caller) {
        if (caller == null || !auth.isAdmin(caller)) {
            throw new MarketException(MarketError.NOT_ADMIN, "Caller is not the protocol admin: " + caller);
        }
    }

    private void publishFees(FeeSchedule f) {
        events.publish(new MarketEvent.FeesUpdated(f.protocolFeeBps(), f.subjectFeeBps(), f.referralFeeBps(),
                f.subscriptionProtocolFeeBps(), f.subscriptionReferrerFeeBps(), clock.now()));
    }
}
