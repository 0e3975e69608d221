package com.podium.application.service;

import com.podium.application.market.EntityLocks;
import com.podium.application.market.MarketContext;
import com.podium.application.market.OutpostRegistry;
import com.podium.application.market.PassAssetRegistry;
import com.podium.application.ports.ClockPort;
import com.podium.application.ports.MarketEventPort;
import com.podium.application.ports.PassTokenPort;
import com.podium.application.ports.SettlementPort;
import com.podium.application.ports.impl.ProtocolAuthorization;
import com.podium.domain.account.Address;
import com.podium.domain.config.ProtocolConfig;
import com.podium.domain.ledger.PassSupplyLedger;
import com.podium.domain.ledger.RedemptionVault;

import java.util.Objects;

/**
 * One wired engine: shared context plus the services operating on it.
 */
public final class MarketEngine {

    private final MarketContext context;
    private final ProtocolAuthorization authorization;
    private final PassTradingService trading;
    private final SubscriptionService subscriptions;
    private final OutpostService outposts;
    private final ProtocolAdminService admin;

    private MarketEngine(MarketContext context,
                         ProtocolAuthorization authorization,
                         PassTradingService trading,
                         SubscriptionService subscriptions,
                         OutpostService outposts,
                         ProtocolAdminService admin) {
        this.context = context;
        this.authorization = authorization;
        this.trading = trading;
        this.subscriptions = subscriptions;
        this.outposts = outposts;
        this.admin = admin;
    }

    public static MarketEngine create(ProtocolConfig config,
                                      Address adminAccount,
                                      boolean autoClearExpired,
                                      SettlementPort settlement,
                                      PassTokenPort passTokens,
                                      ClockPort clock,
                                      MarketEventPort events) {
        Objects.requireNonNull(settlement, "settlement");
        OutpostRegistry registry = new OutpostRegistry();
        MarketContext ctx = new MarketContext(
                config,
                new RedemptionVault(),
                new PassSupplyLedger(),
                registry,
                new PassAssetRegistry(passTokens),
                new EntityLocks()
        );
        settlement.register(ctx.vaultAccount());

        ProtocolAuthorization auth = new ProtocolAuthorization(adminAccount, registry);
        return new MarketEngine(
                ctx,
                auth,
                new PassTradingService(ctx, settlement, clock, events),
                new SubscriptionService(ctx, auth, settlement, clock, events, autoClearExpired),
                new OutpostService(ctx, auth, settlement, clock, events),
                new ProtocolAdminService(ctx, auth, clock, events)
        );
    }

    public MarketContext context() { return context; }
    public ProtocolAuthorization authorization() { return authorization; }
    public PassTradingService trading() { return trading; }
    public SubscriptionService subscriptions() { return subscriptions; }
    public OutpostService outposts() { return outposts; }
    public ProtocolAdminService admin() { return admin; }
}
