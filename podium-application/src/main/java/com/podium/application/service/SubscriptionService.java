package com.podium.application.service;

import com.podium.application.events.MarketEvent;
import com.podium.application.market.EntityLocks;
import com.podium.application.market.MarketContext;
import com.podium.application.market.MarketTransaction;
import com.podium.application.ports.AuthorizationPort;
import com.podium.application.ports.ClockPort;
import com.podium.application.ports.MarketEventPort;
import com.podium.application.ports.SettlementPort;
import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;
import com.podium.domain.config.ProtocolConfig;
import com.podium.domain.fee.FeeSplitter;
import com.podium.domain.fee.SubscriptionSplit;
import com.podium.domain.outpost.Outpost;
import com.podium.domain.outpost.Subscription;
import com.podium.domain.outpost.SubscriptionTier;
import com.podium.domain.outpost.TierDuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tier tables and time-boxed subscriptions of outposts.
 *
 * <p>One subscription record per (subscriber, outpost). Switching tiers means
 * cancel, then subscribe. With {@code autoClearExpired} off, an expired record
 * that was never cancelled still blocks a new subscribe.
 */
public class SubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private final MarketContext ctx;
    private final AuthorizationPort auth;
    private final Payments payments;
    private final ClockPort clock;
    private final MarketEvents events;
    private final boolean autoClearExpired;

    public SubscriptionService(MarketContext ctx,
                               AuthorizationPort auth,
                               SettlementPort settlement,
                               ClockPort clock,
                               MarketEventPort events,
                               boolean autoClearExpired) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.auth = Objects.requireNonNull(auth, "auth");
        this.payments = new Payments(settlement);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = new MarketEvents(events);
        this.autoClearExpired = autoClearExpired;
    }

    /* =========================
       Tiers (owner only)
       ========================= */

    public SubscriptionTier createTier(Address caller, Address outpostAddress, String name, long price,
                                       TierDuration duration) {
        SubscriptionTier tier = ctx.locks().withLocks(keys(outpostAddress), () -> {
            Outpost outpost = ownedOutpost(caller, outpostAddress);
            return outpost.addTier(name, price, duration);
        });
        log.info("[SUBSCRIPTION] action=CREATE_TIER outpost={} tier={} name={} price={} duration={}",
                outpostAddress.shortHex(), tier.id(), tier.name(), tier.price(), tier.duration());
        events.publish(new MarketEvent.TierCreated(outpostAddress, tier.id(), tier.name(), tier.price(),
                tier.duration().name(), clock.now()));
        return tier;
    }

    public SubscriptionTier updateTierPrice(Address caller, Address outpostAddress, int tierId, long price) {
        SubscriptionTier tier = ctx.locks().withLocks(keys(outpostAddress), () ->
                ownedOutpost(caller, outpostAddress).updateTierPrice(tierId, price));
        publishTierUpdated(outpostAddress, tier);
        return tier;
    }

    public SubscriptionTier updateTierDuration(Address caller, Address outpostAddress, int tierId,
                                               TierDuration duration) {
        SubscriptionTier tier = ctx.locks().withLocks(keys(outpostAddress), () ->
                ownedOutpost(caller, outpostAddress).updateTierDuration(tierId, duration));
        publishTierUpdated(outpostAddress, tier);
        return tier;
    }

    /* =========================
       Subscribe / cancel
       ========================= */

    public Subscription subscribe(Address subscriber, Address outpostAddress, int tierId, Address referrer) {
        Objects.requireNonNull(subscriber, "subscriber");
        ctx.requireExternal("subscription party", subscriber, referrer);

        record Result(Subscription subscription, SubscriptionSplit split, Address owner) {}

        Result result = ctx.locks().withLocks(keys(outpostAddress), () -> {
            ProtocolConfig cfg = ctx.config();
            long now = clock.now();
            Outpost outpost = ctx.outposts().require(outpostAddress);
            outpost.requireNotPaused();
            SubscriptionTier tier = outpost.tier(tierId);

            Optional<Subscription> existing = outpost.subscription(subscriber);
            boolean clearExpired = existing.isPresent() && autoClearExpired && existing.get().isExpiredAt(now);
            if (existing.isPresent() && !clearExpired) {
                throw new MarketException(MarketError.ALREADY_SUBSCRIBED,
                        subscriber + " already holds a subscription on " + outpostAddress);
            }

            SubscriptionSplit split = FeeSplitter.splitSubscription(tier.price(), referrer != null, cfg.fees());
            payments.requireBalance(subscriber, split.price());

            return MarketTransaction.run("subscribe", tx -> {
                if (clearExpired) {
                    Subscription stale = outpost.removeSubscription(subscriber);
                    tx.onRollback("restore expired", () -> outpost.restoreSubscription(stale));
                }
                payments.pay(tx, subscriber, cfg.treasury(), split.protocolFee());
                if (referrer != null) {
                    payments.pay(tx, subscriber, referrer, split.referralFee());
                }
                payments.pay(tx, subscriber, outpost.owner(), split.ownerShare());

                Subscription created = Subscription.start(subscriber, tier, now);
                outpost.addSubscription(created);
                tx.onRollback("insert", () -> outpost.removeSubscription(subscriber));
                return new Result(created, split, outpost.owner());
            });
        });

        Subscription s = result.subscription();
        SubscriptionSplit split = result.split();
        log.info("[SUBSCRIPTION] action=SUBSCRIBE outpost={} subscriber={} tier={} price={} until={}",
                outpostAddress.shortHex(), subscriber.shortHex(), s.tierId(), split.price(), s.endTime());
        events.publish(new MarketEvent.SubscriptionCreated(subscriber, outpostAddress, s.tierId(), referrer,
                split.price(), split.protocolFee(), split.referralFee(), split.ownerShare(),
                s.startTime(), s.endTime(), clock.now()));
        return s;
    }

    /** Removes the caller's own record. Nothing is refunded. */
    public Subscription cancel(Address subscriber, Address outpostAddress) {
        Objects.requireNonNull(subscriber, "subscriber");
        Subscription removed = ctx.locks().withLocks(keys(outpostAddress), () -> {
            Outpost outpost = ctx.outposts().require(outpostAddress);
            outpost.requireNotPaused();
            return outpost.removeSubscription(subscriber);
        });
        log.info("[SUBSCRIPTION] action=CANCEL outpost={} subscriber={} tier={}",
                outpostAddress.shortHex(), subscriber.shortHex(), removed.tierId());
        events.publish(new MarketEvent.SubscriptionCancelled(subscriber, outpostAddress, removed.tierId(),
                clock.now()));
        return removed;
    }

    /* =========================
       Views
       ========================= */

    public boolean isActive(Address subscriber, Address outpostAddress, int tierId) {
        if (!ctx.outposts().contains(outpostAddress)) return false;
        return ctx.locks().withLocks(keys(outpostAddress), () ->
                ctx.outposts().require(outpostAddress).isSubscriptionActive(subscriber, tierId, clock.now()));
    }

    public Optional<SubscriptionDetails> subscription(Address subscriber, Address outpostAddress) {
        return ctx.locks().withLocks(keys(outpostAddress), () -> {
            Outpost outpost = ctx.outposts().require(outpostAddress);
            long now = clock.now();
            return outpost.subscription(subscriber)
                    .map(s -> new SubscriptionDetails(s, outpost.tier(s.tierId()), now));
        });
    }

    public List<SubscriptionTier> tiers(Address outpostAddress) {
        return ctx.locks().withLocks(keys(outpostAddress), () ->
                List.copyOf(ctx.outposts().require(outpostAddress).tiers()));
    }

    public SubscriptionTier tier(Address outpostAddress, int tierId) {
        return ctx.locks().withLocks(keys(outpostAddress), () ->
                ctx.outposts().require(outpostAddress).tier(tierId));
    }

    public int tierCount(Address outpostAddress) {
        return ctx.locks().withLocks(keys(outpostAddress), () ->
                ctx.outposts().require(outpostAddress).tierCount());
    }

    /* =========================
       Helpers
       ========================= */

    private Outpost ownedOutpost(Address caller, Address outpostAddress) {
        Outpost outpost = ctx.outposts().require(outpostAddress);
        if (!auth.isOwner(caller, outpostAddress)) {
            throw new MarketException(MarketError.NOT_OWNER, caller + " does not own outpost " + outpostAddress);
        }
        return outpost;
    }

    private void publishTierUpdated(Address outpostAddress, SubscriptionTier tier) {
        log.info("[SUBSCRIPTION] action=UPDATE_TIER outpost={} tier={} price={} duration={}",
                outpostAddress.shortHex(), tier.id(), tier.price(), tier.duration());
        events.publish(new MarketEvent.TierUpdated(outpostAddress, tier.id(), tier.price(),
                tier.duration().name(), clock.now()));
    }

    private static List<String> keys(Address outpostAddress) {
        Objects.requireNonNull(outpostAddress, "outpost");
        return List.of(EntityLocks.outpost(outpostAddress));
    }
}
