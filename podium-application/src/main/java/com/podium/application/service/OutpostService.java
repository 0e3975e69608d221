package com.podium.application.service;

import com.podium.application.events.MarketEvent;
import com.podium.application.market.AddressDerivation;
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
import com.podium.domain.outpost.Outpost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Creation and owner controls of outposts.
 */
public class OutpostService {

    private static final Logger log = LoggerFactory.getLogger(OutpostService.class);

    private final MarketContext ctx;
    private final AuthorizationPort auth;
    private final Payments payments;
    private final ClockPort clock;
    private final MarketEvents events;

    public OutpostService(MarketContext ctx,
                          AuthorizationPort auth,
                          SettlementPort settlement,
                          ClockPort clock,
                          MarketEventPort events) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.auth = Objects.requireNonNull(auth, "auth");
        this.payments = new Payments(settlement);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = new MarketEvents(events);
    }

    /**
     * Charges the purchase price to the creator and registers a new outpost
     * at the address derived from creator and name.
     */
    public Outpost create(Address creator, String name, String description, String uri) {
        Objects.requireNonNull(creator, "creator");
        ctx.requireExternal("outpost creator", creator);
        Address address = AddressDerivation.outpost(creator, name);

        Outpost created = ctx.locks().withLocks(List.of(EntityLocks.outpost(address)), () -> {
            if (ctx.outposts().contains(address)) {
                throw new MarketException(MarketError.OUTPOST_EXISTS, "Outpost already exists: " + address);
            }
            ProtocolConfig cfg = ctx.config();
            long price = cfg.outpostPurchasePrice();
            payments.requireBalance(creator, price);

            return MarketTransaction.run("create-outpost", tx -> {
                payments.pay(tx, creator, cfg.treasury(), price);
                Outpost outpost = Outpost.create(address, creator, name, description, uri,
                        price, cfg.outpostRoyalty(), clock.now());
                ctx.outposts().register(outpost);
                tx.onRollback("register", () -> ctx.outposts().remove(address));
                return outpost;
            });
        });

        log.info("[OUTPOST] action=CREATE outpost={} owner={} name={} paid={}",
                address.shortHex(), creator.shortHex(), created.name(), created.price());
        events.publish(new MarketEvent.OutpostCreated(address, creator, created.name(), created.price(),
                clock.now()));
        return created;
    }

    public long updatePrice(Address caller, Address outpostAddress, long price) {
        long updated = ctx.locks().withLocks(keys(outpostAddress), () -> {
            Outpost outpost = owned(caller, outpostAddress);
            outpost.updatePrice(price);
            return outpost.price();
        });
        log.info("[OUTPOST] action=UPDATE_PRICE outpost={} price={}", outpostAddress.shortHex(), updated);
        events.publish(new MarketEvent.OutpostPriceUpdated(outpostAddress, updated, clock.now()));
        return updated;
    }

    /** @return the pause state after the toggle */
    public boolean togglePause(Address caller, Address outpostAddress) {
        boolean paused = ctx.locks().withLocks(keys(outpostAddress), () ->
                owned(caller, outpostAddress).togglePause());
        log.warn("[OUTPOST] action=TOGGLE_PAUSE outpost={} paused={}", outpostAddress.shortHex(), paused);
        events.publish(new MarketEvent.OutpostPauseToggled(outpostAddress, paused, clock.now()));
        return paused;
    }

    /** @return the previous owner */
    public Address transferOwnership(Address caller, Address outpostAddress, Address newOwner) {
        Objects.requireNonNull(newOwner, "newOwner");
        Address previous = ctx.locks().withLocks(keys(outpostAddress), () -> {
            Outpost outpost = owned(caller, outpostAddress);
            ctx.requireExternal("outpost owner", newOwner);
            return outpost.transferOwnership(newOwner);
        });
        log.info("[OUTPOST] action=TRANSFER_OWNERSHIP outpost={} from={} to={}",
                outpostAddress.shortHex(), previous.shortHex(), newOwner.shortHex());
        events.publish(new MarketEvent.OwnershipTransferred(outpostAddress, previous, newOwner, clock.now()));
        return previous;
    }

    /* =========================
       Views
       ========================= */

    public Optional<Outpost> outpost(Address address) {
        return ctx.outposts().find(address);
    }

    public List<Outpost> outposts() {
        return ctx.outposts().all();
    }

    public boolean isOutpost(Address address) {
        return ctx.outposts().contains(address);
    }

    public Address ownerOf(Address outpostAddress) {
        return ctx.locks().withLocks(keys(outpostAddress), () -> ctx.outposts().require(outpostAddress).owner());
    }

    /** Address a create call by {@code creator} with {@code name} would produce. */
    public Address addressFor(Address creator, String name) {
        return AddressDerivation.outpost(creator, name);
    }

    private Outpost owned(Address caller, Address outpostAddress) {
        Outpost outpost = ctx.outposts().require(outpostAddress);
        if (!auth.isOwner(caller, outpostAddress)) {
            throw new MarketException(MarketError.NOT_OWNER, caller + " does not own outpost " + outpostAddress);
        }
        return outpost;
    }

    private static List<String> keys(Address outpostAddress) {
        Objects.requireNonNull(outpostAddress, "outpost");
        return List.of(EntityLocks.outpost(outpostAddress));
    }
}
