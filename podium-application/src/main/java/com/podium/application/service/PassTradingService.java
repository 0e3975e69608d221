package com.podium.application.service;

import com.podium.application.events.MarketEvent;
import com.podium.application.market.EntityLocks;
import com.podium.application.market.MarketContext;
import com.podium.application.market.MarketTransaction;
import com.podium.application.market.PassAsset;
import com.podium.application.ports.ClockPort;
import com.podium.application.ports.MarketEventPort;
import com.podium.application.ports.SettlementPort;
import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;
import com.podium.domain.config.ProtocolConfig;
import com.podium.domain.curve.BondingCurve;
import com.podium.domain.fee.BuySplit;
import com.podium.domain.fee.FeeSplitter;
import com.podium.domain.fee.SellSplit;
import com.podium.domain.ledger.PassStats;
import com.podium.domain.outpost.Outpost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Buys and sells passes of a target against the bonding curve.
 *
 * A target is either an outpost or a plain account acting as its own subject.
 * Base prices go through the redemption vault; fees go straight to their payees.
 */
public class PassTradingService {

    private static final Logger log = LoggerFactory.getLogger(PassTradingService.class);

    private final MarketContext ctx;
    private final Payments payments;
    private final ClockPort clock;
    private final MarketEvents events;

    public PassTradingService(MarketContext ctx, SettlementPort settlement, ClockPort clock, MarketEventPort events) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.payments = new Payments(settlement);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = new MarketEvents(events);
    }

    /* =========================
       Trades
       ========================= */

    public PassTrade buy(Address buyer, Address target, long amount, Address referrer) {
        Objects.requireNonNull(buyer, "buyer");
        Objects.requireNonNull(target, "target");
        ctx.requireExternal("buy party", buyer, target, referrer);
        requirePositive(amount);

        PassTrade trade = ctx.locks().withLocks(tradeKeys(target), () -> {
            ProtocolConfig cfg = ctx.config();
            Optional<Outpost> outpost = ctx.outposts().find(target);
            outpost.ifPresent(Outpost::requireNotPaused);
            Address subject = outpost.map(Outpost::owner).orElse(target);

            PassStats before = ctx.supply().getOrCreate(target);
            PassQuote quote = priceBuy(cfg, target, before.totalSupply(), amount, referrer != null);
            payments.requireBalance(buyer, quote.callerAmount());

            return MarketTransaction.run("buy", tx -> {
                payments.pay(tx, buyer, ctx.vaultAccount(), quote.basePrice());
                ctx.vault().deposit(quote.basePrice());
                tx.onRollback("vault deposit", () -> ctx.vault().withdraw(quote.basePrice()));

                payments.pay(tx, buyer, cfg.treasury(), quote.protocolFee());
                payments.pay(tx, buyer, subject, quote.subjectFee());
                if (referrer != null) {
                    payments.pay(tx, buyer, referrer, quote.referralFee());
                }

                PassAsset asset = ctx.assets().getOrCreate(target);
                asset.mint(amount);
                tx.onRollback("mint", () -> asset.burn(amount));
                asset.transfer(ctx.escrowAccount(), buyer, amount);
                tx.onRollback("deliver", () -> asset.transfer(buyer, ctx.escrowAccount(), amount));

                PassStats after = ctx.supply().recordBuy(target, amount, quote.basePrice());
                tx.onRollback("supply", () -> ctx.supply().restore(target, before));

                return new PassTrade(buyer, subject, referrer, quote, after.totalSupply());
            });
        });

        log.info("[MARKET] action=BUY target={} buyer={} amount={} price={} supply={}",
                target.shortHex(), buyer.shortHex(), amount, trade.quote().basePrice(), trade.supplyAfter());
        PassQuote q = trade.quote();
        events.publish(new MarketEvent.PassPurchased(buyer, target, referrer, amount,
                q.basePrice(), q.protocolFee(), q.subjectFee(), q.referralFee(),
                trade.supplyAfter(), clock.now()));
        return trade;
    }

    public PassTrade sell(Address seller, Address target, long amount) {
        Objects.requireNonNull(seller, "seller");
        Objects.requireNonNull(target, "target");
        ctx.requireExternal("sell party", seller, target);
        requirePositive(amount);

        PassTrade trade = ctx.locks().withLocks(tradeKeys(target), () -> {
            ProtocolConfig cfg = ctx.config();
            Optional<Outpost> outpost = ctx.outposts().find(target);
            outpost.ifPresent(Outpost::requireNotPaused);
            Address subject = outpost.map(Outpost::owner).orElse(target);

            PassStats before = ctx.supply().getOrCreate(target);
            PassQuote quote = priceSell(cfg, target, before.totalSupply(), amount);

            PassAsset asset = ctx.assets().getOrCreate(target);
            long held = asset.balance(seller);
            if (held < amount) {
                throw new MarketException(MarketError.INSUFFICIENT_CALLER_BALANCE,
                        seller + " holds " + held + " passes, tried to sell " + amount);
            }

            return MarketTransaction.run("sell", tx -> {
                ctx.vault().withdraw(quote.basePrice());
                tx.onRollback("vault withdraw", () -> ctx.vault().deposit(quote.basePrice()));

                asset.transfer(seller, ctx.escrowAccount(), amount);
                tx.onRollback("escrow", () -> asset.transfer(ctx.escrowAccount(), seller, amount));
                asset.burn(amount);
                tx.onRollback("burn", () -> asset.mint(amount));

                payments.pay(tx, ctx.vaultAccount(), cfg.treasury(), quote.protocolFee());
                payments.pay(tx, ctx.vaultAccount(), subject, quote.subjectFee());
                payments.pay(tx, ctx.vaultAccount(), seller, quote.callerAmount());

                PassStats after = ctx.supply().recordSell(target, amount, quote.basePrice());
                tx.onRollback("supply", () -> ctx.supply().restore(target, before));

                return new PassTrade(seller, subject, null, quote, after.totalSupply());
            });
        });

        log.info("[MARKET] action=SELL target={} seller={} amount={} price={} supply={}",
                target.shortHex(), seller.shortHex(), amount, trade.quote().basePrice(), trade.supplyAfter());
        PassQuote q = trade.quote();
        events.publish(new MarketEvent.PassSold(seller, target, amount,
                q.basePrice(), q.protocolFee(), q.subjectFee(), q.callerAmount(),
                trade.supplyAfter(), clock.now()));
        return trade;
    }

    /* =========================
       Views
       ========================= */

    public PassQuote quoteBuy(Address target, long amount, boolean withReferrer) {
        requirePositive(amount);
        return ctx.locks().withLocks(List.of(EntityLocks.target(target)), () ->
                priceBuy(ctx.config(), target, ctx.supply().totalSupply(target), amount, withReferrer));
    }

    public PassQuote quoteSell(Address target, long amount) {
        requirePositive(amount);
        return ctx.locks().withLocks(List.of(EntityLocks.target(target)), () ->
                priceSell(ctx.config(), target, ctx.supply().totalSupply(target), amount));
    }

    /** Stats of a target; untouched targets report the initial entry. */
    public PassStats stats(Address target) {
        return ctx.supply().find(target).orElseGet(PassStats::initial);
    }

    public long passBalance(Address account, Address target) {
        return ctx.assets().getOrCreate(target).balance(account);
    }

    public long vaultBalance() {
        return ctx.vault().balance();
    }

    /* =========================
       Pricing
       ========================= */

    private PassQuote priceBuy(ProtocolConfig cfg, Address target, long supply, long amount, boolean withReferrer) {
        long price = BondingCurve.buyPrice(supply, amount, cfg.weights());
        BuySplit split = FeeSplitter.splitBuy(price, withReferrer, cfg.fees());
        return new PassQuote(TradeSide.BUY, target, supply, amount, split.base(),
                split.protocolFee(), split.subjectFee(), split.referralFee(), split.total());
    }

    private PassQuote priceSell(ProtocolConfig cfg, Address target, long supply, long amount) {
        if (amount > supply) {
            throw new MarketException(MarketError.SUPPLY_UNDERFLOW,
                    "Cannot sell " + amount + " of " + supply + " outstanding");
        }
        long price = BondingCurve.sellPrice(supply, amount, cfg.weights());
        SellSplit split = FeeSplitter.splitSell(price, cfg.fees());
        return new PassQuote(TradeSide.SELL, target, supply, amount, split.base(),
                split.protocolFee(), split.subjectFee(), 0L, split.netToSeller());
    }

    private static List<String> tradeKeys(Address target) {
        return List.of(EntityLocks.VAULT, EntityLocks.target(target), EntityLocks.outpost(target));
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new MarketException(MarketError.INVALID_AMOUNT, "amount must be > 0, got " + amount);
        }
    }
}
