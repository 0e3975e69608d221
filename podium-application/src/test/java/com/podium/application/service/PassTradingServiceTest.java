package com.podium.application.service;

import com.podium.application.events.MarketEvent;
import com.podium.application.support.TestMarket;
import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;
import com.podium.domain.ledger.PassStats;
import com.podium.domain.outpost.Outpost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PassTradingServiceTest {

    private static final long ONE_BILLION = 1_000_000_000L;

    private TestMarket market;
    private PassTradingService trading;
    private Address target;
    private Address buyer;

    @BeforeEach
    void setUp() {
        market = new TestMarket();
        trading = market.engine.trading();
        target = Address.of("0x5b");
        buyer = market.funded("0xb1", ONE_BILLION);
    }

    private static MarketError errorOf(Throwable t) {
        return ((MarketException) t).error();
    }

    @Test
    void buyChargesPricePlusFeesAndMirrorsVault() {
        PassTrade trade = trading.buy(buyer, target, 3, null);

        assertThat(trade.quote().basePrice()).isEqualTo(400_000_000L);
        assertThat(trade.quote().protocolFee()).isEqualTo(16_000_000L);
        assertThat(trade.quote().subjectFee()).isEqualTo(32_000_000L);
        assertThat(trade.quote().referralFee()).isZero();
        assertThat(trade.quote().callerAmount()).isEqualTo(448_000_000L);
        assertThat(trade.supplyAfter()).isEqualTo(3);

        assertThat(market.settlement.balance(buyer)).isEqualTo(ONE_BILLION - 448_000_000L);
        assertThat(market.settlement.balance(TestMarket.TREASURY)).isEqualTo(16_000_000L);
        assertThat(market.settlement.balance(target)).isEqualTo(32_000_000L);
        assertThat(trading.vaultBalance()).isEqualTo(400_000_000L);
        assertThat(market.settlement.balance(market.engine.context().vaultAccount())).isEqualTo(trading.vaultBalance());
        assertThat(trading.passBalance(buyer, target)).isEqualTo(3);
        assertThat(trading.stats(target)).isEqualTo(new PassStats(3, 400_000_000L));
    }

    @Test
    void referrerReceivesReferralFee() {
        Address referrer = Address.of("0xef");

        PassTrade trade = trading.buy(buyer, target, 3, referrer);

        assertThat(trade.quote().callerAmount()).isEqualTo(456_000_000L);
        assertThat(market.settlement.balance(referrer)).isEqualTo(8_000_000L);
    }

    @Test
    void sellPaysBackBaseMinusFeesAndEmptiesVault() {
        long totalBefore = market.settlement.total();
        trading.buy(buyer, target, 3, null);

        PassTrade sold = trading.sell(buyer, target, 3);

        assertThat(sold.quote().basePrice()).isEqualTo(400_000_000L);
        assertThat(sold.quote().callerAmount()).isEqualTo(352_000_000L);
        assertThat(sold.supplyAfter()).isZero();
        assertThat(trading.vaultBalance()).isZero();
        assertThat(market.settlement.balance(market.engine.context().vaultAccount())).isZero();
        assertThat(market.settlement.balance(buyer)).isEqualTo(ONE_BILLION - 448_000_000L + 352_000_000L);
        assertThat(market.settlement.balance(TestMarket.TREASURY)).isEqualTo(32_000_000L);
        assertThat(market.settlement.balance(target)).isEqualTo(64_000_000L);
        assertThat(market.settlement.total()).isEqualTo(totalBefore);
        assertThat(trading.passBalance(buyer, target)).isZero();
    }

    @Test
    void vaultCoversEverySellAfterManyTrades() {
        Address other = market.funded("0xb2", 100 * ONE_BILLION);
        market.settlement.fund(buyer, 10 * ONE_BILLION);
        trading.buy(buyer, target, 2, null);
        trading.buy(other, target, 7, null);
        trading.sell(buyer, target, 1);
        trading.buy(buyer, target, 4, null);

        trading.sell(other, target, 7);
        trading.sell(buyer, target, 5);

        assertThat(trading.stats(target).totalSupply()).isZero();
        assertThat(trading.vaultBalance()).isZero();
    }

    @Test
    void sellingMoreThanSupplyIsUnderflow() {
        assertThatThrownBy(() -> trading.sell(buyer, target, 1))
                .isInstanceOf(MarketException.class)
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(MarketError.SUPPLY_UNDERFLOW));
    }

    @Test
    void sellingPassesNotHeldIsRejected() {
        trading.buy(buyer, target, 2, null);
        Address stranger = market.funded("0xc1", ONE_BILLION);

        assertThatThrownBy(() -> trading.sell(stranger, target, 1))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(MarketError.INSUFFICIENT_CALLER_BALANCE));
        assertThat(trading.stats(target).totalSupply()).isEqualTo(2);
    }

    @Test
    void underfundedBuyChangesNothing() {
        Address poor = market.funded("0xc2", 100);

        assertThatThrownBy(() -> trading.buy(poor, target, 1, null))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(MarketError.INSUFFICIENT_CALLER_BALANCE));
        assertThat(market.settlement.balance(poor)).isEqualTo(100);
        assertThat(trading.vaultBalance()).isZero();
    }

    @Test
    void nonPositiveAmountIsInvalid() {
        assertThatThrownBy(() -> trading.buy(buyer, target, 0, null))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(MarketError.INVALID_AMOUNT));
        assertThatThrownBy(() -> trading.quoteSell(target, -1))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(MarketError.INVALID_AMOUNT));
    }

    @Test
    void failedPayoutRollsBackEveryEffect() {
        market.settlement.failTransfersTo(target);

        assertThatThrownBy(() -> trading.buy(buyer, target, 3, null))
                .isInstanceOf(IllegalStateException.class);

        assertThat(market.settlement.balance(buyer)).isEqualTo(ONE_BILLION);
        assertThat(market.settlement.balance(TestMarket.TREASURY)).isZero();
        assertThat(market.settlement.balance(market.engine.context().vaultAccount())).isZero();
        assertThat(trading.vaultBalance()).isZero();
        assertThat(trading.passBalance(buyer, target)).isZero();
        assertThat(trading.stats(target)).isEqualTo(PassStats.initial());
        assertThat(market.events.all()).isEmpty();
    }

    @Test
    void vaultAccountCannotPayForPasses() {
        trading.buy(buyer, target, 3, null);
        Address vaultAccount = market.engine.context().vaultAccount();
        Address escrowAccount = market.engine.context().escrowAccount();
        Address stranger = Address.of("0xbad");

        assertThatThrownBy(() -> trading.buy(vaultAccount, stranger, 1, stranger))
                .satisfies(t -> assertThat(errorOf(t)).isEqualTo(MarketError.NOT_OWNER));
        assertThatThrownBy(() -> trading.buy(buyer, vaultAccount, 1, null))
                .satisfies(t -> assertThat(errorOf(t)).isEqualTo(MarketError.NOT_OWNER));
        assertThatThrownBy(() -> trading.buy(buyer, target, 1, escrowAccount))
                .satisfies(t -> assertThat(errorOf(t)).isEqualTo(MarketError.NOT_OWNER));
        assertThatThrownBy(() -> trading.sell(escrowAccount, target, 1))
                .satisfies(t -> assertThat(errorOf(t)).isEqualTo(MarketError.NOT_OWNER));

        assertThat(trading.vaultBalance()).isEqualTo(400_000_000L);
        assertThat(market.settlement.balance(vaultAccount)).isEqualTo(400_000_000L);
        assertThat(market.settlement.isRegistered(stranger)).isFalse();

        PassTrade sold = trading.sell(buyer, target, 3);
        assertThat(sold.quote().callerAmount()).isEqualTo(352_000_000L);
        assertThat(trading.vaultBalance()).isZero();
    }

    @Test
    void vaultAccountCannotSubscribeOrBuyAnOutpost() {
        Address vaultAccount = market.engine.context().vaultAccount();
        trading.buy(buyer, target, 3, null);
        Address owner = market.funded("0xa1", ONE_BILLION);
        Outpost outpost = market.engine.outposts().create(owner, "hall", "", "");

        assertThatThrownBy(() -> market.engine.outposts().create(vaultAccount, "stolen", "", ""))
                .satisfies(t -> assertThat(errorOf(t)).isEqualTo(MarketError.NOT_OWNER));
        assertThatThrownBy(() -> market.engine.subscriptions().subscribe(vaultAccount, outpost.address(), 0, null))
                .satisfies(t -> assertThat(errorOf(t)).isEqualTo(MarketError.NOT_OWNER));
        assertThatThrownBy(() -> market.engine.outposts().transferOwnership(owner, outpost.address(), vaultAccount))
                .satisfies(t -> assertThat(errorOf(t)).isEqualTo(MarketError.NOT_OWNER));
        assertThatThrownBy(() -> market.engine.admin().updateTreasury(TestMarket.ADMIN, vaultAccount))
                .satisfies(t -> assertThat(errorOf(t)).isEqualTo(MarketError.NOT_OWNER));

        assertThat(market.settlement.balance(vaultAccount)).isEqualTo(trading.vaultBalance());
        assertThat(market.engine.outposts().ownerOf(outpost.address())).isEqualTo(owner);
    }

    @Test
    void outpostPassesPaySubjectFeeToOwnerAndRespectPause() {
        Address owner = market.funded("0xa1", ONE_BILLION);
        Outpost outpost = market.engine.outposts().create(owner, "hall", "", "");

        trading.buy(buyer, outpost.address(), 3, null);
        assertThat(market.settlement.balance(owner)).isEqualTo(ONE_BILLION - TestMarket.OUTPOST_PRICE + 32_000_000L);

        market.engine.outposts().togglePause(owner, outpost.address());
        assertThatThrownBy(() -> trading.sell(buyer, outpost.address(), 1))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(MarketError.EMERGENCY_PAUSE));
    }

    @Test
    void quotesMatchExecutedTrades() {
        PassQuote quote = trading.quoteBuy(target, 5, true);
        PassTrade trade = trading.buy(buyer, target, 5, Address.of("0xef"));

        assertThat(trade.quote()).isEqualTo(quote);
        assertThat(trading.quoteSell(target, 5).basePrice()).isEqualTo(quote.basePrice());
    }

    @Test
    void tradesPublishEventsAfterCommit() {
        trading.buy(buyer, target, 2, null);
        trading.sell(buyer, target, 1);

        assertThat(market.events.types()).containsExactly("PassPurchased", "PassSold");
        MarketEvent.PassSold sold = market.events.last(MarketEvent.PassSold.class);
        assertThat(sold.supplyAfter()).isEqualTo(1);
        assertThat(sold.timestamp()).isEqualTo(market.clock.now());
    }
}
