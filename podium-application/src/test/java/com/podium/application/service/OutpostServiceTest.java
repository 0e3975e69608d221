package com.podium.application.service;

import com.podium.application.market.AddressDerivation;
import com.podium.application.support.TestMarket;
import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;
import com.podium.domain.outpost.Outpost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutpostServiceTest {

    private TestMarket market;
    private OutpostService outposts;
    private Address creator;

    @BeforeEach
    void setUp() {
        market = new TestMarket();
        outposts = market.engine.outposts();
        creator = market.funded("0xa1", 500_000_000L);
    }

    private static MarketError errorOf(Throwable t) {
        return ((MarketException) t).error();
    }

    @Test
    void createChargesPurchasePriceAtDerivedAddress() {
        Outpost created = outposts.create(creator, "hall", "main stage", "ipfs://hall");

        assertThat(created.address()).isEqualTo(AddressDerivation.outpost(creator, "hall"));
        assertThat(created.address()).isEqualTo(outposts.addressFor(creator, "hall"));
        assertThat(created.owner()).isEqualTo(creator);
        assertThat(created.price()).isEqualTo(TestMarket.OUTPOST_PRICE);
        assertThat(created.createdAt()).isEqualTo(market.clock.now());
        assertThat(market.settlement.balance(creator)).isEqualTo(400_000_000L);
        assertThat(market.settlement.balance(TestMarket.TREASURY)).isEqualTo(TestMarket.OUTPOST_PRICE);
        assertThat(outposts.isOutpost(created.address())).isTrue();
        assertThat(market.events.types()).containsExactly("OutpostCreated");
    }

    @Test
    void sameCreatorAndNameCollides() {
        outposts.create(creator, "hall", "", "");

        assertThatThrownBy(() -> outposts.create(creator, "hall", "", ""))
                .isInstanceOf(MarketException.class)
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(MarketError.OUTPOST_EXISTS));
        assertThat(market.settlement.balance(creator)).isEqualTo(400_000_000L);
    }

    @Test
    void differentCreatorsGetDifferentAddresses() {
        Address other = market.funded("0xa2", 500_000_000L);

        Outpost a = outposts.create(creator, "hall", "", "");
        Outpost b = outposts.create(other, "hall", "", "");

        assertThat(a.address()).isNotEqualTo(b.address());
        assertThat(outposts.outposts()).extracting(Outpost::address).containsExactlyInAnyOrder(a.address(), b.address());
    }

    @Test
    void creatorMustAffordPurchase() {
        Address poor = market.funded("0xc2", 10);

        assertThatThrownBy(() -> outposts.create(poor, "hall", "", ""))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(MarketError.INSUFFICIENT_CALLER_BALANCE));
        assertThat(outposts.isOutpost(outposts.addressFor(poor, "hall"))).isFalse();
    }

    @Test
    void failedPaymentLeavesNoOutpost() {
        market.settlement.failTransfersTo(TestMarket.TREASURY);

        assertThatThrownBy(() -> outposts.create(creator, "hall", "", ""))
                .isInstanceOf(IllegalStateException.class);
        assertThat(outposts.outposts()).isEmpty();
    }

    @Test
    void ownerControlsPriceAndPause() {
        Address address = outposts.create(creator, "hall", "", "").address();

        assertThat(outposts.updatePrice(creator, address, 42)).isEqualTo(42);
        assertThat(outposts.togglePause(creator, address)).isTrue();
        assertThatThrownBy(() -> outposts.updatePrice(creator, address, 43))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(MarketError.EMERGENCY_PAUSE));
        assertThat(outposts.togglePause(creator, address)).isFalse();

        Address stranger = Address.of("0xbad");
        assertThatThrownBy(() -> outposts.togglePause(stranger, address))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(MarketError.NOT_OWNER));
    }

    @Test
    void ownershipTransferMovesControl() {
        Address address = outposts.create(creator, "hall", "", "").address();
        Address heir = Address.of("0xa9");

        assertThat(outposts.transferOwnership(creator, address, heir)).isEqualTo(creator);
        assertThat(outposts.ownerOf(address)).isEqualTo(heir);
        assertThatThrownBy(() -> outposts.updatePrice(creator, address, 1))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(MarketError.NOT_OWNER));
        assertThat(outposts.updatePrice(heir, address, 1)).isEqualTo(1);
    }

    @Test
    void unknownOutpostIsNotFound() {
        assertThatThrownBy(() -> outposts.ownerOf(Address.of("0x404")))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(MarketError.OUTPOST_NOT_FOUND));
        assertThat(outposts.outpost(Address.of("0x404"))).isEmpty();
    }
}
