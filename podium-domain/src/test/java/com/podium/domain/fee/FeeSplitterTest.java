package com.podium.domain.fee;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeeSplitterTest {

    private static final FeeSchedule FEES = FeeSchedule.defaults();

    @Test
    void sellOfHundredSplitsFourEightEightyEight() {
        SellSplit s = FeeSplitter.splitSell(100, FEES);

        assertThat(s.protocolFee()).isEqualTo(4);
        assertThat(s.subjectFee()).isEqualTo(8);
        assertThat(s.netToSeller()).isEqualTo(88);
        assertThat(s.protocolFee() + s.subjectFee() + s.netToSeller()).isEqualTo(s.base());
    }

    @Test
    void buyFeesAreChargedOnTop() {
        BuySplit b = FeeSplitter.splitBuy(400_000_000L, true, FEES);

        assertThat(b.protocolFee()).isEqualTo(16_000_000L);
        assertThat(b.subjectFee()).isEqualTo(32_000_000L);
        assertThat(b.referralFee()).isEqualTo(8_000_000L);
        assertThat(b.total()).isEqualTo(456_000_000L);
        assertThat(b.total()).isEqualTo(b.base() + b.fees());
    }

    @Test
    void noReferrerMeansNoReferralFee() {
        BuySplit b = FeeSplitter.splitBuy(400_000_000L, false, FEES);

        assertThat(b.referralFee()).isZero();
        assertThat(b.total()).isEqualTo(448_000_000L);
    }

    @Test
    void sharesTruncateTowardZero() {
        SellSplit s = FeeSplitter.splitSell(24, FEES);

        assertThat(s.protocolFee()).isZero();
        assertThat(s.subjectFee()).isEqualTo(1);
        assertThat(s.netToSeller()).isEqualTo(23);
    }

    @Test
    void sellThatLeavesNothingForSellerIsRejected() {
        FeeSchedule greedy = FEES.withTradingFees(5_000, 5_000, 0);

        assertThatThrownBy(() -> FeeSplitter.splitSell(100, greedy))
                .isInstanceOf(MarketException.class)
                .satisfies(e -> assertThat(((MarketException) e).error()).isEqualTo(MarketError.INVALID_AMOUNT));
    }

    @Test
    void subscriptionOwnerGetsTheRemainder() {
        SubscriptionSplit withRef = FeeSplitter.splitSubscription(1_000, true, FEES);
        assertThat(withRef.protocolFee()).isEqualTo(50);
        assertThat(withRef.referralFee()).isEqualTo(100);
        assertThat(withRef.ownerShare()).isEqualTo(850);

        SubscriptionSplit noRef = FeeSplitter.splitSubscription(1_000, false, FEES);
        assertThat(noRef.referralFee()).isZero();
        assertThat(noRef.ownerShare()).isEqualTo(950);
    }

    @Test
    void subscriptionWithNothingLeftForOwnerIsRejected() {
        FeeSchedule all = FEES.withSubscriptionFees(5_000, 5_000);

        assertThatThrownBy(() -> FeeSplitter.splitSubscription(1_000, true, all))
                .isInstanceOf(MarketException.class);
    }

    @Test
    void feeRatesOutsideBasisPointsAreRejected() {
        assertThatThrownBy(() -> FEES.withTradingFees(10_001, 0, 0))
                .isInstanceOf(MarketException.class)
                .satisfies(e -> assertThat(((MarketException) e).error()).isEqualTo(MarketError.INVALID_FEE_VALUE));
        assertThatThrownBy(() -> FEES.withSubscriptionFees(-1, 0))
                .isInstanceOf(MarketException.class);
    }

    @Test
    void hugePriceIsOverflowNotWrapAround() {
        assertThatThrownBy(() -> FeeSplitter.splitBuy(Long.MAX_VALUE / 2, true, FEES))
                .isInstanceOf(MarketException.class)
                .satisfies(e -> assertThat(((MarketException) e).error()).isEqualTo(MarketError.ARITHMETIC_OVERFLOW));
    }
}
