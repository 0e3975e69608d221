package com.podium.infrastructure.events;

import com.podium.application.events.MarketEvent;
import com.podium.application.ports.MarketEventPort;
import com.podium.domain.account.Address;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecordingEventAdapterTest {

    private static MarketEvent priceUpdate(long price) {
        return new MarketEvent.OutpostPriceUpdated(Address.of("0x1"), price, 100);
    }

    @Test
    void keepsNewestUpToCapacity() {
        RecordingEventAdapter recorder = new RecordingEventAdapter(2);
        recorder.publish(priceUpdate(1));
        recorder.publish(priceUpdate(2));
        recorder.publish(priceUpdate(3));

        assertThat(recorder.recent()).containsExactly(priceUpdate(2), priceUpdate(3));
        assertThat(recorder.recent(1)).containsExactly(priceUpdate(3));
        assertThat(recorder.recent(10)).hasSize(2);
        assertThat(recorder.total()).isEqualTo(3);
    }

    @Test
    void fanOutSurvivesFailingSink() {
        RecordingEventAdapter recorder = new RecordingEventAdapter(4);
        MarketEventPort failing = event -> {
            throw new IllegalStateException("sink down");
        };
        FanOutEventAdapter fanOut = new FanOutEventAdapter(List.of(failing, recorder));

        fanOut.publish(priceUpdate(9));

        assertThat(recorder.recent()).containsExactly(priceUpdate(9));
    }
}
