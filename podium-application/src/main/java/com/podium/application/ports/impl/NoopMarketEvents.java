package com.podium.application.ports.impl;

import com.podium.application.events.MarketEvent;
import com.podium.application.ports.MarketEventPort;

public final class NoopMarketEvents implements MarketEventPort {

    @Override
    public void publish(MarketEvent event) {
        // no-op
    }
}
