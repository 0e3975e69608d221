package com.podium.application.ports;

import com.podium.application.events.MarketEvent;

/**
 * Sink for market notifications. Delivery is best effort; the engine never
 * depends on it.
 */
public interface MarketEventPort {

    void publish(MarketEvent event);
}
