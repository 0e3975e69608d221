package com.podium.application.service;

import com.podium.application.events.MarketEvent;
import com.podium.application.ports.MarketEventPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Fire-and-forget publishing. A failing sink never fails the call that committed.
 */
final class MarketEvents {

    private static final Logger log = LoggerFactory.getLogger(MarketEvents.class);

    private final MarketEventPort port;

    MarketEvents(MarketEventPort port) {
        this.port = Objects.requireNonNull(port, "port");
    }

    void publish(MarketEvent event) {
        try {
            port.publish(event);
        } catch (RuntimeException e) {
            log.warn("[MARKET_EVENTS] publish failed type={} err={}", event.type(), e.toString());
        }
    }
}
