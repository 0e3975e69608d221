package com.podium.infrastructure.events;

import com.podium.application.events.MarketEvent;
import com.podium.application.ports.MarketEventPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Delivers each event to every sink. One failing sink does not stop the others.
 */
public final class FanOutEventAdapter implements MarketEventPort {

    private static final Logger log = LoggerFactory.getLogger(FanOutEventAdapter.class);

    private final List<MarketEventPort> sinks;

    public FanOutEventAdapter(List<MarketEventPort> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void publish(MarketEvent event) {
        for (MarketEventPort sink : sinks) {
            try {
                sink.publish(event);
            } catch (RuntimeException e) {
                log.warn("[EVENTS] sink={} failed type={} err={}",
                        sink.getClass().getSimpleName(), event.type(), e.toString());
            }
        }
    }
}
