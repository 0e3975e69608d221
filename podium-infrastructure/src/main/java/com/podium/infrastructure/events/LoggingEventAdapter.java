package com.podium.infrastructure.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.podium.application.events.MarketEvent;
import com.podium.application.ports.MarketEventPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each event as one JSON line to the {@code podium.events} logger.
 */
public final class LoggingEventAdapter implements MarketEventPort {

    private static final Logger events = LoggerFactory.getLogger("podium.events");

    private final ObjectMapper mapper;

    public LoggingEventAdapter() {
        this(EventJson.mapper());
    }

    public LoggingEventAdapter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void publish(MarketEvent event) {
        if (!events.isInfoEnabled()) return;
        try {
            events.info(EventJson.toJson(mapper, event));
        } catch (JsonProcessingException e) {
            events.warn("[EVENTS] cannot serialize type={} err={}", event.type(), e.getOriginalMessage());
        }
    }
}
