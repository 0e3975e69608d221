package com.podium.application.support;

import com.podium.application.events.MarketEvent;
import com.podium.application.ports.MarketEventPort;

import java.util.ArrayList;
import java.util.List;

public final class CapturingEvents implements MarketEventPort {

    private final List<MarketEvent> events = new ArrayList<>();

    @Override
    public void publish(MarketEvent event) {
        events.add(event);
    }

    public List<MarketEvent> all() {
        return events;
    }

    public List<String> types() {
        return events.stream().map(MarketEvent::type).toList();
    }

    public <T extends MarketEvent> T last(Class<T> type) {
        for (int i = events.size() - 1; i >= 0; i--) {
            if (type.isInstance(events.get(i))) return type.cast(events.get(i));
        }
        throw new AssertionError("no " + type.getSimpleName() + " in " + types());
    }
}
