package com.podium.infrastructure.events;

import com.podium.application.events.MarketEvent;
import com.podium.application.ports.MarketEventPort;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent events in memory, oldest dropped first.
 */
public final class RecordingEventAdapter implements MarketEventPort {

    private final int capacity;
    private final Deque<MarketEvent> recent = new ArrayDeque<>();
    private long total;

    public RecordingEventAdapter(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
    }

    @Override
    public synchronized void publish(MarketEvent event) {
        if (recent.size() == capacity) recent.removeFirst();
        recent.addLast(event);
        total++;
    }

    /** Newest last. */
    public synchronized List<MarketEvent> recent() {
        return new ArrayList<>(recent);
    }

    public synchronized List<MarketEvent> recent(int limit) {
        List<MarketEvent> all = new ArrayList<>(recent);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return all.subList(from, all.size());
    }

    /** Events seen since start, dropped ones included. */
    public synchronized long total() {
        return total;
    }

    public int capacity() {
        return capacity;
    }
}
