package com.podium.application.market;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Function;

/**
 * All-or-nothing wrapper for one engine call.
 *
 * Every applied effect registers its compensation. If the body throws, the
 * compensations run newest first and the original exception is rethrown, with
 * any compensation failure attached as suppressed.
 */
public final class MarketTransaction {

    private static final Logger log = LoggerFactory.getLogger(MarketTransaction.class);

    private final String name;
    private final Deque<Compensation> compensations = new ArrayDeque<>();

    private record Compensation(String label, Runnable action) {}

    private MarketTransaction(String name) {
        this.name = name;
    }

    public static <T> T run(String name, Function<MarketTransaction, T> body) {
        MarketTransaction tx = new MarketTransaction(name);
        try {
            return body.apply(tx);
        } catch (RuntimeException e) {
            tx.rollback(e);
            throw e;
        }
    }

    public void onRollback(String label, Runnable action) {
        compensations.push(new Compensation(label, Objects.requireNonNull(action, "action")));
    }

    public int pending() {
        return compensations.size();
    }

    private void rollback(RuntimeException cause) {
        if (compensations.isEmpty()) return;
        log.warn("[MARKET_TX] rollback tx={} steps={} cause={}", name, compensations.size(), cause.toString());
        while (!compensations.isEmpty()) {
            Compensation c = compensations.pop();
            try {
                c.action().run();
            } catch (RuntimeException undoFailure) {
                log.error("[MARKET_TX] compensation failed tx={} step={}", name, c.label(), undoFailure);
                cause.addSuppressed(undoFailure);
            }
        }
    }
}
