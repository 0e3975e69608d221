package com.podium.application.market;

import com.podium.domain.account.Address;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per entity key. A call takes all of its keys up front, in sorted
 * order, and holds them until it returns.
 */
public final class EntityLocks {

    public static final String VAULT = "vault";
    public static final String CONFIG = "config";

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public static String target(Address target) {
        return "target:" + target.value();
    }

    public static String outpost(Address outpost) {
        return "outpost:" + outpost.value();
    }

    public <T> T withLocks(Collection<String> keys, Supplier<T> body) {
        List<ReentrantLock> held = new ArrayList<>();
        try {
            for (String key : new TreeSet<>(keys)) {
                ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
                lock.lock();
                held.add(lock);
            }
            return body.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    public void withLocks(Collection<String> keys, Runnable body) {
        withLocks(keys, () -> {
            body.run();
            return null;
        });
    }

    /** Number of keys seen so far. */
    public int size() {
        return locks.size();
    }
}
