package io.contextrunr.core;

import java.util.function.Supplier;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutual exclusion per key (session id, user id) over a fixed set of lock stripes.
 * Two keys may share a stripe; locks are reentrant, so nested use by one thread is safe.
 */
public class KeyedLocks {

    private static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public KeyedLocks() {
        this(DEFAULT_STRIPES);
    }

    public KeyedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("Stripe count must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String key) {
        int hash = key == null ? 0 : key.hashCode();
        return stripes[Math.floorMod(hash ^ (hash >>> 16), stripes.length)];
    }
}
