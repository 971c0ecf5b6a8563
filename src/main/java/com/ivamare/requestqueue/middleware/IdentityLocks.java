package com.ivamare.requestqueue.middleware;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-identity mutual exclusion.
 *
 * <p>Entries exist only while some thread holds or waits for the lock of an
 * identity, so the map does not grow with the number of requests seen.
 */
class IdentityLocks {

    private final Map<UUID, Entry> locks = new ConcurrentHashMap<>();

    <T> T withLock(UUID identity, Supplier<T> action) {
        Entry entry = locks.compute(identity, (id, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.users++;
            return e;
        });

        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(identity, (id, e) -> --e.users == 0 ? null : e);
        }
    }

    int activeCount() {
        return locks.size();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // Guarded by the map's per-key compute
        private int users;
    }
}
