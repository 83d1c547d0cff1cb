package com.rolebridge.sync;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-identity mutual exclusion.
 *
 * <p>Work for the same identity key runs one at a time; work for different keys runs concurrently.
 * Locks are reference counted and removed once no thread holds or waits for them, so the registry
 * does not grow with the number of identities ever seen.
 */
public final class IdentityLockRegistry {

    private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();

    /** Runs {@code work} while holding the lock for {@code identityKey}. */
    public <T> T withLock(String identityKey, Supplier<T> work) {
        Entry entry = locks.compute(identityKey, (key, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.references++;
            return e;
        });
        entry.lock.lock();
        try {
            return work.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(identityKey, (key, e) -> --e.references == 0 ? null : e);
        }
    }

    /** Number of identity keys currently locked or waited on. */
    public int activeKeys() {
        return locks.size();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's compute
        private int references;
    }
}
