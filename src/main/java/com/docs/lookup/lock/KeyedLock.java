package com.docs.lookup.lock;

import java.util.function.Supplier;

/**
 * Per-key mutual exclusion used to serialize persisted-tier reads and writes of the same key.
 */
public interface KeyedLock {

    /**
     * Acquires the lock guarding {@code key}.
     *
     * @throws LockAcquisitionException if the lock cannot be acquired within the configured timeout
     */
    void lock(String key);

    /**
     * Releases the lock guarding {@code key}. Does nothing if the current thread does not hold it.
     */
    void unlock(String key);

    /**
     * Runs {@code action} while holding the lock for {@code key}.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        lock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
