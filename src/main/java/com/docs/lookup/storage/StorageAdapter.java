package com.docs.lookup.storage;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Durable key-value byte store backing the persisted cache tier.
 *
 * <p>Implementations must make each per-key {@link #put} atomic: a concurrent reader, in this
 * or another process, observes either the previous value or the new one, never a partial write.</p>
 */
public interface StorageAdapter {

    /**
     * Returns the stored value, or empty if absent. Expired values may still be returned;
     * expiration is the caller's decision.
     *
     * @throws StorageException if the value exists but cannot be read
     */
    Optional<byte[]> get(byte[] key);

    /**
     * Stores {@code value} under {@code key}, replacing any previous value.
     *
     * @param expiresAt the instant after which {@link #sweepExpired()} may remove the value
     * @throws StorageException if the write fails
     */
    void put(byte[] key, byte[] value, Instant expiresAt);

    /**
     * Removes the value under {@code key}. Removing an absent key is not an error.
     */
    void delete(byte[] key);

    /**
     * Removes every value whose expiry has passed.
     *
     * @return the number of values removed
     */
    int sweepExpired();

    /**
     * Removes every value whose key matches {@code keyFilter}.
     *
     * @return the number of values removed
     */
    int deleteMatching(Predicate<byte[]> keyFilter);
}
