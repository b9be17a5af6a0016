package com.docs.lookup.storage;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * {@link StorageAdapter} kept in a {@link ConcurrentHashMap}. Per-key atomicity comes from the map.
 * Suitable for hosts without durable storage and for tests.
 */
public class InMemoryStorageAdapter implements StorageAdapter {

    private final ConcurrentMap<ByteBuffer, Stored> values = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryStorageAdapter() {
        this(Clock.systemUTC());
    }

    public InMemoryStorageAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<byte[]> get(byte[] key) {
        Stored stored = values.get(wrap(key));
        return stored == null ? Optional.empty() : Optional.of(stored.value().clone());
    }

    @Override
    public void put(byte[] key, byte[] value, Instant expiresAt) {
        values.put(wrap(key), new Stored(value.clone(), expiresAt));
    }

    @Override
    public void delete(byte[] key) {
        values.remove(wrap(key));
    }

    @Override
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<ByteBuffer, Stored> entry : values.entrySet()) {
            if (!now.isBefore(entry.getValue().expiresAt()) && values.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int deleteMatching(Predicate<byte[]> keyFilter) {
        int removed = 0;
        for (ByteBuffer key : values.keySet()) {
            byte[] raw = new byte[key.remaining()];
            key.duplicate().get(raw);
            if (keyFilter.test(raw) && values.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return values.size();
    }

    private static ByteBuffer wrap(byte[] key) {
        return ByteBuffer.wrap(key.clone()).asReadOnlyBuffer();
    }

    private record Stored(byte[] value, Instant expiresAt) {}
}
