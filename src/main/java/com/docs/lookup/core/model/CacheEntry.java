package com.docs.lookup.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A cached documentation payload. Owned by the cache store; the payload array is never
 * handed out, callers get {@link DocumentContent} copies instead.
 */
public final class CacheEntry {

    private final ResolutionKey key;
    private final byte[] payload;
    private final Instant fetchedAt;
    private final Instant expiresAt;

    private CacheEntry(ResolutionKey key, byte[] payload, Instant fetchedAt, Instant expiresAt) {
        this.key = Objects.requireNonNull(key, "key is required");
        this.payload = Objects.requireNonNull(payload, "payload is required").clone();
        this.fetchedAt = Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt is required");
        if (!expiresAt.isAfter(fetchedAt)) {
            throw new IllegalArgumentException("expiresAt must be after fetchedAt");
        }
    }

    public static CacheEntry of(ResolutionKey key, byte[] payload, Instant fetchedAt, Duration ttl) {
        return new CacheEntry(key, payload, fetchedAt, fetchedAt.plus(ttl));
    }

    public static CacheEntry restore(ResolutionKey key, byte[] payload, Instant fetchedAt, Instant expiresAt) {
        return new CacheEntry(key, payload, fetchedAt, expiresAt);
    }

    public ResolutionKey getKey() {
        return key;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public int getSizeBytes() {
        return payload.length;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Returns a copy of the payload.
     */
    public byte[] copyPayload() {
        return payload.clone();
    }

    public DocumentContent toContent() {
        return DocumentContent.of(key, payload, fetchedAt, expiresAt, false);
    }

    public DocumentContent toStaleContent() {
        return DocumentContent.of(key, payload, fetchedAt, expiresAt, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheEntry that = (CacheEntry) o;
        return key.equals(that.key) && Arrays.equals(payload, that.payload)
                && fetchedAt.equals(that.fetchedAt) && expiresAt.equals(that.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, Arrays.hashCode(payload), fetchedAt, expiresAt);
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key + ", sizeBytes=" + payload.length
                + ", fetchedAt=" + fetchedAt + ", expiresAt=" + expiresAt + "}";
    }
}
