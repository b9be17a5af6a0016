package com.docs.lookup.core.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of a documentation payload handed to callers.
 * The payload is opaque; rendering it is the host's concern.
 */
public final class DocumentContent {

    private final ResolutionKey key;
    private final byte[] payload;
    private final Instant fetchedAt;
    private final Instant expiresAt;
    private final boolean stale;

    private DocumentContent(ResolutionKey key, byte[] payload, Instant fetchedAt, Instant expiresAt, boolean stale) {
        this.key = key;
        this.payload = payload;
        this.fetchedAt = fetchedAt;
        this.expiresAt = expiresAt;
        this.stale = stale;
    }

    static DocumentContent of(ResolutionKey key, byte[] payload, Instant fetchedAt, Instant expiresAt, boolean stale) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(payload, "payload is required");
        return new DocumentContent(key, payload.clone(), fetchedAt, expiresAt, stale);
    }

    public ResolutionKey getKey() {
        return key;
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    public String asText() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public int getSizeBytes() {
        return payload.length;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * True when this content is an expired entry served because a refresh failed.
     */
    public boolean isStale() {
        return stale;
    }

    @Override
    public String toString() {
        return "DocumentContent{key=" + key + ", sizeBytes=" + payload.length
                + ", expiresAt=" + expiresAt + (stale ? ", stale" : "") + "}";
    }
}
