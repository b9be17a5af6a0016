package com.docs.lookup.cache;

import com.docs.lookup.core.model.CacheEntry;
import com.docs.lookup.core.model.ResolutionKey;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;

/**
 * Jackson envelope for entries in the persisted tier. The payload is written as base64.
 *
 * <pre>
 * {"v":1,"key":"3|BUILTIN_FUNCTION|len","fetchedAt":1718000000000,"expiresAt":1718604800000,"payload":"PGh0..."}
 * </pre>
 */
class PersistedEntryCodec {

    static final int FORMAT_VERSION = 1;

    private final ObjectMapper mapper;

    PersistedEntryCodec() {
        this(new ObjectMapper());
    }

    PersistedEntryCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    byte[] encode(CacheEntry entry) {
        Envelope envelope = new Envelope(FORMAT_VERSION, entry.getKey().storageKey(),
                entry.getFetchedAt().toEpochMilli(), entry.getExpiresAt().toEpochMilli(), entry.copyPayload());
        try {
            return mapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode cache entry " + entry.getKey(), e);
        }
    }

    /**
     * @throws IOException if the bytes are not an envelope this codec understands
     */
    CacheEntry decode(byte[] data) throws IOException {
        Envelope envelope = mapper.readValue(data, Envelope.class);
        if (envelope.version() != FORMAT_VERSION) {
            throw new IOException("Unsupported entry format version " + envelope.version());
        }
        if (envelope.key() == null || envelope.payload() == null) {
            throw new IOException("Entry envelope is missing key or payload");
        }
        try {
            return CacheEntry.restore(ResolutionKey.fromStorageKey(envelope.key()), envelope.payload(),
                    Instant.ofEpochMilli(envelope.fetchedAt()), Instant.ofEpochMilli(envelope.expiresAt()));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid entry envelope: " + e.getMessage(), e);
        }
    }

    record Envelope(@JsonProperty("v") int version,
                    @JsonProperty("key") String key,
                    @JsonProperty("fetchedAt") long fetchedAt,
                    @JsonProperty("expiresAt") long expiresAt,
                    @JsonProperty("payload") byte[] payload) {
    }
}
