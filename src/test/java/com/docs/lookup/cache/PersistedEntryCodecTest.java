package com.docs.lookup.cache;

import com.docs.lookup.core.model.CacheEntry;
import com.docs.lookup.core.model.ResolutionKey;
import com.docs.lookup.core.model.SymbolCategory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PersistedEntryCodecTest {

    private final PersistedEntryCodec codec = new PersistedEntryCodec();
    private final ResolutionKey key = ResolutionKey.of("os.path", SymbolCategory.MODULE, "fr/3.12");
    private final Instant fetchedAt = Instant.parse("2024-06-01T10:00:00Z");

    @Test
    @DisplayName("Should write a versioned envelope with a base64 payload")
    void testEnvelopeShape() throws IOException {
        byte[] payload = {0, 1, 2, (byte) 0xFF};
        byte[] encoded = codec.encode(CacheEntry.of(key, payload, fetchedAt, Duration.ofDays(7)));

        JsonNode json = new ObjectMapper().readTree(encoded);
        assertEquals(1, json.get("v").asInt());
        assertEquals("fr/3.12|MODULE|os.path", json.get("key").asText());
        assertEquals(fetchedAt.toEpochMilli(), json.get("fetchedAt").asLong());
        assertEquals("AAEC/w==", json.get("payload").asText());

        CacheEntry decoded = codec.decode(encoded);
        assertEquals(key, decoded.getKey());
        assertArrayEquals(payload, decoded.copyPayload());
        assertEquals(fetchedAt.plus(Duration.ofDays(7)), decoded.getExpiresAt());
    }

    @Test
    @DisplayName("Should reject unknown versions and malformed envelopes")
    void testRejects() {
        String otherVersion = "{\"v\":2,\"key\":\"3|KEYWORD|if\",\"fetchedAt\":1,\"expiresAt\":2,\"payload\":\"AA==\"}";
        String noPayload = "{\"v\":1,\"key\":\"3|KEYWORD|if\",\"fetchedAt\":1,\"expiresAt\":2}";
        String badKey = "{\"v\":1,\"key\":\"nonsense\",\"fetchedAt\":1,\"expiresAt\":2,\"payload\":\"AA==\"}";
        String backwards = "{\"v\":1,\"key\":\"3|KEYWORD|if\",\"fetchedAt\":5,\"expiresAt\":2,\"payload\":\"AA==\"}";

        assertThrows(IOException.class, () -> codec.decode(otherVersion.getBytes(StandardCharsets.UTF_8)));
        assertThrows(IOException.class, () -> codec.decode(noPayload.getBytes(StandardCharsets.UTF_8)));
        assertThrows(IOException.class, () -> codec.decode(badKey.getBytes(StandardCharsets.UTF_8)));
        assertThrows(IOException.class, () -> codec.decode(backwards.getBytes(StandardCharsets.UTF_8)));
        assertThrows(IOException.class, () -> codec.decode("{".getBytes(StandardCharsets.UTF_8)));
    }
}
