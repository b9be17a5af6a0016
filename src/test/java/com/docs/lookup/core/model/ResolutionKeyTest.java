package com.docs.lookup.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionKeyTest {

    @Nested
    @DisplayName("ResolutionKey")
    class KeyTests {

        @Test
        @DisplayName("Should be equal only when symbol, category and version all match")
        void testEquality() {
            ResolutionKey key = ResolutionKey.of("count", SymbolCategory.STRING_METHOD, "3");

            assertEquals(key, ResolutionKey.of("count", SymbolCategory.STRING_METHOD, "3"));
            assertNotEquals(key, ResolutionKey.of("count", SymbolCategory.LIST_METHOD, "3"));
            assertNotEquals(key, ResolutionKey.of("count", SymbolCategory.STRING_METHOD, "3.12"));
            assertNotEquals(key, ResolutionKey.of("index", SymbolCategory.STRING_METHOD, "3"));
        }

        @Test
        @DisplayName("Should round-trip through the storage key form")
        void testStorageKey() {
            ResolutionKey key = ResolutionKey.of("os.path", SymbolCategory.MODULE, "fr/3.12");

            assertEquals("fr/3.12|MODULE|os.path", key.storageKey());
            assertEquals(key, ResolutionKey.fromStorageKey(key.storageKey()));
        }

        @Test
        @DisplayName("Should match storage keys by version prefix")
        void testStorageKeyHasVersion() {
            byte[] stored = ResolutionKey.of("len", SymbolCategory.BUILTIN_FUNCTION, "3.11").storageKeyBytes();

            assertTrue(ResolutionKey.storageKeyHasVersion(stored, "3.11"));
            assertFalse(ResolutionKey.storageKeyHasVersion(stored, "3.1"));
            assertFalse(ResolutionKey.storageKeyHasVersion("3.11".getBytes(StandardCharsets.UTF_8), "3.11"));
        }

        @Test
        @DisplayName("Should reject blank symbols and separators in the version")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> ResolutionKey.of(" ", SymbolCategory.OTHER, "3"));
            assertThrows(IllegalArgumentException.class, () -> ResolutionKey.of("x", SymbolCategory.OTHER, "3|4"));
            assertThrows(NullPointerException.class, () -> ResolutionKey.of("x", null, "3"));
            assertThrows(IllegalArgumentException.class, () -> ResolutionKey.fromStorageKey("nonsense"));
        }
    }

    @Nested
    @DisplayName("CacheEntry")
    class EntryTests {

        private final ResolutionKey key = ResolutionKey.of("len", SymbolCategory.BUILTIN_FUNCTION, "3");
        private final Instant fetchedAt = Instant.parse("2024-06-01T10:00:00Z");

        @Test
        @DisplayName("Should expire exactly at expiresAt")
        void testExpiry() {
            CacheEntry entry = CacheEntry.of(key, new byte[]{1, 2, 3}, fetchedAt, Duration.ofDays(7));

            assertEquals(fetchedAt.plus(Duration.ofDays(7)), entry.getExpiresAt());
            assertEquals(3, entry.getSizeBytes());
            assertFalse(entry.isExpired(fetchedAt.plus(Duration.ofDays(7)).minusMillis(1)));
            assertTrue(entry.isExpired(fetchedAt.plus(Duration.ofDays(7))));
        }

        @Test
        @DisplayName("Should never expose its payload array")
        void testDefensiveCopies() {
            byte[] payload = {1, 2, 3};
            CacheEntry entry = CacheEntry.of(key, payload, fetchedAt, Duration.ofMinutes(1));
            payload[0] = 9;

            byte[] copy = entry.copyPayload();
            copy[1] = 9;
            DocumentContent content = entry.toContent();
            content.getPayload()[2] = 9;

            assertArrayEquals(new byte[]{1, 2, 3}, entry.copyPayload());
            assertArrayEquals(new byte[]{1, 2, 3}, content.getPayload());
        }

        @Test
        @DisplayName("Should require expiresAt after fetchedAt")
        void testInvalidLifetime() {
            assertThrows(IllegalArgumentException.class,
                    () -> CacheEntry.restore(key, new byte[0], fetchedAt, fetchedAt));
            assertThrows(IllegalArgumentException.class,
                    () -> CacheEntry.of(key, new byte[0], fetchedAt, Duration.ofSeconds(-1)));
        }

        @Test
        @DisplayName("Should mark stale content")
        void testStaleContent() {
            CacheEntry entry = CacheEntry.of(key, "doc".getBytes(StandardCharsets.UTF_8), fetchedAt, Duration.ofMinutes(1));

            assertFalse(entry.toContent().isStale());
            assertTrue(entry.toStaleContent().isStale());
            assertEquals("doc", entry.toStaleContent().asText());
        }
    }

    @Test
    @DisplayName("Should reject invalid attempt records")
    void testFetchAttemptValidation() {
        FetchAttempt attempt = new FetchAttempt(1, 0, FetchOutcome.SUCCESS, 200, null);
        assertTrue(attempt.failureCause().isEmpty());

        assertThrows(IllegalArgumentException.class, () -> new FetchAttempt(0, 0, FetchOutcome.SUCCESS, 200, null));
        assertThrows(IllegalArgumentException.class,
                () -> new FetchAttempt(2, -1, FetchOutcome.RETRYABLE_FAILURE, 503, "HTTP 503"));
    }
}
