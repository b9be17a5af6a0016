package com.docs.lookup.api;

import com.docs.lookup.cache.CacheConfig;
import com.docs.lookup.fetch.RetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LookupOptionsTest {

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Should use the documented defaults")
        void testDefaults() {
            LookupOptions options = LookupOptions.defaults();

            assertEquals(7, options.getCacheTtlDays());
            assertEquals(500, options.getMaxCacheEntries());
            assertEquals(3, options.getMaxRetries());
            assertEquals(6_000, options.getHttpTimeoutMs());
            assertTrue(options.isWarmOnStartup());
            assertFalse(options.isOfflineOnly());
            assertEquals("3", options.getDocsVersion());
            assertEquals("en", options.getDocsLocale());
            assertNull(options.getCacheDirectory());
        }

        @Test
        @DisplayName("Should convert into cache and retry configuration")
        void testConversions() {
            LookupOptions options = LookupOptions.builder()
                    .cacheTtlDays(14)
                    .negativeCacheTtlSeconds(0)
                    .maxRetries(5)
                    .build();

            CacheConfig cache = options.toCacheConfig();
            RetryPolicy retry = options.toRetryPolicy();

            assertEquals(Duration.ofDays(14), cache.ttl());
            assertFalse(cache.negativeCachingEnabled());
            assertEquals(5, retry.maxAttempts());
            assertEquals(Duration.ofSeconds(30), retry.maxDelay());
        }
    }

    @Nested
    @DisplayName("Clamping")
    class ClampingTests {

        @Test
        @DisplayName("Should clamp out-of-range values to the nearest bound")
        void testClamp() {
            LookupOptions options = LookupOptions.builder()
                    .cacheTtlDays(0)
                    .maxCacheEntries(-5)
                    .maxRetries(50)
                    .httpTimeoutMs(10)
                    .jitterFraction(3.0)
                    .sweepIntervalMinutes(0)
                    .build();

            assertEquals(1, options.getCacheTtlDays());
            assertEquals(1, options.getMaxCacheEntries());
            assertEquals(10, options.getMaxRetries());
            assertEquals(1_000, options.getHttpTimeoutMs());
            assertEquals(1.0, options.getJitterFraction());
            assertEquals(1, options.getSweepIntervalMinutes());
        }

        @Test
        @DisplayName("Should raise maxDelay to baseDelay")
        void testMaxDelayAtLeastBase() {
            LookupOptions options = LookupOptions.builder().baseDelayMs(5_000).maxDelayMs(100).build();

            assertEquals(5_000, options.getMaxDelayMs());
            assertDoesNotThrow(options::toRetryPolicy);
        }

        @Test
        @DisplayName("Should ignore malformed version and locale")
        void testVersionAndLocale() {
            LookupOptions options = LookupOptions.builder().docsVersion("3.12/../x").docsLocale("french").build();

            assertEquals("3", options.getDocsVersion());
            assertEquals("en", options.getDocsLocale());
        }
    }

    @Nested
    @DisplayName("Version tag")
    class VersionTagTests {

        @Test
        @DisplayName("Should omit the English locale")
        void testEnglish() {
            assertEquals("3.12", LookupOptions.builder().docsVersion("3.12").build().versionTag());
        }

        @Test
        @DisplayName("Should prefix other locales in lower case")
        void testOtherLocale() {
            assertEquals("pt-br/3.11", LookupOptions.builder().docsVersion("3.11").docsLocale("pt-BR").build().versionTag());
        }
    }

    @Nested
    @DisplayName("Properties")
    class PropertiesTests {

        @Test
        @DisplayName("Should read kebab-case docs-lookup properties")
        void testFromProperties() {
            LookupOptions options = LookupOptions.fromProperties(Map.of(
                    "docs-lookup.cache-ttl-days", "30",
                    "docs-lookup.max-retries", "5",
                    "docs-lookup.docs-version", "3.11",
                    "docs-lookup.docs-locale", "ja",
                    "docs-lookup.offline-only", "TRUE",
                    "docs-lookup.cache-directory", "/tmp/docs-cache",
                    "other.max-retries", "9"));

            assertEquals(30, options.getCacheTtlDays());
            assertEquals(5, options.getMaxRetries());
            assertEquals("ja/3.11", options.versionTag());
            assertTrue(options.isOfflineOnly());
            assertEquals(Path.of("/tmp/docs-cache"), options.getCacheDirectory());
        }

        @Test
        @DisplayName("Should ignore unparseable values")
        void testInvalidValues() {
            LookupOptions options = LookupOptions.fromProperties(Map.of(
                    "docs-lookup.max-retries", "many",
                    "docs-lookup.warm-on-startup", "sometimes",
                    "docs-lookup.cache-ttl-days", " "));

            assertEquals(3, options.getMaxRetries());
            assertTrue(options.isWarmOnStartup());
            assertEquals(7, options.getCacheTtlDays());
        }

        @Test
        @DisplayName("Should clamp numbers too large for their type")
        void testOverflowingValues() {
            LookupOptions options = LookupOptions.fromProperties(Map.of(
                    "docs-lookup.cache-ttl-days", "99999999999",
                    "docs-lookup.max-cache-entries", "-99999999999",
                    "docs-lookup.sweep-interval-minutes", "123456789012345678901234567890"));

            assertEquals(365, options.getCacheTtlDays());
            assertEquals(1, options.getMaxCacheEntries());
            assertEquals(1440, options.getSweepIntervalMinutes());
        }
    }
}
