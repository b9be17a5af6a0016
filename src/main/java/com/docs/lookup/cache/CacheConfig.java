package com.docs.lookup.cache;

import java.time.Duration;

/**
 * Configuration for the two-tier documentation cache.
 *
 * @param maxEntries        maximum number of entries held in memory
 * @param maxBytes          maximum total payload bytes held in memory
 * @param ttl               time-to-live of a fetched entry
 * @param negativeTtl       how long a fatal fetch failure is remembered; zero disables it
 * @param serveStaleOnError whether an expired entry is returned when its refresh fails
 */
public record CacheConfig(int maxEntries, long maxBytes, Duration ttl, Duration negativeTtl,
                          boolean serveStaleOnError) {

    public static final long DEFAULT_MAX_BYTES = 16L * 1024 * 1024;

    public CacheConfig {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be > 0");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        if (negativeTtl == null || negativeTtl.isNegative()) {
            throw new IllegalArgumentException("negativeTtl must be >= 0");
        }
    }

    /**
     * Default configuration: 500 entries, 16 MiB, 7 day TTL, 60s negative TTL, stale fallback on.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(500, DEFAULT_MAX_BYTES, Duration.ofDays(7), Duration.ofSeconds(60), true);
    }

    public boolean negativeCachingEnabled() {
        return !negativeTtl.isZero();
    }
}
