package com.docs.lookup.cache;

/**
 * Point-in-time cache metrics.
 *
 * @param entryCount             entries currently held in memory
 * @param hitCount               lookups served from either tier
 * @param missCount              lookups that found no valid entry
 * @param evictionCount          entries evicted from memory to stay within bounds
 * @param bytesUsed              payload bytes currently held in memory
 * @param persistedTierAvailable false after a persisted-tier failure, until it next succeeds
 */
public record CacheStats(long entryCount, long hitCount, long missCount, long evictionCount,
                         long bytesUsed, boolean persistedTierAvailable) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0, true);
    }
}
