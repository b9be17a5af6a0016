package com.docs.lookup.lock;

/**
 * Configuration for {@link StripedKeyedLock}.
 *
 * @param timeoutMs maximum time to wait for lock acquisition
 * @param stripes   number of lock stripes; keys hash onto stripes
 */
public record LockConfig(long timeoutMs, int stripes) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        if (stripes <= 0) {
            throw new IllegalArgumentException("stripes must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout, 64 stripes.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, 64);
    }
}
