package com.docs.lookup.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Per-host token bucket limiting outbound documentation requests.
 * Each host gets an independent bucket with a fill rate and burst size.
 */
public class HostRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(HostRateLimiter.class);

    public static final int DEFAULT_REQUESTS_PER_MINUTE = 100;
    public static final int DEFAULT_BURST = 20;

    private final int burst;
    private final int requestsPerMinute;
    private final LongSupplier nanoClock;
    private final ConcurrentHashMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    public HostRateLimiter() {
        this(DEFAULT_REQUESTS_PER_MINUTE, DEFAULT_BURST, System::nanoTime);
    }

    public HostRateLimiter(int requestsPerMinute, int burst, LongSupplier nanoClock) {
        if (requestsPerMinute < 1 || burst < 1) {
            throw new IllegalArgumentException("requestsPerMinute and burst must be >= 1");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.burst = burst;
        this.nanoClock = nanoClock;
    }

    /**
     * Takes one token from the host's bucket.
     *
     * @return false if the bucket is empty
     */
    public boolean tryAcquire(String host) {
        TokenBucket bucket = buckets.computeIfAbsent(host,
                h -> new TokenBucket(burst, requestsPerMinute, nanoClock));
        boolean granted = bucket.tryConsume();
        if (!granted) {
            log.warn("rateLimit.exceeded host={}", host);
        }
        return granted;
    }

    long availableTokens(String host) {
        TokenBucket bucket = buckets.get(host);
        return bucket == null ? burst : bucket.availableTokens();
    }

    /**
     * Lock-free token bucket; token counts are kept in thousandths.
     */
    static class TokenBucket {
        private final int maxTokens;
        private final double refillPerNano;
        private final LongSupplier nanoClock;
        private final AtomicLong milliTokens;
        private final AtomicLong lastRefillNanos;

        TokenBucket(int maxTokens, int tokensPerMinute, LongSupplier nanoClock) {
            this.maxTokens = maxTokens;
            this.refillPerNano = tokensPerMinute / 60_000_000_000.0;
            this.nanoClock = nanoClock;
            this.milliTokens = new AtomicLong((long) maxTokens * 1000);
            this.lastRefillNanos = new AtomicLong(nanoClock.getAsLong());
        }

        boolean tryConsume() {
            refill();
            while (true) {
                long current = milliTokens.get();
                if (current < 1000) {
                    return false;
                }
                if (milliTokens.compareAndSet(current, current - 1000)) {
                    return true;
                }
            }
        }

        private void refill() {
            long now = nanoClock.getAsLong();
            long last = lastRefillNanos.get();
            long elapsed = now - last;
            if (elapsed <= 0) {
                return;
            }
            long added = (long) (elapsed * refillPerNano * 1000);
            if (added <= 0) {
                return;
            }
            if (lastRefillNanos.compareAndSet(last, now)) {
                milliTokens.accumulateAndGet(added, (current, delta) ->
                        Math.min((long) maxTokens * 1000, current + delta));
            }
        }

        long availableTokens() {
            refill();
            return milliTokens.get() / 1000;
        }
    }
}
