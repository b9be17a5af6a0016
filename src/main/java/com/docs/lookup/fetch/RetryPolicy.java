package com.docs.lookup.fetch;

import java.time.Duration;

/**
 * Retry policy for {@link RetryingFetcher}.
 *
 * <p>The delay before retry {@code i} (i >= 1, i.e. before attempt {@code i + 1}) is
 * {@code min(maxDelay, baseDelay * 2^(i-1)) * (1 + u)} with {@code u} uniform in
 * {@code [-jitterFraction, +jitterFraction]}.</p>
 *
 * @param maxAttempts    total attempts including the first, >= 1
 * @param baseDelay      delay before the first retry, before jitter
 * @param maxDelay       ceiling for the un-jittered delay
 * @param jitterFraction relative jitter in [0, 1]
 * @param attemptTimeout timeout of each individual attempt
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay,
                          double jitterFraction, Duration attemptTimeout) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must be >= 0");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (jitterFraction < 0.0 || jitterFraction > 1.0) {
            throw new IllegalArgumentException("jitterFraction must be within [0, 1]");
        }
        if (attemptTimeout.isNegative() || attemptTimeout.isZero()) {
            throw new IllegalArgumentException("attemptTimeout must be > 0");
        }
    }

    /**
     * Default policy: 3 attempts, 1s base delay, 30s cap, 20% jitter, 6s per attempt.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 0.2, Duration.ofSeconds(6));
    }

    /**
     * Delay before retry number {@code retry} (1 for the second attempt).
     *
     * @param unitRandom a uniform sample in [0, 1), mapped onto the jitter range
     */
    public long delayBeforeRetryMillis(int retry, double unitRandom) {
        if (retry < 1) {
            return 0;
        }
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        // 2^(retry-1) overflows quickly; once past the cap the shift no longer matters
        long exponential = retry - 1 >= 62 || base > (cap >> Math.min(retry - 1, 62))
                ? cap : Math.min(cap, base << (retry - 1));
        double jitter = (unitRandom * 2.0 - 1.0) * jitterFraction;
        return Math.max(0L, Math.round(exponential * (1.0 + jitter)));
    }

    /**
     * Worst-case time a fetch can take: every attempt times out and every delay is maximal.
     */
    public Duration worstCaseLatency() {
        long total = attemptTimeout.toMillis() * maxAttempts;
        for (int retry = 1; retry < maxAttempts; retry++) {
            total += Math.round(Math.min(maxDelay.toMillis(), delayBeforeRetryMillis(retry, 0.5)) * (1.0 + jitterFraction));
        }
        return Duration.ofMillis(total);
    }
}
