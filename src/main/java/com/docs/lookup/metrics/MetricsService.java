package com.docs.lookup.metrics;

import com.docs.lookup.core.model.FetchOutcome;

import java.time.Duration;

/**
 * Interface for recording documentation lookup metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependency on the classpath.
 */
public interface MetricsService {

    /**
     * Cache tier that served a hit.
     */
    enum Tier { MEMORY, PERSISTED }

    void recordCacheHit(Tier tier);

    void recordCacheMiss();

    void recordEviction();

    void recordFetchAttempt(FetchOutcome outcome);

    void recordFetchDuration(boolean success, Duration duration);

    void recordLookupDuration(String status, Duration duration);

    void recordStorageFailure();
}
