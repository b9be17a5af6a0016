package com.docs.lookup.metrics;

import com.docs.lookup.core.model.FetchOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}. Used when no registry is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHit(Tier tier) {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordEviction() {
    }

    @Override
    public void recordFetchAttempt(FetchOutcome outcome) {
    }

    @Override
    public void recordFetchDuration(boolean success, Duration duration) {
    }

    @Override
    public void recordLookupDuration(String status, Duration duration) {
    }

    @Override
    public void recordStorageFailure() {
    }
}
