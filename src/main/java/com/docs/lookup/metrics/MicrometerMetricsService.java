package com.docs.lookup.metrics;

import com.docs.lookup.core.model.FetchOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code docs.cache.hit} - Counter (tag: tier)</li>
 *   <li>{@code docs.cache.miss} - Counter</li>
 *   <li>{@code docs.cache.eviction} - Counter</li>
 *   <li>{@code docs.cache.storage.failure} - Counter</li>
 *   <li>{@code docs.fetch.attempt} - Counter (tag: outcome)</li>
 *   <li>{@code docs.fetch.duration} - Timer (tag: result)</li>
 *   <li>{@code docs.lookup.duration} - Timer (tag: status)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter cacheMissCounter;
    private final Counter evictionCounter;
    private final Counter storageFailureCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheMissCounter = Counter.builder("docs.cache.miss")
                .description("Lookups that missed both cache tiers")
                .register(registry);
        this.evictionCounter = Counter.builder("docs.cache.eviction")
                .description("Entries evicted from the memory tier by the LRU budget")
                .register(registry);
        this.storageFailureCounter = Counter.builder("docs.cache.storage.failure")
                .description("Persisted-tier operations that failed and were degraded")
                .register(registry);
    }

    @Override
    public void recordCacheHit(Tier tier) {
        counter("hit:" + tier.name(), "docs.cache.hit", "Cache hits by tier", "tier", tier.name()).increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordEviction() {
        evictionCounter.increment();
    }

    @Override
    public void recordFetchAttempt(FetchOutcome outcome) {
        counter("attempt:" + outcome.name(), "docs.fetch.attempt", "Network fetch attempts by outcome",
                "outcome", outcome.name()).increment();
    }

    @Override
    public void recordFetchDuration(boolean success, Duration duration) {
        String result = success ? "success" : "failure";
        timer("fetch:" + result, "docs.fetch.duration", "Duration of a fetch including retries",
                "result", result).record(duration);
    }

    @Override
    public void recordLookupDuration(String status, Duration duration) {
        timer("lookup:" + status, "docs.lookup.duration", "Duration of documentation lookups",
                "status", status).record(duration);
    }

    @Override
    public void recordStorageFailure() {
        storageFailureCounter.increment();
    }

    private Counter counter(String cacheKey, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(cacheKey, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }

    private Timer timer(String cacheKey, String name, String description, String tagKey, String tagValue) {
        return timerCache.computeIfAbsent(cacheKey, k ->
                Timer.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
