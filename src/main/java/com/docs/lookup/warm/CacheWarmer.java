package com.docs.lookup.warm;

import com.docs.lookup.cache.CacheStore;
import com.docs.lookup.cache.DocumentFetcher;
import com.docs.lookup.core.model.ResolutionKey;
import com.docs.lookup.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pre-populates the cache with a set of keys so that common lookups hit without network latency.
 * In-flight de-duplication comes from the {@link CacheStore}: a key being warmed while a lookup
 * fetches it is fetched once.
 */
public class CacheWarmer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CacheWarmer.class);

    private final CacheStore store;
    private final DocumentFetcher fetcher;
    private final ScheduledExecutorService scheduler;
    private final List<ScheduledFuture<?>> schedules = new ArrayList<>();
    private volatile boolean closed;

    public CacheWarmer(CacheStore store, DocumentFetcher fetcher) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "docs-cache-warmer");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Warms {@code keys}, skipping those with a valid entry. Individual failures are counted,
     * never propagated; the returned future always completes normally.
     */
    public CompletableFuture<WarmResult> warm(Collection<ResolutionKey> keys) {
        Set<ResolutionKey> distinct = new LinkedHashSet<>(keys);
        String runId = UUID.randomUUID().toString().substring(0, 8);
        try (LogContext ignored = LogContext.forWarm(runId)) {
            log.info("warm.starting keys={}", distinct.size());

            AtomicInteger alreadyCached = new AtomicInteger();
            AtomicInteger warmed = new AtomicInteger();
            AtomicInteger failed = new AtomicInteger();
            List<CompletableFuture<Void>> pending = new ArrayList<>();

            for (ResolutionKey key : distinct) {
                if (store.containsValid(key)) {
                    alreadyCached.incrementAndGet();
                    continue;
                }
                pending.add(store.getOrFetch(key, fetcher).handle((content, error) -> {
                    if (error != null) {
                        failed.incrementAndGet();
                        log.debug("warm.keyFailed runId={} key={} error={}", runId, key, error.getMessage());
                    } else {
                        warmed.incrementAndGet();
                    }
                    return null;
                }));
            }

            return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                    .thenApply(done -> {
                        WarmResult result = new WarmResult(distinct.size(), alreadyCached.get(), warmed.get(), failed.get());
                        log.info("warm.completed runId={} requested={} alreadyCached={} warmed={} failed={}",
                                runId, result.requested(), result.alreadyCached(), result.warmed(), result.failed());
                        return result;
                    });
        }
    }

    /**
     * Re-runs {@link #warm} for {@code keys} every {@code period} until {@link #close()}.
     */
    public ScheduledFuture<?> schedule(Collection<ResolutionKey> keys, Duration period) {
        if (closed) {
            throw new IllegalStateException("CacheWarmer is closed");
        }
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }
        List<ResolutionKey> snapshot = List.copyOf(keys);
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
            try {
                warm(snapshot).join();
            } catch (RuntimeException e) {
                log.warn("warm.scheduledRunFailed error={}", e.getMessage(), e);
            }
        }, period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        synchronized (schedules) {
            schedules.add(future);
        }
        log.info("warm.scheduled keys={} periodMs={}", snapshot.size(), period.toMillis());
        return future;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        synchronized (schedules) {
            schedules.forEach(f -> f.cancel(false));
            schedules.clear();
        }
        scheduler.shutdownNow();
        log.debug("warm.closed");
    }
}
