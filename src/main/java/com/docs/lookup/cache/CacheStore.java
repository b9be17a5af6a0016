package com.docs.lookup.cache;

import com.docs.lookup.core.model.CacheEntry;
import com.docs.lookup.core.model.DocumentContent;
import com.docs.lookup.core.model.ResolutionKey;
import com.docs.lookup.fetch.FetchException;
import com.docs.lookup.metrics.MetricsService;
import com.docs.lookup.metrics.NoOpMetricsService;
import com.docs.lookup.storage.CorruptRecordException;
import com.docs.lookup.storage.InMemoryStorageAdapter;
import com.docs.lookup.storage.StorageAdapter;
import com.docs.lookup.storage.StorageException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-tier documentation cache: a bounded in-memory LRU tier in front of a persisted
 * {@link StorageAdapter}, with coalescing of concurrent misses for the same key.
 *
 * <p>The memory tier and the in-flight registry are guarded by one lock that is only held for
 * map operations; storage access and fetches run without it. Persisted-tier failures degrade the
 * store to memory-only operation and never fail a lookup.</p>
 *
 * <pre>
 * CacheStore store = CacheStore.builder()
 *     .config(CacheConfig.defaults())
 *     .storage(new FileSystemStorageAdapter(cacheDir))
 *     .fetchExecutor(executor)
 *     .build();
 * DocumentContent doc = store.getOrFetch(key, fetcher).join();
 * </pre>
 */
public class CacheStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private final CacheConfig config;
    private final StorageAdapter storage;
    private final Clock clock;
    private final MetricsService metrics;
    private final Executor fetchExecutor;
    private final ExecutorService ownedExecutor;
    private final PersistedEntryCodec codec = new PersistedEntryCodec();

    private final ReentrantLock lock = new ReentrantLock();
    // access-ordered: iteration starts at the least recently used entry
    private final LinkedHashMap<ResolutionKey, CacheEntry> memory = new LinkedHashMap<>(64, 0.75f, true);
    private final Map<ResolutionKey, CompletableFuture<DocumentContent>> inFlight = new HashMap<>();
    private long bytesUsed;

    private final Cache<ResolutionKey, FetchException> failures;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private volatile boolean persistedAvailable = true;

    private CacheStore(Builder builder) {
        this.config = builder.config != null ? builder.config : CacheConfig.defaults();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.storage = builder.storage != null ? builder.storage : new InMemoryStorageAdapter(clock);
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        if (builder.fetchExecutor != null) {
            this.fetchExecutor = builder.fetchExecutor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newFixedThreadPool(4, daemonThreads("docs-cache-fetch"));
            this.fetchExecutor = ownedExecutor;
        }
        this.failures = config.negativeCachingEnabled()
                ? Caffeine.newBuilder()
                        .expireAfterWrite(config.negativeTtl())
                        .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                        .executor(Runnable::run)
                        .maximumSize(10_000)
                        .build()
                : null;
        log.info("CacheStore initialized: maxEntries={}, maxBytes={}, ttl={}, negativeTtl={}, storage={}",
                config.maxEntries(), config.maxBytes(), config.ttl(), config.negativeTtl(),
                storage.getClass().getSimpleName());
    }

    /**
     * Returns the content for {@code key}, from memory, the persisted tier, or by invoking
     * {@code fetcher} on the fetch executor. Concurrent callers for the same missing key share one
     * fetch. Each caller gets its own future: cancelling it does not cancel the shared fetch,
     * which always completes and populates the cache.
     *
     * <p>The future fails with {@link FetchException} when the fetch fails and no stale entry can
     * be served.</p>
     */
    public CompletableFuture<DocumentContent> getOrFetch(ResolutionKey key, DocumentFetcher fetcher) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(fetcher, "fetcher is required");

        CompletableFuture<DocumentContent> shared;
        CacheEntry stale;
        lock.lock();
        try {
            Lookup cached = lookupMemory(key);
            if (cached.valid() != null) {
                recordHit(MetricsService.Tier.MEMORY);
                return CompletableFuture.completedFuture(cached.valid().toContent());
            }
            stale = cached.expired();
            CompletableFuture<DocumentContent> pending = inFlight.get(key);
            if (pending != null) {
                recordMiss();
                log.debug("cache.coalesced key={}", key);
                return pending.copy();
            }
            shared = new CompletableFuture<>();
            inFlight.put(key, shared);
        } finally {
            lock.unlock();
        }

        // this caller leads: it alone reads the persisted tier and starts the fetch
        CompletableFuture<DocumentContent> mine = shared.copy();
        try {
            lead(key, fetcher, shared, stale);
        } catch (RuntimeException e) {
            deregister(key, shared);
            shared.completeExceptionally(e);
        } catch (Error e) {
            deregister(key, shared);
            shared.completeExceptionally(e);
            throw e;
        }
        return mine;
    }

    private void lead(ResolutionKey key, DocumentFetcher fetcher, CompletableFuture<DocumentContent> shared,
                      CacheEntry memoryStale) {
        Lookup persisted = readPersisted(key);
        if (persisted.valid() != null) {
            storeInMemory(persisted.valid());
            recordHit(MetricsService.Tier.PERSISTED);
            deregister(key, shared);
            shared.complete(persisted.valid().toContent());
            return;
        }
        recordMiss();
        CacheEntry stale = newest(memoryStale, persisted.expired());

        FetchException remembered = failures != null ? failures.getIfPresent(key) : null;
        if (remembered != null) {
            log.debug("cache.negativeHit key={}", key);
            deregister(key, shared);
            settleFailure(key, shared, remembered.remembered(), stale);
            return;
        }

        try {
            fetchExecutor.execute(() -> runFetch(key, fetcher, shared, stale));
        } catch (RejectedExecutionException e) {
            deregister(key, shared);
            shared.completeExceptionally(new IllegalStateException("Cache store is shut down", e));
        }
    }

    private void runFetch(ResolutionKey key, DocumentFetcher fetcher, CompletableFuture<DocumentContent> shared,
                          CacheEntry stale) {
        try {
            byte[] payload = fetcher.fetch(key);
            if (payload == null) {
                throw FetchException.fatal(key, "Fetcher returned no payload for " + key, List.of(), null);
            }
            CacheEntry entry = CacheEntry.of(key, payload, clock.instant(), config.ttl());
            writePersisted(entry);
            storeInMemory(entry);
            deregister(key, shared);
            log.debug("cache.stored key={} bytes={}", key, entry.getSizeBytes());
            shared.complete(entry.toContent());
        } catch (FetchException e) {
            if (failures != null && e.getKind() == FetchException.Kind.FATAL) {
                failures.put(key, e);
            }
            deregister(key, shared);
            settleFailure(key, shared, e, stale);
        } catch (RuntimeException e) {
            log.error("cache.fetchFailed key={} error={}", key, e.getMessage(), e);
            deregister(key, shared);
            shared.completeExceptionally(e);
        } catch (Error e) {
            // waiters must still settle and the key must not stay registered
            log.error("cache.fetchAborted key={} error={}", key, e.toString(), e);
            deregister(key, shared);
            shared.completeExceptionally(e);
            throw e;
        }
    }

    private void settleFailure(ResolutionKey key, CompletableFuture<DocumentContent> shared,
                               FetchException failure, CacheEntry stale) {
        if (stale != null && config.serveStaleOnError()) {
            log.warn("cache.servingStale key={} expiredAt={} cause={}", key, stale.getExpiresAt(), failure.getMessage());
            shared.complete(stale.toStaleContent());
        } else {
            shared.completeExceptionally(failure);
        }
    }

    /**
     * Tier lookups only; never fetches.
     */
    public Optional<DocumentContent> getIfPresent(ResolutionKey key) {
        Objects.requireNonNull(key, "key is required");
        lock.lock();
        try {
            CacheEntry entry = lookupMemory(key).valid();
            if (entry != null) {
                recordHit(MetricsService.Tier.MEMORY);
                return Optional.of(entry.toContent());
            }
        } finally {
            lock.unlock();
        }
        CacheEntry persisted = readPersisted(key).valid();
        if (persisted != null) {
            storeInMemory(persisted);
            recordHit(MetricsService.Tier.PERSISTED);
            return Optional.of(persisted.toContent());
        }
        recordMiss();
        return Optional.empty();
    }

    /**
     * Returns true if either tier holds an unexpired entry for {@code key}. Does not touch
     * hit/miss counters or LRU order.
     */
    public boolean containsValid(ResolutionKey key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry entry = memory.get(key);
            if (entry != null && !entry.isExpired(now)) {
                return true;
            }
        } finally {
            lock.unlock();
        }
        return readPersisted(key).valid() != null;
    }

    /**
     * Removes {@code key} from both tiers and forgets any remembered failure for it.
     * A fetch already in flight still completes and stores its result.
     */
    public void invalidate(ResolutionKey key) {
        lock.lock();
        try {
            removeFromMemory(key);
        } finally {
            lock.unlock();
        }
        if (failures != null) {
            failures.invalidate(key);
        }
        try {
            storage.delete(key.storageKeyBytes());
            markPersistedAvailable();
        } catch (StorageException e) {
            degrade("delete", key, e);
        }
        log.debug("cache.invalidated key={}", key);
    }

    /**
     * Removes every entry of one documentation version from both tiers.
     */
    public void invalidateAll(String versionTag) {
        Objects.requireNonNull(versionTag, "versionTag is required");
        int removedFromMemory = 0;
        lock.lock();
        try {
            Iterator<Map.Entry<ResolutionKey, CacheEntry>> it = memory.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<ResolutionKey, CacheEntry> e = it.next();
                if (e.getKey().versionTag().equals(versionTag)) {
                    bytesUsed -= e.getValue().getSizeBytes();
                    it.remove();
                    removedFromMemory++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (failures != null) {
            failures.asMap().keySet().removeIf(k -> k.versionTag().equals(versionTag));
        }
        int removedFromStorage = 0;
        try {
            removedFromStorage = storage.deleteMatching(k -> ResolutionKey.storageKeyHasVersion(k, versionTag));
            markPersistedAvailable();
        } catch (StorageException e) {
            degrade("deleteMatching", null, e);
        }
        log.info("cache.invalidatedVersion versionTag={} memory={} persisted={}",
                versionTag, removedFromMemory, removedFromStorage);
    }

    /**
     * Removes every entry from both tiers.
     */
    public void invalidateAll() {
        lock.lock();
        try {
            memory.clear();
            bytesUsed = 0;
        } finally {
            lock.unlock();
        }
        if (failures != null) {
            failures.invalidateAll();
        }
        try {
            int removed = storage.deleteMatching(k -> true);
            markPersistedAvailable();
            log.info("cache.cleared persisted={}", removed);
        } catch (StorageException e) {
            degrade("deleteMatching", null, e);
        }
    }

    /**
     * Removes expired entries from memory and asks the persisted tier to do the same.
     *
     * @return total entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        lock.lock();
        try {
            Iterator<CacheEntry> it = memory.values().iterator();
            while (it.hasNext()) {
                CacheEntry entry = it.next();
                if (entry.isExpired(now)) {
                    bytesUsed -= entry.getSizeBytes();
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (failures != null) {
            failures.cleanUp();
        }
        try {
            removed += storage.sweepExpired();
            markPersistedAvailable();
        } catch (StorageException e) {
            degrade("sweep", null, e);
        }
        if (removed > 0) {
            log.info("cache.swept removed={}", removed);
        }
        return removed;
    }

    public CacheStats stats() {
        long entries;
        long bytes;
        lock.lock();
        try {
            entries = memory.size();
            bytes = bytesUsed;
        } finally {
            lock.unlock();
        }
        return new CacheStats(entries, hits.get(), misses.get(), evictions.get(), bytes, persistedAvailable);
    }

    /**
     * Number of keys with a fetch currently outstanding.
     */
    public int inFlightCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    // --- memory tier, callers hold the lock ---

    private Lookup lookupMemory(ResolutionKey key) {
        CacheEntry entry = memory.get(key);
        if (entry == null) {
            return Lookup.NONE;
        }
        if (entry.isExpired(clock.instant())) {
            removeFromMemory(key);
            return new Lookup(null, entry);
        }
        return new Lookup(entry, null);
    }

    private void removeFromMemory(ResolutionKey key) {
        CacheEntry removed = memory.remove(key);
        if (removed != null) {
            bytesUsed -= removed.getSizeBytes();
        }
    }

    private void storeInMemory(CacheEntry entry) {
        lock.lock();
        try {
            if (entry.getSizeBytes() > config.maxBytes()) {
                // too large for memory; the persisted tier still holds it
                removeFromMemory(entry.getKey());
                log.debug("cache.tooLargeForMemory key={} bytes={}", entry.getKey(), entry.getSizeBytes());
                return;
            }
            CacheEntry previous = memory.put(entry.getKey(), entry);
            if (previous != null) {
                bytesUsed -= previous.getSizeBytes();
            }
            bytesUsed += entry.getSizeBytes();
            evictIfNeeded();
        } finally {
            lock.unlock();
        }
    }

    private void evictIfNeeded() {
        Iterator<Map.Entry<ResolutionKey, CacheEntry>> it = memory.entrySet().iterator();
        while ((memory.size() > config.maxEntries() || bytesUsed > config.maxBytes()) && it.hasNext()) {
            Map.Entry<ResolutionKey, CacheEntry> eldest = it.next();
            bytesUsed -= eldest.getValue().getSizeBytes();
            it.remove();
            evictions.incrementAndGet();
            metrics.recordEviction();
            log.debug("cache.evicted key={}", eldest.getKey());
        }
    }

    private void deregister(ResolutionKey key, CompletableFuture<DocumentContent> shared) {
        lock.lock();
        try {
            inFlight.remove(key, shared);
        } finally {
            lock.unlock();
        }
    }

    // --- persisted tier, never under the lock ---

    private Lookup readPersisted(ResolutionKey key) {
        byte[] raw;
        try {
            Optional<byte[]> stored = storage.get(key.storageKeyBytes());
            markPersistedAvailable();
            if (stored.isEmpty()) {
                return Lookup.NONE;
            }
            raw = stored.get();
        } catch (CorruptRecordException e) {
            discardCorrupt(key, e);
            return Lookup.NONE;
        } catch (StorageException e) {
            degrade("get", key, e);
            return Lookup.NONE;
        }

        CacheEntry entry;
        try {
            entry = codec.decode(raw);
        } catch (IOException e) {
            discardCorrupt(key, e);
            return Lookup.NONE;
        }
        if (!entry.getKey().equals(key)) {
            discardCorrupt(key, new IOException("Stored entry belongs to " + entry.getKey()));
            return Lookup.NONE;
        }
        return entry.isExpired(clock.instant()) ? new Lookup(null, entry) : new Lookup(entry, null);
    }

    private void writePersisted(CacheEntry entry) {
        try {
            storage.put(entry.getKey().storageKeyBytes(), codec.encode(entry), entry.getExpiresAt());
            markPersistedAvailable();
        } catch (StorageException e) {
            degrade("put", entry.getKey(), e);
        }
    }

    private void discardCorrupt(ResolutionKey key, Exception cause) {
        log.warn("cache.corruptEntry key={} error={}", key, cause.getMessage());
        try {
            storage.delete(key.storageKeyBytes());
        } catch (StorageException e) {
            degrade("delete", key, e);
        }
    }

    private void degrade(String operation, ResolutionKey key, StorageException e) {
        if (persistedAvailable) {
            log.warn("cache.persistedTierUnavailable operation={} key={} error={}", operation, key, e.getMessage());
        } else {
            log.debug("cache.persistedTierStillUnavailable operation={} key={} error={}", operation, key, e.getMessage());
        }
        persistedAvailable = false;
        metrics.recordStorageFailure();
    }

    private void markPersistedAvailable() {
        if (!persistedAvailable) {
            persistedAvailable = true;
            log.info("cache.persistedTierRecovered");
        }
    }

    private void recordHit(MetricsService.Tier tier) {
        hits.incrementAndGet();
        metrics.recordCacheHit(tier);
    }

    private void recordMiss() {
        misses.incrementAndGet();
        metrics.recordCacheMiss();
    }

    private static CacheEntry newest(CacheEntry a, CacheEntry b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.getFetchedAt().isAfter(b.getFetchedAt()) ? a : b;
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicLong counter = new AtomicLong();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Result of a tier lookup: a valid entry, an expired one kept as a stale candidate, or neither.
     */
    private record Lookup(CacheEntry valid, CacheEntry expired) {
        static final Lookup NONE = new Lookup(null, null);
    }

    public static class Builder {
        private CacheConfig config;
        private StorageAdapter storage;
        private Clock clock;
        private MetricsService metrics;
        private Executor fetchExecutor;

        public Builder config(CacheConfig config) {
            this.config = config;
            return this;
        }

        public Builder storage(StorageAdapter storage) {
            this.storage = storage;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Executor that runs fetches. When unset the store creates and owns a small pool.
         */
        public Builder fetchExecutor(Executor fetchExecutor) {
            this.fetchExecutor = fetchExecutor;
            return this;
        }

        public CacheStore build() {
            return new CacheStore(this);
        }
    }
}
