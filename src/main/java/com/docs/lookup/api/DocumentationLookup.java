package com.docs.lookup.api;

import com.docs.lookup.cache.CacheStats;
import com.docs.lookup.cache.CacheStore;
import com.docs.lookup.cache.DocumentFetcher;
import com.docs.lookup.core.model.DocumentContent;
import com.docs.lookup.core.model.ResolutionKey;
import com.docs.lookup.fetch.DocumentationLocator;
import com.docs.lookup.fetch.FetchAttemptListener;
import com.docs.lookup.fetch.FetchException;
import com.docs.lookup.fetch.JdkHttpTransportAdapter;
import com.docs.lookup.fetch.RetryingFetcher;
import com.docs.lookup.fetch.TransportAdapter;
import com.docs.lookup.lock.LockConfig;
import com.docs.lookup.lock.StripedKeyedLock;
import com.docs.lookup.logging.LogContext;
import com.docs.lookup.metrics.MetricsService;
import com.docs.lookup.metrics.NoOpMetricsService;
import com.docs.lookup.resolution.ContextResolver;
import com.docs.lookup.resolution.Resolution;
import com.docs.lookup.resolution.SymbolDictionary;
import com.docs.lookup.storage.FileSystemStorageAdapter;
import com.docs.lookup.storage.InMemoryStorageAdapter;
import com.docs.lookup.storage.StorageAdapter;
import com.docs.lookup.warm.CacheWarmer;
import com.docs.lookup.warm.WarmKeys;
import com.docs.lookup.warm.WarmResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for documentation lookups.
 *
 * <p>Resolves the token at the cursor to a {@link ResolutionKey}, then serves its documentation from
 * the memory tier, the persisted tier, or the network, in that order. Each instance owns its
 * executors, warmer and sweeper; {@link #close()} stops them all.</p>
 *
 * <pre>
 * try (DocumentationLookup lookup = DocumentationLookup.builder()
 *         .dictionary(MapSymbolDictionary.fromJson(in))
 *         .options(LookupOptions.builder().docsVersion("3.12").build())
 *         .build()) {
 *     LookupResult result = lookup.lookup(source, offset, "upper");
 * }
 * </pre>
 */
public class DocumentationLookup implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DocumentationLookup.class);

    private final LookupOptions options;
    private final ContextResolver resolver;
    private final CacheStore store;
    private final DocumentFetcher fetcher;
    private final CacheWarmer warmer;
    private final MetricsService metrics;
    private final ExecutorService fetchExecutor;
    private final ScheduledExecutorService sweeper;
    private final CompletableFuture<WarmResult> startupWarm;
    private final AtomicBoolean closed = new AtomicBoolean();

    private DocumentationLookup(Builder builder) {
        Objects.requireNonNull(builder.dictionary, "dictionary is required");
        this.options = builder.options != null ? builder.options : LookupOptions.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        String versionTag = options.versionTag();

        this.resolver = new ContextResolver(builder.dictionary, versionTag);
        this.fetchExecutor = Executors.newFixedThreadPool(4, daemonThreads("docs-lookup-fetch"));
        this.store = CacheStore.builder()
                .config(options.toCacheConfig())
                .storage(builder.storage != null ? builder.storage : defaultStorage(options, clock))
                .clock(clock)
                .metrics(metrics)
                .fetchExecutor(fetchExecutor)
                .build();
        this.fetcher = builder.fetcher != null ? builder.fetcher : RetryingFetcher.builder()
                .transport(builder.transport != null ? builder.transport : JdkHttpTransportAdapter.createDefault())
                .locator(new DocumentationLocator(builder.dictionary))
                .retryPolicy(options.toRetryPolicy())
                .listener(builder.attemptListener)
                .metrics(metrics)
                .clock(clock)
                .build();
        this.warmer = new CacheWarmer(store, fetcher);

        this.sweeper = Executors.newSingleThreadScheduledExecutor(daemonThreads("docs-lookup-sweeper"));
        long sweepMinutes = options.getSweepIntervalMinutes();
        sweeper.scheduleWithFixedDelay(this::sweepQuietly, sweepMinutes, sweepMinutes, TimeUnit.MINUTES);

        List<ResolutionKey> warmKeys = builder.warmKeys != null
                ? List.copyOf(builder.warmKeys) : WarmKeys.frequentlyUsed(versionTag);
        if (options.isWarmOnStartup() && !options.isOfflineOnly()) {
            this.startupWarm = warmer.warm(warmKeys);
        } else {
            this.startupWarm = CompletableFuture.completedFuture(new WarmResult(0, 0, 0, 0));
        }

        log.info("DocumentationLookup initialized: versionTag={}, offlineOnly={}, warmOnStartup={}, persisted={}",
                versionTag, options.isOfflineOnly(), options.isWarmOnStartup(),
                options.getCacheDirectory() != null ? options.getCacheDirectory() : "memory");
    }

    private static StorageAdapter defaultStorage(LookupOptions options, Clock clock) {
        if (options.getCacheDirectory() == null) {
            return new InMemoryStorageAdapter(clock);
        }
        return new FileSystemStorageAdapter(options.getCacheDirectory(), new StripedKeyedLock(LockConfig.defaults()), clock);
    }

    /**
     * Looks up documentation for the token at the cursor, blocking until the result is known.
     */
    public LookupResult lookup(String sourceText, int cursorOffset, String rawToken) {
        return lookupAsync(sourceText, cursorOffset, rawToken).join();
    }

    /**
     * Asynchronous {@link #lookup}. The returned future always completes normally; failures are
     * reported through {@link LookupResult#getStatus()}.
     */
    public CompletableFuture<LookupResult> lookupAsync(String sourceText, int cursorOffset, String rawToken) {
        return run(sourceText, cursorOffset, rawToken, false);
    }

    /**
     * Drops the cached entry for the token at the cursor and fetches it again.
     */
    public LookupResult refresh(String sourceText, int cursorOffset, String rawToken) {
        return run(sourceText, cursorOffset, rawToken, true).join();
    }

    private CompletableFuture<LookupResult> run(String sourceText, int cursorOffset, String rawToken, boolean refresh) {
        ensureOpen();
        long startNanos = System.nanoTime();
        String correlationId = LogContext.generateCorrelationId();
        try (LogContext ignored = LogContext.forLookup(correlationId, String.valueOf(rawToken))) {
            Resolution resolution = resolver.resolve(sourceText, cursorOffset, rawToken);
            if (!resolution.isResolved()) {
                String reason = resolution.getReason().orElse("not resolvable");
                log.debug("lookup.unresolvable reason={}", reason);
                return CompletableFuture.completedFuture(finish(LookupResult.unresolvable(reason), startNanos));
            }

            ResolutionKey key = resolution.getKey().orElseThrow();
            String warning = resolution.getContextWarning().orElse(null);
            if (refresh) {
                store.invalidate(key);
                log.info("lookup.refresh key={}", key);
            }

            if (options.isOfflineOnly()) {
                Optional<DocumentContent> cached;
                try {
                    cached = store.getIfPresent(key);
                } catch (RuntimeException e) {
                    log.error("lookup.cacheError key={} error={}", key, e.getMessage(), e);
                    return CompletableFuture.completedFuture(finish(LookupResult.cacheError(key, e), startNanos));
                }
                LookupResult result = cached
                        .map(content -> LookupResult.found(content, warning))
                        .orElseGet(() -> LookupResult.unavailable(key, FetchError.offline(), warning));
                return CompletableFuture.completedFuture(finish(result, startNanos));
            }

            CompletableFuture<DocumentContent> pending;
            try {
                pending = store.getOrFetch(key, fetcher);
            } catch (RuntimeException e) {
                log.error("lookup.cacheError key={} error={}", key, e.getMessage(), e);
                return CompletableFuture.completedFuture(finish(LookupResult.cacheError(key, e), startNanos));
            }
            return pending.handle((content, error) -> {
                if (error == null) {
                    return finish(LookupResult.found(content, warning), startNanos);
                }
                Throwable cause = unwrap(error);
                if (cause instanceof FetchException fetchException) {
                    log.info("lookup.unavailable key={} kind={} cause={}",
                            key, fetchException.getKind(), fetchException.getMessage());
                    return finish(LookupResult.unavailable(key, FetchError.from(fetchException), warning), startNanos);
                }
                log.error("lookup.cacheError key={} error={}", key, cause.getMessage(), cause);
                return finish(LookupResult.cacheError(key, cause), startNanos);
            });
        }
    }

    private LookupResult finish(LookupResult result, long startNanos) {
        metrics.recordLookupDuration(result.getStatus().name(), Duration.ofNanos(System.nanoTime() - startNanos));
        return result;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Clears both cache tiers.
     */
    public void clearCache() {
        ensureOpen();
        store.invalidateAll();
        log.info("lookup.cacheCleared");
    }

    public CacheStats cacheStats() {
        return store.stats();
    }

    /**
     * Warms the cache with {@code keys} in the background.
     */
    public CompletableFuture<WarmResult> warm(Collection<ResolutionKey> keys) {
        ensureOpen();
        return warmer.warm(keys);
    }

    /**
     * Re-warms {@code keys} every {@code period} until this lookup is closed.
     */
    public void scheduleWarming(Collection<ResolutionKey> keys, Duration period) {
        ensureOpen();
        warmer.schedule(keys, period);
    }

    /**
     * The warming run started at construction; already complete when startup warming is off.
     */
    public CompletableFuture<WarmResult> startupWarm() {
        return startupWarm;
    }

    public LookupOptions getOptions() {
        return options;
    }

    public ContextResolver getResolver() {
        return resolver;
    }

    private void sweepQuietly() {
        try {
            store.sweepExpired();
        } catch (RuntimeException e) {
            log.warn("lookup.sweepFailed error={}", e.getMessage(), e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("DocumentationLookup is closed");
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        warmer.close();
        sweeper.shutdownNow();
        store.close();
        fetchExecutor.shutdown();
        try {
            if (!fetchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                fetchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            fetchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("DocumentationLookup closed");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SymbolDictionary dictionary;
        private LookupOptions options;
        private TransportAdapter transport;
        private StorageAdapter storage;
        private DocumentFetcher fetcher;
        private FetchAttemptListener attemptListener;
        private MetricsService metrics;
        private Clock clock;
        private Collection<ResolutionKey> warmKeys;

        /**
         * Sets the static symbol table. Required.
         */
        public Builder dictionary(SymbolDictionary dictionary) {
            this.dictionary = dictionary;
            return this;
        }

        public Builder options(LookupOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets the network transport used by the default fetcher.
         */
        public Builder transport(TransportAdapter transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Overrides the persisted tier chosen from the options.
         */
        public Builder storage(StorageAdapter storage) {
            this.storage = storage;
            return this;
        }

        /**
         * Replaces the network fetcher entirely.
         */
        public Builder fetcher(DocumentFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder attemptListener(FetchAttemptListener attemptListener) {
            this.attemptListener = attemptListener;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Keys warmed at startup; defaults to {@link WarmKeys#frequentlyUsed}.
         */
        public Builder warmKeys(Collection<ResolutionKey> warmKeys) {
            this.warmKeys = warmKeys;
            return this;
        }

        public DocumentationLookup build() {
            return new DocumentationLookup(this);
        }
    }
}
