package com.docs.lookup.api;

import com.docs.lookup.cache.CacheConfig;
import com.docs.lookup.fetch.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Options for a {@link DocumentationLookup}.
 * Out-of-range values are clamped to the nearest bound with a WARN log; they never fail.
 */
public class LookupOptions {
    private static final Logger log = LoggerFactory.getLogger(LookupOptions.class);

    public static final String PROPERTY_PREFIX = "docs-lookup.";

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private static final int DEFAULT_CACHE_TTL_DAYS = 7;
    private static final int DEFAULT_MAX_CACHE_ENTRIES = 500;
    private static final long DEFAULT_MAX_CACHE_BYTES = 16L * 1024 * 1024;
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final long DEFAULT_BASE_DELAY_MS = 1_000;
    private static final long DEFAULT_MAX_DELAY_MS = 30_000;
    private static final double DEFAULT_JITTER_FRACTION = 0.2;
    private static final long DEFAULT_HTTP_TIMEOUT_MS = 6_000;
    private static final long DEFAULT_NEGATIVE_CACHE_TTL_SECONDS = 60;
    private static final long DEFAULT_SWEEP_INTERVAL_MINUTES = 10;

    private final int cacheTtlDays;
    private final int maxCacheEntries;
    private final long maxCacheBytes;
    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFraction;
    private final boolean warmOnStartup;
    private final long httpTimeoutMs;
    private final boolean offlineOnly;
    private final String docsVersion;
    private final String docsLocale;
    private final long negativeCacheTtlSeconds;
    private final long sweepIntervalMinutes;
    private final boolean serveStaleOnError;
    private final Path cacheDirectory;

    private LookupOptions(Builder builder) {
        this.cacheTtlDays = builder.cacheTtlDays;
        this.maxCacheEntries = builder.maxCacheEntries;
        this.maxCacheBytes = builder.maxCacheBytes;
        this.maxRetries = builder.maxRetries;
        this.baseDelayMs = builder.baseDelayMs;
        if (builder.maxDelayMs < builder.baseDelayMs) {
            log.warn("options.clamped name=maxDelayMs value={} bound={}", builder.maxDelayMs, builder.baseDelayMs);
            this.maxDelayMs = builder.baseDelayMs;
        } else {
            this.maxDelayMs = builder.maxDelayMs;
        }
        this.jitterFraction = builder.jitterFraction;
        this.warmOnStartup = builder.warmOnStartup;
        this.httpTimeoutMs = builder.httpTimeoutMs;
        this.offlineOnly = builder.offlineOnly;
        this.docsVersion = builder.docsVersion;
        this.docsLocale = builder.docsLocale;
        this.negativeCacheTtlSeconds = builder.negativeCacheTtlSeconds;
        this.sweepIntervalMinutes = builder.sweepIntervalMinutes;
        this.serveStaleOnError = builder.serveStaleOnError;
        this.cacheDirectory = builder.cacheDirectory;
    }

    public int getCacheTtlDays() {
        return cacheTtlDays;
    }

    public int getMaxCacheEntries() {
        return maxCacheEntries;
    }

    public long getMaxCacheBytes() {
        return maxCacheBytes;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFraction() {
        return jitterFraction;
    }

    public boolean isWarmOnStartup() {
        return warmOnStartup;
    }

    public long getHttpTimeoutMs() {
        return httpTimeoutMs;
    }

    public boolean isOfflineOnly() {
        return offlineOnly;
    }

    public String getDocsVersion() {
        return docsVersion;
    }

    public String getDocsLocale() {
        return docsLocale;
    }

    public long getNegativeCacheTtlSeconds() {
        return negativeCacheTtlSeconds;
    }

    public long getSweepIntervalMinutes() {
        return sweepIntervalMinutes;
    }

    public boolean isServeStaleOnError() {
        return serveStaleOnError;
    }

    /**
     * Directory of the persisted tier, or null to keep the persisted tier in memory.
     */
    public Path getCacheDirectory() {
        return cacheDirectory;
    }

    /**
     * Version tag of every key this lookup produces: the docs version, prefixed by the locale
     * when it is not English ({@code fr/3.12}).
     */
    public String versionTag() {
        return "en".equals(docsLocale) ? docsVersion : docsLocale + "/" + docsVersion;
    }

    public CacheConfig toCacheConfig() {
        return new CacheConfig(maxCacheEntries, maxCacheBytes, Duration.ofDays(cacheTtlDays),
                Duration.ofSeconds(negativeCacheTtlSeconds), serveStaleOnError);
    }

    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(maxRetries, Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxDelayMs),
                jitterFraction, Duration.ofMillis(httpTimeoutMs));
    }

    public static LookupOptions defaults() {
        return builder().build();
    }

    /**
     * Reads options from {@code docs-lookup.*} entries. Unparseable values are logged and ignored.
     *
     * <pre>
     * docs-lookup.cache-ttl-days=14
     * docs-lookup.max-retries=5
     * docs-lookup.docs-version=3.12
     * </pre>
     */
    public static LookupOptions fromProperties(Map<String, String> properties) {
        Builder builder = builder();
        apply(properties, "cache-ttl-days", v -> builder.cacheTtlDays(parseWholeInt(v)));
        apply(properties, "max-cache-entries", v -> builder.maxCacheEntries(parseWholeInt(v)));
        apply(properties, "max-cache-bytes", v -> builder.maxCacheBytes(parseWhole(v)));
        apply(properties, "max-retries", v -> builder.maxRetries(parseWholeInt(v)));
        apply(properties, "base-delay-ms", v -> builder.baseDelayMs(parseWhole(v)));
        apply(properties, "max-delay-ms", v -> builder.maxDelayMs(parseWhole(v)));
        apply(properties, "jitter-fraction", v -> builder.jitterFraction(Double.parseDouble(v)));
        apply(properties, "warm-on-startup", v -> builder.warmOnStartup(parseBoolean(v)));
        apply(properties, "http-timeout-ms", v -> builder.httpTimeoutMs(parseWhole(v)));
        apply(properties, "offline-only", v -> builder.offlineOnly(parseBoolean(v)));
        apply(properties, "docs-version", builder::docsVersion);
        apply(properties, "docs-locale", builder::docsLocale);
        apply(properties, "negative-cache-ttl-seconds", v -> builder.negativeCacheTtlSeconds(parseWhole(v)));
        apply(properties, "sweep-interval-minutes", v -> builder.sweepIntervalMinutes(parseWhole(v)));
        apply(properties, "serve-stale-on-error", v -> builder.serveStaleOnError(parseBoolean(v)));
        apply(properties, "cache-directory", v -> builder.cacheDirectory(Path.of(v)));
        return builder.build();
    }

    private static void apply(Map<String, String> properties, String name, Consumer<String> setter) {
        String value = properties.get(PROPERTY_PREFIX + name);
        if (value == null || value.isBlank()) {
            return;
        }
        try {
            setter.accept(value.trim());
        } catch (IllegalArgumentException e) {
            log.warn("options.ignored name={} value={} error={}", PROPERTY_PREFIX + name, value, e.getMessage());
        }
    }

    /**
     * Parses an integer of any magnitude, saturating at the {@code long} range so that the
     * builder clamps huge values to their bound instead of rejecting them.
     */
    static long parseWhole(String value) {
        BigInteger parsed = new BigInteger(value);
        return parsed.max(LONG_MIN).min(LONG_MAX).longValue();
    }

    static int parseWholeInt(String value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, parseWhole(value)));
    }

    private static boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Not a boolean: " + value);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int cacheTtlDays = DEFAULT_CACHE_TTL_DAYS;
        private int maxCacheEntries = DEFAULT_MAX_CACHE_ENTRIES;
        private long maxCacheBytes = DEFAULT_MAX_CACHE_BYTES;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long baseDelayMs = DEFAULT_BASE_DELAY_MS;
        private long maxDelayMs = DEFAULT_MAX_DELAY_MS;
        private double jitterFraction = DEFAULT_JITTER_FRACTION;
        private boolean warmOnStartup = true;
        private long httpTimeoutMs = DEFAULT_HTTP_TIMEOUT_MS;
        private boolean offlineOnly = false;
        private String docsVersion = "3";
        private String docsLocale = "en";
        private long negativeCacheTtlSeconds = DEFAULT_NEGATIVE_CACHE_TTL_SECONDS;
        private long sweepIntervalMinutes = DEFAULT_SWEEP_INTERVAL_MINUTES;
        private boolean serveStaleOnError = true;
        private Path cacheDirectory;

        public Builder cacheTtlDays(int cacheTtlDays) {
            this.cacheTtlDays = (int) clamp("cacheTtlDays", cacheTtlDays, 1, 365);
            return this;
        }

        public Builder maxCacheEntries(int maxCacheEntries) {
            this.maxCacheEntries = (int) clamp("maxCacheEntries", maxCacheEntries, 1, 100_000);
            return this;
        }

        public Builder maxCacheBytes(long maxCacheBytes) {
            this.maxCacheBytes = clamp("maxCacheBytes", maxCacheBytes, 1024L, 1024L * 1024 * 1024);
            return this;
        }

        /**
         * Total fetch attempts, including the first.
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = (int) clamp("maxRetries", maxRetries, 1, 10);
            return this;
        }

        public Builder baseDelayMs(long baseDelayMs) {
            this.baseDelayMs = clamp("baseDelayMs", baseDelayMs, 0, 60_000);
            return this;
        }

        /**
         * Clamped to at most 300000 here, and to at least {@code baseDelayMs} when built.
         */
        public Builder maxDelayMs(long maxDelayMs) {
            this.maxDelayMs = clamp("maxDelayMs", maxDelayMs, 0, 300_000);
            return this;
        }

        public Builder jitterFraction(double jitterFraction) {
            double clamped = Double.isNaN(jitterFraction) ? DEFAULT_JITTER_FRACTION
                    : Math.max(0.0, Math.min(1.0, jitterFraction));
            if (clamped != jitterFraction) {
                log.warn("options.clamped name=jitterFraction value={} bound={}", jitterFraction, clamped);
            }
            this.jitterFraction = clamped;
            return this;
        }

        public Builder warmOnStartup(boolean warmOnStartup) {
            this.warmOnStartup = warmOnStartup;
            return this;
        }

        public Builder httpTimeoutMs(long httpTimeoutMs) {
            this.httpTimeoutMs = clamp("httpTimeoutMs", httpTimeoutMs, 1_000, 60_000);
            return this;
        }

        public Builder offlineOnly(boolean offlineOnly) {
            this.offlineOnly = offlineOnly;
            return this;
        }

        public Builder docsVersion(String docsVersion) {
            if (docsVersion == null || docsVersion.isBlank() || !docsVersion.trim().matches("[0-9A-Za-z.\\-]+")) {
                log.warn("options.ignored name=docsVersion value={}", docsVersion);
                return this;
            }
            this.docsVersion = docsVersion.trim();
            return this;
        }

        public Builder docsLocale(String docsLocale) {
            if (docsLocale == null || !docsLocale.trim().matches("[A-Za-z]{2}(-[A-Za-z]{2})?")) {
                log.warn("options.ignored name=docsLocale value={}", docsLocale);
                return this;
            }
            this.docsLocale = docsLocale.trim().toLowerCase(Locale.ROOT);
            return this;
        }

        /**
         * Zero disables negative caching.
         */
        public Builder negativeCacheTtlSeconds(long negativeCacheTtlSeconds) {
            this.negativeCacheTtlSeconds = clamp("negativeCacheTtlSeconds", negativeCacheTtlSeconds, 0, 3_600);
            return this;
        }

        public Builder sweepIntervalMinutes(long sweepIntervalMinutes) {
            this.sweepIntervalMinutes = clamp("sweepIntervalMinutes", sweepIntervalMinutes, 1, 1_440);
            return this;
        }

        public Builder serveStaleOnError(boolean serveStaleOnError) {
            this.serveStaleOnError = serveStaleOnError;
            return this;
        }

        public Builder cacheDirectory(Path cacheDirectory) {
            this.cacheDirectory = cacheDirectory;
            return this;
        }

        public LookupOptions build() {
            return new LookupOptions(this);
        }

        private static long clamp(String name, long value, long min, long max) {
            long clamped = Math.max(min, Math.min(max, value));
            if (clamped != value) {
                log.warn("options.clamped name={} value={} bound={}", name, value, clamped);
            }
            return clamped;
        }
    }
}
