package com.docs.lookup.fetch;

import com.docs.lookup.cache.DocumentFetcher;
import com.docs.lookup.core.model.FetchAttempt;
import com.docs.lookup.core.model.FetchOutcome;
import com.docs.lookup.core.model.ResolutionKey;
import com.docs.lookup.logging.LogContext;
import com.docs.lookup.metrics.MetricsService;
import com.docs.lookup.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * {@link DocumentFetcher} that retrieves documentation over a {@link TransportAdapter},
 * retrying transient failures with capped exponential backoff and jitter.
 *
 * <p>Network errors, 5xx and 429 responses are retried; any other 4xx, an empty 2xx body or a
 * URL outside the allow-list fails immediately. Redirects are followed within one attempt.</p>
 *
 * <pre>
 * RetryingFetcher fetcher = RetryingFetcher.builder()
 *     .transport(JdkHttpTransportAdapter.createDefault())
 *     .locator(new DocumentationLocator(dictionary))
 *     .retryPolicy(RetryPolicy.defaults())
 *     .build();
 * byte[] page = fetcher.fetch(key);
 * </pre>
 */
public class RetryingFetcher implements DocumentFetcher {
    private static final Logger log = LoggerFactory.getLogger(RetryingFetcher.class);

    static final int MAX_REDIRECTS = 5;
    static final Map<String, String> REQUEST_HEADERS = Map.of(
            "User-Agent", "docs-lookup/1.0",
            "Accept", "text/html");

    private final TransportAdapter transport;
    private final DocumentationLocator locator;
    private final RetryPolicy policy;
    private final HostRateLimiter rateLimiter;
    private final FetchAttemptListener listener;
    private final MetricsService metrics;
    private final Sleeper sleeper;
    private final DoubleSupplier random;
    private final Clock clock;

    private RetryingFetcher(Builder builder) {
        this.transport = Objects.requireNonNull(builder.transport, "transport is required");
        this.locator = Objects.requireNonNull(builder.locator, "locator is required");
        this.policy = builder.policy != null ? builder.policy : RetryPolicy.defaults();
        this.rateLimiter = builder.rateLimiter != null ? builder.rateLimiter : new HostRateLimiter();
        this.listener = builder.listener != null ? builder.listener : FetchAttemptListener.NONE;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD;
        this.random = builder.random != null ? builder.random : () -> ThreadLocalRandom.current().nextDouble();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    @Override
    public byte[] fetch(ResolutionKey key) {
        try (LogContext ignored = LogContext.forFetch(key)) {
            long startNanos = System.nanoTime();
            try {
                byte[] body = doFetch(key);
                metrics.recordFetchDuration(true, Duration.ofNanos(System.nanoTime() - startNanos));
                return body;
            } catch (FetchException e) {
                metrics.recordFetchDuration(false, Duration.ofNanos(System.nanoTime() - startNanos));
                throw e;
            }
        }
    }

    private byte[] doFetch(ResolutionKey key) {
        Optional<URI> located = locator.locate(key);
        if (located.isEmpty()) {
            log.info("fetch.unlocatable key={}", key);
            throw FetchException.fatal(key, "No documentation page known for " + key, List.of(), null);
        }
        URI uri = located.get();
        if (!locator.isAllowed(uri)) {
            log.warn("fetch.rejectedUrl key={} uri={}", key, uri);
            throw FetchException.fatal(key, "Refusing to fetch disallowed URL " + uri, List.of(), null);
        }

        List<FetchAttempt> attempts = new ArrayList<>();
        long delayMs = 0;
        AttemptResult last = null;
        for (int attemptNumber = 1; attemptNumber <= policy.maxAttempts(); attemptNumber++) {
            if (attemptNumber > 1 && delayMs > 0) {
                try {
                    sleeper.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("fetch.interrupted key={} attempts={}", key, attempts.size());
                    throw FetchException.interrupted(key, attempts, e);
                }
            }

            last = attemptOnce(uri);
            FetchAttempt attempt = new FetchAttempt(attemptNumber, delayMs, last.outcome(), last.statusCode(), last.cause());
            attempts.add(attempt);
            metrics.recordFetchAttempt(last.outcome());
            listener.onAttempt(key, attempt);

            if (ErrorClassifier.isInterruption(last.error())) {
                log.info("fetch.interrupted key={} attempts={}", key, attempts.size());
                throw FetchException.interrupted(key, attempts, last.error());
            }
            switch (last.outcome()) {
                case SUCCESS -> {
                    log.debug("fetch.succeeded key={} attempt={} bytes={}", key, attemptNumber, last.body().length);
                    return last.body();
                }
                case FATAL_FAILURE -> {
                    log.info("fetch.fatal key={} attempt={} status={} cause={}",
                            key, attemptNumber, last.statusCode(), last.cause());
                    throw FetchException.fatal(key, last.cause(), attempts, last.error());
                }
                default -> {
                    if (attemptNumber < policy.maxAttempts()) {
                        delayMs = nextDelay(attemptNumber, last);
                        log.warn("fetch.retrying key={} attempt={} status={} cause={} delayMs={}",
                                key, attemptNumber, last.statusCode(), last.cause(), delayMs);
                    }
                }
            }
        }

        log.warn("fetch.exhausted key={} attempts={} cause={}", key, attempts.size(), last.cause());
        throw FetchException.exhausted(key, last.cause(), attempts, last.error());
    }

    private long nextDelay(int completedAttempt, AttemptResult last) {
        long backoff = policy.delayBeforeRetryMillis(completedAttempt, random.getAsDouble());
        if (last.retryAfterMs() < 0) {
            return backoff;
        }
        return Math.min(policy.maxDelay().toMillis(), Math.max(backoff, last.retryAfterMs()));
    }

    private AttemptResult attemptOnce(URI uri) {
        if (!rateLimiter.tryAcquire(uri.getHost())) {
            return AttemptResult.failure(FetchOutcome.RETRYABLE_FAILURE, 0,
                    "Rate limit exceeded for " + uri.getHost(), null);
        }

        URI current = uri;
        for (int hop = 0; ; hop++) {
            TransportResponse response;
            try {
                response = transport.request(current, REQUEST_HEADERS, policy.attemptTimeout());
            } catch (TransportException e) {
                return AttemptResult.failure(ErrorClassifier.classify(e), 0,
                        e.getKind() + ": " + e.getMessage(), e);
            }

            int status = response.statusCode();
            if (response.isRedirect()) {
                Optional<String> location = response.header("Location");
                if (location.isEmpty()) {
                    return AttemptResult.failure(FetchOutcome.FATAL_FAILURE, status,
                            "Redirect without Location from " + current, null);
                }
                if (hop >= MAX_REDIRECTS) {
                    return AttemptResult.failure(FetchOutcome.FATAL_FAILURE, status,
                            "Too many redirects starting at " + uri, null);
                }
                URI next;
                try {
                    next = current.resolve(location.get().trim());
                } catch (IllegalArgumentException e) {
                    return AttemptResult.failure(FetchOutcome.FATAL_FAILURE, status,
                            "Malformed redirect Location: " + location.get(), e);
                }
                if (!locator.isAllowed(next)) {
                    return AttemptResult.failure(FetchOutcome.FATAL_FAILURE, status,
                            "Redirect to disallowed URL " + next, null);
                }
                log.debug("fetch.redirect from={} to={} status={}", current, next, status);
                current = next;
                continue;
            }

            FetchOutcome outcome = ErrorClassifier.classifyStatus(status);
            if (outcome == FetchOutcome.SUCCESS) {
                if (response.body().length == 0) {
                    return AttemptResult.failure(FetchOutcome.FATAL_FAILURE, status,
                            "Empty response body from " + current, null);
                }
                return new AttemptResult(FetchOutcome.SUCCESS, status, response.body(), null, -1, null);
            }
            long retryAfter = status == ErrorClassifier.TOO_MANY_REQUESTS
                    ? parseRetryAfter(response.header("Retry-After").orElse(null)) : -1;
            return new AttemptResult(outcome, status, null, "HTTP " + status + " from " + current, retryAfter, null);
        }
    }

    /**
     * Parses a Retry-After value given as delta-seconds or an HTTP-date.
     *
     * @return the delay in milliseconds, or -1 if absent or unparseable
     */
    long parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return -1;
        }
        String trimmed = value.trim();
        try {
            long seconds = Long.parseLong(trimmed);
            return seconds < 0 ? -1 : Math.multiplyExact(seconds, 1000L);
        } catch (NumberFormatException | ArithmeticException e) {
            // not delta-seconds, try HTTP-date
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            return Math.max(0L, Duration.between(clock.instant(), at.toInstant()).toMillis());
        } catch (DateTimeParseException e) {
            log.debug("fetch.badRetryAfter value={}", trimmed);
            return -1;
        }
    }

    public RetryPolicy getRetryPolicy() {
        return policy;
    }

    public static Builder builder() {
        return new Builder();
    }

    private record AttemptResult(FetchOutcome outcome, int statusCode, byte[] body, String cause,
                                 long retryAfterMs, Throwable error) {
        static AttemptResult failure(FetchOutcome outcome, int statusCode, String cause, Throwable error) {
            return new AttemptResult(outcome, statusCode, null, cause, -1, error);
        }
    }

    public static class Builder {
        private TransportAdapter transport;
        private DocumentationLocator locator;
        private RetryPolicy policy;
        private HostRateLimiter rateLimiter;
        private FetchAttemptListener listener;
        private MetricsService metrics;
        private Sleeper sleeper;
        private DoubleSupplier random;
        private Clock clock;

        public Builder transport(TransportAdapter transport) {
            this.transport = transport;
            return this;
        }

        public Builder locator(DocumentationLocator locator) {
            this.locator = locator;
            return this;
        }

        public Builder retryPolicy(RetryPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder rateLimiter(HostRateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder listener(FetchAttemptListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Source of uniform samples in [0, 1) used for jitter.
         */
        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RetryingFetcher build() {
            return new RetryingFetcher(this);
        }
    }
}
