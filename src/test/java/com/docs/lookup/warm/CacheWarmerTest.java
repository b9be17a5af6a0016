package com.docs.lookup.warm;

import com.docs.lookup.cache.CacheConfig;
import com.docs.lookup.cache.CacheStore;
import com.docs.lookup.cache.DocumentFetcher;
import com.docs.lookup.core.model.ResolutionKey;
import com.docs.lookup.core.model.SymbolCategory;
import com.docs.lookup.fetch.FetchException;
import com.docs.lookup.storage.InMemoryStorageAdapter;
import com.docs.lookup.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CacheWarmerTest {

    private static final ResolutionKey LEN = ResolutionKey.of("len", SymbolCategory.BUILTIN_FUNCTION, "3.12");
    private static final ResolutionKey STR = ResolutionKey.of("str", SymbolCategory.OTHER, "3.12");
    private static final ResolutionKey MISSING = ResolutionKey.of("nope", SymbolCategory.OTHER, "3.12");

    private final AtomicInteger fetches = new AtomicInteger();
    private final DocumentFetcher fetcher = key -> {
        fetches.incrementAndGet();
        if (key.equals(MISSING)) {
            throw FetchException.fatal(key, "HTTP 404", List.of(), null);
        }
        return ("doc:" + key.symbol()).getBytes(StandardCharsets.UTF_8);
    };

    private CacheStore store;
    private CacheWarmer warmer;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-06-01T10:00:00Z");
        store = CacheStore.builder()
                .config(CacheConfig.defaults())
                .storage(new InMemoryStorageAdapter(clock))
                .clock(clock)
                .fetchExecutor(Runnable::run)
                .build();
        warmer = new CacheWarmer(store, fetcher);
    }

    @AfterEach
    void tearDown() {
        warmer.close();
        store.close();
    }

    @Nested
    @DisplayName("warm")
    class WarmTests {

        @Test
        @DisplayName("Should populate the cache so later lookups do not fetch")
        void testWarmThenHit() {
            WarmResult result = warmer.warm(List.of(LEN, STR)).join();

            assertEquals(new WarmResult(2, 0, 2, 0), result);
            assertEquals(2, store.stats().entryCount());

            store.getOrFetch(LEN, fetcher).join();
            store.getOrFetch(STR, fetcher).join();
            assertEquals(2, fetches.get());
        }

        @Test
        @DisplayName("Should skip cached and duplicate keys")
        void testSkipsCached() {
            warmer.warm(List.of(LEN)).join();

            WarmResult result = warmer.warm(List.of(LEN, STR, STR)).join();

            assertEquals(2, result.requested());
            assertEquals(1, result.alreadyCached());
            assertEquals(1, result.warmed());
            assertEquals(2, fetches.get());
        }

        @Test
        @DisplayName("Should count failures without failing the run")
        void testFailuresCounted() {
            WarmResult result = warmer.warm(List.of(LEN, MISSING)).join();

            assertEquals(1, result.warmed());
            assertEquals(1, result.failed());
        }

        @Test
        @DisplayName("Should complete immediately for no keys")
        void testEmpty() {
            assertEquals(new WarmResult(0, 0, 0, 0), warmer.warm(List.of()).join());
        }
    }

    @Nested
    @DisplayName("schedule")
    class ScheduleTests {

        @Test
        @DisplayName("Should reject invalid periods and scheduling after close")
        void testScheduleValidation() {
            assertThrows(IllegalArgumentException.class, () -> warmer.schedule(List.of(LEN), Duration.ZERO));

            ScheduledFuture<?> future = warmer.schedule(List.of(LEN), Duration.ofHours(1));
            assertFalse(future.isDone());

            warmer.close();
            assertTrue(warmer.isClosed());
            assertTrue(future.isCancelled());
            assertThrows(IllegalStateException.class, () -> warmer.schedule(List.of(LEN), Duration.ofHours(1)));
        }
    }

    @Test
    @DisplayName("Should build the frequently used key set for a version")
    void testWarmKeys() {
        List<ResolutionKey> keys = WarmKeys.frequentlyUsed("3.12");

        assertEquals(WarmKeys.FREQUENT_KEYWORDS.size() + WarmKeys.FREQUENT_BUILTINS.size(), keys.size());
        assertTrue(keys.contains(ResolutionKey.of("class", SymbolCategory.KEYWORD, "3.12")));
        assertTrue(keys.contains(LEN));
    }
}
