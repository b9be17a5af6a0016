package com.docs.lookup.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StripedKeyedLockTest {

    @Nested
    @DisplayName("StripedKeyedLock")
    class LockTests {

        @Test
        @DisplayName("Should acquire and release lock")
        void testAcquireRelease() {
            StripedKeyedLock lock = new StripedKeyedLock();
            assertDoesNotThrow(() -> lock.lock("key"));
            assertDoesNotThrow(() -> lock.unlock("key"));
        }

        @Test
        @DisplayName("Should allow re-entrant locking from same thread")
        void testReentrant() {
            StripedKeyedLock lock = new StripedKeyedLock();
            lock.lock("key");
            lock.lock("key");
            lock.unlock("key");
            lock.unlock("key");
        }

        @Test
        @DisplayName("Should map the same key to the same stripe")
        void testStableStripe() {
            StripedKeyedLock lock = new StripedKeyedLock(new LockConfig(1000, 8));
            int index = lock.stripeIndex("3.12|KEYWORD|class");
            assertEquals(index, lock.stripeIndex("3.12|KEYWORD|class"));
            assertTrue(index >= 0 && index < 8);
        }

        @Test
        @DisplayName("Should time out while another thread holds the key")
        void testTimeout() throws Exception {
            StripedKeyedLock lock = new StripedKeyedLock(new LockConfig(50, 4));
            ExecutorService other = Executors.newSingleThreadExecutor();
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            try {
                Future<?> holder = other.submit(() -> {
                    lock.lock("busy");
                    held.countDown();
                    release.await();
                    lock.unlock("busy");
                    return null;
                });
                assertTrue(held.await(5, TimeUnit.SECONDS));

                assertThrows(LockAcquisitionException.class, () -> lock.lock("busy"));

                release.countDown();
                holder.get(5, TimeUnit.SECONDS);
                assertDoesNotThrow(() -> lock.withLock("busy", () -> "done"));
            } finally {
                other.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should serialize work on the same key")
        void testMutualExclusion() throws Exception {
            StripedKeyedLock lock = new StripedKeyedLock();
            AtomicInteger concurrent = new AtomicInteger();
            AtomicInteger maxConcurrent = new AtomicInteger();
            ExecutorService pool = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            try {
                Future<?>[] futures = new Future<?>[4];
                for (int i = 0; i < futures.length; i++) {
                    futures[i] = pool.submit(() -> {
                        start.await();
                        return lock.withLock("shared", () -> {
                            int current = concurrent.incrementAndGet();
                            maxConcurrent.accumulateAndGet(current, Math::max);
                            try {
                                Thread.sleep(20);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                            concurrent.decrementAndGet();
                            return null;
                        });
                    });
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, maxConcurrent.get());
        }

        @Test
        @DisplayName("Should handle unlock for a key it does not hold")
        void testUnlockNotHeld() {
            StripedKeyedLock lock = new StripedKeyedLock();
            assertDoesNotThrow(() -> lock.unlock("never-locked"));
        }
    }

    @Nested
    @DisplayName("LockConfig")
    class LockConfigTests {

        @Test
        @DisplayName("Should create default config")
        void testDefaults() {
            LockConfig config = LockConfig.defaults();
            assertEquals(5000, config.timeoutMs());
            assertEquals(64, config.stripes());
        }

        @Test
        @DisplayName("Should reject invalid values")
        void testInvalid() {
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(0, 4));
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(100, 0));
        }
    }
}
