package com.docs.lookup.storage;

import com.docs.lookup.lock.LockConfig;
import com.docs.lookup.lock.StripedKeyedLock;
import com.docs.lookup.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemStorageAdapterTest {

    @TempDir
    Path directory;

    private MutableClock clock;
    private FileSystemStorageAdapter adapter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-06-01T10:00:00Z");
        adapter = new FileSystemStorageAdapter(directory, new StripedKeyedLock(LockConfig.defaults()), clock);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private Instant inOneHour() {
        return clock.instant().plus(Duration.ofHours(1));
    }

    private List<Path> files(String suffix) throws IOException {
        try (Stream<Path> listing = Files.list(directory)) {
            return listing.filter(p -> p.getFileName().toString().endsWith(suffix)).toList();
        }
    }

    @Nested
    @DisplayName("Basic operations")
    class BasicTests {

        @Test
        @DisplayName("Should store, read, replace and delete values")
        void testPutGetDelete() {
            adapter.put(bytes("3|KEYWORD|class"), bytes("v1"), inOneHour());
            assertArrayEquals(bytes("v1"), adapter.get(bytes("3|KEYWORD|class")).orElseThrow());

            adapter.put(bytes("3|KEYWORD|class"), bytes("v2"), inOneHour());
            assertArrayEquals(bytes("v2"), adapter.get(bytes("3|KEYWORD|class")).orElseThrow());

            adapter.delete(bytes("3|KEYWORD|class"));
            assertTrue(adapter.get(bytes("3|KEYWORD|class")).isEmpty());
            adapter.delete(bytes("3|KEYWORD|class"));
        }

        @Test
        @DisplayName("Should survive a new adapter instance on the same directory")
        void testDurable() {
            adapter.put(bytes("k"), bytes("persisted"), inOneHour());

            FileSystemStorageAdapter reopened = new FileSystemStorageAdapter(directory);

            assertArrayEquals(bytes("persisted"), reopened.get(bytes("k")).orElseThrow());
        }

        @Test
        @DisplayName("Should leave no temporary files after a write")
        void testNoTempFiles() throws IOException {
            adapter.put(bytes("k"), bytes("v"), inOneHour());

            assertEquals(1, files(".entry").size());
            assertTrue(files(".tmp").isEmpty());
        }

        @Test
        @DisplayName("Should return expired values until they are swept")
        void testExpiredValuesStillReadable() {
            adapter.put(bytes("k"), bytes("v"), inOneHour());
            clock.advance(Duration.ofHours(2));

            assertTrue(adapter.get(bytes("k")).isPresent());
        }
    }

    @Nested
    @DisplayName("Sweeping and bulk removal")
    class SweepTests {

        @Test
        @DisplayName("Should remove only expired records")
        void testSweepExpired() {
            adapter.put(bytes("short"), bytes("a"), clock.instant().plus(Duration.ofMinutes(5)));
            adapter.put(bytes("long"), bytes("b"), clock.instant().plus(Duration.ofDays(5)));
            clock.advance(Duration.ofMinutes(5));

            assertEquals(1, adapter.sweepExpired());
            assertTrue(adapter.get(bytes("short")).isEmpty());
            assertTrue(adapter.get(bytes("long")).isPresent());
        }

        @Test
        @DisplayName("Should delete records whose key matches")
        void testDeleteMatching() {
            adapter.put(bytes("3.11|MODULE|os"), bytes("a"), inOneHour());
            adapter.put(bytes("3.11|MODULE|sys"), bytes("b"), inOneHour());
            adapter.put(bytes("3.12|MODULE|os"), bytes("c"), inOneHour());

            int removed = adapter.deleteMatching(k -> new String(k, StandardCharsets.UTF_8).startsWith("3.11|"));

            assertEquals(2, removed);
            assertTrue(adapter.get(bytes("3.12|MODULE|os")).isPresent());
        }

        @Test
        @DisplayName("Should clean up orphaned temporary files older than an hour")
        void testOrphanTempCleanup() throws IOException {
            Path orphan = Files.createFile(directory.resolve("abc.entry123.tmp"));
            Files.setLastModifiedTime(orphan, FileTime.from(clock.instant().minus(Duration.ofHours(2))));
            Path fresh = Files.createFile(directory.resolve("def.entry456.tmp"));
            Files.setLastModifiedTime(fresh, FileTime.from(clock.instant()));

            adapter.sweepExpired();

            assertFalse(Files.exists(orphan));
            assertTrue(Files.exists(fresh));
        }

        @Test
        @DisplayName("Should keep sweeping past a temporary file that vanished")
        void testVanishedTempFile() throws IOException {
            adapter.put(bytes("3.11|MODULE|os"), bytes("a"), inOneHour());
            adapter.put(bytes("3.11|MODULE|sys"), bytes("b"), inOneHour());
            // a dangling link stats like a temp file moved away between listing and cleanup
            Files.createSymbolicLink(directory.resolve("abc.tmp"), directory.resolve("gone.entry.tmp"));

            assertEquals(2, adapter.deleteMatching(k -> true));
            assertEquals(0, adapter.sweepExpired());
            assertTrue(adapter.get(bytes("3.11|MODULE|os")).isEmpty());
        }
    }

    @Nested
    @DisplayName("Corruption")
    class CorruptionTests {

        @Test
        @DisplayName("Should report a corrupt record distinctly from an I/O failure")
        void testCorruptRecord() throws IOException {
            adapter.put(bytes("k"), bytes("value"), inOneHour());
            Path file = files(".entry").get(0);
            Files.write(file, bytes("garbage"));

            assertThrows(CorruptRecordException.class, () -> adapter.get(bytes("k")));
        }

        @Test
        @DisplayName("Should reject truncated records and trailing bytes")
        void testRecordFormat() {
            byte[] record = FileSystemStorageAdapter.encode(bytes("k"), bytes("value"), inOneHour());
            byte[] truncated = Arrays.copyOf(record, record.length - 2);
            byte[] extended = Arrays.copyOf(record, record.length + 1);

            assertThrows(IOException.class, () -> FileSystemStorageAdapter.readRecord(truncated));
            assertThrows(IOException.class, () -> FileSystemStorageAdapter.readRecord(extended));
        }

        @Test
        @DisplayName("Should sweep unreadable records")
        void testSweepCorrupt() throws IOException {
            adapter.put(bytes("k"), bytes("value"), clock.instant().plus(Duration.ofDays(1)));
            Files.write(files(".entry").get(0), bytes("garbage"));

            assertEquals(1, adapter.sweepExpired());
            assertTrue(files(".entry").isEmpty());
        }
    }

    @Test
    @DisplayName("Should never expose a partial write to concurrent readers")
    void testConcurrentReadersSeeWholeValues() throws Exception {
        byte[] first = bytes("a".repeat(64 * 1024));
        byte[] second = bytes("b".repeat(64 * 1024));
        adapter.put(bytes("k"), first, inOneHour());

        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                    adapter.put(bytes("k"), i % 2 == 0 ? second : first, inOneHour());
                }
                return null;
            }));
            for (int r = 0; r < 3; r++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        byte[] read = adapter.get(bytes("k")).orElseThrow();
                        assertTrue(Arrays.equals(read, first) || Arrays.equals(read, second));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
