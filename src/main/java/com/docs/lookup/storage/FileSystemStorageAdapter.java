package com.docs.lookup.storage;

import com.docs.lookup.lock.KeyedLock;
import com.docs.lookup.lock.LockAcquisitionException;
import com.docs.lookup.lock.StripedKeyedLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * {@link StorageAdapter} that keeps one file per key in a private directory.
 *
 * <p>File names are the SHA-256 of the key. Each file holds a small binary record:</p>
 * <pre>
 * int   magic
 * long  expiresAt (epoch millis)
 * int   key length, key bytes
 * int   value length, value bytes
 * </pre>
 *
 * <p>Writes go to a temporary file in the same directory and are moved into place atomically,
 * so a reader in another process sees either the old record or the new one. Within this process
 * a {@link KeyedLock} serializes access to the same key.</p>
 */
public class FileSystemStorageAdapter implements StorageAdapter {
    private static final Logger log = LoggerFactory.getLogger(FileSystemStorageAdapter.class);

    private static final int MAGIC = 0x444F4331; // "DOC1"
    private static final String ENTRY_SUFFIX = ".entry";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final int MAX_RECORD_PART = 64 * 1024 * 1024;
    private static final Duration ORPHAN_TEMP_AGE = Duration.ofHours(1);

    private final Path directory;
    private final KeyedLock keyLock;
    private final Clock clock;

    public FileSystemStorageAdapter(Path directory) {
        this(directory, new StripedKeyedLock(), Clock.systemUTC());
    }

    public FileSystemStorageAdapter(Path directory, KeyedLock keyLock, Clock clock) {
        this.directory = directory;
        this.keyLock = keyLock;
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Cannot create cache directory " + directory, e);
        }
        log.info("FileSystemStorageAdapter initialized: directory={}", directory);
    }

    @Override
    public Optional<byte[]> get(byte[] key) {
        String name = fileName(key);
        return locked(name, () -> {
            Path file = directory.resolve(name);
            byte[] data;
            try {
                data = Files.readAllBytes(file);
            } catch (NoSuchFileException e) {
                return Optional.empty();
            } catch (IOException e) {
                throw new StorageException("Cannot read cache record " + name, e);
            }
            Record record;
            try {
                record = readRecord(data);
            } catch (IOException e) {
                throw new CorruptRecordException("Corrupt cache record " + name + ": " + e.getMessage(), e);
            }
            // distinct keys sharing a digest are treated as absent
            return Arrays.equals(record.key(), key) ? Optional.of(record.value()) : Optional.<byte[]>empty();
        });
    }

    @Override
    public void put(byte[] key, byte[] value, Instant expiresAt) {
        String name = fileName(key);
        byte[] record = encode(key, value, expiresAt);
        locked(name, () -> {
            Path target = directory.resolve(name);
            Path temp = null;
            try {
                temp = Files.createTempFile(directory, name, TEMP_SUFFIX);
                Files.write(temp, record);
                moveIntoPlace(temp, target);
                return null;
            } catch (IOException e) {
                deleteQuietly(temp);
                throw new StorageException("Cannot write cache record " + name, e);
            }
        });
    }

    @Override
    public void delete(byte[] key) {
        String name = fileName(key);
        locked(name, () -> {
            try {
                Files.deleteIfExists(directory.resolve(name));
                return null;
            } catch (IOException e) {
                throw new StorageException("Cannot delete cache record " + name, e);
            }
        });
    }

    @Override
    public int sweepExpired() {
        Instant now = clock.instant();
        return removeWhere((name, record) -> record == null || !now.isBefore(record.expiresAt()));
    }

    @Override
    public int deleteMatching(Predicate<byte[]> keyFilter) {
        return removeWhere((name, record) -> record != null && keyFilter.test(record.key()));
    }

    public Path getDirectory() {
        return directory;
    }

    private int removeWhere(RecordFilter filter) {
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (name.endsWith(TEMP_SUFFIX)) {
                    removeOrphanTemp(file);
                } else if (name.endsWith(ENTRY_SUFFIX) && removeIfMatches(file, filter)) {
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new StorageException("Cannot list cache directory " + directory, e);
        } catch (DirectoryIteratorException e) {
            throw new StorageException("Cannot list cache directory " + directory, e.getCause());
        }
        return removed;
    }

    private boolean removeIfMatches(Path file, RecordFilter filter) {
        String name = file.getFileName().toString();
        return locked(name, () -> {
            Record record;
            try {
                record = readRecord(Files.readAllBytes(file));
            } catch (NoSuchFileException e) {
                return false;
            } catch (IOException e) {
                log.warn("storage.unreadableRecord file={} error={}", name, e.getMessage());
                record = null;
            }
            if (!filter.matches(name, record)) {
                return false;
            }
            try {
                return Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new StorageException("Cannot delete cache record " + name, e);
            }
        });
    }

    /**
     * Deletes a temp file left behind by a crashed write. A temp file that disappears meanwhile was
     * moved into place by a concurrent put; a failure on one file never stops the sweep.
     */
    private void removeOrphanTemp(Path temp) {
        try {
            Instant modified = Files.getLastModifiedTime(temp).toInstant();
            if (modified.plus(ORPHAN_TEMP_AGE).isBefore(clock.instant())) {
                Files.deleteIfExists(temp);
            }
        } catch (NoSuchFileException e) {
            log.debug("storage.tempVanished file={}", temp.getFileName());
        } catch (IOException e) {
            log.warn("storage.tempCleanupFailed file={} error={}", temp.getFileName(), e.getMessage());
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("storage.tempCleanupFailed file={} error={}", temp.getFileName(), e.getMessage());
        }
    }

    private <T> T locked(String name, Supplier<T> action) {
        try {
            return keyLock.withLock(name, action);
        } catch (LockAcquisitionException e) {
            throw new StorageException("Timed out waiting for cache record " + name, e);
        }
    }

    static byte[] encode(byte[] key, byte[] value, Instant expiresAt) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(key.length + value.length + 24);
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(MAGIC);
            out.writeLong(expiresAt.toEpochMilli());
            out.writeInt(key.length);
            out.write(key);
            out.writeInt(value.length);
            out.write(value);
        } catch (IOException e) {
            throw new StorageException("Cannot encode cache record", e);
        }
        return bytes.toByteArray();
    }

    static Record readRecord(byte[] data) throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            if (in.readInt() != MAGIC) {
                throw new IOException("Bad record header");
            }
            Instant expiresAt = Instant.ofEpochMilli(in.readLong());
            byte[] key = readPart(in);
            byte[] value = readPart(in);
            if (in.read() != -1) {
                throw new IOException("Trailing bytes after record");
            }
            return new Record(key, value, expiresAt);
        } catch (EOFException e) {
            throw new IOException("Truncated record", e);
        }
    }

    private static byte[] readPart(DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length < 0 || length > MAX_RECORD_PART) {
            throw new IOException("Invalid record length " + length);
        }
        byte[] part = new byte[length];
        in.readFully(part);
        return part;
    }

    static String fileName(byte[] key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key)) + ENTRY_SUFFIX;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    record Record(byte[] key, byte[] value, Instant expiresAt) {}

    @FunctionalInterface
    private interface RecordFilter {
        boolean matches(String fileName, Record record);
    }
}
