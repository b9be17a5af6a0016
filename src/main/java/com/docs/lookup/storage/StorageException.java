package com.docs.lookup.storage;

/**
 * Failure of the persisted cache tier: I/O error, unreadable record, or lock timeout.
 * The cache store degrades to memory-only operation when it sees one.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
