package com.docs.lookup.storage;

/**
 * A stored value exists but its bytes cannot be decoded. The value is unusable; the
 * storage itself is still healthy.
 */
public class CorruptRecordException extends StorageException {

    public CorruptRecordException(String message) {
        super(message);
    }

    public CorruptRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
