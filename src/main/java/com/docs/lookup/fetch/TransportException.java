package com.docs.lookup.fetch;

/**
 * Network-level failure raised by a {@link TransportAdapter}: no status code was received.
 */
public class TransportException extends RuntimeException {

    /**
     * Network failure category. All kinds except {@link #INTERRUPTED} are worth retrying.
     */
    public enum Kind { CONNECT, TIMEOUT, DNS, RESET, IO, INTERRUPTED }

    private final Kind kind;

    public TransportException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TransportException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
