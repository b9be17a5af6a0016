package com.docs.lookup.fetch;

import com.docs.lookup.core.model.FetchAttempt;
import com.docs.lookup.core.model.ResolutionKey;

import java.util.List;

/**
 * Terminal failure of a documentation fetch.
 * {@link Kind#FATAL} means retrying cannot help (absent resource, rejected URL);
 * {@link Kind#EXHAUSTED} means every allowed attempt failed transiently, or the fetch was
 * interrupted before it could finish. Only fatal failures are worth remembering.
 */
public class FetchException extends RuntimeException {

    public enum Kind { FATAL, EXHAUSTED }

    private final Kind kind;
    private final ResolutionKey key;
    private final List<FetchAttempt> attempts;
    private final boolean remembered;

    private FetchException(Kind kind, ResolutionKey key, String message, List<FetchAttempt> attempts,
                           Throwable cause, boolean remembered) {
        super(message, cause);
        this.kind = kind;
        this.key = key;
        this.attempts = List.copyOf(attempts);
        this.remembered = remembered;
    }

    public static FetchException fatal(ResolutionKey key, String message, List<FetchAttempt> attempts, Throwable cause) {
        return new FetchException(Kind.FATAL, key, message, attempts, cause, false);
    }

    public static FetchException exhausted(ResolutionKey key, String lastCause, List<FetchAttempt> attempts, Throwable cause) {
        return new FetchException(Kind.EXHAUSTED, key, "All " + attempts.size() + " attempts failed for "
                + key + "; last cause: " + lastCause, attempts, cause, false);
    }

    /**
     * The fetching thread was interrupted, while waiting to retry or during a request.
     */
    public static FetchException interrupted(ResolutionKey key, List<FetchAttempt> attempts, Throwable cause) {
        return new FetchException(Kind.EXHAUSTED, key, "Interrupted while fetching " + key + " after "
                + attempts.size() + " attempts", attempts, cause, false);
    }

    /**
     * Copy of a fatal failure replayed from the negative cache, without any network attempt.
     */
    public FetchException remembered() {
        return new FetchException(kind, key, getMessage(), List.of(), getCause(), true);
    }

    public Kind getKind() {
        return kind;
    }

    public ResolutionKey getKey() {
        return key;
    }

    public List<FetchAttempt> getAttempts() {
        return attempts;
    }

    /**
     * True when this failure was served from the negative cache rather than a fresh fetch.
     */
    public boolean isRemembered() {
        return remembered;
    }
}
