package com.docs.lookup.api;

import com.docs.lookup.fetch.FetchException;

/**
 * Why documentation is unavailable.
 *
 * @param kind     fatal or exhausted
 * @param cause    human-readable cause
 * @param attempts network attempts made; zero for remembered failures and offline misses
 */
public record FetchError(FetchException.Kind kind, String cause, int attempts) {

    static FetchError from(FetchException e) {
        return new FetchError(e.getKind(), e.getMessage(), e.getAttempts().size());
    }

    static FetchError offline() {
        return new FetchError(FetchException.Kind.FATAL, "Offline mode: documentation is not cached", 0);
    }
}
