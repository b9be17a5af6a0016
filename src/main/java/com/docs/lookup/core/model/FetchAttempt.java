package com.docs.lookup.core.model;

import java.util.Optional;

/**
 * Record of one network attempt made while fetching a key. Never persisted.
 *
 * @param attemptNumber 1-based attempt index
 * @param delayBeforeMs time waited before this attempt started
 * @param outcome       how the attempt ended
 * @param statusCode    transport status code, or 0 when no response was received
 * @param cause         failure description, null on success
 */
public record FetchAttempt(int attemptNumber, long delayBeforeMs, FetchOutcome outcome,
                           int statusCode, String cause) {

    public FetchAttempt {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        if (delayBeforeMs < 0) {
            throw new IllegalArgumentException("delayBeforeMs must be >= 0");
        }
    }

    public Optional<String> failureCause() {
        return Optional.ofNullable(cause);
    }
}
