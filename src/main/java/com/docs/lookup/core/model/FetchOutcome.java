package com.docs.lookup.core.model;

/**
 * Outcome of a single fetch attempt.
 */
public enum FetchOutcome {
    SUCCESS,
    RETRYABLE_FAILURE,
    FATAL_FAILURE
}
