package com.docs.lookup.fetch;

import com.docs.lookup.core.model.FetchOutcome;

/**
 * Decides whether a failed attempt is worth retrying.
 */
final class ErrorClassifier {

    static final int TOO_MANY_REQUESTS = 429;

    private ErrorClassifier() {
    }

    static FetchOutcome classifyStatus(int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return FetchOutcome.SUCCESS;
        }
        if (statusCode >= 500 || statusCode == TOO_MANY_REQUESTS) {
            return FetchOutcome.RETRYABLE_FAILURE;
        }
        return FetchOutcome.FATAL_FAILURE;
    }

    /**
     * Every transport failure is transient. An interrupted attempt is still not retried; see
     * {@link #isInterruption}.
     */
    static FetchOutcome classify(TransportException e) {
        return FetchOutcome.RETRYABLE_FAILURE;
    }

    static boolean isInterruption(Throwable error) {
        return error instanceof TransportException
                && ((TransportException) error).getKind() == TransportException.Kind.INTERRUPTED;
    }
}
