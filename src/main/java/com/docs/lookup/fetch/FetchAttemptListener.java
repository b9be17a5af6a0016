package com.docs.lookup.fetch;

import com.docs.lookup.core.model.FetchAttempt;
import com.docs.lookup.core.model.ResolutionKey;

/**
 * Receives every attempt a {@link RetryingFetcher} makes, as it completes.
 */
@FunctionalInterface
public interface FetchAttemptListener {

    FetchAttemptListener NONE = (key, attempt) -> { };

    void onAttempt(ResolutionKey key, FetchAttempt attempt);
}
