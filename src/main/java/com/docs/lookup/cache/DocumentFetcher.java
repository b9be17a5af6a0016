package com.docs.lookup.cache;

import com.docs.lookup.core.model.ResolutionKey;

/**
 * Miss handler invoked by {@link CacheStore#getOrFetch} when neither tier holds a valid entry.
 * Runs on the store's fetch executor with no store lock held.
 */
@FunctionalInterface
public interface DocumentFetcher {

    /**
     * Retrieves the documentation payload for {@code key}.
     *
     * @return the payload bytes, passed through unmodified
     * @throws com.docs.lookup.fetch.FetchException if the payload cannot be obtained
     */
    byte[] fetch(ResolutionKey key);
}
