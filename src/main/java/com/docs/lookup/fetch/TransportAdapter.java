package com.docs.lookup.fetch;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Narrow network contract the fetch layer depends on. Implementations perform exactly one
 * request, do not follow redirects and do not retry.
 */
public interface TransportAdapter {

    /**
     * Performs a GET of {@code uri}.
     *
     * @param timeout upper bound for this single request
     * @return the response, whatever its status code
     * @throws TransportException if no response was received
     */
    TransportResponse request(URI uri, Map<String, String> headers, Duration timeout);
}
