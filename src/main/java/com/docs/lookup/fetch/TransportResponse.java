package com.docs.lookup.fetch;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Status, body and headers of one transport request.
 *
 * @param statusCode the HTTP-style status code
 * @param body       response body bytes, never null
 * @param headers    response headers; lookups through {@link #header(String)} ignore case
 */
public record TransportResponse(int statusCode, byte[] body, Map<String, List<String>> headers) {

    public TransportResponse {
        body = body != null ? body : new byte[0];
        Map<String, List<String>> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null) {
                    normalized.put(name, List.copyOf(values));
                }
            });
        }
        headers = normalized;
    }

    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, body.getBytes(StandardCharsets.UTF_8), Map.of());
    }

    public TransportResponse withHeader(String name, String value) {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        copy.put(name, List.of(value));
        return new TransportResponse(statusCode, body, copy);
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isRedirect() {
        return statusCode >= 300 && statusCode < 400;
    }
}
