package com.docs.lookup.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * {@link TransportAdapter} over the JDK {@link HttpClient}. Redirects are not followed here;
 * the fetcher follows them itself so every hop passes the host allow-list.
 *
 * <pre>
 * TransportAdapter transport = JdkHttpTransportAdapter.builder()
 *     .connectTimeout(Duration.ofSeconds(5))
 *     .build();
 * </pre>
 */
public class JdkHttpTransportAdapter implements TransportAdapter {
    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransportAdapter.class);

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient httpClient;

    private JdkHttpTransportAdapter(Builder builder) {
        Duration connectTimeout = builder.connectTimeout != null ? builder.connectTimeout : DEFAULT_CONNECT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public TransportResponse request(URI uri, Map<String, String> headers, Duration timeout) {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET();
        headers.forEach(request::header);

        try {
            HttpResponse<byte[]> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
            log.debug("transport.response uri={} status={} bytes={}",
                    uri, response.statusCode(), response.body() == null ? 0 : response.body().length);
            return new TransportResponse(response.statusCode(), response.body(), response.headers().map());
        } catch (HttpConnectTimeoutException e) {
            throw new TransportException(TransportException.Kind.TIMEOUT, "Connect timed out: " + uri, e);
        } catch (HttpTimeoutException e) {
            throw new TransportException(TransportException.Kind.TIMEOUT, "Request timed out after " + timeout.toMillis() + "ms: " + uri, e);
        } catch (UnknownHostException | UnresolvedAddressException e) {
            throw new TransportException(TransportException.Kind.DNS, "Cannot resolve host: " + uri.getHost(), e);
        } catch (ConnectException e) {
            if (e.getCause() instanceof UnresolvedAddressException) {
                throw new TransportException(TransportException.Kind.DNS, "Cannot resolve host: " + uri.getHost(), e);
            }
            throw new TransportException(TransportException.Kind.CONNECT, "Connection failed: " + uri, e);
        } catch (IOException e) {
            String message = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
            TransportException.Kind kind = message.contains("reset") || message.contains("closed")
                    ? TransportException.Kind.RESET : TransportException.Kind.IO;
            throw new TransportException(kind, "I/O error fetching " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportException.Kind.INTERRUPTED, "Interrupted while fetching " + uri, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static JdkHttpTransportAdapter createDefault() {
        return builder().build();
    }

    public static class Builder {
        private Duration connectTimeout;

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public JdkHttpTransportAdapter build() {
            return new JdkHttpTransportAdapter(this);
        }
    }
}
