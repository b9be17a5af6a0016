package com.docs.lookup.logging;

import com.docs.lookup.core.model.ResolutionKey;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forLookup(correlationId, "upper")) {
 *     log.info("lookup.resolved key={}", key);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final List<String> previousValues = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a lookup request.
     */
    public static LogContext forLookup(String correlationId, String rawToken) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("token", rawToken);
        ctx.put("operation", "lookup");
        return ctx;
    }

    /**
     * Creates a log context for a network fetch of one key.
     */
    public static LogContext forFetch(ResolutionKey key) {
        LogContext ctx = new LogContext();
        ctx.put("symbol", key.symbol());
        ctx.put("category", key.category().name());
        ctx.put("versionTag", key.versionTag());
        ctx.put("operation", "fetch");
        return ctx;
    }

    /**
     * Creates a log context for a cache warming run.
     */
    public static LogContext forWarm(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("warmRunId", runId);
        ctx.put("operation", "warm");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        // fetches run nested inside lookups on the same thread; restore the outer value on close
        previousValues.add(MDC.get(key));
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String previous = previousValues.get(i);
            if (previous == null) {
                MDC.remove(keys.get(i));
            } else {
                MDC.put(keys.get(i), previous);
            }
        }
        keys.clear();
        previousValues.clear();
    }
}
