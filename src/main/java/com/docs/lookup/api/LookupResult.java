package com.docs.lookup.api;

import com.docs.lookup.core.model.DocumentContent;
import com.docs.lookup.core.model.ResolutionKey;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a documentation lookup.
 */
public class LookupResult {

    private final LookupStatus status;
    private final ResolutionKey key;
    private final DocumentContent content;
    private final String contextWarning;
    private final String reason;
    private final FetchError fetchError;
    private final Throwable cause;

    private LookupResult(LookupStatus status, ResolutionKey key, DocumentContent content, String contextWarning,
                         String reason, FetchError fetchError, Throwable cause) {
        this.status = status;
        this.key = key;
        this.content = content;
        this.contextWarning = contextWarning;
        this.reason = reason;
        this.fetchError = fetchError;
        this.cause = cause;
    }

    public static LookupResult found(DocumentContent content, String contextWarning) {
        Objects.requireNonNull(content, "content is required");
        return new LookupResult(LookupStatus.FOUND, content.getKey(), content, contextWarning, null, null, null);
    }

    public static LookupResult unresolvable(String reason) {
        return new LookupResult(LookupStatus.UNRESOLVABLE, null, null, null, reason, null, null);
    }

    public static LookupResult unavailable(ResolutionKey key, FetchError fetchError, String contextWarning) {
        return new LookupResult(LookupStatus.UNAVAILABLE, key, null, contextWarning,
                fetchError.cause(), fetchError, null);
    }

    public static LookupResult cacheError(ResolutionKey key, Throwable cause) {
        return new LookupResult(LookupStatus.CACHE_ERROR, key, null, null,
                String.valueOf(cause.getMessage()), null, cause);
    }

    public LookupStatus getStatus() {
        return status;
    }

    public boolean isFound() {
        return status == LookupStatus.FOUND;
    }

    /**
     * The resolved key; empty only for {@link LookupStatus#UNRESOLVABLE}.
     */
    public Optional<ResolutionKey> getKey() {
        return Optional.ofNullable(key);
    }

    public Optional<DocumentContent> getContent() {
        return Optional.ofNullable(content);
    }

    public Optional<String> getContextWarning() {
        return Optional.ofNullable(contextWarning);
    }

    /**
     * Why no content was returned; empty for {@link LookupStatus#FOUND}.
     */
    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<FetchError> getFetchError() {
        return Optional.ofNullable(fetchError);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return "LookupResult{status=" + status
                + (key != null ? ", key=" + key : "")
                + (content != null && content.isStale() ? ", stale" : "")
                + (reason != null ? ", reason=" + reason : "")
                + "}";
    }
}
