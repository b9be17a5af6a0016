package com.docs.lookup.resolution;

import com.docs.lookup.core.model.ResolutionKey;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link ContextResolver#resolve}: either a resolved key, possibly carrying a
 * context warning for the host to surface, or a not-resolvable marker with a reason.
 * Not being resolvable is a normal outcome, not an error.
 */
public final class Resolution {

    public static final String AWAIT_OUTSIDE_ASYNC = "await outside async";

    private final ResolutionKey key;
    private final String contextWarning;
    private final String reason;

    private Resolution(ResolutionKey key, String contextWarning, String reason) {
        this.key = key;
        this.contextWarning = contextWarning;
        this.reason = reason;
    }

    public static Resolution resolved(ResolutionKey key) {
        return new Resolution(Objects.requireNonNull(key, "key is required"), null, null);
    }

    public static Resolution resolved(ResolutionKey key, String contextWarning) {
        return new Resolution(Objects.requireNonNull(key, "key is required"), contextWarning, null);
    }

    public static Resolution notResolvable(String reason) {
        return new Resolution(null, null, Objects.requireNonNull(reason, "reason is required"));
    }

    public boolean isResolved() {
        return key != null;
    }

    public Optional<ResolutionKey> getKey() {
        return Optional.ofNullable(key);
    }

    public Optional<String> getContextWarning() {
        return Optional.ofNullable(contextWarning);
    }

    /**
     * Why the token could not be resolved; empty for resolved outcomes.
     */
    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        if (key == null) {
            return "Resolution{notResolvable, reason=" + reason + "}";
        }
        return "Resolution{key=" + key + (contextWarning != null ? ", warning=" + contextWarning : "") + "}";
    }
}
