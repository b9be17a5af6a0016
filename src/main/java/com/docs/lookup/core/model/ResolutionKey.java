package com.docs.lookup.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Disambiguated identity of a looked-up symbol: name, category and documentation version tag.
 * Two keys are equal iff all three fields match.
 *
 * @param symbol     the symbol text, e.g. {@code upper} or {@code os.path}
 * @param category   the resolved category
 * @param versionTag the documentation source version; changing it invalidates entries en masse
 */
public record ResolutionKey(String symbol, SymbolCategory category, String versionTag) {

    private static final char SEPARATOR = '|';

    public ResolutionKey {
        Objects.requireNonNull(symbol, "symbol is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(versionTag, "versionTag is required");
        if (symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        if (versionTag.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("versionTag must not contain '" + SEPARATOR + "'");
        }
    }

    public static ResolutionKey of(String symbol, SymbolCategory category, String versionTag) {
        return new ResolutionKey(symbol, category, versionTag);
    }

    /**
     * Stable textual form used as the persisted-tier key: {@code versionTag|CATEGORY|symbol}.
     */
    public String storageKey() {
        return versionTag + SEPARATOR + category.name() + SEPARATOR + symbol;
    }

    public byte[] storageKeyBytes() {
        return storageKey().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parses the output of {@link #storageKey()}.
     *
     * @throws IllegalArgumentException if the text is not a storage key
     */
    public static ResolutionKey fromStorageKey(String storageKey) {
        int first = storageKey.indexOf(SEPARATOR);
        int second = first < 0 ? -1 : storageKey.indexOf(SEPARATOR, first + 1);
        if (first < 0 || second < 0) {
            throw new IllegalArgumentException("Not a storage key: " + storageKey);
        }
        return new ResolutionKey(
                storageKey.substring(second + 1),
                SymbolCategory.valueOf(storageKey.substring(first + 1, second)),
                storageKey.substring(0, first));
    }

    /**
     * Returns true if the given persisted-tier key belongs to {@code versionTag}.
     */
    public static boolean storageKeyHasVersion(byte[] storageKey, String versionTag) {
        String prefix = versionTag + SEPARATOR;
        return new String(storageKey, StandardCharsets.UTF_8).startsWith(prefix);
    }

    @Override
    public String toString() {
        return category.name() + ":" + symbol + "@" + versionTag;
    }
}
