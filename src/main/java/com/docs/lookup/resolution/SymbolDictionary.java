package com.docs.lookup.resolution;

import com.docs.lookup.core.model.SymbolCategory;

import java.util.Optional;

/**
 * Read-only mapping from {@code (symbol, category)} to a canonical documentation identifier,
 * e.g. {@code ("len", BUILTIN_FUNCTION) -> "library/functions.html#len"}.
 * Supplied by the host at startup and never mutated by the lookup core.
 */
public interface SymbolDictionary {

    Optional<String> documentId(String symbol, SymbolCategory category);

    default boolean contains(String symbol, SymbolCategory category) {
        return documentId(symbol, category).isPresent();
    }

    int size();
}
