package com.docs.lookup.resolution;

import com.docs.lookup.core.model.SymbolCategory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable {@link SymbolDictionary} backed by a map.
 *
 * <p>The JSON form read by {@link #fromJson(InputStream)} groups entries by category:</p>
 * <pre>
 * {
 *   "BUILTIN_FUNCTION": { "len": "library/functions.html#len" },
 *   "KEYWORD":          { "class": "reference/compound_stmts.html#class" }
 * }
 * </pre>
 */
public final class MapSymbolDictionary implements SymbolDictionary {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<Entry, String> documents;

    private MapSymbolDictionary(Map<Entry, String> documents) {
        this.documents = Collections.unmodifiableMap(new HashMap<>(documents));
    }

    @Override
    public Optional<String> documentId(String symbol, SymbolCategory category) {
        if (symbol == null || category == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(new Entry(symbol, category)));
    }

    @Override
    public int size() {
        return documents.size();
    }

    public static MapSymbolDictionary empty() {
        return new MapSymbolDictionary(Map.of());
    }

    /**
     * Loads a dictionary from its JSON form.
     *
     * @throws IOException if the stream is not valid JSON or names an unknown category
     */
    public static MapSymbolDictionary fromJson(InputStream json) throws IOException {
        Map<String, Map<String, String>> raw = MAPPER.readValue(json, new TypeReference<>() {});
        Builder builder = builder();
        for (Map.Entry<String, Map<String, String>> group : raw.entrySet()) {
            SymbolCategory category;
            try {
                category = SymbolCategory.valueOf(group.getKey());
            } catch (IllegalArgumentException e) {
                throw new IOException("Unknown symbol category: " + group.getKey(), e);
            }
            group.getValue().forEach((symbol, docId) -> builder.add(symbol, category, docId));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<Entry, String> documents = new HashMap<>();

        public Builder add(String symbol, SymbolCategory category, String documentId) {
            Objects.requireNonNull(symbol, "symbol is required");
            Objects.requireNonNull(category, "category is required");
            Objects.requireNonNull(documentId, "documentId is required");
            documents.put(new Entry(symbol, category), documentId);
            return this;
        }

        public MapSymbolDictionary build() {
            return new MapSymbolDictionary(documents);
        }
    }

    private record Entry(String symbol, SymbolCategory category) {}
}
