package com.docs.lookup.warm;

import com.docs.lookup.core.model.ResolutionKey;
import com.docs.lookup.core.model.SymbolCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Default key sets for cache warming.
 */
public final class WarmKeys {

    static final List<String> FREQUENT_KEYWORDS = List.of(
            "class", "def", "if", "for", "while", "try", "except", "import", "from", "with", "async", "await");

    static final List<String> FREQUENT_BUILTINS = List.of(
            "str", "list", "dict", "tuple", "set", "int", "float", "bool", "len", "print", "range");

    private WarmKeys() {
    }

    /**
     * The most frequently looked-up keywords and built-ins for one documentation version.
     */
    public static List<ResolutionKey> frequentlyUsed(String versionTag) {
        List<ResolutionKey> keys = new ArrayList<>(FREQUENT_KEYWORDS.size() + FREQUENT_BUILTINS.size());
        for (String keyword : FREQUENT_KEYWORDS) {
            keys.add(ResolutionKey.of(keyword, SymbolCategory.KEYWORD, versionTag));
        }
        for (String builtin : FREQUENT_BUILTINS) {
            keys.add(ResolutionKey.of(builtin, SymbolCategory.BUILTIN_FUNCTION, versionTag));
        }
        return List.copyOf(keys);
    }
}
