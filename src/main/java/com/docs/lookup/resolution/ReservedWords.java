package com.docs.lookup.resolution;

import java.util.Set;

/**
 * Python 3 reserved words, including the soft keywords {@code match}, {@code case},
 * {@code type} and {@code _}.
 */
public final class ReservedWords {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await",
            "break", "class", "continue", "def", "del", "elif", "else", "except",
            "finally", "for", "from", "global", "if", "import", "in", "is",
            "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
            "while", "with", "yield");

    private static final Set<String> SOFT_KEYWORDS = Set.of("match", "case", "type", "_");

    private ReservedWords() {
    }

    public static boolean isReserved(String token) {
        return KEYWORDS.contains(token) || SOFT_KEYWORDS.contains(token);
    }

    public static boolean isSoftKeyword(String token) {
        return SOFT_KEYWORDS.contains(token);
    }
}
