package com.docs.lookup.resolution;

/**
 * Lexical helpers over a window of source text. Everything here is heuristic:
 * brackets inside string literals are not tracked when scanning backwards.
 */
final class SourceScanner {

    private SourceScanner() {
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    static boolean isIdentifier(String token) {
        if (token.isEmpty() || !isIdentifierStart(token.charAt(0))) {
            return false;
        }
        for (int i = 1; i < token.length(); i++) {
            if (!isIdentifierPart(token.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    /**
     * Index of the last non-blank character strictly before {@code from} on the same line, or -1.
     */
    static int previousNonBlank(CharSequence text, int from) {
        int i = from - 1;
        while (i >= 0) {
            char c = text.charAt(i);
            if (c == '\n') {
                return -1;
            }
            if (c != ' ' && c != '\t') {
                return i;
            }
            i--;
        }
        return -1;
    }

    /**
     * Index of the first non-blank character at or after {@code from} on the same line, or -1.
     */
    static int nextNonBlank(CharSequence text, int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n') {
                return -1;
            }
            if (c != ' ' && c != '\t') {
                return i;
            }
            i++;
        }
        return -1;
    }

    /**
     * Start index of the identifier that ends at {@code end} (exclusive).
     */
    static int identifierStart(CharSequence text, int end) {
        int i = end;
        while (i > 0 && isIdentifierPart(text.charAt(i - 1))) {
            i--;
        }
        return i;
    }

    /**
     * Finds the bracket opening the one closed at {@code closeIndex}, scanning backwards.
     *
     * @return the index of the opening bracket, or -1 if it is outside the text
     */
    static int matchingOpen(CharSequence text, int closeIndex) {
        char close = text.charAt(closeIndex);
        char open = openerFor(close);
        int depth = 0;
        for (int i = closeIndex; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == close) {
                depth++;
            } else if (c == open) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Classifies a brace literal starting at {@code openIndex}: {@code {}} and {@code {k: v}} are dicts,
     * {@code {a, b}} is a set. String literals and nested brackets are skipped.
     *
     * @return true for a dict, false for a set
     */
    static boolean isDictLiteral(CharSequence text, int openIndex) {
        int depth = 0;
        boolean sawContent = false;
        char quote = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (isQuote(c)) {
                quote = c;
                sawContent = true;
            } else if (c == '{' || c == '[' || c == '(') {
                depth++;
                if (depth > 1) {
                    sawContent = true;
                }
            } else if (c == '}' || c == ']' || c == ')') {
                depth--;
                if (depth == 0) {
                    return !sawContent;
                }
            } else if (depth == 1) {
                if (c == ':') {
                    return true;
                }
                if (!Character.isWhitespace(c)) {
                    sawContent = true;
                }
            }
        }
        return !sawContent;
    }

    /**
     * Leading whitespace width of a line, tabs counted as 4 columns; -1 for blank or comment-only lines.
     */
    static int indentation(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += 4;
            } else {
                return c == '#' ? -1 : width;
            }
        }
        return -1;
    }

    private static char openerFor(char close) {
        switch (close) {
            case ')':
                return '(';
            case ']':
                return '[';
            case '}':
                return '{';
            default:
                throw new IllegalArgumentException("Not a closing bracket: " + close);
        }
    }
}
