package com.docs.lookup.resolution;

/**
 * Bounded slice of a source file around a located token: at most {@code maxLines} lines and
 * {@code maxChars} characters before the token, and the rest of the token's line after it.
 */
final class SourceWindow {

    private final String text;
    private final int tokenStart;
    private final int tokenEnd;

    private SourceWindow(String text, int tokenStart, int tokenEnd) {
        this.text = text;
        this.tokenStart = tokenStart;
        this.tokenEnd = tokenEnd;
    }

    static SourceWindow around(String source, int tokenStart, int tokenLength, int maxLines, int maxChars) {
        int start = tokenStart;
        int lines = 0;
        while (start > 0 && tokenStart - start < maxChars) {
            if (source.charAt(start - 1) == '\n') {
                lines++;
                if (lines > maxLines) {
                    break;
                }
            }
            start--;
        }
        int end = source.indexOf('\n', tokenStart + tokenLength);
        if (end < 0) {
            end = source.length();
        }
        return new SourceWindow(source.substring(start, end), tokenStart - start, tokenStart - start + tokenLength);
    }

    String text() {
        return text;
    }

    int tokenStart() {
        return tokenStart;
    }

    int tokenEnd() {
        return tokenEnd;
    }

    /**
     * Text of the token's line before the token.
     */
    String linePrefix() {
        return text.substring(lineStart(tokenStart), tokenStart);
    }

    /**
     * Text of the token's line after the token.
     */
    String lineSuffix() {
        return text.substring(tokenEnd);
    }

    int lineStart(int index) {
        int newline = text.lastIndexOf('\n', index - 1);
        return newline + 1;
    }

    /**
     * Complete lines of the window that precede the token's line, oldest first. The first line may be
     * partial when the window was cut by the character budget.
     */
    String[] previousLines() {
        int currentLineStart = lineStart(tokenStart);
        if (currentLineStart == 0) {
            return new String[0];
        }
        return text.substring(0, currentLineStart - 1).split("\n", -1);
    }
}
