package com.docs.lookup.resolution;

import com.docs.lookup.core.model.ResolutionKey;
import com.docs.lookup.core.model.SymbolCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides which documentation entry a token under the cursor refers to, using only a bounded
 * window of the surrounding source text.
 *
 * <p>Rules, in strict priority order:</p>
 * <ol>
 *   <li>Token preceded by {@code .} whose receiver is statically a string, list, dict or set
 *       (literal, prior literal assignment, constructor call, or annotation): the matching method
 *       category. A dotted token is never classified as a keyword.</li>
 *   <li>Reserved word: {@link SymbolCategory#KEYWORD}. {@code await} outside an {@code async def}
 *       is still a keyword but carries the {@value Resolution#AWAIT_OUTSIDE_ASYNC} warning.</li>
 *   <li>Token followed by {@code (}: {@link SymbolCategory#BUILTIN_FUNCTION} if the dictionary knows it,
 *       otherwise not resolvable.</li>
 *   <li>Token in an {@code import} or {@code from} statement: {@link SymbolCategory#MODULE}.</li>
 *   <li>{@link SymbolCategory#OTHER} if the dictionary knows the token, otherwise not resolvable.</li>
 * </ol>
 *
 * <p>Resolution is pure: no I/O, no shared mutable state, safe to call from any thread.</p>
 */
public class ContextResolver {
    private static final Logger log = LoggerFactory.getLogger(ContextResolver.class);

    public static final int DEFAULT_MAX_LINES = 200;
    public static final int DEFAULT_MAX_CHARS = 8 * 1024;
    static final int MAX_TOKEN_LENGTH = 100;
    private static final char LINE_SEPARATOR = (char) 0x2028;
    private static final char PARAGRAPH_SEPARATOR = (char) 0x2029;

    private static final Pattern IMPORT_PREFIX =
            Pattern.compile("^\\s*import\\s+(?:[\\w.]+(?:\\s+as\\s+\\w+)?\\s*,\\s*)*([\\w.]*)$");
    private static final Pattern FROM_MODULE_PREFIX = Pattern.compile("^\\s*from\\s+(\\.*[\\w.]*)$");
    private static final Pattern FROM_NAME_PREFIX = Pattern.compile(
            "^\\s*from\\s+(\\.*[\\w.]*)\\s+import\\s+\\(?\\s*(?:\\w+(?:\\s+as\\s+\\w+)?\\s*,\\s*)*$");
    private static final Pattern ASYNC_DEF = Pattern.compile("^\\s*async\\s+def\\b");
    private static final Pattern DEF = Pattern.compile("^\\s*def\\b");
    private static final Pattern CLASS = Pattern.compile("^\\s*class\\b");

    private final SymbolDictionary dictionary;
    private final String versionTag;
    private final int maxLines;
    private final int maxChars;

    public ContextResolver(SymbolDictionary dictionary, String versionTag) {
        this(dictionary, versionTag, DEFAULT_MAX_LINES, DEFAULT_MAX_CHARS);
    }

    public ContextResolver(SymbolDictionary dictionary, String versionTag, int maxLines, int maxChars) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary is required");
        this.versionTag = Objects.requireNonNull(versionTag, "versionTag is required");
        if (maxLines <= 0 || maxChars <= 0) {
            throw new IllegalArgumentException("window bounds must be > 0");
        }
        this.maxLines = maxLines;
        this.maxChars = maxChars;
    }

    /**
     * Resolves {@code rawToken}, located at {@code cursorOffset} in {@code sourceText}, to a key.
     * Never throws for bad input; such input is reported as not resolvable.
     */
    public Resolution resolve(String sourceText, int cursorOffset, String rawToken) {
        if (sourceText == null || rawToken == null) {
            return Resolution.notResolvable("missing source text or token");
        }
        String token = sanitize(rawToken);
        if (!SourceScanner.isIdentifier(token)) {
            return Resolution.notResolvable("not an identifier: " + token);
        }
        if (cursorOffset < 0 || cursorOffset > sourceText.length()) {
            return Resolution.notResolvable("cursor offset out of range");
        }
        int tokenStart = locateToken(sourceText, cursorOffset, token);
        if (tokenStart < 0) {
            return Resolution.notResolvable("token not found at cursor");
        }

        SourceWindow window = SourceWindow.around(sourceText, tokenStart, token.length(), maxLines, maxChars);
        Resolution resolution = classify(window, token);
        log.debug("resolver.classified token={} result={}", token, resolution);
        return resolution;
    }

    public String getVersionTag() {
        return versionTag;
    }

    private Resolution classify(SourceWindow window, String token) {
        String text = window.text();
        int before = SourceScanner.previousNonBlank(text, window.tokenStart());
        boolean dotted = before >= 0 && text.charAt(before) == '.';

        if (dotted) {
            return classifyAttribute(window, token, before);
        }

        if (ReservedWords.isReserved(token)) {
            if ("await".equals(token) && !insideAsyncFunction(window)) {
                return Resolution.resolved(key(token, SymbolCategory.KEYWORD), Resolution.AWAIT_OUTSIDE_ASYNC);
            }
            return Resolution.resolved(key(token, SymbolCategory.KEYWORD));
        }

        int after = SourceScanner.nextNonBlank(text, window.tokenEnd());
        if (after >= 0 && text.charAt(after) == '(') {
            if (dictionary.contains(token, SymbolCategory.BUILTIN_FUNCTION)) {
                return Resolution.resolved(key(token, SymbolCategory.BUILTIN_FUNCTION));
            }
            return Resolution.notResolvable("call of unknown function: " + token);
        }

        Optional<String> module = importedModulePath(window.linePrefix(), token);
        if (module.isPresent()) {
            return Resolution.resolved(key(module.get(), SymbolCategory.MODULE));
        }

        if (dictionary.contains(token, SymbolCategory.OTHER)) {
            return Resolution.resolved(key(token, SymbolCategory.OTHER));
        }
        return Resolution.notResolvable("unknown symbol: " + token);
    }

    private Resolution classifyAttribute(SourceWindow window, String token, int dotIndex) {
        // "import os.path": a dotted module path, not attribute access
        Optional<String> modulePath = importedModulePath(window.linePrefix(), token);
        if (modulePath.isPresent()) {
            return Resolution.resolved(key(modulePath.get(), SymbolCategory.MODULE));
        }

        Optional<SymbolCategory> container = ReceiverInference.containerCategory(window, dotIndex);
        if (container.isPresent()) {
            return Resolution.resolved(key(token, container.get()));
        }

        Optional<String> receiver = ReceiverInference.receiverName(window, dotIndex);
        if (receiver.isPresent()) {
            Optional<String> module = ReceiverInference.importedModule(window, receiver.get());
            if (module.isPresent()) {
                String qualified = module.get() + "." + token;
                if (dictionary.contains(qualified, SymbolCategory.OTHER)) {
                    return Resolution.resolved(key(qualified, SymbolCategory.OTHER));
                }
            }
        }

        if (dictionary.contains(token, SymbolCategory.OTHER)) {
            return Resolution.resolved(key(token, SymbolCategory.OTHER));
        }
        return Resolution.notResolvable("attribute without static receiver evidence: " + token);
    }

    /**
     * Full dotted module name when the token sits in an import statement, e.g.
     * {@code import os.pa|th -> os.path}, {@code from collections import Ord|eredDict -> collections.OrderedDict}.
     */
    static Optional<String> importedModulePath(String linePrefix, String token) {
        Matcher imp = IMPORT_PREFIX.matcher(linePrefix);
        if (imp.matches()) {
            return Optional.of(imp.group(1) + token);
        }
        Matcher fromModule = FROM_MODULE_PREFIX.matcher(linePrefix);
        if (fromModule.matches()) {
            String module = ReceiverInference.stripRelative(fromModule.group(1) + token);
            return module.isEmpty() ? Optional.empty() : Optional.of(module);
        }
        Matcher fromName = FROM_NAME_PREFIX.matcher(linePrefix);
        if (fromName.matches()) {
            String module = ReceiverInference.stripRelative(fromName.group(1));
            return Optional.of(module.isEmpty() ? token : module + "." + token);
        }
        return Optional.empty();
    }

    /**
     * Walks outwards through enclosing blocks by indentation until a function or class boundary.
     */
    static boolean insideAsyncFunction(SourceWindow window) {
        String prefix = window.linePrefix();
        if (ASYNC_DEF.matcher(prefix).find()) {
            return true;
        }
        if (DEF.matcher(prefix).find()) {
            return false;
        }
        int indent = SourceScanner.indentation(prefix + "x");
        String[] lines = window.previousLines();
        for (int i = lines.length - 1; i >= 0 && indent > 0; i--) {
            String line = lines[i];
            int lineIndent = SourceScanner.indentation(line);
            if (lineIndent < 0 || lineIndent >= indent) {
                continue;
            }
            if (ASYNC_DEF.matcher(line).find()) {
                return true;
            }
            if (DEF.matcher(line).find() || CLASS.matcher(line).find()) {
                return false;
            }
            indent = lineIndent;
        }
        return false;
    }

    static String sanitize(String rawToken) {
        StringBuilder cleaned = new StringBuilder(Math.min(rawToken.length(), MAX_TOKEN_LENGTH));
        for (int i = 0; i < rawToken.length() && cleaned.length() < MAX_TOKEN_LENGTH; i++) {
            char c = rawToken.charAt(i);
            if (!Character.isISOControl(c) && c != LINE_SEPARATOR && c != PARAGRAPH_SEPARATOR) {
                cleaned.append(c);
            }
        }
        return cleaned.toString().trim();
    }

    private static int locateToken(String source, int cursor, String token) {
        int first = Math.max(0, cursor - token.length());
        int last = Math.min(cursor, source.length() - token.length());
        for (int start = first; start <= last; start++) {
            if (!source.startsWith(token, start)) {
                continue;
            }
            int end = start + token.length();
            boolean leftBoundary = start == 0 || !SourceScanner.isIdentifierPart(source.charAt(start - 1));
            boolean rightBoundary = end == source.length() || !SourceScanner.isIdentifierPart(source.charAt(end));
            if (leftBoundary && rightBoundary) {
                return start;
            }
        }
        return -1;
    }

    private ResolutionKey key(String symbol, SymbolCategory category) {
        return new ResolutionKey(symbol, category, versionTag);
    }
}
