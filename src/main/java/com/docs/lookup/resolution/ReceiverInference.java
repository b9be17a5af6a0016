package com.docs.lookup.resolution;

import com.docs.lookup.core.model.SymbolCategory;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers the static shape of the expression left of a {@code .} from lexical evidence only:
 * the literal itself, the most recent assignment of a literal or constructor call to the receiver
 * name, or a type annotation on it. Also recognises receivers that name imported modules.
 */
final class ReceiverInference {

    private static final Map<String, SymbolCategory> TYPE_NAMES = Map.ofEntries(
            Map.entry("str", SymbolCategory.STRING_METHOD),
            Map.entry("list", SymbolCategory.LIST_METHOD),
            Map.entry("List", SymbolCategory.LIST_METHOD),
            Map.entry("dict", SymbolCategory.DICT_METHOD),
            Map.entry("Dict", SymbolCategory.DICT_METHOD),
            Map.entry("set", SymbolCategory.SET_METHOD),
            Map.entry("Set", SymbolCategory.SET_METHOD),
            Map.entry("frozenset", SymbolCategory.SET_METHOD),
            Map.entry("FrozenSet", SymbolCategory.SET_METHOD));

    private static final Map<String, SymbolCategory> CONSTRUCTORS = Map.of(
            "str", SymbolCategory.STRING_METHOD,
            "repr", SymbolCategory.STRING_METHOD,
            "input", SymbolCategory.STRING_METHOD,
            "list", SymbolCategory.LIST_METHOD,
            "sorted", SymbolCategory.LIST_METHOD,
            "dict", SymbolCategory.DICT_METHOD,
            "set", SymbolCategory.SET_METHOD,
            "frozenset", SymbolCategory.SET_METHOD);

    private static final Pattern STRING_LITERAL_START = Pattern.compile("^[rRbBuUfF]{0,2}['\"]");
    private static final Pattern CALL_START = Pattern.compile("^([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern IMPORT_LINE = Pattern.compile("^\\s*import\\s+(.+)$");
    private static final Pattern FROM_IMPORT_LINE = Pattern.compile("^\\s*from\\s+(\\.*[\\w.]*)\\s+import\\s+\\(?(.+?)\\)?\\s*$");
    private static final Pattern ALIASED_NAME = Pattern.compile("^([\\w.]+)(?:\\s+as\\s+(\\w+))?$");

    private ReceiverInference() {
    }

    /**
     * Shape of the receiver whose {@code .} sits at {@code dotIndex}, if static evidence exists.
     */
    static Optional<SymbolCategory> containerCategory(SourceWindow window, int dotIndex) {
        String text = window.text();
        int end = SourceScanner.previousNonBlank(text, dotIndex);
        if (end < 0) {
            return Optional.empty();
        }
        char last = text.charAt(end);
        if (SourceScanner.isQuote(last)) {
            return Optional.of(SymbolCategory.STRING_METHOD);
        }
        if (last == ']' || last == '}' || last == ')') {
            return bracketedReceiver(text, end);
        }
        if (!SourceScanner.isIdentifierPart(last)) {
            return Optional.empty();
        }
        int start = SourceScanner.identifierStart(text, end + 1);
        String name = text.substring(start, end + 1);
        if (start > 0 && text.charAt(start - 1) == '.') {
            // attribute chains such as self.items carry no evidence we can check lexically
            return Optional.empty();
        }
        if (TYPE_NAMES.containsKey(name) && Character.isLowerCase(name.charAt(0))) {
            return Optional.of(TYPE_NAMES.get(name));
        }
        return evidenceForName(window, name, window.lineStart(start), start);
    }

    /**
     * Module bound to {@code name} by an import statement in the window, e.g. {@code np -> numpy}.
     */
    static Optional<String> importedModule(SourceWindow window, String name) {
        String[] lines = window.previousLines();
        String current = window.linePrefix();
        for (int i = lines.length; i >= 0; i--) {
            String line = i == lines.length ? current : lines[i];
            Optional<String> module = moduleBoundBy(line, name);
            if (module.isPresent()) {
                return module;
            }
        }
        return Optional.empty();
    }

    /**
     * Receiver identifier immediately left of the {@code .} at {@code dotIndex}, if it is a plain name.
     */
    static Optional<String> receiverName(SourceWindow window, int dotIndex) {
        String text = window.text();
        int end = SourceScanner.previousNonBlank(text, dotIndex);
        if (end < 0 || !SourceScanner.isIdentifierPart(text.charAt(end))) {
            return Optional.empty();
        }
        int start = SourceScanner.identifierStart(text, end + 1);
        if (start > 0 && text.charAt(start - 1) == '.') {
            return Optional.empty();
        }
        String name = text.substring(start, end + 1);
        return SourceScanner.isIdentifier(name) ? Optional.of(name) : Optional.empty();
    }

    private static Optional<SymbolCategory> bracketedReceiver(String text, int closeIndex) {
        int open = SourceScanner.matchingOpen(text, closeIndex);
        if (open < 0) {
            return Optional.empty();
        }
        int before = SourceScanner.previousNonBlank(text, open);
        char close = text.charAt(closeIndex);
        if (close == ')') {
            // str(x).upper(), list(range(3)).count(...)
            if (before < 0 || !SourceScanner.isIdentifierPart(text.charAt(before))) {
                return Optional.empty();
            }
            String callee = text.substring(SourceScanner.identifierStart(text, before + 1), before + 1);
            return Optional.ofNullable(CONSTRUCTORS.get(callee));
        }
        boolean subscriptOrCall = before >= 0 && (text.charAt(before) == ')' || text.charAt(before) == ']');
        if (before >= 0 && SourceScanner.isIdentifierPart(text.charAt(before))) {
            String word = text.substring(SourceScanner.identifierStart(text, before + 1), before + 1);
            subscriptOrCall = !ReservedWords.isReserved(word);
        }
        if (subscriptOrCall && close == ']') {
            return Optional.empty();
        }
        if (close == ']') {
            return Optional.of(SymbolCategory.LIST_METHOD);
        }
        return Optional.of(SourceScanner.isDictLiteral(text, open)
                ? SymbolCategory.DICT_METHOD : SymbolCategory.SET_METHOD);
    }

    /**
     * Walks backwards from the receiver towards the window start; the most recent assignment or
     * annotation of {@code name} decides.
     */
    private static Optional<SymbolCategory> evidenceForName(SourceWindow window, String name,
                                                           int receiverLineStart, int receiverStart) {
        String text = window.text();
        Pattern annotation = Pattern.compile("(?<![\\w.])" + Pattern.quote(name)
                + "\\s*:\\s*(?:typing\\.)?([A-Za-z_]\\w*)(?=\\s*(?:$|[=,)\\[|#]))");
        Pattern assignment = Pattern.compile("(?<![\\w.])" + Pattern.quote(name)
                + "\\s*(?::[^=\\n]*)?=(?!=)\\s*");

        int lineEnd = receiverStart;
        int lineStart = receiverLineStart;
        while (true) {
            String line = text.substring(lineStart, lineEnd);
            Evidence evidence = lastEvidence(line, lineStart, text, annotation, assignment);
            if (evidence != null) {
                return Optional.ofNullable(evidence.category());
            }
            if (lineStart == 0) {
                return Optional.empty();
            }
            lineEnd = lineStart - 1;
            lineStart = window.lineStart(lineEnd);
        }
    }

    private static Evidence lastEvidence(String line, int lineOffset, String text,
                                         Pattern annotation, Pattern assignment) {
        Evidence found = null;
        int foundAt = -1;
        Matcher ann = annotation.matcher(line);
        while (ann.find()) {
            foundAt = ann.start();
            found = new Evidence(TYPE_NAMES.get(ann.group(1)));
        }
        Matcher assign = assignment.matcher(line);
        while (assign.find()) {
            if (assign.start() >= foundAt) {
                SymbolCategory value = classifyValue(text, lineOffset + assign.end());
                // "x: list[int] = load()" keeps the annotation of the same target
                if (value != null || assign.start() > foundAt) {
                    foundAt = assign.start();
                    found = new Evidence(value);
                }
            }
        }
        return found;
    }

    private static SymbolCategory classifyValue(String text, int valueStart) {
        if (valueStart >= text.length()) {
            return null;
        }
        String rest = text.substring(valueStart, Math.min(text.length(), valueStart + 256));
        if (STRING_LITERAL_START.matcher(rest).find()) {
            return SymbolCategory.STRING_METHOD;
        }
        char first = rest.charAt(0);
        if (first == '[') {
            return SymbolCategory.LIST_METHOD;
        }
        if (first == '{') {
            return SourceScanner.isDictLiteral(text, valueStart)
                    ? SymbolCategory.DICT_METHOD : SymbolCategory.SET_METHOD;
        }
        Matcher call = CALL_START.matcher(rest);
        if (call.find()) {
            return CONSTRUCTORS.get(call.group(1));
        }
        return null;
    }

    private static Optional<String> moduleBoundBy(String line, String name) {
        Matcher from = FROM_IMPORT_LINE.matcher(line);
        if (from.matches()) {
            String module = stripRelative(from.group(1));
            for (String part : from.group(2).split(",")) {
                Matcher alias = ALIASED_NAME.matcher(part.trim());
                if (alias.matches()) {
                    String bound = alias.group(2) != null ? alias.group(2) : alias.group(1);
                    if (bound.equals(name)) {
                        return Optional.of(module.isEmpty() ? alias.group(1) : module + "." + alias.group(1));
                    }
                }
            }
            return Optional.empty();
        }
        Matcher imp = IMPORT_LINE.matcher(line);
        if (imp.matches()) {
            for (String part : imp.group(1).split(",")) {
                Matcher alias = ALIASED_NAME.matcher(part.trim());
                if (!alias.matches()) {
                    continue;
                }
                String module = alias.group(1);
                if (alias.group(2) != null) {
                    if (alias.group(2).equals(name)) {
                        return Optional.of(module);
                    }
                } else {
                    // "import os.path" binds the top-level name "os"
                    int dot = module.indexOf('.');
                    String bound = dot < 0 ? module : module.substring(0, dot);
                    if (bound.equals(name)) {
                        return Optional.of(bound);
                    }
                }
            }
        }
        return Optional.empty();
    }

    static String stripRelative(String module) {
        int i = 0;
        while (i < module.length() && module.charAt(i) == '.') {
            i++;
        }
        return module.substring(i);
    }

    /**
     * A matched assignment or annotation; a null category means "assigned something we cannot classify".
     */
    private record Evidence(SymbolCategory category) {}
}
