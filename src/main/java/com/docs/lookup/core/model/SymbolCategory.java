package com.docs.lookup.core.model;

/**
 * Disambiguating category of a looked-up symbol.
 * Two tokens with the same text but different categories point at different documentation entries.
 */
public enum SymbolCategory {
    KEYWORD("Keyword"),
    BUILTIN_FUNCTION("Built-in function"),
    STRING_METHOD("String method"),
    LIST_METHOD("List method"),
    DICT_METHOD("Dict method"),
    SET_METHOD("Set method"),
    MODULE("Module"),
    OTHER("Other");

    private final String label;

    SymbolCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns true for the categories that describe a method on a built-in container type.
     */
    public boolean isMethod() {
        return this == STRING_METHOD || this == LIST_METHOD || this == DICT_METHOD || this == SET_METHOD;
    }
}
