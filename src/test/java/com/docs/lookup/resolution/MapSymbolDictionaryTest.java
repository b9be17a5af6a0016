package com.docs.lookup.resolution;

import com.docs.lookup.core.model.SymbolCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MapSymbolDictionaryTest {

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should look up document ids by symbol and category")
    void testLookup() {
        MapSymbolDictionary dictionary = MapSymbolDictionary.builder()
                .add("len", SymbolCategory.BUILTIN_FUNCTION, "library/functions.html#len")
                .add("count", SymbolCategory.STRING_METHOD, "library/stdtypes.html#str.count")
                .build();

        assertEquals("library/functions.html#len",
                dictionary.documentId("len", SymbolCategory.BUILTIN_FUNCTION).orElseThrow());
        assertTrue(dictionary.contains("count", SymbolCategory.STRING_METHOD));
        assertFalse(dictionary.contains("count", SymbolCategory.LIST_METHOD));
        assertTrue(dictionary.documentId(null, SymbolCategory.OTHER).isEmpty());
        assertEquals(2, dictionary.size());
    }

    @Test
    @DisplayName("Should load the grouped JSON form")
    void testFromJson() throws IOException {
        MapSymbolDictionary dictionary = MapSymbolDictionary.fromJson(json(
                "{\"KEYWORD\": {\"class\": \"reference/compound_stmts.html#class\"},"
                        + " \"MODULE\": {\"os\": \"library/os.html\", \"sys\": \"library/sys.html\"}}"));

        assertEquals(3, dictionary.size());
        assertTrue(dictionary.contains("class", SymbolCategory.KEYWORD));
        assertEquals("library/sys.html", dictionary.documentId("sys", SymbolCategory.MODULE).orElseThrow());
    }

    @Test
    @DisplayName("Should reject unknown categories and malformed JSON")
    void testFromJsonErrors() {
        assertThrows(IOException.class, () -> MapSymbolDictionary.fromJson(json("{\"GADGET\": {\"x\": \"y\"}}")));
        assertThrows(IOException.class, () -> MapSymbolDictionary.fromJson(json("{not json")));
    }

    @Test
    @DisplayName("Should load the bundled symbol table")
    void testBundledTable() throws IOException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("docs-lookup/python-symbols.json")) {
            assertNotNull(in);
            MapSymbolDictionary dictionary = MapSymbolDictionary.fromJson(in);

            assertTrue(dictionary.contains("len", SymbolCategory.BUILTIN_FUNCTION));
            assertTrue(dictionary.contains("await", SymbolCategory.KEYWORD));
            assertTrue(dictionary.contains("upper", SymbolCategory.STRING_METHOD));
        }
    }

    @Test
    @DisplayName("Should recognise hard and soft keywords only")
    void testReservedWords() {
        assertTrue(ReservedWords.isReserved("class"));
        assertTrue(ReservedWords.isReserved("match"));
        assertTrue(ReservedWords.isSoftKeyword("_"));
        assertFalse(ReservedWords.isSoftKeyword("class"));
        assertFalse(ReservedWords.isReserved("print"));
        assertFalse(ReservedWords.isReserved("Class"));
    }
}
