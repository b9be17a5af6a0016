package com.docs.lookup.fetch;

import com.docs.lookup.core.model.FetchOutcome;
import com.docs.lookup.core.model.ResolutionKey;
import com.docs.lookup.core.model.SymbolCategory;
import com.docs.lookup.resolution.MapSymbolDictionary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class DocumentationLocatorTest {

    private final DocumentationLocator locator = new DocumentationLocator(MapSymbolDictionary.builder()
            .add("class", SymbolCategory.KEYWORD, "/reference/compound_stmts.html#class-definitions")
            .add("os", SymbolCategory.MODULE, "library/os.html")
            .build());

    @Nested
    @DisplayName("Locating pages")
    class LocateTests {

        @Test
        @DisplayName("Should join base URL, version tag and document id")
        void testDictionaryEntry() {
            URI uri = locator.locate(ResolutionKey.of("class", SymbolCategory.KEYWORD, "3.12")).orElseThrow();
            assertEquals("https://docs.python.org/3.12/reference/compound_stmts.html#class-definitions", uri.toString());
        }

        @Test
        @DisplayName("Should include a non-default locale from the version tag")
        void testLocale() {
            URI uri = locator.locate(ResolutionKey.of("os", SymbolCategory.MODULE, "fr/3.11")).orElseThrow();
            assertEquals("https://docs.python.org/fr/3.11/library/os.html", uri.toString());
        }

        @Test
        @DisplayName("Should fall back to the stdtypes anchors for methods")
        void testMethodFallback() {
            assertEquals("https://docs.python.org/3.12/library/stdtypes.html#str.upper",
                    locator.locate(ResolutionKey.of("upper", SymbolCategory.STRING_METHOD, "3.12")).orElseThrow().toString());
            assertEquals("https://docs.python.org/3.12/library/stdtypes.html#frozenset.union",
                    locator.locate(ResolutionKey.of("union", SymbolCategory.SET_METHOD, "3.12")).orElseThrow().toString());
        }

        @Test
        @DisplayName("Should not locate unknown non-method symbols")
        void testUnknown() {
            assertTrue(locator.locate(ResolutionKey.of("frobnicate", SymbolCategory.OTHER, "3.12")).isEmpty());
            assertTrue(locator.locate(ResolutionKey.of("mystery", SymbolCategory.BUILTIN_FUNCTION, "3.12")).isEmpty());
        }
    }

    @Nested
    @DisplayName("Allow-list")
    class AllowListTests {

        @Test
        @DisplayName("Should allow https to listed hosts only")
        void testAllowed() {
            assertTrue(locator.isAllowed(URI.create("https://docs.python.org/3/library/os.html")));
            assertTrue(locator.isAllowed(URI.create("https://DOCS.python.org/3/")));
            assertFalse(locator.isAllowed(URI.create("http://docs.python.org/3/")));
            assertFalse(locator.isAllowed(URI.create("https://docs.python.org.evil.com/3/")));
            assertFalse(locator.isAllowed(URI.create("https://user@docs.python.org/3/")));
            assertFalse(locator.isAllowed(URI.create("file:///etc/passwd")));
            assertFalse(locator.isAllowed(null));
        }
    }

    @Nested
    @DisplayName("Error classification")
    class ClassifierTests {

        @Test
        @DisplayName("Should retry server errors and 429 only")
        void testStatus() {
            assertEquals(FetchOutcome.SUCCESS, ErrorClassifier.classifyStatus(204));
            assertEquals(FetchOutcome.RETRYABLE_FAILURE, ErrorClassifier.classifyStatus(502));
            assertEquals(FetchOutcome.RETRYABLE_FAILURE, ErrorClassifier.classifyStatus(429));
            assertEquals(FetchOutcome.FATAL_FAILURE, ErrorClassifier.classifyStatus(404));
            assertEquals(FetchOutcome.FATAL_FAILURE, ErrorClassifier.classifyStatus(403));
        }

        @Test
        @DisplayName("Should treat every transport failure as transient")
        void testTransport() {
            for (TransportException.Kind kind : TransportException.Kind.values()) {
                TransportException e = new TransportException(kind, "x");
                assertEquals(FetchOutcome.RETRYABLE_FAILURE, ErrorClassifier.classify(e));
                assertEquals(kind == TransportException.Kind.INTERRUPTED, ErrorClassifier.isInterruption(e));
            }
            assertFalse(ErrorClassifier.isInterruption(null));
        }
    }
}
