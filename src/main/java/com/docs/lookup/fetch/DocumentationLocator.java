package com.docs.lookup.fetch;

import com.docs.lookup.core.model.ResolutionKey;
import com.docs.lookup.core.model.SymbolCategory;
import com.docs.lookup.resolution.SymbolDictionary;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a {@link ResolutionKey} to the URL of its documentation page and decides which
 * URLs may be requested at all.
 *
 * <p>URLs have the form {@code baseUrl/{versionTag}/{documentId}}, where the version tag already
 * carries a non-default locale ({@code fr/3.12}). Method keys without a dictionary entry use the
 * {@code library/stdtypes.html#str.upper} anchor convention.</p>
 */
public class DocumentationLocator {

    public static final URI DEFAULT_BASE_URL = URI.create("https://docs.python.org");
    public static final Set<String> DEFAULT_ALLOWED_HOSTS = Set.of("docs.python.org", "www.python.org");

    private static final String STDTYPES_PAGE = "library/stdtypes.html#";

    private final SymbolDictionary dictionary;
    private final URI baseUrl;
    private final Set<String> allowedHosts;

    public DocumentationLocator(SymbolDictionary dictionary) {
        this(dictionary, DEFAULT_BASE_URL, DEFAULT_ALLOWED_HOSTS);
    }

    public DocumentationLocator(SymbolDictionary dictionary, URI baseUrl, Set<String> allowedHosts) {
        this.dictionary = dictionary;
        this.baseUrl = baseUrl;
        this.allowedHosts = Set.copyOf(allowedHosts);
    }

    /**
     * Returns the documentation URL for {@code key}, or empty if no page is known for it.
     */
    public Optional<URI> locate(ResolutionKey key) {
        return documentPath(key).map(path -> {
            String base = baseUrl.toString();
            if (!base.endsWith("/")) {
                base = base + "/";
            }
            return URI.create(base + key.versionTag() + "/" + path);
        });
    }

    private Optional<String> documentPath(ResolutionKey key) {
        Optional<String> fromDictionary = dictionary.documentId(key.symbol(), key.category());
        if (fromDictionary.isPresent()) {
            return fromDictionary.map(id -> id.startsWith("/") ? id.substring(1) : id);
        }
        String receiver = receiverType(key.category());
        if (receiver == null || !isPlainName(key.symbol())) {
            return Optional.empty();
        }
        return Optional.of(STDTYPES_PAGE + receiver + "." + key.symbol());
    }

    private static String receiverType(SymbolCategory category) {
        return switch (category) {
            case STRING_METHOD -> "str";
            case LIST_METHOD -> "list";
            case DICT_METHOD -> "dict";
            // set methods are documented under frozenset
            case SET_METHOD -> "frozenset";
            default -> null;
        };
    }

    private static boolean isPlainName(String symbol) {
        for (int i = 0; i < symbol.length(); i++) {
            char c = symbol.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_')) {
                return false;
            }
        }
        return !symbol.isEmpty();
    }

    /**
     * Only {@code https} URLs to an allow-listed host may be requested.
     */
    public boolean isAllowed(URI uri) {
        if (uri == null || uri.getHost() == null) {
            return false;
        }
        return "https".equalsIgnoreCase(uri.getScheme())
                && uri.getUserInfo() == null
                && allowedHosts.contains(uri.getHost().toLowerCase(Locale.ROOT));
    }
}
