package com.docs.lookup.cdi;

import com.docs.lookup.api.DocumentationLookup;
import com.docs.lookup.api.LookupOptions;
import com.docs.lookup.metrics.MetricsService;
import com.docs.lookup.resolution.MapSymbolDictionary;
import com.docs.lookup.resolution.SymbolDictionary;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * CDI producer that wires a {@link DocumentationLookup} from MicroProfile Config properties.
 *
 * <pre>
 * docs-lookup:
 *   docs-version: "3.12"
 *   cache-ttl-days: 14
 *   cache-directory: /var/cache/docs-lookup
 *   symbol-table: /etc/docs-lookup/symbols.json
 * </pre>
 *
 * <p>Without {@code symbol-table} the bundled table is used. A {@link MetricsService} bean,
 * when one exists, receives the lookup metrics.</p>
 */
@ApplicationScoped
public class DocumentationLookupProducer {

    private static final Logger log = LoggerFactory.getLogger(DocumentationLookupProducer.class);

    static final String BUNDLED_SYMBOL_TABLE = "docs-lookup/python-symbols.json";

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "docs-lookup.cache-ttl-days", defaultValue = "7")
    int cacheTtlDays;

    @Inject
    @ConfigProperty(name = "docs-lookup.max-cache-entries", defaultValue = "500")
    int maxCacheEntries;

    @Inject
    @ConfigProperty(name = "docs-lookup.max-cache-bytes", defaultValue = "16777216")
    long maxCacheBytes;

    @Inject
    @ConfigProperty(name = "docs-lookup.negative-cache-ttl-seconds", defaultValue = "60")
    long negativeCacheTtlSeconds;

    @Inject
    @ConfigProperty(name = "docs-lookup.sweep-interval-minutes", defaultValue = "10")
    long sweepIntervalMinutes;

    @Inject
    @ConfigProperty(name = "docs-lookup.serve-stale-on-error", defaultValue = "true")
    boolean serveStaleOnError;

    @Inject
    @ConfigProperty(name = "docs-lookup.cache-directory")
    Optional<String> cacheDirectory;

    @Inject
    @ConfigProperty(name = "docs-lookup.warm-on-startup", defaultValue = "true")
    boolean warmOnStartup;

    // ── Fetch ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "docs-lookup.max-retries", defaultValue = "3")
    int maxRetries;

    @Inject
    @ConfigProperty(name = "docs-lookup.base-delay-ms", defaultValue = "1000")
    long baseDelayMs;

    @Inject
    @ConfigProperty(name = "docs-lookup.max-delay-ms", defaultValue = "30000")
    long maxDelayMs;

    @Inject
    @ConfigProperty(name = "docs-lookup.jitter-fraction", defaultValue = "0.2")
    double jitterFraction;

    @Inject
    @ConfigProperty(name = "docs-lookup.http-timeout-ms", defaultValue = "6000")
    long httpTimeoutMs;

    @Inject
    @ConfigProperty(name = "docs-lookup.offline-only", defaultValue = "false")
    boolean offlineOnly;

    // ── Documentation source ──────────────────────────────────

    @Inject
    @ConfigProperty(name = "docs-lookup.docs-version", defaultValue = "3")
    String docsVersion;

    @Inject
    @ConfigProperty(name = "docs-lookup.docs-locale", defaultValue = "en")
    String docsLocale;

    @Inject
    @ConfigProperty(name = "docs-lookup.symbol-table")
    Optional<String> symbolTable;

    @Inject
    Instance<MetricsService> metricsServices;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public DocumentationLookup documentationLookup() {
        LookupOptions options = buildOptions();
        log.info("Producing DocumentationLookup: versionTag={} offlineOnly={}", options.versionTag(), options.isOfflineOnly());

        DocumentationLookup.Builder builder = DocumentationLookup.builder()
                .dictionary(loadSymbolTable())
                .options(options);
        if (metricsServices != null && metricsServices.isResolvable()) {
            builder.metrics(metricsServices.get());
        }
        return builder.build();
    }

    public void closeLookup(@Disposes DocumentationLookup lookup) {
        log.info("Closing DocumentationLookup");
        lookup.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    LookupOptions buildOptions() {
        LookupOptions.Builder builder = LookupOptions.builder()
                .cacheTtlDays(cacheTtlDays)
                .maxCacheEntries(maxCacheEntries)
                .maxCacheBytes(maxCacheBytes)
                .negativeCacheTtlSeconds(negativeCacheTtlSeconds)
                .sweepIntervalMinutes(sweepIntervalMinutes)
                .serveStaleOnError(serveStaleOnError)
                .warmOnStartup(warmOnStartup)
                .maxRetries(maxRetries)
                .baseDelayMs(baseDelayMs)
                .maxDelayMs(maxDelayMs)
                .jitterFraction(jitterFraction)
                .httpTimeoutMs(httpTimeoutMs)
                .offlineOnly(offlineOnly)
                .docsVersion(docsVersion)
                .docsLocale(docsLocale);
        cacheDirectory.filter(dir -> !dir.isBlank()).ifPresent(dir -> builder.cacheDirectory(Path.of(dir)));
        return builder.build();
    }

    SymbolDictionary loadSymbolTable() {
        try {
            if (symbolTable.isPresent() && !symbolTable.get().isBlank()) {
                Path path = Path.of(symbolTable.get());
                try (InputStream in = Files.newInputStream(path)) {
                    MapSymbolDictionary dictionary = MapSymbolDictionary.fromJson(in);
                    log.info("Loaded symbol table: path={} entries={}", path, dictionary.size());
                    return dictionary;
                }
            }
            try (InputStream in = DocumentationLookupProducer.class.getClassLoader().getResourceAsStream(BUNDLED_SYMBOL_TABLE)) {
                if (in == null) {
                    log.warn("Bundled symbol table {} not found, using an empty table", BUNDLED_SYMBOL_TABLE);
                    return MapSymbolDictionary.empty();
                }
                MapSymbolDictionary dictionary = MapSymbolDictionary.fromJson(in);
                log.info("Loaded bundled symbol table: entries={}", dictionary.size());
                return dictionary;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load symbol table", e);
        }
    }
}
