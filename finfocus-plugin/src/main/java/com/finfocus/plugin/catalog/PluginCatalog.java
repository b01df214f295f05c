package com.finfocus.plugin.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finfocus.plugin.RegistryException;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Catalog of installable plugins shipped as the {@code registry.json}
 * classpath resource. Registry-style specifiers ({@code name[@version]})
 * are resolved to a release repository through it.
 */
@Slf4j
public class PluginCatalog {

    public static final String RESOURCE = "/registry.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern REPOSITORY = Pattern.compile("^[A-Za-z0-9_.-]+/[A-Za-z0-9_.-]+$");
    private static final Set<String> SECURITY_LEVELS = Set.of("official", "community", "experimental");

    private final Map<String, CatalogEntry> entries;

    PluginCatalog(Map<String, CatalogEntry> entries) {
        this.entries = new TreeMap<>(entries);
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CatalogFile {
        private String schemaVersion;
        private Map<String, CatalogEntry> plugins = new LinkedHashMap<>();
    }

    // =========================================================================
    // Loading
    // =========================================================================

    private static final class DefaultHolder {
        static final PluginCatalog INSTANCE = loadResource();
    }

    /**
     * The embedded catalog, parsed once.
     */
    public static PluginCatalog getDefault() {
        return DefaultHolder.INSTANCE;
    }

    private static PluginCatalog loadResource() {
        try (InputStream in = PluginCatalog.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("catalog resource " + RESOURCE + " missing from classpath");
            }
            return parse(in);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read plugin catalog", e);
        }
    }

    /**
     * Parse a catalog document. Entries with a malformed repository or an
     * unknown security level are skipped with a warning.
     */
    public static PluginCatalog parse(InputStream in) throws IOException {
        CatalogFile file = MAPPER.readValue(in, CatalogFile.class);
        Map<String, CatalogEntry> valid = new LinkedHashMap<>();
        if (file.getPlugins() != null) {
            file.getPlugins().forEach((name, entry) -> {
                if (entry == null || entry.getRepository() == null
                        || !REPOSITORY.matcher(entry.getRepository()).matches()) {
                    log.warn("Skipping catalog entry {}: invalid repository", name);
                    return;
                }
                if (entry.getSecurityLevel() != null && !SECURITY_LEVELS.contains(entry.getSecurityLevel())) {
                    log.warn("Skipping catalog entry {}: unknown security level {}", name, entry.getSecurityLevel());
                    return;
                }
                entry.setName(name);
                valid.put(name, entry);
            });
        }
        return new PluginCatalog(valid);
    }

    // =========================================================================
    // Lookup
    // =========================================================================

    public Optional<CatalogEntry> findPlugin(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    /**
     * @throws RegistryException PLUGIN_NOT_FOUND for unknown names
     */
    public CatalogEntry getPlugin(String name) {
        return findPlugin(name).orElseThrow(() -> new RegistryException(
                RegistryException.Kind.PLUGIN_NOT_FOUND, "plugin not found in registry: " + name));
    }

    /**
     * All entries, sorted by name.
     */
    public List<CatalogEntry> getAllEntries() {
        return new ArrayList<>(entries.values());
    }
}
