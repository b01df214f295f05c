package com.finfocus.plugin.registry;

import com.finfocus.common.config.ConfigPaths;
import com.finfocus.common.infra.Semver;
import com.finfocus.plugin.RegistryException;
import com.finfocus.plugin.RegistryException.Kind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read-only scanner over {@code <root>/<name>/<version>/} plugin trees.
 * <p>
 * Several roots may be given; for an identical (name, version) the first
 * root wins and the shadowed copy is reported as a warning. Version
 * directories without a usable executable are skipped, so a half-written
 * install never breaks enumeration.
 */
@Slf4j
public class PluginRegistry {

    private final List<Path> roots;
    private final BinaryMatchers matchers;

    public PluginRegistry(Path root) {
        this(List.of(root), BinaryMatchers.forCurrentPlatform());
    }

    public PluginRegistry(List<Path> roots, BinaryMatchers matchers) {
        this.roots = List.copyOf(roots);
        this.matchers = matchers;
    }

    public static PluginRegistry fromEnvironment() {
        return new PluginRegistry(ConfigPaths.resolvePluginDir());
    }

    // =========================================================================
    // Result types
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScanResult {
        @Builder.Default
        private List<PluginInfo> plugins = new ArrayList<>();
        /** Non-fatal problems found while scanning. */
        @Builder.Default
        private List<String> warnings = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LookupResult {
        private PluginInfo plugin;
        @Builder.Default
        private List<String> warnings = new ArrayList<>();

        public boolean isFound() {
            return plugin != null;
        }
    }

    // =========================================================================
    // Scanning
    // =========================================================================

    /**
     * Every installed (name, version) with a resolvable binary, sorted by name
     * then version directory.
     */
    public List<PluginInfo> listPlugins() {
        return scan().getPlugins();
    }

    /**
     * Full scan including warnings (unreadable metadata, unlistable plugin
     * directories, shadowed duplicates).
     *
     * @throws RegistryException IO if an existing root cannot be listed
     */
    public ScanResult scan() {
        List<PluginInfo> plugins = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Path> seen = new HashMap<>();

        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                log.debug("Plugin root {} does not exist, skipping", root);
                continue;
            }
            for (Path nameDir : listRoot(root)) {
                String name = nameDir.getFileName().toString();
                List<Path> versionDirs;
                try {
                    versionDirs = listVisibleDirs(nameDir);
                } catch (IOException e) {
                    String warning = String.format("Plugin %s in %s cannot be listed: %s", name, root, e.getMessage());
                    log.warn(warning);
                    warnings.add(warning);
                    continue;
                }
                for (Path versionDir : versionDirs) {
                    String version = versionDir.getFileName().toString();
                    Optional<PluginInfo> info = inspect(name, version, versionDir, warnings);
                    if (info.isEmpty()) {
                        continue;
                    }
                    String key = name + "@" + version;
                    Path previous = seen.putIfAbsent(key, root);
                    if (previous != null) {
                        warnings.add(String.format("Plugin %s version %s in %s is shadowed by %s",
                                name, version, root, previous));
                        continue;
                    }
                    plugins.add(info.get());
                }
            }
        }

        plugins.sort(Comparator.comparing(PluginInfo::getName).thenComparing(PluginInfo::getVersion));
        return ScanResult.builder().plugins(plugins).warnings(warnings).build();
    }

    /**
     * The highest valid semantic version per plugin name. Versions that do not
     * parse are left out and reported as warnings.
     */
    public ScanResult listLatestPlugins() {
        ScanResult all = scan();
        List<String> warnings = new ArrayList<>(all.getWarnings());
        Map<String, PluginInfo> latest = new LinkedHashMap<>();
        Map<String, Semver.Version> latestVersions = new HashMap<>();

        for (PluginInfo plugin : all.getPlugins()) {
            Semver.Version version;
            try {
                version = Semver.parse(plugin.getVersion());
            } catch (Semver.SemverError e) {
                String warning = String.format("Plugin %s version %s has invalid semver format: %s",
                        plugin.getName(), plugin.getVersion(), e.getMessage());
                log.warn(warning);
                warnings.add(warning);
                continue;
            }
            Semver.Version current = latestVersions.get(plugin.getName());
            if (current == null || version.greaterThan(current)) {
                latest.put(plugin.getName(), plugin);
                latestVersions.put(plugin.getName(), version);
            }
        }
        return ScanResult.builder()
                .plugins(new ArrayList<>(latest.values()))
                .warnings(warnings)
                .build();
    }

    public LookupResult getLatestPlugin(String name) {
        ScanResult latest = listLatestPlugins();
        PluginInfo match = latest.getPlugins().stream()
                .filter(p -> p.getName().equals(name))
                .findFirst()
                .orElse(null);
        List<String> warnings = latest.getWarnings().stream()
                .filter(w -> w.startsWith("Plugin " + name + " "))
                .toList();
        return LookupResult.builder().plugin(match).warnings(new ArrayList<>(warnings)).build();
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private Optional<PluginInfo> inspect(String name, String version, Path versionDir, List<String> warnings) {
        Map<String, String> metadata = new LinkedHashMap<>();
        boolean metadataFileMissing = false;
        try {
            metadata = PluginMetadata.read(versionDir);
        } catch (RegistryException e) {
            if (e.getKind() == Kind.METADATA_NOT_FOUND) {
                metadataFileMissing = true;
            } else {
                log.warn("Ignoring metadata of {} {}: {}", name, version, e.getMessage());
                warnings.add(String.format("Plugin %s version %s has unreadable metadata: %s",
                        name, version, e.getMessage()));
            }
        }

        Optional<Path> binary = matchers.findBinary(versionDir, name, metadata);
        if (binary.isEmpty()) {
            log.debug("No executable in {}, skipping", versionDir);
            return Optional.empty();
        }

        if (metadataFileMissing) {
            String region = PluginMetadata.parseRegionFromBinaryName(binary.get().getFileName().toString());
            if (region != null) {
                metadata.put(PluginMetadata.REGION_KEY, region);
            }
        }
        return Optional.of(PluginInfo.builder()
                .name(name)
                .version(version)
                .path(binary.get().toAbsolutePath())
                .metadata(metadata)
                .build());
    }

    private static List<Path> listRoot(Path root) {
        try {
            return listVisibleDirs(root);
        } catch (IOException e) {
            throw new RegistryException(Kind.IO, "failed to list " + root + ": " + e.getMessage(), e);
        }
    }

    private static List<Path> listVisibleDirs(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(Files::isDirectory)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted()
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
