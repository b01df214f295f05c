package com.finfocus.plugin.registry;

import com.finfocus.common.config.ConfigPaths;
import com.finfocus.common.infra.ExecutabilityChecker;
import com.finfocus.common.infra.Platform;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Selects the executable of a plugin version directory by trying an ordered
 * chain of naming strategies:
 * <ol>
 * <li>the plugin name itself</li>
 * <li>{@code finfocus-plugin-<name>}, region-suffixed variant first when the
 * metadata names a region</li>
 * <li>{@code pulumicost-plugin-<name>}, only when legacy naming is enabled</li>
 * <li>any executable file in the directory</li>
 * </ol>
 */
@Slf4j
public class BinaryMatchers {

    public static final String PLUGIN_PREFIX = "finfocus-plugin-";
    public static final String LEGACY_PREFIX = "pulumicost-plugin-";

    /**
     * One naming strategy.
     */
    @FunctionalInterface
    public interface BinaryMatcher {
        Optional<Path> match(Path dir, String pluginName, Map<String, String> metadata);
    }

    private final Platform platform;
    private final ExecutabilityChecker checker;
    private final List<BinaryMatcher> chain;

    public BinaryMatchers(Platform platform, ExecutabilityChecker checker, boolean legacyNaming) {
        this.platform = platform;
        this.checker = checker;
        List<BinaryMatcher> matchers = new ArrayList<>();
        matchers.add((dir, name, meta) -> named(dir, name));
        matchers.add(this::prefixed);
        if (legacyNaming) {
            matchers.add((dir, name, meta) -> named(dir, LEGACY_PREFIX + name));
        }
        matchers.add((dir, name, meta) -> anyExecutable(dir));
        this.chain = Collections.unmodifiableList(matchers);
    }

    public static BinaryMatchers forCurrentPlatform() {
        Platform platform = Platform.current();
        return new BinaryMatchers(platform, ExecutabilityChecker.forPlatform(platform),
                ConfigPaths.isLegacyNamingEnabled());
    }

    public ExecutabilityChecker getChecker() {
        return checker;
    }

    public List<BinaryMatcher> getChain() {
        return chain;
    }

    /**
     * @return the first match of the chain, or empty when the directory holds
     *         no usable executable (or cannot be read)
     */
    public Optional<Path> findBinary(Path dir, String pluginName, Map<String, String> metadata) {
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        Map<String, String> meta = metadata == null ? Map.of() : metadata;
        for (BinaryMatcher matcher : chain) {
            Optional<Path> found = matcher.match(dir, pluginName, meta);
            if (found.isPresent()) {
                log.debug("Selected binary {} for plugin {}", found.get(), pluginName);
                return found;
            }
        }
        return Optional.empty();
    }

    // =========================================================================
    // Strategies
    // =========================================================================

    private Optional<Path> prefixed(Path dir, String name, Map<String, String> metadata) {
        String region = metadata.get(PluginMetadata.REGION_KEY);
        if (region != null && !region.isBlank()) {
            Optional<Path> regional = named(dir, PLUGIN_PREFIX + name + "-" + region);
            if (regional.isPresent()) {
                return regional;
            }
        }
        return named(dir, PLUGIN_PREFIX + name);
    }

    private Optional<Path> named(Path dir, String baseName) {
        Path candidate = dir.resolve(platform.executableName(baseName));
        return isExecutableFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    private Optional<Path> anyExecutable(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.sorted()
                    .filter(this::isExecutableFile)
                    .findFirst();
        } catch (IOException | UncheckedIOException e) {
            log.debug("Cannot list {}: {}", dir, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isExecutableFile(Path path) {
        return Files.isRegularFile(path) && checker.isExecutable(path);
    }
}
