package com.finfocus.plugin.install;

import com.finfocus.common.config.ConfigPaths;
import com.finfocus.common.infra.Archive;
import com.finfocus.common.infra.PidLock;
import com.finfocus.common.infra.Semver;
import com.finfocus.plugin.RegistryException;
import com.finfocus.plugin.RegistryException.Kind;
import com.finfocus.plugin.catalog.CatalogEntry;
import com.finfocus.plugin.catalog.PluginCatalog;
import com.finfocus.plugin.registry.BinaryMatchers;
import com.finfocus.plugin.registry.PluginInfo;
import com.finfocus.plugin.registry.PluginMetadata;
import com.finfocus.plugin.registry.PluginRegistry;
import com.finfocus.plugin.release.AssetNamingHints;
import com.finfocus.plugin.release.FallbackInfo;
import com.finfocus.plugin.release.ReleaseAsset;
import com.finfocus.plugin.release.ReleaseClient;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Installs, updates and removes plugin binaries under
 * {@code <pluginRoot>/<name>/<version>/}.
 * <p>
 * Every mutating operation holds the plugin's {@link PidLock}. Downloads and
 * extraction happen in a private directory under {@code <pluginRoot>/.staging/}
 * which is always removed afterwards; only a validated tree is moved into its
 * final place, so a failed or cancelled install leaves nothing behind.
 * Cancellation is by interrupting the calling thread.
 */
@Slf4j
public class PluginInstaller {

    static final String STAGING_DIR = ".staging";
    private static final String EXTRACT_DIR = "extract";
    private static final String PREVIOUS_DIR = "previous";

    private final Path pluginRoot;
    private final ReleaseClient releaseClient;
    private final PluginCatalog catalog;
    private final BinaryMatchers matchers;

    public PluginInstaller(Path pluginRoot, ReleaseClient releaseClient) {
        this(pluginRoot, releaseClient, PluginCatalog.getDefault(), BinaryMatchers.forCurrentPlatform());
    }

    public PluginInstaller(Path pluginRoot, ReleaseClient releaseClient, PluginCatalog catalog,
                           BinaryMatchers matchers) {
        this.pluginRoot = pluginRoot;
        this.releaseClient = releaseClient;
        this.catalog = catalog;
        this.matchers = matchers;
    }

    public static PluginInstaller fromEnvironment() {
        return new PluginInstaller(ConfigPaths.resolvePluginDir(), ReleaseClient.fromEnvironment());
    }

    public Path getPluginRoot() {
        return pluginRoot;
    }

    // =========================================================================
    // Install
    // =========================================================================

    /**
     * Install a plugin from a specifier such as {@code aws-public@v1.2.0} or
     * {@code owner/finfocus-plugin-foo}.
     *
     * @param progress receives human-readable status lines, may be null
     * @throws RegistryException classified by kind; the plugin root is left
     *         as it was on any failure
     */
    public InstallResult install(String specifier, InstallOptions options, Consumer<String> progress) {
        InstallOptions opts = options == null ? new InstallOptions() : options;
        if (opts.isFallbackToLatest() && opts.isNoFallback()) {
            throw new RegistryException(Kind.INVALID_OPTIONS,
                    "fallbackToLatest and noFallback cannot be used together");
        }
        PluginSpecifier parsed = PluginSpecifier.parse(specifier);

        PluginSpecifier target = parsed;
        AssetNamingHints hints = null;
        if (!parsed.fromUrl()) {
            CatalogEntry entry = catalog.getPlugin(parsed.name());
            target = new PluginSpecifier(parsed.name(), entry.getOwner(), entry.getRepo(), parsed.version(), false);
            hints = entry.toNamingHints();
        }
        return installResolved(target, withRegion(hints, opts.getMetadata()), opts, progress);
    }

    /**
     * Take the lock of a plugin in the installer's root.
     *
     * @throws RegistryException LOCK_HELD if another operation on the plugin
     *         is in progress
     */
    public PidLock.LockHandle acquireLock(String name) {
        return acquireLock(pluginRoot, name);
    }

    private InstallResult installResolved(PluginSpecifier target, AssetNamingHints hints, InstallOptions opts,
                                          Consumer<String> progress) {
        Path root = rootFor(opts.getPluginDir());
        String name = target.name();
        String repository = target.owner() + "/" + target.repo();

        try (PidLock.LockHandle ignored = acquireLock(root, name)) {
            if (target.isExactVersion() && !opts.isForce()) {
                checkNotInstalled(root, name, target.version());
            }

            report(progress, "Resolving " + repository + (target.hasVersion() ? "@" + target.version() : ""));
            FallbackInfo resolved = resolve(target, hints, opts);
            String tag = resolved.getRelease().getTagName();
            checkTag(tag, repository);
            if (resolved.isWasFallback()) {
                report(progress, "Warning: " + resolved.getFallbackReason() + ", installing " + tag + " instead");
            }
            if (!opts.isForce()) {
                checkNotInstalled(root, name, tag);
            }

            Path targetDir = root.resolve(name).resolve(tag);
            stageAndMove(name, tag, resolved.getAsset(), opts.getMetadata(), root, targetDir, progress);
            log.info("Installed plugin {} {} from {} to {}", name, tag, repository, targetDir);
            report(progress, "Installed " + name + " " + tag);

            if (!opts.isNoSave()) {
                saveRecord(root, name, tag, repository, progress);
            }
            if (opts.isClean()) {
                cleanOtherVersions(root, name, tag, progress);
            }

            return InstallResult.builder()
                    .name(name)
                    .version(tag)
                    .path(targetDir)
                    .repository(repository)
                    .fromUrl(target.fromUrl())
                    .wasFallback(resolved.isWasFallback())
                    .requestedVersion(target.version())
                    .build();
        }
    }

    private FallbackInfo resolve(PluginSpecifier target, AssetNamingHints hints, InstallOptions opts) {
        if (target.hasVersion() && !target.isExactVersion()) {
            return releaseClient.findReleaseForConstraint(target.owner(), target.repo(), target.constraint(),
                    target.name(), hints);
        }
        FallbackInfo info = releaseClient.findReleaseWithFallbackInfo(target.owner(), target.repo(),
                target.version(), target.name(), hints, !opts.isNoFallback());
        if (info.isWasFallback() && !opts.isFallbackToLatest()) {
            throw new RegistryException(Kind.NO_COMPATIBLE_ASSET, String.format(
                    "release %s of %s/%s has no compatible asset for %s; %s has one, use fallbackToLatest to install it",
                    target.version(), target.owner(), target.repo(), releaseClient.getPlatform(),
                    info.getRelease().getTagName()));
        }
        return info;
    }

    private void stageAndMove(String name, String tag, ReleaseAsset asset, Map<String, String> metadata,
                              Path root, Path targetDir, Consumer<String> progress) {
        String context = "install " + name + " " + tag;
        Path staging = null;
        try {
            staging = Files.createDirectories(root.resolve(STAGING_DIR))
                    .resolve(name + "-" + tag + "-" + UUID.randomUUID());
            Files.createDirectories(staging);

            Path archive = staging.resolve(assetFileName(asset));
            report(progress, "Downloading " + asset.getName());
            long bytes = releaseClient.downloadAsset(asset.getBrowserDownloadUrl(), archive, null);
            report(progress, "Downloaded " + bytes + " bytes");
            checkCancelled(context);

            Path extracted = staging.resolve(EXTRACT_DIR);
            report(progress, "Extracting " + asset.getName());
            Archive.extractArchive(archive, extracted);
            Files.delete(archive);

            if (metadata != null && !metadata.isEmpty()) {
                PluginMetadata.write(extracted, metadata);
            }
            Path binary = matchers.findBinary(extracted, name, metadata)
                    .orElseThrow(() -> new RegistryException(Kind.BINARY_NOT_FOUND,
                            "no executable for plugin " + name + " in " + asset.getName()));
            Archive.validateBinary(binary, matchers.getChecker());
            checkCancelled(context);

            moveIntoPlace(extracted, targetDir, staging);
        } catch (Archive.ArchiveError e) {
            throw RegistryException.fromArchiveError(e, context);
        } catch (InterruptedIOException | ClosedByInterruptException e) {
            throw new RegistryException(Kind.CANCELLED, context + ": cancelled", e);
        } catch (IOException e) {
            throw new RegistryException(Kind.IO, context + " failed: " + e.getMessage(), e);
        } finally {
            if (staging != null) {
                deleteQuietly(staging);
            }
        }
    }

    private static void moveIntoPlace(Path extracted, Path targetDir, Path staging) throws IOException {
        Files.createDirectories(targetDir.getParent());
        Path previous = null;
        if (Files.exists(targetDir, LinkOption.NOFOLLOW_LINKS)) {
            previous = staging.resolve(PREVIOUS_DIR);
            move(targetDir, previous);
        }
        try {
            move(extracted, targetDir);
        } catch (IOException e) {
            if (previous != null) {
                try {
                    move(previous, targetDir);
                } catch (IOException restore) {
                    e.addSuppressed(restore);
                }
            }
            throw e;
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }

    private void saveRecord(Path root, String name, String tag, String repository, Consumer<String> progress) {
        try {
            PluginInstallRecord.recordInstall(root, PluginInstallRecord.Entry.builder()
                    .name(name)
                    .version(tag)
                    .repository(repository)
                    .build());
        } catch (IOException e) {
            log.warn("Failed to record install of {}: {}", name, e.getMessage());
            report(progress, "Warning: failed to record install of " + name + ": " + e.getMessage());
        }
    }

    private void cleanOtherVersions(Path root, String name, String keep, Consumer<String> progress) {
        try {
            RemoveOtherVersionsResult cleaned = removeOtherVersionsLocked(root, name, keep, progress);
            if (!cleaned.getRemovedVersions().isEmpty()) {
                report(progress, "Removed " + cleaned.getRemovedVersions().size() + " old version(s), freed "
                        + cleaned.getBytesFreed() + " bytes");
            }
        } catch (IOException | RegistryException e) {
            log.warn("Cleanup of old {} versions failed: {}", name, e.getMessage());
            report(progress, "Warning: failed to remove old versions of " + name + ": " + e.getMessage());
        }
    }

    // =========================================================================
    // Update
    // =========================================================================

    /**
     * Move an installed plugin to the newest release (or the pinned
     * {@link UpdateOptions#getVersion() version}). Installed metadata such as
     * the region carries over to the new version.
     *
     * @throws RegistryException NOT_INSTALLED if the plugin has no valid
     *         installed version, PLUGIN_NOT_FOUND if its source is unknown
     */
    public UpdateResult update(String name, UpdateOptions options, Consumer<String> progress) {
        UpdateOptions opts = options == null ? new UpdateOptions() : options;
        PluginSpecifier.requireValidName(name);
        Path root = rootFor(opts.getPluginDir());

        PluginRegistry.LookupResult lookup = new PluginRegistry(List.of(root), matchers).getLatestPlugin(name);
        lookup.getWarnings().forEach(w -> report(progress, "Warning: " + w));
        if (!lookup.isFound()) {
            throw new RegistryException(Kind.NOT_INSTALLED, "plugin " + name + " is not installed");
        }
        PluginInfo current = lookup.getPlugin();

        Optional<CatalogEntry> entry = catalog.findPlugin(name);
        PluginInstallRecord.Entry record = PluginInstallRecord.find(root, name);
        String[] ownerRepo;
        if (record != null && record.getRepository() != null) {
            ownerRepo = PluginSpecifier.parseOwnerRepo(record.getRepository());
        } else if (entry.isPresent()) {
            ownerRepo = new String[] { entry.get().getOwner(), entry.get().getRepo() };
        } else {
            throw new RegistryException(Kind.PLUGIN_NOT_FOUND, "plugin " + name
                    + " has no install record and is not in the catalog; reinstall it with owner/repo");
        }
        AssetNamingHints hints = withRegion(entry.map(CatalogEntry::toNamingHints).orElse(null),
                current.getMetadata());

        boolean pinned = opts.getVersion() != null && !opts.getVersion().isBlank();
        report(progress, "Checking " + ownerRepo[0] + "/" + ownerRepo[1] + " for "
                + (pinned ? opts.getVersion() : "the latest release"));
        FallbackInfo target = releaseClient.findReleaseWithFallbackInfo(ownerRepo[0], ownerRepo[1],
                pinned ? opts.getVersion().trim() : null, name, hints, false);
        String newVersion = target.getRelease().getTagName();

        int cmp;
        try {
            cmp = Semver.compareVersions(newVersion, current.getVersion());
        } catch (Semver.SemverError e) {
            throw new RegistryException(Kind.INVALID_VERSION,
                    "cannot compare " + newVersion + " with installed " + current.getVersion() + ": " + e.getMessage(), e);
        }
        boolean upToDate = pinned ? cmp == 0 : cmp <= 0;

        UpdateResult.UpdateResultBuilder result = UpdateResult.builder()
                .name(name)
                .oldVersion(current.getVersion())
                .dryRun(opts.isDryRun());
        if (upToDate) {
            report(progress, name + " " + current.getVersion() + " is up to date");
            return result.newVersion(current.getVersion()).wasUpToDate(true).build();
        }
        if (opts.isDryRun()) {
            report(progress, "Would update " + name + " from " + current.getVersion() + " to " + newVersion);
            return result.newVersion(newVersion).build();
        }

        InstallOptions installOptions = InstallOptions.builder()
                .pluginDir(root)
                .force(true)
                .metadata(new LinkedHashMap<>(current.getMetadata()))
                .build();
        PluginSpecifier next = new PluginSpecifier(name, ownerRepo[0], ownerRepo[1], newVersion, entry.isEmpty());
        InstallResult installed = installResolved(next, hints, installOptions, progress);
        return result.newVersion(installed.getVersion()).path(installed.getPath()).build();
    }

    // =========================================================================
    // Remove
    // =========================================================================

    /**
     * Delete every installed version of a plugin. With
     * {@link RemoveOptions#isKeepConfig() keepConfig} each version's
     * {@code plugin.metadata.json} and the install record survive.
     *
     * @throws RegistryException NOT_INSTALLED if the plugin directory is absent
     */
    public void remove(String name, RemoveOptions options, Consumer<String> progress) {
        RemoveOptions opts = options == null ? new RemoveOptions() : options;
        PluginSpecifier.requireValidName(name);
        Path root = rootFor(opts.getPluginDir());
        Path pluginDir = root.resolve(name);
        if (!Files.isDirectory(pluginDir)) {
            throw new RegistryException(Kind.NOT_INSTALLED, "plugin " + name + " is not installed");
        }

        try (PidLock.LockHandle ignored = acquireLock(root, name)) {
            if (opts.isKeepConfig()) {
                deleteAllButMetadata(pluginDir);
                report(progress, "Removed " + name + " binaries, kept configuration");
            } else {
                deleteTree(pluginDir);
                PluginInstallRecord.remove(root, name);
                report(progress, "Removed " + name);
            }
            log.info("Removed plugin {} (keepConfig={})", name, opts.isKeepConfig());
        } catch (IOException e) {
            throw new RegistryException(Kind.IO, "failed to remove plugin " + name + ": " + e.getMessage(), e);
        }
    }

    /**
     * Delete every version directory of {@code name} except {@code keepVersion}.
     * Non-directory entries are left alone.
     *
     * @param rootDir plugin root, null for the installer's root
     * @throws RegistryException INVALID_VERSION if {@code keepVersion} is not a
     *         plain directory name, LOCK_HELD if the plugin is locked,
     *         NOT_INSTALLED if the plugin exists but {@code keepVersion} does not
     */
    public RemoveOtherVersionsResult removeOtherVersions(String name, String keepVersion, Path rootDir,
                                                         Consumer<String> progress) {
        PluginSpecifier.requireValidName(name);
        requireVersionDirName(keepVersion);
        Path root = rootDir == null ? pluginRoot : rootDir;
        try (PidLock.LockHandle ignored = acquireLock(root, name)) {
            return removeOtherVersionsLocked(root, name, keepVersion, progress);
        } catch (IOException e) {
            throw new RegistryException(Kind.IO,
                    "failed to remove old versions of " + name + ": " + e.getMessage(), e);
        }
    }

    private RemoveOtherVersionsResult removeOtherVersionsLocked(Path root, String name, String keepVersion,
                                                                Consumer<String> progress) throws IOException {
        Path pluginDir = root.resolve(name);
        RemoveOtherVersionsResult result = RemoveOtherVersionsResult.builder()
                .pluginName(name)
                .keptVersion(keepVersion)
                .build();
        if (!Files.isDirectory(pluginDir)) {
            return result;
        }
        if (!Files.isDirectory(pluginDir.resolve(keepVersion))) {
            throw new RegistryException(Kind.NOT_INSTALLED,
                    "version " + keepVersion + " of plugin " + name + " is not installed");
        }

        List<Path> versionDirs;
        try (Stream<Path> entries = Files.list(pluginDir)) {
            versionDirs = entries.filter(p -> Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS)).sorted().toList();
        }
        long freed = 0;
        for (Path dir : versionDirs) {
            String version = dir.getFileName().toString();
            if (version.equals(keepVersion)) {
                continue;
            }
            long size = getDirSize(dir);
            deleteTree(dir);
            result.getRemovedVersions().add(version);
            freed += size;
            report(progress, "Removed " + name + " " + version);
        }
        result.setBytesFreed(freed);
        return result;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /**
     * Executable of a plugin version directory, chosen by the binary matchers.
     *
     * @return empty if the directory does not exist or holds no executable
     */
    public Optional<Path> findPluginBinary(Path versionDir, String name) {
        if (!Files.isDirectory(versionDir)) {
            return Optional.empty();
        }
        return matchers.findBinary(versionDir, name, readMetadataLenient(versionDir));
    }

    /**
     * Total size of the regular files below {@code dir}; links are not followed.
     *
     * @throws NoSuchFileException if {@code dir} does not exist
     */
    public static long getDirSize(Path dir) throws IOException {
        if (!Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
            throw new NoSuchFileException(dir.toString());
        }
        long[] total = { 0 };
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    total[0] += attrs.size();
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return total[0];
    }

    private boolean isInstalled(Path root, String name, String version) {
        return findPluginBinary(root.resolve(name).resolve(version), name).isPresent();
    }

    private void checkNotInstalled(Path root, String name, String version) {
        String alternate = version.startsWith("v") ? version.substring(1) : "v" + version;
        if (isInstalled(root, name, version) || isInstalled(root, name, alternate)) {
            throw new RegistryException(Kind.ALREADY_INSTALLED,
                    "plugin " + name + " " + version + " is already installed; use force to reinstall");
        }
    }

    private static void checkTag(String tag, String repository) {
        if (!isVersionDirName(tag)) {
            throw new RegistryException(Kind.INVALID_VERSION,
                    "release of " + repository + " has an unusable tag: " + tag);
        }
    }

    private static void requireVersionDirName(String version) {
        if (!isVersionDirName(version)) {
            throw new RegistryException(Kind.INVALID_VERSION, "invalid version '" + version + "'");
        }
    }

    /**
     * A single, visible path segment; anything else could resolve outside
     * {@code <pluginRoot>/<name>/}.
     */
    private static boolean isVersionDirName(String version) {
        return version != null && !version.isBlank() && !version.startsWith(".")
                && !version.contains("/") && !version.contains("\\");
    }

    private static PidLock.LockHandle acquireLock(Path root, String name) {
        try {
            return new PidLock(root).acquire(name);
        } catch (PidLock.LockHeldError e) {
            throw new RegistryException(Kind.LOCK_HELD, "failed to acquire lock for plugin " + name
                    + ": another install, update or remove is in progress; try again later", e);
        } catch (IOException e) {
            throw new RegistryException(Kind.IO,
                    "failed to create lock for plugin " + name + ": " + e.getMessage(), e);
        }
    }

    private Path rootFor(Path override) {
        return override != null ? override : pluginRoot;
    }

    private static AssetNamingHints withRegion(AssetNamingHints hints, Map<String, String> metadata) {
        String region = metadata == null ? null : metadata.get(PluginMetadata.REGION_KEY);
        if (region == null || region.isBlank()) {
            return hints;
        }
        return AssetNamingHints.builder()
                .assetPrefix(hints != null ? hints.getAssetPrefix() : null)
                .region(region)
                .build();
    }

    private static Map<String, String> readMetadataLenient(Path versionDir) {
        try {
            return PluginMetadata.read(versionDir);
        } catch (RegistryException e) {
            if (e.getKind() != Kind.METADATA_NOT_FOUND) {
                log.debug("Ignoring metadata of {}: {}", versionDir, e.getMessage());
            }
            return Map.of();
        }
    }

    private static String assetFileName(ReleaseAsset asset) {
        Path fileName = asset.getName() == null ? null : Path.of(asset.getName()).getFileName();
        if (fileName == null) {
            throw new RegistryException(Kind.FETCH_FAILED, "release asset has no usable name: " + asset.getName());
        }
        return fileName.toString();
    }

    private static void checkCancelled(String context) {
        if (Thread.currentThread().isInterrupted()) {
            throw new RegistryException(Kind.CANCELLED, context + ": cancelled");
        }
    }

    private static void report(Consumer<String> progress, String message) {
        log.debug(message);
        if (progress != null) {
            progress.accept(message);
        }
    }

    private static void deleteAllButMetadata(Path pluginDir) throws IOException {
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(pluginDir)) {
            entries = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path p : entries) {
            if (p.equals(pluginDir)) {
                continue;
            }
            if (Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS)) {
                if (isEmptyDirectory(p)) {
                    Files.delete(p);
                }
            } else if (!isVersionMetadata(pluginDir, p)) {
                Files.delete(p);
            }
        }
    }

    private static boolean isVersionMetadata(Path pluginDir, Path file) {
        return file.getFileName().toString().equals(PluginMetadata.FILE_NAME)
                && pluginDir.relativize(file).getNameCount() == 2;
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }

    static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static void deleteQuietly(Path dir) {
        try {
            deleteTree(dir);
        } catch (IOException e) {
            log.warn("Failed to clean up {}: {}", dir, e.getMessage());
        }
    }
}
