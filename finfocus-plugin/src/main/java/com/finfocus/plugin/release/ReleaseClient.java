package com.finfocus.plugin.release;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finfocus.common.config.ConfigPaths;
import com.finfocus.common.infra.Archive;
import com.finfocus.common.infra.Platform;
import com.finfocus.common.infra.Semver;
import com.finfocus.plugin.RegistryException;
import com.finfocus.plugin.RegistryException.Kind;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.channels.ClosedByInterruptException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Client for a GitHub-compatible release API: latest release, release by tag,
 * stable release listing, streaming asset download and platform asset
 * resolution with fallback to older releases.
 * <p>
 * The transport is injected so tests can point the client at a local server.
 */
@Slf4j
public class ReleaseClient {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<List<GitHubRelease>> RELEASE_LIST = new TypeReference<>() {
    };

    private static final int PAGE_SIZE = 100;
    private static final int BUFFER_SIZE = 32 * 1024;
    private static final Duration API_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DOWNLOAD_TIMEOUT = Duration.ofMinutes(10);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String token;
    private final Platform platform;

    public ReleaseClient(HttpClient httpClient, String baseUrl, String token, Platform platform) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
        this.platform = platform;
    }

    /**
     * Client for the running platform, configured from FINFOCUS_GITHUB_API_URL
     * and GITHUB_TOKEN. Redirects are followed since asset downloads are
     * served from a CDN.
     */
    public static ReleaseClient fromEnvironment(Map<String, String> env) {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(API_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new ReleaseClient(http, ConfigPaths.resolveGitHubApiUrl(env),
                ConfigPaths.resolveGitHubToken(env), Platform.current());
    }

    public static ReleaseClient fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public Platform getPlatform() {
        return platform;
    }

    // =========================================================================
    // Release queries
    // =========================================================================

    public GitHubRelease getLatestRelease(String owner, String repo) {
        return fetchRelease(repoUrl(owner, repo) + "/releases/latest", owner + "/" + repo + "@latest");
    }

    public GitHubRelease getReleaseByTag(String owner, String repo, String tag) {
        return fetchRelease(repoUrl(owner, repo) + "/releases/tags/" + encode(tag),
                owner + "/" + repo + "@" + tag);
    }

    /**
     * Fetch a single release from an API URL.
     *
     * @param context owner/repo[@tag] used in error messages
     */
    public GitHubRelease fetchRelease(String url, String context) {
        String body = getJson(url, context);
        try {
            return MAPPER.readValue(body, GitHubRelease.class);
        } catch (JsonProcessingException e) {
            throw new RegistryException(Kind.FETCH_FAILED,
                    "invalid release payload for " + context + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Releases that are neither draft nor prerelease, in API order (newest
     * first), at most {@code limit} of them; {@code limit <= 0} means no cap.
     */
    public List<GitHubRelease> listStableReleases(String owner, String repo, int limit) {
        String context = owner + "/" + repo;
        String body = getJson(repoUrl(owner, repo) + "/releases?per_page=" + PAGE_SIZE, context);
        List<GitHubRelease> all;
        try {
            all = MAPPER.readValue(body, RELEASE_LIST);
        } catch (JsonProcessingException e) {
            throw new RegistryException(Kind.FETCH_FAILED,
                    "invalid release list for " + context + ": " + e.getOriginalMessage(), e);
        }

        List<GitHubRelease> stable = new ArrayList<>();
        for (GitHubRelease release : all) {
            if (!release.isStable()) {
                continue;
            }
            stable.add(release);
            if (limit > 0 && stable.size() >= limit) {
                break;
            }
        }
        return stable;
    }

    // =========================================================================
    // Download
    // =========================================================================

    /**
     * Stream an asset to {@code dest}. The partial file is removed on any
     * failure, including interruption of the calling thread.
     *
     * @return number of bytes written
     */
    public long downloadAsset(String url, Path dest, DownloadProgress progress) {
        String context = "download " + url;
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(DOWNLOAD_TIMEOUT)
                .header("Accept", "application/octet-stream")
                .GET();
        // only our own API gets the token, never a third-party asset host
        if (token != null && (url.equals(baseUrl) || url.startsWith(baseUrl + "/"))) {
            builder.header("Authorization", "Bearer " + token);
        }

        HttpResponse<InputStream> response = send(builder.build(), HttpResponse.BodyHandlers.ofInputStream(), context);
        boolean complete = false;
        try (InputStream in = response.body()) {
            checkStatus(response.statusCode(), context);
            long total = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
            if (dest.getParent() != null) {
                Files.createDirectories(dest.getParent());
            }

            long written = 0;
            byte[] buffer = new byte[BUFFER_SIZE];
            try (OutputStream out = Files.newOutputStream(dest)) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    if (Thread.currentThread().isInterrupted()) {
                        throw new InterruptedIOException("download cancelled");
                    }
                    out.write(buffer, 0, read);
                    written += read;
                    if (progress != null) {
                        progress.onProgress(written, total);
                    }
                }
            }
            complete = true;
            log.debug("Downloaded {} bytes from {}", written, url);
            return written;
        } catch (InterruptedIOException | ClosedByInterruptException e) {
            throw new RegistryException(Kind.CANCELLED, context + ": cancelled", e);
        } catch (IOException e) {
            throw new RegistryException(Kind.FETCH_FAILED, context + " failed: " + e.getMessage(), e);
        } finally {
            if (!complete) {
                deletePartial(dest);
            }
        }
    }

    // =========================================================================
    // Asset resolution
    // =========================================================================

    /**
     * Pick the asset of {@code release} built for this client's platform.
     * A name matches when it contains the prefix, an OS alias and an
     * architecture alias, and carries a supported archive extension. With a
     * region hint, assets naming the region win over the others.
     *
     * @return the asset, or null when none fits
     */
    public ReleaseAsset findPlatformAsset(GitHubRelease release, String namePrefix, AssetNamingHints hints) {
        String prefix = effectivePrefix(namePrefix, hints).toLowerCase(Locale.ROOT);
        List<ReleaseAsset> candidates = new ArrayList<>();
        if (release.getAssets() == null) {
            return null;
        }
        for (ReleaseAsset asset : release.getAssets()) {
            if (asset != null && asset.getName() != null && matchesPlatform(asset.getName().toLowerCase(Locale.ROOT), prefix)) {
                candidates.add(asset);
            }
        }
        if (candidates.isEmpty()) {
            return null;
        }

        String region = hints != null ? hints.getRegion() : null;
        if (region != null && !region.isBlank()) {
            String wanted = region.toLowerCase(Locale.ROOT);
            for (ReleaseAsset asset : candidates) {
                if (asset.getName().toLowerCase(Locale.ROOT).contains(wanted)) {
                    return asset;
                }
            }
        }
        return candidates.get(0);
    }

    /**
     * Resolve a release and asset for this platform, falling back to older
     * stable releases when needed; see
     * {@link #findReleaseWithFallbackInfo(String, String, String, String, AssetNamingHints, boolean)}.
     */
    public FallbackInfo findReleaseWithAsset(String owner, String repo, String version,
                                             String namePrefix, AssetNamingHints hints) {
        return findReleaseWithFallbackInfo(owner, repo, version, namePrefix, hints, true);
    }

    /**
     * Resolve a release and asset for this platform.
     * <p>
     * Without a version, the newest stable release carrying a compatible asset
     * is chosen. With a version, the tagged release is tried first (with and
     * without a {@code v} prefix); if it exists but has no compatible asset
     * and {@code allowFallback} is set, the newest stable release that does
     * have one is returned with {@code wasFallback} set.
     *
     * @throws RegistryException RELEASE_NOT_FOUND if the requested tag does
     *         not exist, NO_COMPATIBLE_ASSET if no candidate release fits
     */
    public FallbackInfo findReleaseWithFallbackInfo(String owner, String repo, String version,
                                                    String namePrefix, AssetNamingHints hints,
                                                    boolean allowFallback) {
        boolean latest = version == null || version.isBlank();
        if (latest) {
            for (GitHubRelease release : listStableReleases(owner, repo, 0)) {
                ReleaseAsset asset = findPlatformAsset(release, namePrefix, hints);
                if (asset != null) {
                    return FallbackInfo.builder().release(release).asset(asset).build();
                }
            }
            throw noCompatibleAsset(owner, repo, "any stable release");
        }

        GitHubRelease tagged = getReleaseByTagLenient(owner, repo, version);
        ReleaseAsset asset = findPlatformAsset(tagged, namePrefix, hints);
        if (asset != null) {
            return FallbackInfo.builder()
                    .release(tagged)
                    .asset(asset)
                    .requestedVersion(version)
                    .build();
        }
        if (!allowFallback) {
            throw noCompatibleAsset(owner, repo, tagged.getTagName());
        }

        log.info("Release {}/{}@{} has no asset for {}, searching older stable releases",
                owner, repo, tagged.getTagName(), platform);
        for (GitHubRelease release : listStableReleases(owner, repo, 0)) {
            if (release.getTagName() != null && release.getTagName().equals(tagged.getTagName())) {
                continue;
            }
            ReleaseAsset candidate = findPlatformAsset(release, namePrefix, hints);
            if (candidate != null) {
                return FallbackInfo.builder()
                        .release(release)
                        .asset(candidate)
                        .wasFallback(true)
                        .requestedVersion(version)
                        .fallbackReason("release " + tagged.getTagName() + " has no compatible assets for " + platform)
                        .build();
            }
        }
        throw noCompatibleAsset(owner, repo, tagged.getTagName());
    }

    /**
     * Newest stable release whose tag satisfies {@code constraint} and that
     * carries a compatible asset. Tags that are not valid versions are skipped.
     *
     * @throws RegistryException NO_COMPATIBLE_ASSET if no release qualifies
     */
    public FallbackInfo findReleaseForConstraint(String owner, String repo, Semver.Constraint constraint,
                                                 String namePrefix, AssetNamingHints hints) {
        FallbackInfo best = null;
        Semver.Version bestVersion = null;
        for (GitHubRelease release : listStableReleases(owner, repo, 0)) {
            if (release.getTagName() == null || !Semver.isValidVersion(release.getTagName())) {
                continue;
            }
            Semver.Version version = Semver.parse(release.getTagName());
            if (!constraint.check(version) || (bestVersion != null && !version.greaterThan(bestVersion))) {
                continue;
            }
            ReleaseAsset asset = findPlatformAsset(release, namePrefix, hints);
            if (asset == null) {
                log.debug("Release {} satisfies {} but has no asset for {}", release.getTagName(), constraint, platform);
                continue;
            }
            best = FallbackInfo.builder()
                    .release(release)
                    .asset(asset)
                    .requestedVersion(constraint.toString())
                    .build();
            bestVersion = version;
        }
        if (best == null) {
            throw new RegistryException(Kind.NO_COMPATIBLE_ASSET, "no release of " + owner + "/" + repo
                    + " satisfying " + constraint + " has a compatible asset for platform " + platform);
        }
        return best;
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private GitHubRelease getReleaseByTagLenient(String owner, String repo, String version) {
        try {
            return getReleaseByTag(owner, repo, version);
        } catch (RegistryException e) {
            if (e.getKind() != Kind.RELEASE_NOT_FOUND || version.startsWith("v")) {
                throw e;
            }
            log.debug("Tag {} not found, retrying as v{}", version, version);
            return getReleaseByTag(owner, repo, "v" + version);
        }
    }

    private String effectivePrefix(String namePrefix, AssetNamingHints hints) {
        if (hints != null && hints.getAssetPrefix() != null && !hints.getAssetPrefix().isBlank()) {
            return hints.getAssetPrefix();
        }
        return namePrefix == null ? "" : namePrefix;
    }

    private boolean matchesPlatform(String lowerName, String lowerPrefix) {
        if (!lowerName.contains(lowerPrefix)) {
            return false;
        }
        if (Archive.resolveArchiveKind(lowerName) == null) {
            return false;
        }
        return platform.matchesAssetName(lowerName);
    }

    private RegistryException noCompatibleAsset(String owner, String repo, String where) {
        return new RegistryException(Kind.NO_COMPATIBLE_ASSET,
                "no compatible asset for platform " + platform + " in " + owner + "/" + repo + " (" + where + ")");
    }

    private String getJson(String url, String context) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(API_TIMEOUT)
                .header("Accept", "application/vnd.github+json")
                .GET();
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        HttpResponse<String> response = send(builder.build(), HttpResponse.BodyHandlers.ofString(), context);
        checkStatus(response.statusCode(), context);
        return response.body();
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler, String context) {
        try {
            return httpClient.send(request, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException(Kind.CANCELLED, context + ": interrupted", e);
        } catch (IOException e) {
            throw new RegistryException(Kind.FETCH_FAILED, context + ": " + e.getMessage(), e);
        }
    }

    static void checkStatus(int status, String context) {
        if (status >= 200 && status < 300) {
            return;
        }
        switch (status) {
            case 404 -> throw new RegistryException(Kind.RELEASE_NOT_FOUND, "not found: " + context);
            case 403, 429 -> throw new RegistryException(Kind.RATE_LIMITED,
                    "rate limited or forbidden (HTTP " + status + "): " + context);
            default -> throw new RegistryException(Kind.FETCH_FAILED,
                    "request failed with HTTP " + status + ": " + context);
        }
    }

    private String repoUrl(String owner, String repo) {
        return baseUrl + "/repos/" + encode(owner) + "/" + encode(repo);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void deletePartial(Path dest) {
        try {
            Files.deleteIfExists(dest);
        } catch (IOException e) {
            log.warn("Failed to remove partial download {}: {}", dest, e.getMessage());
        }
    }
}
