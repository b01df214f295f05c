package com.finfocus.plugin.release;

import com.finfocus.common.infra.Platform;
import com.finfocus.common.infra.Semver;
import com.finfocus.plugin.ReleaseFixtures.ReleaseServer;
import com.finfocus.plugin.RegistryException;
import com.finfocus.plugin.RegistryException.Kind;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.finfocus.plugin.ReleaseFixtures.LINUX_AMD64;
import static com.finfocus.plugin.ReleaseFixtures.asset;
import static com.finfocus.plugin.ReleaseFixtures.release;
import static org.junit.jupiter.api.Assertions.*;

class ReleaseClientTest {

    private ReleaseServer server;
    private ReleaseClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new ReleaseServer();
        client = server.client();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.close();
    }

    // =========================================================================
    // Queries
    // =========================================================================

    @Test
    void getLatestRelease_returnsNewestStable() {
        server.addReleases("acme", "finfocus-plugin-demo",
                release("v1.1.0", asset("demo_v1.1.0_linux_amd64.tar.gz")),
                release("v1.0.0"));

        GitHubRelease latest = client.getLatestRelease("acme", "finfocus-plugin-demo");

        assertEquals("v1.1.0", latest.getTagName());
        assertEquals(1, latest.getAssets().size());
        assertEquals("demo_v1.1.0_linux_amd64.tar.gz", latest.getAssets().get(0).getName());
    }

    @Test
    void getReleaseByTag_missingIsNotFound() {
        server.addReleases("acme", "demo", release("v1.0.0"));

        RegistryException e = assertThrows(RegistryException.class,
                () -> client.getReleaseByTag("acme", "demo", "v9.9.9"));
        assertEquals(Kind.RELEASE_NOT_FOUND, e.getKind());
        assertTrue(e.getMessage().contains("acme/demo@v9.9.9"), e.getMessage());
    }

    @Test
    void statusCodes_mapToKinds() {
        server.fail("/repos/acme/limited/releases/latest", 403);
        server.fail("/repos/acme/throttled/releases/latest", 429);
        server.fail("/repos/acme/broken/releases/latest", 502);

        assertEquals(Kind.RATE_LIMITED, assertThrows(RegistryException.class,
                () -> client.getLatestRelease("acme", "limited")).getKind());
        assertEquals(Kind.RATE_LIMITED, assertThrows(RegistryException.class,
                () -> client.getLatestRelease("acme", "throttled")).getKind());
        RegistryException broken = assertThrows(RegistryException.class,
                () -> client.getLatestRelease("acme", "broken"));
        assertEquals(Kind.FETCH_FAILED, broken.getKind());
        assertTrue(broken.getMessage().contains("502"));
    }

    @Test
    void checkStatus_acceptsAll2xx() {
        assertDoesNotThrow(() -> ReleaseClient.checkStatus(200, "x"));
        assertDoesNotThrow(() -> ReleaseClient.checkStatus(204, "x"));
        assertEquals(Kind.RELEASE_NOT_FOUND,
                assertThrows(RegistryException.class, () -> ReleaseClient.checkStatus(404, "x")).getKind());
        assertEquals(Kind.FETCH_FAILED,
                assertThrows(RegistryException.class, () -> ReleaseClient.checkStatus(301, "x")).getKind());
    }

    @Test
    void fetchRelease_invalidPayloadIsFetchFailure() throws IOException {
        try (ReleaseServer other = new ReleaseServer()) {
            String url = other.serveFile("bad.json", "not json".getBytes(StandardCharsets.UTF_8));
            RegistryException e = assertThrows(RegistryException.class, () -> client.fetchRelease(url, "acme/demo"));
            assertEquals(Kind.FETCH_FAILED, e.getKind());
        }
    }

    @Test
    void listStableReleases_filtersAndCaps() {
        server.addReleases("acme", "demo",
                GitHubRelease.builder().tagName("v3.0.0-rc.1").prerelease(true).build(),
                GitHubRelease.builder().tagName("v2.1.0").draft(true).build(),
                release("v2.0.0"),
                release("v1.1.0"),
                release("v1.0.0"));

        List<String> all = tags(client.listStableReleases("acme", "demo", 0));
        assertEquals(List.of("v2.0.0", "v1.1.0", "v1.0.0"), all);

        List<String> capped = tags(client.listStableReleases("acme", "demo", 2));
        assertEquals(List.of("v2.0.0", "v1.1.0"), capped);
    }

    // =========================================================================
    // Asset resolution
    // =========================================================================

    @Test
    void findReleaseWithAsset_fallsBackToOlderReleaseWithPlatformAsset() {
        server.addReleases("acme", "demo",
                release("v2.0.0", asset("plugin_v2.0.0_windows_amd64.zip")),
                release("v1.0.0", asset("plugin_v1.0.0_linux_amd64.tar.gz")));

        FallbackInfo info = client.findReleaseWithAsset("acme", "demo", "v2.0.0", "plugin", null);

        assertEquals("v1.0.0", info.getRelease().getTagName());
        assertEquals("plugin_v1.0.0_linux_amd64.tar.gz", info.getAsset().getName());
        assertTrue(info.isWasFallback());
        assertEquals("v2.0.0", info.getRequestedVersion());
        assertTrue(info.getFallbackReason().contains("linux/amd64"), info.getFallbackReason());
    }

    @Test
    void findReleaseWithAsset_exactTagWithAssetIsNotFallback() {
        server.addReleases("acme", "demo",
                release("v2.0.0", asset("plugin_v2.0.0_linux_x86_64.tar.gz")),
                release("v1.0.0", asset("plugin_v1.0.0_linux_amd64.tar.gz")));

        FallbackInfo info = client.findReleaseWithAsset("acme", "demo", "v2.0.0", "plugin", null);

        assertEquals("v2.0.0", info.getRelease().getTagName());
        assertFalse(info.isWasFallback());
        assertNull(info.getFallbackReason());
    }

    @Test
    void findReleaseWithAsset_retriesTagWithVPrefix() {
        server.addReleases("acme", "demo", release("v1.4.0", asset("plugin_linux_amd64.tar.gz")));

        FallbackInfo info = client.findReleaseWithAsset("acme", "demo", "1.4.0", "plugin", null);

        assertEquals("v1.4.0", info.getRelease().getTagName());
    }

    @Test
    void findReleaseWithAsset_latestSkipsReleasesWithoutAsset() {
        server.addReleases("acme", "demo",
                release("v3.0.0", asset("plugin_v3.0.0_darwin_arm64.tar.gz")),
                release("v2.0.0", asset("plugin_v2.0.0_linux_amd64.tar.gz")));

        FallbackInfo info = client.findReleaseWithAsset("acme", "demo", null, "plugin", null);

        assertEquals("v2.0.0", info.getRelease().getTagName());
        assertFalse(info.isWasFallback());
        assertEquals("", info.getRequestedVersion());
    }

    @Test
    void findReleaseWithAsset_unknownTagIsNotFound() {
        server.addReleases("acme", "demo", release("v1.0.0", asset("plugin_linux_amd64.tar.gz")));

        RegistryException e = assertThrows(RegistryException.class,
                () -> client.findReleaseWithAsset("acme", "demo", "v5.0.0", "plugin", null));
        assertEquals(Kind.RELEASE_NOT_FOUND, e.getKind());
    }

    @Test
    void findReleaseWithAsset_noCompatibleAssetAnywhere() {
        server.addReleases("acme", "demo",
                release("v2.0.0", asset("plugin_windows_amd64.zip")),
                release("v1.0.0", asset("plugin_darwin_arm64.tar.gz")));

        RegistryException e = assertThrows(RegistryException.class,
                () -> client.findReleaseWithAsset("acme", "demo", "v2.0.0", "plugin", null));
        assertEquals(Kind.NO_COMPATIBLE_ASSET, e.getKind());
        assertTrue(e.getMessage().contains("linux/amd64"), e.getMessage());
    }

    @Test
    void findReleaseWithFallbackInfo_withoutFallbackFailsFast() {
        server.addReleases("acme", "demo",
                release("v2.0.0", asset("plugin_windows_amd64.zip")),
                release("v1.0.0", asset("plugin_linux_amd64.tar.gz")));

        RegistryException e = assertThrows(RegistryException.class,
                () -> client.findReleaseWithFallbackInfo("acme", "demo", "v2.0.0", "plugin", null, false));
        assertEquals(Kind.NO_COMPATIBLE_ASSET, e.getKind());
    }

    @Test
    void fetchRelease_nullAssetsMeanNoAssets() throws IOException {
        String payload = "{\"tag_name\":\"v1.0.0\",\"assets\":null}";
        String withNullEntry = "{\"tag_name\":\"v1.1.0\",\"assets\":[null,"
                + "{\"name\":\"plugin_v1.1.0_linux_amd64.tar.gz\",\"browser_download_url\":\"https://downloads.invalid/p\"}]}";
        try (ReleaseServer other = new ReleaseServer()) {
            GitHubRelease empty = client.fetchRelease(
                    other.serveFile("empty.json", payload.getBytes(StandardCharsets.UTF_8)), "acme/demo");
            GitHubRelease sparse = client.fetchRelease(
                    other.serveFile("sparse.json", withNullEntry.getBytes(StandardCharsets.UTF_8)), "acme/demo");

            assertNotNull(empty.getAssets());
            assertTrue(empty.getAssets().isEmpty());
            assertNull(client.findPlatformAsset(empty, "plugin", null));
            assertEquals(1, sparse.getAssets().size());
            assertNotNull(client.findPlatformAsset(sparse, "plugin", null));
        }

        GitHubRelease built = GitHubRelease.builder().tagName("v1.0.0").assets(null).build();
        assertNull(client.findPlatformAsset(built, "plugin", null));
    }

    @Test
    void findPlatformAsset_matchingRules() {
        GitHubRelease r = release("v1.0.0",
                asset("checksums.txt"),
                asset("plugin_v1.0.0_linux_amd64.tar.gz.sha256"),
                asset("other_v1.0.0_linux_amd64.tar.gz"),
                asset("plugin_v1.0.0_linux_arm64.tar.gz"),
                asset("Plugin_v1.0.0_Linux_x86_64.zip"));

        ReleaseAsset found = client.findPlatformAsset(r, "plugin", null);

        assertNotNull(found);
        assertEquals("Plugin_v1.0.0_Linux_x86_64.zip", found.getName());
        assertNull(client.findPlatformAsset(r, "missing", null));
    }

    @Test
    void findPlatformAsset_prefersRegionAndHonorsPrefixHint() {
        GitHubRelease r = release("v1.0.0",
                asset("finfocus-plugin-aws-public_v1.0.0_linux_amd64.tar.gz"),
                asset("finfocus-plugin-aws-public_v1.0.0_linux_amd64_eu-west-1.tar.gz"),
                asset("finfocus-plugin-aws-public_v1.0.0_linux_amd64_us-east-1.tar.gz"));
        AssetNamingHints euHints = AssetNamingHints.builder()
                .assetPrefix("finfocus-plugin-aws-public")
                .region("eu-west-1")
                .build();

        assertEquals("finfocus-plugin-aws-public_v1.0.0_linux_amd64_eu-west-1.tar.gz",
                client.findPlatformAsset(r, "ignored-by-hint", euHints).getName());

        AssetNamingHints unknownRegion = AssetNamingHints.builder().region("ap-south-2").build();
        assertEquals("finfocus-plugin-aws-public_v1.0.0_linux_amd64.tar.gz",
                client.findPlatformAsset(r, "aws-public", unknownRegion).getName());
    }

    @Test
    void findPlatformAsset_windowsPlatform() {
        ReleaseClient windows = new ReleaseClient(HttpClient.newHttpClient(), "http://localhost", null,
                Platform.of("windows", "amd64"));
        GitHubRelease r = release("v1.0.0",
                asset("plugin_linux_amd64.tar.gz"),
                asset("plugin_windows_amd64.zip"));

        assertEquals("plugin_windows_amd64.zip", windows.findPlatformAsset(r, "plugin", null).getName());
    }

    @Test
    void findPlatformAsset_armDoesNotTakeArm64() {
        ReleaseClient arm = new ReleaseClient(HttpClient.newHttpClient(), "http://localhost", null,
                Platform.of("linux", "arm"));
        GitHubRelease onlyArm64 = release("v1.0.0", asset("plugin_linux_arm64.tar.gz"));
        GitHubRelease both = release("v1.0.0",
                asset("plugin_linux_arm64.tar.gz"),
                asset("plugin_linux_armv7.tar.gz"));

        assertNull(arm.findPlatformAsset(onlyArm64, "plugin", null));
        assertEquals("plugin_linux_armv7.tar.gz", arm.findPlatformAsset(both, "plugin", null).getName());
    }

    @Test
    void findReleaseForConstraint_picksHighestSatisfyingWithAsset() {
        server.addReleases("acme", "demo",
                release("v2.0.0", asset("plugin_linux_amd64.tar.gz")),
                release("v1.5.0", asset("plugin_windows_amd64.zip")),
                release("v1.4.2", asset("plugin_linux_amd64.tar.gz")),
                release("nightly", asset("plugin_linux_amd64.tar.gz")),
                release("v1.1.0", asset("plugin_linux_amd64.tar.gz")));

        FallbackInfo info = client.findReleaseForConstraint("acme", "demo",
                Semver.parseVersionConstraint("^1.0"), "plugin", null);

        assertEquals("v1.4.2", info.getRelease().getTagName());
        assertFalse(info.isWasFallback());
        assertEquals("^1.0", info.getRequestedVersion());

        RegistryException e = assertThrows(RegistryException.class, () -> client.findReleaseForConstraint(
                "acme", "demo", Semver.parseVersionConstraint(">=3.0.0"), "plugin", null));
        assertEquals(Kind.NO_COMPATIBLE_ASSET, e.getKind());
    }

    // =========================================================================
    // Download
    // =========================================================================

    @Test
    void downloadAsset_streamsToDiskAndReportsProgress(@TempDir Path tempDir) throws IOException {
        byte[] body = new byte[100_000];
        for (int i = 0; i < body.length; i++) {
            body[i] = (byte) (i % 251);
        }
        String url = server.serveFile("plugin_linux_amd64.tar.gz", body);
        Path dest = tempDir.resolve("nested/plugin.tar.gz");
        List<long[]> updates = new ArrayList<>();

        long written = client.downloadAsset(url, dest, (done, total) -> updates.add(new long[] { done, total }));

        assertEquals(body.length, written);
        assertArrayEquals(body, Files.readAllBytes(dest));
        assertFalse(updates.isEmpty());
        long[] last = updates.get(updates.size() - 1);
        assertEquals(body.length, last[0]);
        assertEquals(body.length, last[1]);
    }

    @Test
    void downloadAsset_failureLeavesNoFile(@TempDir Path tempDir) {
        Path dest = tempDir.resolve("missing.tar.gz");

        RegistryException e = assertThrows(RegistryException.class,
                () -> client.downloadAsset(server.downloadUrl("missing.tar.gz"), dest, null));
        assertEquals(Kind.RELEASE_NOT_FOUND, e.getKind());
        assertFalse(Files.exists(dest));
    }

    @Test
    void downloadAsset_interruptedThreadIsCancelled(@TempDir Path tempDir) {
        String url = server.serveFile("big.tar.gz", new byte[256 * 1024]);
        Path dest = tempDir.resolve("big.tar.gz");

        Thread.currentThread().interrupt();
        try {
            RegistryException e = assertThrows(RegistryException.class, () -> client.downloadAsset(url, dest, null));
            assertEquals(Kind.CANCELLED, e.getKind());
        } finally {
            Thread.interrupted();
        }
        assertFalse(Files.exists(dest));
    }

    @Test
    void token_sentToApiButNotToForeignAssetHost(@TempDir Path tempDir) throws Exception {
        try (ReleaseServer assetHost = new ReleaseServer()) {
            ReleaseClient authed = server.client("secret-token");
            server.addReleases("acme", "demo", release("v1.0.0"));
            String foreignUrl = assetHost.serveFile("plugin.tar.gz", new byte[] { 1, 2, 3 });

            authed.getLatestRelease("acme", "demo");
            authed.downloadAsset(foreignUrl, tempDir.resolve("plugin.tar.gz"), null);

            RecordedRequest apiRequest = server.takeRequest();
            assertEquals("Bearer secret-token", apiRequest.getHeader("Authorization"));
            RecordedRequest assetRequest = assetHost.takeRequest();
            assertNull(assetRequest.getHeader("Authorization"));
        }
    }

    private static List<String> tags(List<GitHubRelease> releases) {
        return releases.stream().map(GitHubRelease::getTagName).collect(Collectors.toList());
    }

    @Test
    void platform_isExposed() {
        assertEquals(LINUX_AMD64, client.getPlatform());
    }
}
