package com.finfocus.common.config;

import com.finfocus.common.infra.EnvUtils;

import java.nio.file.Path;
import java.util.Map;

/**
 * Where finfocus keeps its state, and the few settings read from the
 * environment. Every resolver has an overload taking the environment map and
 * home directory explicitly.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static final String ENV_HOME = "FINFOCUS_HOME";
    public static final String ENV_PLUGIN_DIR = "FINFOCUS_PLUGIN_DIR";
    public static final String ENV_LEGACY_NAMING = "FINFOCUS_LOG_LEGACY";
    public static final String ENV_GITHUB_TOKEN = "GITHUB_TOKEN";
    public static final String ENV_GITHUB_API_URL = "FINFOCUS_GITHUB_API_URL";

    public static final String DEFAULT_GITHUB_API_URL = "https://api.github.com";

    private static final String STATE_DIR = ".finfocus";
    private static final String PLUGINS_DIR = "plugins";

    // =========================================================================
    // Directories
    // =========================================================================

    /**
     * {@code $FINFOCUS_HOME}, else {@code ~/.finfocus}.
     */
    public static Path resolveHomeDir() {
        return resolveHomeDir(System.getenv(), userHome());
    }

    public static Path resolveHomeDir(Map<String, String> env, String homedir) {
        String override = EnvUtils.getAndReport(env, ENV_HOME, "state directory", false);
        return override == null ? Path.of(homedir, STATE_DIR) : resolveUserPath(override, homedir);
    }

    /**
     * Root holding {@code <name>/<version>/} installs: {@code $FINFOCUS_PLUGIN_DIR},
     * else {@code plugins/} under the home directory.
     */
    public static Path resolvePluginDir() {
        return resolvePluginDir(System.getenv(), userHome());
    }

    public static Path resolvePluginDir(Map<String, String> env, String homedir) {
        String override = EnvUtils.getAndReport(env, ENV_PLUGIN_DIR, "plugin directory", false);
        return override == null ? resolveHomeDir(env, homedir).resolve(PLUGINS_DIR) : resolveUserPath(override, homedir);
    }

    // =========================================================================
    // Release API
    // =========================================================================

    /**
     * API base URL without a trailing slash.
     */
    public static String resolveGitHubApiUrl(Map<String, String> env) {
        String url = EnvUtils.getAndReport(env, ENV_GITHUB_API_URL, "release API", false);
        if (url == null) {
            return DEFAULT_GITHUB_API_URL;
        }
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    /**
     * @return the bearer token, or null for anonymous access
     */
    public static String resolveGitHubToken(Map<String, String> env) {
        return EnvUtils.getAndReport(env, ENV_GITHUB_TOKEN, "release API token", true);
    }

    // =========================================================================
    // Toggles
    // =========================================================================

    /**
     * Opt-in search for {@code pulumicost-plugin-<name>} binaries.
     */
    public static boolean isLegacyNamingEnabled(Map<String, String> env) {
        return EnvUtils.isEnabled(env, ENV_LEGACY_NAMING);
    }

    public static boolean isLegacyNamingEnabled() {
        return isLegacyNamingEnabled(System.getenv());
    }

    /**
     * Absolute, normalized path for user input; a leading {@code ~} means
     * {@code homedir}. Blank input gives the empty path.
     */
    public static Path resolveUserPath(String input, String homedir) {
        String trimmed = input == null ? "" : input.trim();
        if (trimmed.isEmpty()) {
            return Path.of("");
        }
        Path path;
        if (trimmed.equals("~")) {
            path = Path.of(homedir);
        } else if (trimmed.startsWith("~/") || trimmed.startsWith("~\\")) {
            path = Path.of(homedir, trimmed.substring(2));
        } else {
            path = Path.of(trimmed);
        }
        return path.toAbsolutePath().normalize();
    }

    private static String userHome() {
        return System.getProperty("user.home");
    }
}
