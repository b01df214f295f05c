package com.finfocus.plugin.install;

import com.finfocus.common.infra.Semver;
import com.finfocus.plugin.RegistryException;
import com.finfocus.plugin.RegistryException.Kind;

import java.util.regex.Pattern;

/**
 * Parsed install specifier.
 * <p>
 * Accepted forms: {@code name}, {@code name@version}, {@code owner/repo},
 * {@code owner/repo@version}, optionally prefixed with {@code github.com/} or
 * a full {@code https://github.com/} URL. {@code @latest} is the same as no
 * version. The version may be an exact tag ({@code v1.2.3}) or a constraint
 * ({@code ^1.2}, {@code >=1.0.0,<2.0.0}).
 *
 * @param name    local plugin name
 * @param owner   release source owner, null for registry-style specifiers
 * @param repo    release source repository, null for registry-style specifiers
 * @param version requested version or constraint, null for latest
 * @param fromUrl true for owner/repo specifiers
 */
public record PluginSpecifier(String name, String owner, String repo, String version, boolean fromUrl) {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9._-]*$");
    private static final Pattern REPO_SEGMENT = Pattern.compile("^[A-Za-z0-9_.-]+$");
    private static final Pattern EXACT_VERSION = Pattern.compile("^v?\\d+\\.\\d+\\.\\d+(?:[-+].*)?$");
    private static final String GITHUB_PREFIX = "github.com/";
    private static final String LATEST = "latest";

    /**
     * @throws RegistryException INVALID_SPECIFIER for malformed input,
     *         INVALID_CONSTRAINT for an unparsable version constraint
     */
    public static PluginSpecifier parse(String specifier) {
        if (specifier == null || specifier.isBlank()) {
            throw invalid("plugin specifier is empty");
        }
        String input = specifier.trim();
        String rest = input.replaceFirst("^https?://", "");
        boolean hadHost = rest.startsWith(GITHUB_PREFIX);
        if (hadHost) {
            rest = rest.substring(GITHUB_PREFIX.length());
        }

        String version = null;
        int at = rest.lastIndexOf('@');
        if (at >= 0) {
            version = rest.substring(at + 1).trim();
            rest = rest.substring(0, at).trim();
            if (version.isEmpty()) {
                throw invalid("empty version in specifier: " + specifier);
            }
            if (LATEST.equalsIgnoreCase(version)) {
                version = null;
            }
        }

        PluginSpecifier parsed;
        if (rest.contains("/") || hadHost) {
            String[] ownerRepo = parseOwnerRepo(rest);
            String name = stripPluginPrefix(ownerRepo[1]);
            checkName(name, specifier);
            parsed = new PluginSpecifier(name, ownerRepo[0], ownerRepo[1], version, true);
        } else {
            checkName(rest, specifier);
            parsed = new PluginSpecifier(rest, null, null, version, false);
        }

        if (parsed.hasVersion() && !parsed.isExactVersion()) {
            parsed.constraint();
        }
        return parsed;
    }

    /**
     * Split {@code owner/repo}; both parts must be plain, non-empty path segments.
     *
     * @throws RegistryException INVALID_SPECIFIER otherwise
     */
    public static String[] parseOwnerRepo(String input) {
        if (input == null || input.isBlank()) {
            throw invalid("repository is empty, expected owner/repo");
        }
        String[] parts = input.trim().split("/", -1);
        if (parts.length != 2 || !isRepoSegment(parts[0].trim()) || !isRepoSegment(parts[1].trim())) {
            throw invalid("invalid repository '" + input + "', expected owner/repo");
        }
        return new String[] { parts[0].trim(), parts[1].trim() };
    }

    private static boolean isRepoSegment(String segment) {
        return REPO_SEGMENT.matcher(segment).matches() && !segment.equals(".") && !segment.equals("..");
    }

    public boolean hasVersion() {
        return version != null;
    }

    /**
     * True when the version names one release rather than a range.
     */
    public boolean isExactVersion() {
        return version != null && EXACT_VERSION.matcher(version).matches() && Semver.isValidVersion(version);
    }

    /**
     * @throws RegistryException INVALID_CONSTRAINT if the version is not a constraint
     */
    public Semver.Constraint constraint() {
        try {
            return Semver.parseVersionConstraint(version);
        } catch (Semver.SemverError e) {
            throw new RegistryException(Kind.INVALID_CONSTRAINT,
                    "invalid version constraint '" + version + "' for plugin " + name + ": " + e.getMessage(), e);
        }
    }

    private static String stripPluginPrefix(String repo) {
        String prefix = "finfocus-plugin-";
        return repo.startsWith(prefix) && repo.length() > prefix.length() ? repo.substring(prefix.length()) : repo;
    }

    /**
     * @throws RegistryException INVALID_SPECIFIER if {@code name} is not a
     *         plain plugin name usable as a directory name
     */
    static void requireValidName(String name) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw invalid("invalid plugin name '" + name + "'");
        }
    }

    private static void checkName(String name, String specifier) {
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw invalid("invalid plugin name '" + name + "' in specifier: " + specifier);
        }
    }

    private static RegistryException invalid(String message) {
        return new RegistryException(Kind.INVALID_SPECIFIER, message);
    }
}
