package com.finfocus.common.infra;

import java.util.List;
import java.util.Locale;

/**
 * Operating system / architecture pair in release-asset naming convention
 * ({@code linux}, {@code darwin}, {@code windows}; {@code amd64}, {@code arm64}).
 */
public record Platform(String os, String arch) {

    public static final String LINUX = "linux";
    public static final String DARWIN = "darwin";
    public static final String WINDOWS = "windows";

    public static final String AMD64 = "amd64";
    public static final String ARM64 = "arm64";
    public static final String ARM = "arm";

    public Platform {
        os = os == null ? "" : os.toLowerCase(Locale.ROOT);
        arch = arch == null ? "" : arch.toLowerCase(Locale.ROOT);
    }

    public static Platform of(String os, String arch) {
        return new Platform(os, arch);
    }

    /**
     * Resolve the platform of the running JVM.
     */
    public static Platform current() {
        return resolve(System.getProperty("os.name", "unknown"),
                System.getProperty("os.arch", "unknown"));
    }

    static Platform resolve(String osName, String osArch) {
        String name = osName.toLowerCase(Locale.ROOT);
        String os;
        if (name.contains("mac") || name.contains("darwin")) {
            os = DARWIN;
        } else if (name.contains("win")) {
            os = WINDOWS;
        } else if (name.contains("linux")) {
            os = LINUX;
        } else {
            os = name.replaceAll("\\s+", "");
        }

        String a = osArch.toLowerCase(Locale.ROOT);
        String arch = switch (a) {
            case "x86_64", "amd64", "x64" -> AMD64;
            case "aarch64", "arm64" -> ARM64;
            case "arm", "armv7", "armv7l", "armhf" -> ARM;
            case "x86", "i386", "i686" -> "386";
            default -> a;
        };
        return new Platform(os, arch);
    }

    public boolean isWindows() {
        return WINDOWS.equals(os);
    }

    /**
     * Spellings of the OS seen in asset names.
     */
    public List<String> osAliases() {
        return switch (os) {
            case DARWIN -> List.of("darwin", "macos", "apple");
            case WINDOWS -> List.of("windows", "win64");
            default -> List.of(os);
        };
    }

    /**
     * Spellings of the architecture seen in asset names.
     */
    public List<String> archAliases() {
        return switch (arch) {
            case AMD64 -> List.of("amd64", "x86_64");
            case ARM64 -> List.of("arm64", "aarch64");
            case ARM -> List.of("arm", "armv7", "armv6", "armhf");
            default -> List.of(arch);
        };
    }

    /**
     * Whether an asset file name is built for this platform: it must carry an
     * OS alias and an architecture alias as whole tokens, so {@code arm} does
     * not match {@code arm64}.
     */
    public boolean matchesAssetName(String assetName) {
        String lower = assetName.toLowerCase(Locale.ROOT);
        return osAliases().stream().anyMatch(alias -> containsToken(lower, alias))
                && archAliases().stream().anyMatch(alias -> containsToken(lower, alias));
    }

    private static boolean containsToken(String name, String token) {
        if (token.isEmpty()) {
            return false;
        }
        for (int i = name.indexOf(token); i >= 0; i = name.indexOf(token, i + 1)) {
            int end = i + token.length();
            if ((i == 0 || !isTokenChar(name.charAt(i - 1))) && (end == name.length() || !isTokenChar(name.charAt(end)))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTokenChar(char c) {
        return Character.isLetterOrDigit(c);
    }

    /**
     * File name of an executable called {@code base} on this platform.
     */
    public String executableName(String base) {
        return isWindows() ? base + ".exe" : base;
    }

    @Override
    public String toString() {
        return os + "/" + arch;
    }
}
