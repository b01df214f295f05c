package com.finfocus.common.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reading settings out of an environment map. Callers pass the map so tests
 * never depend on the real process environment.
 */
public final class EnvUtils {

    private EnvUtils() {
    }

    private static final Logger log = LoggerFactory.getLogger(EnvUtils.class);
    private static final Set<String> reported = ConcurrentHashMap.newKeySet();
    private static final Set<String> TRUTHY = Set.of("1", "true", "yes", "on");
    private static final int MAX_LOGGED_LENGTH = 120;

    /**
     * Trimmed value of {@code key}, or null when unset or blank.
     */
    public static String get(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Like {@link #get(Map, String)}, and logs the override the first time a
     * key is seen. Secrets are logged as {@code <set>}.
     */
    public static String getAndReport(Map<String, String> env, String key, String purpose, boolean secret) {
        String value = get(env, key);
        if (value != null && reported.add(key)) {
            log.info("Using {} from {}: {}", purpose, key, secret ? "<set>" : abbreviate(value));
        }
        return value;
    }

    /**
     * {@code 1}, {@code true}, {@code yes} and {@code on}, in any case.
     */
    public static boolean isTruthy(String value) {
        return value != null && TRUTHY.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    public static boolean isEnabled(Map<String, String> env, String key) {
        return isTruthy(env.get(key));
    }

    private static String abbreviate(String value) {
        String oneLine = value.replaceAll("\\s+", " ");
        return oneLine.length() <= MAX_LOGGED_LENGTH ? oneLine : oneLine.substring(0, MAX_LOGGED_LENGTH) + "...";
    }

    static void clearReported() {
        reported.clear();
    }
}
