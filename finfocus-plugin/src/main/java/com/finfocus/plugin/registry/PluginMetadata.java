package com.finfocus.plugin.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.finfocus.common.infra.JsonFile;
import com.finfocus.plugin.RegistryException;
import com.finfocus.plugin.RegistryException.Kind;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The optional {@code plugin.metadata.json} stored next to a plugin binary:
 * a flat string map such as {@code {"region": "us-east-1"}}.
 */
public final class PluginMetadata {

    private PluginMetadata() {
    }

    public static final String FILE_NAME = "plugin.metadata.json";
    public static final String REGION_KEY = "region";

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private static final Pattern REGION_SUFFIX = Pattern.compile("(?:us|eu|ap|sa|ca|me|af|il|mx)-[a-z]+-\\d$");

    /**
     * Read the metadata of a version directory.
     *
     * @throws RegistryException METADATA_NOT_FOUND when the file is absent,
     *         METADATA_INVALID when it is not a JSON object of strings, IO otherwise
     */
    public static Map<String, String> read(Path versionDir) {
        Path file = versionDir.resolve(FILE_NAME);
        try {
            Map<String, String> data = JsonFile.read(file, STRING_MAP);
            if (data == null) {
                throw new RegistryException(Kind.METADATA_INVALID, "metadata is not an object: " + file);
            }
            return new LinkedHashMap<>(data);
        } catch (NoSuchFileException e) {
            throw new RegistryException(Kind.METADATA_NOT_FOUND, "metadata not found: " + file, e);
        } catch (JsonProcessingException e) {
            throw new RegistryException(Kind.METADATA_INVALID,
                    "invalid metadata in " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RegistryException(Kind.IO, "failed to read metadata " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Write metadata (owner-only permissions, trailing newline).
     */
    public static void write(Path versionDir, Map<String, String> metadata) throws IOException {
        JsonFile.save(versionDir.resolve(FILE_NAME), new TreeMap<>(metadata));
    }

    /**
     * Cloud region encoded as a binary-name suffix, e.g.
     * {@code finfocus-plugin-aws-public-us-east-1} gives {@code us-east-1}.
     *
     * @return the region, or null
     */
    public static String parseRegionFromBinaryName(String binaryName) {
        String base = binaryName.toLowerCase(Locale.ROOT);
        if (base.endsWith(".exe")) {
            base = base.substring(0, base.length() - 4);
        }
        Matcher m = REGION_SUFFIX.matcher(base);
        return m.find() ? m.group() : null;
    }

    /**
     * Add registry-side metadata to what a running plugin reports about
     * itself. Keys the plugin already reports are never overwritten.
     *
     * @param reported metadata reported by the plugin, may be null
     * @return the merged map
     */
    public static Map<String, String> mergeRegistryMetadata(Map<String, String> reported, PluginInfo plugin) {
        Map<String, String> merged = reported == null ? new LinkedHashMap<>() : new LinkedHashMap<>(reported);
        if (plugin.getMetadata() != null) {
            plugin.getMetadata().forEach(merged::putIfAbsent);
        }
        return merged;
    }
}
