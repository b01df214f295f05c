package com.finfocus.plugin.registry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An installed plugin version: identity is (name, version).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginInfo {
    private String name;
    private String version;
    /** Absolute path of the selected executable. */
    private Path path;
    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    /**
     * Region from metadata, or null for region-agnostic plugins.
     */
    public String getRegion() {
        return metadata == null ? null : metadata.get(PluginMetadata.REGION_KEY);
    }
}
