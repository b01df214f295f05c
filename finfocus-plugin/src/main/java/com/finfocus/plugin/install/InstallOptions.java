package com.finfocus.plugin.install;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstallOptions {
    /** Reinstall even if the version is already present. */
    private boolean force;
    /** Skip writing the install record. */
    private boolean noSave;
    /** Remove every other installed version afterwards. */
    private boolean clean;
    /** Accept an older release when the requested one has no asset for this platform. */
    private boolean fallbackToLatest;
    /** Never consider another release than the requested one. */
    private boolean noFallback;
    /** Plugin root override; null means the installer's root. */
    private Path pluginDir;
    /** Written to plugin.metadata.json when non-empty, e.g. region. */
    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();
}
