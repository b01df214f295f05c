package com.finfocus.plugin.install;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstallResult {
    private String name;
    /** Tag of the installed release. */
    private String version;
    /** Installed version directory. */
    private Path path;
    /** {@code owner/repo} the release came from. */
    private String repository;
    private boolean fromUrl;
    /** An older release was installed because the requested one had no compatible asset. */
    private boolean wasFallback;
    private String requestedVersion;
}
