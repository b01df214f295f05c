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
public class UpdateOptions {
    /** Report the target version without installing it. */
    private boolean dryRun;
    /** Pin the target to this tag instead of the latest release. */
    private String version;
    private Path pluginDir;
}
