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
public class UpdateResult {
    private String name;
    private String oldVersion;
    private String newVersion;
    private boolean wasUpToDate;
    private boolean dryRun;
    /** Directory of the new version; null when nothing was installed. */
    private Path path;
}
