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
public class RemoveOptions {
    /** Keep each version's plugin.metadata.json and the install record. */
    private boolean keepConfig;
    private Path pluginDir;
}
