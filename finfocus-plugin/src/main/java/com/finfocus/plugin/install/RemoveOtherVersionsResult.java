package com.finfocus.plugin.install;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoveOtherVersionsResult {
    private String pluginName;
    private String keptVersion;
    @Builder.Default
    private List<String> removedVersions = new ArrayList<>();
    private long bytesFreed;
}
