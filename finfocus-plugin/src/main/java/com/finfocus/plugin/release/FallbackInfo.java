package com.finfocus.plugin.release;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of release resolution. When {@code wasFallback} is set the release
 * differs from {@code requestedVersion}, which had no compatible asset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FallbackInfo {
    private GitHubRelease release;
    private ReleaseAsset asset;
    private boolean wasFallback;
    /** Empty when the latest release was requested. */
    @Builder.Default
    private String requestedVersion = "";
    private String fallbackReason;
}
