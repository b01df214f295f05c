package com.finfocus.plugin.release;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional hints for picking a release asset: a name prefix that overrides
 * the plugin name, and a region whose assets are preferred.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetNamingHints {
    private String assetPrefix;
    private String region;
}
