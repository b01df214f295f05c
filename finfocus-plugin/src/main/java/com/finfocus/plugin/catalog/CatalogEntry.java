package com.finfocus.plugin.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.finfocus.plugin.release.AssetNamingHints;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One plugin known to the embedded catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogEntry {
    /** Catalog key; filled in on load. */
    private String name;
    private String description;
    /** {@code owner/repo} of the release source. */
    private String repository;
    private String author;
    private String license;
    /** official, community or experimental. */
    private String securityLevel;
    @Builder.Default
    private List<String> supportedProviders = new ArrayList<>();
    private AssetHints assetHints;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AssetHints {
        private String assetPrefix;
        private String defaultRegion;
    }

    public String getOwner() {
        return repository.substring(0, repository.indexOf('/'));
    }

    public String getRepo() {
        return repository.substring(repository.indexOf('/') + 1);
    }

    /**
     * Naming hints for release asset selection, or null without hints.
     */
    public AssetNamingHints toNamingHints() {
        if (assetHints == null) {
            return null;
        }
        return AssetNamingHints.builder()
                .assetPrefix(assetHints.getAssetPrefix())
                .region(assetHints.getDefaultRegion())
                .build();
    }
}
