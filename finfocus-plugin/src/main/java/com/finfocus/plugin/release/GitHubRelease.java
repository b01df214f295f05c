package com.finfocus.plugin.release;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A tagged release as returned by the release API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitHubRelease {
    @JsonProperty("tag_name")
    private String tagName;
    private String name;
    private boolean draft;
    private boolean prerelease;
    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    private List<ReleaseAsset> assets = new ArrayList<>();

    /** Neither draft nor prerelease. */
    @JsonIgnore
    public boolean isStable() {
        return !draft && !prerelease;
    }
}
