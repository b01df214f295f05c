package com.finfocus.plugin.install;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.finfocus.common.infra.JsonFile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Install records: where each plugin was installed from. One file per plugin
 * under {@code <pluginRoot>/.records/}, written only while that plugin's lock
 * is held.
 */
public final class PluginInstallRecord {

    private PluginInstallRecord() {
    }

    static final String RECORDS_DIR = ".records";

    private static final TypeReference<Entry> ENTRY = new TypeReference<>() {
    };

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {
        private String name;
        private String version;
        /** owner/repo */
        private String repository;
        private String installedAt;
    }

    public static Path recordPath(Path pluginRoot, String name) {
        return pluginRoot.resolve(RECORDS_DIR).resolve(name + ".json");
    }

    /**
     * Write (or replace) the record of a plugin, stamping the install time
     * when the entry carries none.
     */
    public static void recordInstall(Path pluginRoot, Entry entry) throws IOException {
        if (entry.getInstalledAt() == null) {
            entry.setInstalledAt(Instant.now().toString());
        }
        JsonFile.save(recordPath(pluginRoot, entry.getName()), entry);
    }

    /**
     * @return the record, or null if absent or unreadable
     */
    public static Entry find(Path pluginRoot, String name) {
        return JsonFile.load(recordPath(pluginRoot, name), ENTRY);
    }

    /**
     * @return true if a record was deleted
     */
    public static boolean remove(Path pluginRoot, String name) throws IOException {
        return Files.deleteIfExists(recordPath(pluginRoot, name));
    }
}
