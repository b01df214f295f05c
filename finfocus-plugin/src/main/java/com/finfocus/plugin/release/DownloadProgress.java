package com.finfocus.plugin.release;

/**
 * Byte-level download progress callback.
 */
@FunctionalInterface
public interface DownloadProgress {

    /**
     * @param downloaded bytes written so far
     * @param total      declared length, or -1 when the server sent none
     */
    void onProgress(long downloaded, long total);
}
