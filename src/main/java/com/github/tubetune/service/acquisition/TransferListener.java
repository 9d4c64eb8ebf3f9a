package com.github.tubetune.service.acquisition;

/**
 * Byte-level transfer progress.
 */
@FunctionalInterface
public interface TransferListener {

    TransferListener NONE = (transferredBytes, totalBytes) -> { };

    /**
     * @param transferredBytes Bytes written so far
     * @param totalBytes Expected total, {@code -1} when unknown
     */
    void onProgress(long transferredBytes, long totalBytes);
}
