package de.bsommerfeld.artifactsync.repository.download;

/**
 * Callback for tracking artifact download progress.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    DownloadProgressListener NONE = (bytesRead, totalBytes) -> {
    };

    /**
     * Called after every chunk written to disk.
     *
     * @param bytesRead  bytes transferred so far
     * @param totalBytes expected size, or -1 if unknown
     */
    void onProgress(long bytesRead, long totalBytes);
}
