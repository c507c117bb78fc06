package de.bsommerfeld.artifactsync.core.error;

import de.bsommerfeld.artifactsync.core.domain.Severity;

/**
 * The downloaded file does not match the size or checksum the repository
 * reported for it. The partial file is discarded.
 */
public class DownloadIncompleteException extends SyncException {

    public DownloadIncompleteException(String message) {
        super(message);
    }

    public DownloadIncompleteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Severity severity() {
        return Severity.WARNING;
    }
}
