package de.bsommerfeld.artifactsync.core.error;

import de.bsommerfeld.artifactsync.core.domain.Severity;

/**
 * Local filesystem failure while staging or extracting (disk full,
 * permissions, failed rename).
 */
public class StagingFilesystemException extends SyncException {

    public StagingFilesystemException(String message) {
        super(message);
    }

    public StagingFilesystemException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Severity severity() {
        return Severity.ERROR;
    }
}
