package de.bsommerfeld.artifactsync.core.error;

import de.bsommerfeld.artifactsync.core.domain.Severity;

/** A listing or download did not finish within the configured timeout. */
public class DownloadTimeoutException extends SyncException {

    public DownloadTimeoutException(String message) {
        super(message);
    }

    public DownloadTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Severity severity() {
        return Severity.WARNING;
    }
}
