package de.bsommerfeld.artifactsync.core.error;

import de.bsommerfeld.artifactsync.core.domain.Severity;

/**
 * The branch version cannot be advanced by its auto-increment policy because
 * the part to advance is at its maximum. Needs an administrator to reset the
 * branch version; nothing is downloaded until then.
 */
public class VersionExhaustedException extends SyncException {

    public VersionExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Severity severity() {
        return Severity.ERROR;
    }
}
