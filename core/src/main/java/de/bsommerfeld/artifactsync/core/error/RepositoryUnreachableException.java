package de.bsommerfeld.artifactsync.core.error;

import de.bsommerfeld.artifactsync.core.domain.Severity;

/**
 * The artifact repository could not be reached or rejected the request
 * (connection failure, authentication, unexpected HTTP status).
 */
public class RepositoryUnreachableException extends SyncException {

    public RepositoryUnreachableException(String message) {
        super(message);
    }

    public RepositoryUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Severity severity() {
        return Severity.WARNING;
    }
}
