package de.bsommerfeld.artifactsync.core.error;

import de.bsommerfeld.artifactsync.core.domain.Severity;

/**
 * The component/branch catalog could not be read. The whole cycle is
 * deferred to the next interval.
 */
public class CatalogUnavailableException extends SyncException {

    public CatalogUnavailableException(String message) {
        super(message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Severity severity() {
        return Severity.ERROR;
    }
}
