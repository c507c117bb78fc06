package de.bsommerfeld.artifactsync.core.error;

import de.bsommerfeld.artifactsync.core.domain.Severity;

/**
 * Base of every expected failure of a branch synchronization. Each subtype
 * decides how loudly it is reported; none of them ever escapes a branch job.
 */
public abstract class SyncException extends Exception {

    protected SyncException(String message) {
        super(message);
    }

    protected SyncException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Severity the failure is audited and logged with. */
    public abstract Severity severity();

    /**
     * Whether the failure is expected to go away by itself (network hiccup,
     * timeout). Transient failures are retried on the next cycle without
     * operator attention.
     */
    public boolean isTransient() {
        return severity() == Severity.WARNING;
    }
}
