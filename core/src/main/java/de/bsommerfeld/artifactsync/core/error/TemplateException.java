package de.bsommerfeld.artifactsync.core.error;

import de.bsommerfeld.artifactsync.core.domain.Severity;

/**
 * A path template cannot be resolved: unknown placeholder, missing value or
 * no build segment. Misconfiguration; the branch is skipped for the cycle.
 */
public class TemplateException extends SyncException {

    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Severity severity() {
        return Severity.ERROR;
    }
}
