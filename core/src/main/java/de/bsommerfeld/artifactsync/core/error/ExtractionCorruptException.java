package de.bsommerfeld.artifactsync.core.error;

import de.bsommerfeld.artifactsync.core.domain.Severity;

/**
 * The staged archive is unreadable, truncated, fails its CRC check or
 * contains an entry that would escape the target directory.
 */
public class ExtractionCorruptException extends SyncException {

    public ExtractionCorruptException(String message) {
        super(message);
    }

    public ExtractionCorruptException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Severity severity() {
        return Severity.ERROR;
    }
}
