package de.bsommerfeld.artifactsync.db;

/**
 * Unchecked wrapper for a failed database operation on engine-owned state.
 * Callers inside a branch job let it surface so the job ends in a failed
 * state instead of reporting a commit that never happened.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
