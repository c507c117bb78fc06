package de.bsommerfeld.artifactsync.engine;

import java.util.Locale;

/**
 * Lifecycle of a {@link BranchSyncJob}.
 *
 * <pre>
 * IDLE → CHECKING → UP_TO_DATE → IDLE
 *                 → DOWNLOADING → EXTRACTING → COMMITTING → RETAINING → IDLE
 * </pre>
 *
 * {@link #FAILED} is reachable from every active state and returns to
 * {@link #IDLE}.
 */
public enum JobState {

    IDLE,
    CHECKING,
    UP_TO_DATE,
    DOWNLOADING,
    EXTRACTING,
    COMMITTING,
    RETAINING,
    FAILED;

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
