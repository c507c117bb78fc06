package de.bsommerfeld.artifactsync.engine;

/** How a single {@link BranchSyncJob} run ended. */
public enum JobOutcome {

    /** A newer build was staged, extracted and committed. */
    SYNCED,
    /** Nothing newer than the ledger in the repository. */
    UP_TO_DATE,
    /** Another job for the branch was still running. */
    SKIPPED_IN_PROGRESS,
    /** Shutdown was requested before the job reached a safe boundary. */
    SKIPPED_SHUTDOWN,
    FAILED
}
