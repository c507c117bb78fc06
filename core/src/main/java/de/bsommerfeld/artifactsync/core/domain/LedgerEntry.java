package de.bsommerfeld.artifactsync.core.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Latest known build of a branch plus the operator-facing timestamps.
 *
 * <p>
 * A row may exist before the first successful synchronization: a check that
 * found nothing still records {@code lastChecked}. In that state
 * {@code latestBuild} and {@code lastSuccess} are {@code null}.
 *
 * @param branchId    owning branch
 * @param latestBuild newest committed build, or {@code null} if none yet
 * @param lastChecked last time the repository was queried successfully
 * @param lastSuccess last time a build was committed
 */
public record LedgerEntry(long branchId, BuildReference latestBuild, Instant lastChecked, Instant lastSuccess) {

    public static LedgerEntry neverSynced(long branchId) {
        return new LedgerEntry(branchId, null, null, null);
    }

    public Optional<BuildReference> latest() {
        return Optional.ofNullable(latestBuild);
    }

    public LedgerEntry withChecked(Instant at) {
        return new LedgerEntry(branchId, latestBuild, at, lastSuccess);
    }

    public LedgerEntry withCommitted(BuildReference build, Instant at) {
        return new LedgerEntry(branchId, build, at, at);
    }
}
