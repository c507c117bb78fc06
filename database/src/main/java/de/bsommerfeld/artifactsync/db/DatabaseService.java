package de.bsommerfeld.artifactsync.db;

import de.bsommerfeld.artifactsync.core.domain.AuditEntry;
import de.bsommerfeld.artifactsync.core.domain.BuildReference;
import de.bsommerfeld.artifactsync.core.domain.CatalogSnapshot;
import de.bsommerfeld.artifactsync.core.domain.LedgerEntry;
import de.bsommerfeld.artifactsync.core.domain.PackagingRequest;
import de.bsommerfeld.artifactsync.core.domain.RetainedBuild;
import de.bsommerfeld.artifactsync.core.error.CatalogUnavailableException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the sync engine. Implementations must be
 * thread-safe: up to {@code max-concurrent-jobs} workers call in at once,
 * each for a different branch.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlDatabaseService}: SQLite, used in production</li>
 * <li>{@link InMemoryDatabaseService}: maps, used by tests</li>
 * </ul>
 *
 * Write operations throw {@link DatabaseException} on failure.
 */
public interface DatabaseService {

    // -- Catalog --

    /**
     * Reads all components and branches in one consistent snapshot.
     *
     * @throws CatalogUnavailableException if the catalog cannot be read
     */
    CatalogSnapshot loadCatalog() throws CatalogUnavailableException;

    // -- Version ledger --

    Optional<LedgerEntry> getLedgerEntry(long branchId);

    /** All ledger rows ordered by branch id. */
    List<LedgerEntry> getLedgerEntries();

    /**
     * Stores {@code build} as the branch's latest build and sets both
     * timestamps to {@code at}, but only if {@code build} is strictly newer
     * than the stored one. The comparison and the write are one atomic step.
     *
     * @return {@code true} if the row was written
     */
    boolean commitLedgerEntry(long branchId, BuildReference build, Instant at);

    /** Records a successful repository check without touching the build. */
    void touchLedgerChecked(long branchId, Instant at);

    // -- Retention / artifact history --

    /** Adds a build to the branch's retention set. Re-adding is harmless. */
    void saveRetainedBuild(RetainedBuild build);

    /** Builds still on disk for the branch, oldest first. */
    List<RetainedBuild> getRetainedBuilds(long branchId);

    /** Drops a build from the retention set, keeping its history row. */
    void markRetainedBuildDeleted(long branchId, BuildReference build, Instant at);

    // -- Audit --

    void appendAudit(AuditEntry entry);

    /**
     * Newest entries first.
     *
     * @param branchId restrict to one branch, or {@code null} for all
     */
    List<AuditEntry> getRecentAudit(Long branchId, int limit);

    // -- Packaging queue --

    void enqueuePackaging(PackagingRequest request);

    /** Pending requests in queue order. */
    List<PackagingRequest> getPendingPackaging();
}
