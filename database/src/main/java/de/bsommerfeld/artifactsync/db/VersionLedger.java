package de.bsommerfeld.artifactsync.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.artifactsync.core.domain.AuditCategory;
import de.bsommerfeld.artifactsync.core.domain.AuditEntry;
import de.bsommerfeld.artifactsync.core.domain.BuildReference;
import de.bsommerfeld.artifactsync.core.domain.LedgerEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Latest known build per branch. The only writer is the branch job that
 * holds the branch lock.
 *
 * <h3>Monotonic commit</h3>
 * {@link #commit} stores a build only if it is strictly newer than the one
 * on record. Anything else is a no-op that leaves a WARNING audit entry; the
 * ledger never goes backwards, even if a stale job races a fresh one.
 */
@Singleton
public class VersionLedger {

    private final DatabaseService database;
    private final AuditLog auditLog;

    @Inject
    public VersionLedger(DatabaseService database, AuditLog auditLog) {
        this.database = database;
        this.auditLog = auditLog;
    }

    /**
     * @return {@code true} if {@code build} became the branch's latest build
     * @throws DatabaseException if the write fails
     */
    public boolean commit(long branchId, BuildReference build, Instant at) {
        if (database.commitLedgerEntry(branchId, build, at)) {
            return true;
        }
        String onRecord = read(branchId).flatMap(LedgerEntry::latest).map(BuildReference::toString).orElse("none");
        auditLog.record(AuditEntry.warning(branchId, AuditCategory.DETECT,
                "Rejected ledger commit of " + build + ": not newer than " + onRecord));
        return false;
    }

    public Optional<LedgerEntry> read(long branchId) {
        return database.getLedgerEntry(branchId);
    }

    public void touchChecked(long branchId, Instant at) {
        database.touchLedgerChecked(branchId, at);
    }

    public List<LedgerEntry> entries() {
        return database.getLedgerEntries();
    }
}
