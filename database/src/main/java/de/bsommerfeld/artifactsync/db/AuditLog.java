package de.bsommerfeld.artifactsync.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.artifactsync.core.domain.AuditCategory;
import de.bsommerfeld.artifactsync.core.domain.AuditEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Append-only audit sink. Every entry goes to the {@code audit_log} table
 * and is mirrored to SLF4J at the matching level.
 *
 * <p>
 * A failed insert is logged and dropped. Losing an audit row must not turn
 * a successful sync into a failed one.
 */
@Singleton
public class AuditLog {

    private static final Logger LOG = LoggerFactory.getLogger(AuditLog.class);

    private final DatabaseService database;

    @Inject
    public AuditLog(DatabaseService database) {
        this.database = database;
    }

    public void record(AuditEntry entry) {
        mirror(entry);
        try {
            database.appendAudit(entry);
        } catch (DatabaseException e) {
            LOG.error("Failed to persist audit entry [{}] {}", entry.category().dbValue(), entry.detail(), e);
        }
    }

    public void info(Long branchId, AuditCategory category, String detail) {
        record(AuditEntry.info(branchId, category, detail));
    }

    public void warning(Long branchId, AuditCategory category, String detail) {
        record(AuditEntry.warning(branchId, category, detail));
    }

    public void error(Long branchId, AuditCategory category, String detail) {
        record(AuditEntry.error(branchId, category, detail));
    }

    /** Newest first; {@code branchId == null} means all branches. */
    public List<AuditEntry> recent(Long branchId, int limit) {
        return database.getRecentAudit(branchId, limit);
    }

    private static void mirror(AuditEntry entry) {
        String scope = entry.branchId() == null ? "[cycle]" : "[branch " + entry.branchId() + "]";
        switch (entry.severity()) {
            case INFO -> LOG.info("{} [{}] {}", scope, entry.category().dbValue(), entry.detail());
            case WARNING -> LOG.warn("{} [{}] {}", scope, entry.category().dbValue(), entry.detail());
            case ERROR -> LOG.error("{} [{}] {}", scope, entry.category().dbValue(), entry.detail());
        }
    }
}
