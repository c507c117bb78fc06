package de.bsommerfeld.artifactsync.engine;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.artifactsync.core.config.SyncSettings;
import de.bsommerfeld.artifactsync.core.domain.SyncTarget;
import de.bsommerfeld.artifactsync.core.event.ApplicationEventBus;
import de.bsommerfeld.artifactsync.db.AuditLog;
import de.bsommerfeld.artifactsync.db.VersionLedger;
import de.bsommerfeld.artifactsync.engine.extract.ArchiveExtractor;
import de.bsommerfeld.artifactsync.engine.staging.RetentionManager;
import de.bsommerfeld.artifactsync.repository.RepositoryClient;

import java.time.Clock;
import java.util.function.BooleanSupplier;

/** Creates jobs bound to the shared services and a cycle's settings snapshot. */
@Singleton
public class BranchSyncJobFactory {

    private final VersionLedger ledger;
    private final RetentionManager retention;
    private final AuditLog auditLog;
    private final ArchiveExtractor extractor;
    private final BranchLocks locks;
    private final ApplicationEventBus eventBus;
    private final Clock clock;

    @Inject
    public BranchSyncJobFactory(VersionLedger ledger, RetentionManager retention, AuditLog auditLog,
            ArchiveExtractor extractor, BranchLocks locks, ApplicationEventBus eventBus, Clock clock) {
        this.ledger = ledger;
        this.retention = retention;
        this.auditLog = auditLog;
        this.extractor = extractor;
        this.locks = locks;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public BranchSyncJob create(SyncTarget target, SyncSettings settings, RepositoryClient client,
            BooleanSupplier cancelled) {
        return new BranchSyncJob(target, settings, client, cancelled, ledger, retention, auditLog, extractor,
                locks, eventBus, clock);
    }
}
