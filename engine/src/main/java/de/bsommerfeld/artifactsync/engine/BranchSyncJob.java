package de.bsommerfeld.artifactsync.engine;

import de.bsommerfeld.artifactsync.core.config.SyncSettings;
import de.bsommerfeld.artifactsync.core.domain.AuditCategory;
import de.bsommerfeld.artifactsync.core.domain.AuditEntry;
import de.bsommerfeld.artifactsync.core.domain.Branch;
import de.bsommerfeld.artifactsync.core.domain.BuildReference;
import de.bsommerfeld.artifactsync.core.domain.LedgerEntry;
import de.bsommerfeld.artifactsync.core.domain.PackagingRequest;
import de.bsommerfeld.artifactsync.core.domain.RetainedBuild;
import de.bsommerfeld.artifactsync.core.domain.SyncTarget;
import de.bsommerfeld.artifactsync.core.error.StagingFilesystemException;
import de.bsommerfeld.artifactsync.core.error.SyncException;
import de.bsommerfeld.artifactsync.core.error.VersionExhaustedException;
import de.bsommerfeld.artifactsync.core.event.ApplicationEventBus;
import de.bsommerfeld.artifactsync.core.event.SyncEvents.BuildStagedEvent;
import de.bsommerfeld.artifactsync.core.util.ByteFormatter;
import de.bsommerfeld.artifactsync.db.AuditLog;
import de.bsommerfeld.artifactsync.db.VersionLedger;
import de.bsommerfeld.artifactsync.engine.extract.ArchiveExtractor;
import de.bsommerfeld.artifactsync.engine.extract.ExtractionResult;
import de.bsommerfeld.artifactsync.engine.staging.RetentionManager;
import de.bsommerfeld.artifactsync.engine.staging.StagingLayout;
import de.bsommerfeld.artifactsync.repository.BuildCandidate;
import de.bsommerfeld.artifactsync.repository.RepositoryClient;
import de.bsommerfeld.artifactsync.repository.download.HashUtil;
import de.bsommerfeld.artifactsync.repository.pattern.PatternResolver;
import de.bsommerfeld.artifactsync.repository.pattern.ResolvedPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * One synchronization attempt for one branch.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Acquire the branch lock, otherwise skip. A scheduler that queues the
 * job takes the lock at dispatch through {@link #reserve()} instead.</li>
 * <li>Sweep leftovers of an interrupted run.</li>
 * <li>Resolve the path template and list build candidates.</li>
 * <li>Record the check time; stop if nothing is newer than the ledger.</li>
 * <li>Work out the proposed version, so a branch version that cannot advance
 * fails before anything is written.</li>
 * <li>Download, extract, commit, publish the packaging request, retain.</li>
 * </ol>
 * A committed build is always registered with retention, even if publishing
 * its packaging request throws.
 *
 * <h3>Failure</h3>
 * A {@link SyncException} is audited at its own severity and ends the job in
 * {@link JobState#FAILED} without touching the ledger. Any other runtime
 * exception is logged with stack trace and audited as an error. Nothing
 * escapes {@link #run()}.
 *
 * <h3>Cancellation</h3>
 * The shutdown flag is honored before checking and before downloading.
 * Once the download starts the job runs to its end so no extraction is cut
 * short.
 */
public class BranchSyncJob {

    private static final Logger LOG = LoggerFactory.getLogger(BranchSyncJob.class);

    private final SyncTarget target;
    private final SyncSettings settings;
    private final RepositoryClient client;
    private final BooleanSupplier cancelled;
    private final StagingLayout layout;

    private final VersionLedger ledger;
    private final RetentionManager retention;
    private final AuditLog auditLog;
    private final ArchiveExtractor extractor;
    private final BranchLocks locks;
    private final ApplicationEventBus eventBus;
    private final Clock clock;

    private volatile JobState state = JobState.IDLE;
    private boolean reserved;

    BranchSyncJob(SyncTarget target, SyncSettings settings, RepositoryClient client, BooleanSupplier cancelled,
            VersionLedger ledger, RetentionManager retention, AuditLog auditLog, ArchiveExtractor extractor,
            BranchLocks locks, ApplicationEventBus eventBus, Clock clock) {
        this.target = target;
        this.settings = settings;
        this.client = client;
        this.cancelled = cancelled;
        this.layout = new StagingLayout(settings.baseDirectory());
        this.ledger = ledger;
        this.retention = retention;
        this.auditLog = auditLog;
        this.extractor = extractor;
        this.locks = locks;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public SyncTarget target() {
        return target;
    }

    public JobState state() {
        return state;
    }

    /**
     * Takes the branch lock ahead of {@link #run()}, for a caller that hands
     * the job to a queue. A held lock is audited as a skip.
     *
     * @return {@code false} if another job holds the branch
     */
    boolean reserve() {
        if (!locks.tryAcquire(target.branchId())) {
            auditSkipped();
            return false;
        }
        reserved = true;
        return true;
    }

    /** Gives back a lock taken by {@link #reserve()} for a job that will not run. */
    void releaseReservation() {
        if (reserved) {
            reserved = false;
            locks.release(target.branchId());
        }
    }

    public JobOutcome run() {
        long branchId = target.branchId();
        if (cancelled.getAsBoolean()) {
            LOG.debug("Skipping {}: shutting down", target.label());
            releaseReservation();
            return JobOutcome.SKIPPED_SHUTDOWN;
        }
        if (!reserved && !locks.tryAcquire(branchId)) {
            auditSkipped();
            return JobOutcome.SKIPPED_IN_PROGRESS;
        }
        reserved = false;

        try {
            return execute();
        } catch (SyncException e) {
            JobState failedIn = state;
            transition(JobState.FAILED);
            auditLog.record(new AuditEntry(clock.instant(), e.severity(), branchId, AuditCategory.ERROR,
                    "Failed while " + failedIn.label() + ": " + e.getMessage()));
            return JobOutcome.FAILED;
        } catch (RuntimeException e) {
            JobState failedIn = state;
            transition(JobState.FAILED);
            LOG.error("Unexpected failure syncing {} while {}", target.label(), failedIn.label(), e);
            auditLog.error(branchId, AuditCategory.ERROR,
                    "Unexpected failure while " + failedIn.label() + ": " + e);
            return JobOutcome.FAILED;
        } finally {
            transition(JobState.IDLE);
            locks.release(branchId);
        }
    }

    // =====================================================================
    // Pipeline
    // =====================================================================

    private JobOutcome execute() throws SyncException {
        long branchId = target.branchId();

        transition(JobState.CHECKING);
        layout.sweep(target);

        ResolvedPattern pattern = PatternResolver.resolve(target, settings.defaultPathTemplate());
        List<BuildCandidate> candidates = client.listCandidates(pattern);
        ledger.touchChecked(branchId, clock.instant());

        Optional<BuildReference> current = ledger.read(branchId).flatMap(LedgerEntry::latest);
        Optional<BuildCandidate> newest = BuildCandidate.newest(candidates);
        if (newest.isEmpty() || !newest.get().build().isNewerThan(current.orElse(null))) {
            transition(JobState.UP_TO_DATE);
            auditLog.info(branchId, AuditCategory.DETECT, newest.isEmpty()
                    ? "No builds found under " + pattern.listingPrefix()
                    : "Up to date at " + current.map(BuildReference::toString).orElse("-"));
            return JobOutcome.UP_TO_DATE;
        }

        BuildCandidate candidate = newest.get();
        BuildReference build = candidate.build();
        auditLog.info(branchId, AuditCategory.DETECT, "New build " + build + " (ledger at "
                + current.map(BuildReference::toString).orElse("none") + ")");
        String proposedVersion = proposedVersion();

        if (cancelled.getAsBoolean()) {
            LOG.info("Shutdown requested, not downloading {} for {}", build, target.label());
            return JobOutcome.SKIPPED_SHUTDOWN;
        }

        transition(JobState.DOWNLOADING);
        Path archive = layout.archivePath(target, build, candidate.fileName());
        long size = client.download(candidate, archive);
        String sha256 = checksum(archive);
        auditLog.info(branchId, AuditCategory.DOWNLOAD,
                "Downloaded " + candidate.fileName() + " (" + ByteFormatter.format(size) + ")");

        transition(JobState.EXTRACTING);
        Path extracted = layout.extractedPath(target, build);
        ExtractionResult result = extractor.extract(archive, extracted);
        auditLog.info(branchId, AuditCategory.EXTRACT, "Extracted " + result.files() + " files ("
                + ByteFormatter.format(result.bytes()) + ") to " + extracted);

        transition(JobState.COMMITTING);
        Instant committedAt = clock.instant();
        PackagingRequest request = new PackagingRequest(target.component().id(), branchId, build, extracted,
                target.branch().version().render(), proposedVersion, committedAt);
        RetainedBuild retained = new RetainedBuild(branchId, build, archive, extracted, size, sha256, committedAt);
        if (!ledger.commit(branchId, build, committedAt)) {
            // the ledger audited the rejection
            return JobOutcome.UP_TO_DATE;
        }
        try {
            eventBus.post(new BuildStagedEvent(request));
        } finally {
            transition(JobState.RETAINING);
            retention.retain(branchId, retained, settings.retentionCount());
        }
        return JobOutcome.SYNCED;
    }

    private String proposedVersion() throws VersionExhaustedException {
        Branch branch = target.branch();
        try {
            return branch.autoIncrement().next(branch.version()).render();
        } catch (IllegalStateException e) {
            throw new VersionExhaustedException(e.getMessage(), e);
        }
    }

    private void auditSkipped() {
        auditLog.info(target.branchId(), AuditCategory.DETECT, "Sync already in progress, skipped");
    }

    private static String checksum(Path archive) throws StagingFilesystemException {
        try {
            return HashUtil.sha256(archive);
        } catch (IOException e) {
            throw new StagingFilesystemException("Cannot read staged archive " + archive, e);
        }
    }

    private void transition(JobState next) {
        LOG.debug("{}: {} -> {}", target.label(), state, next);
        state = next;
    }
}
