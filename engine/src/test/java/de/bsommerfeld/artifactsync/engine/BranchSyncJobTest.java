package de.bsommerfeld.artifactsync.engine;

import de.bsommerfeld.artifactsync.core.config.SyncSettings;
import de.bsommerfeld.artifactsync.core.domain.AuditCategory;
import de.bsommerfeld.artifactsync.core.domain.AuditEntry;
import de.bsommerfeld.artifactsync.core.domain.AutoIncrement;
import de.bsommerfeld.artifactsync.core.domain.Branch;
import de.bsommerfeld.artifactsync.core.domain.BranchStatus;
import de.bsommerfeld.artifactsync.core.domain.BuildReference;
import de.bsommerfeld.artifactsync.core.domain.LedgerEntry;
import de.bsommerfeld.artifactsync.core.domain.PackagingRequest;
import de.bsommerfeld.artifactsync.core.domain.RetainedBuild;
import de.bsommerfeld.artifactsync.core.domain.Severity;
import de.bsommerfeld.artifactsync.core.domain.SyncTarget;
import de.bsommerfeld.artifactsync.core.domain.VersionTuple;
import de.bsommerfeld.artifactsync.core.error.DownloadTimeoutException;
import de.bsommerfeld.artifactsync.core.event.ApplicationEventBus;
import de.bsommerfeld.artifactsync.db.AuditLog;
import de.bsommerfeld.artifactsync.db.InMemoryDatabaseService;
import de.bsommerfeld.artifactsync.db.PackagingQueue;
import de.bsommerfeld.artifactsync.db.VersionLedger;
import de.bsommerfeld.artifactsync.engine.extract.ArchiveExtractor;
import de.bsommerfeld.artifactsync.engine.staging.RetentionManager;
import de.bsommerfeld.artifactsync.engine.staging.StagingLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class BranchSyncJobTest {

    @TempDir
    Path base;

    private InMemoryDatabaseService database;
    private VersionLedger ledger;
    private BranchLocks locks;
    private MutableClock clock;
    private BranchSyncJobFactory factory;
    private FakeRepositoryClient client;
    private SyncSettings settings;

    private final SyncTarget develop = EngineFixtures.target(11, "develop");

    @BeforeEach
    void setUp() {
        database = new InMemoryDatabaseService();
        AuditLog auditLog = new AuditLog(database);
        ledger = new VersionLedger(database, auditLog);
        locks = new BranchLocks();
        clock = new MutableClock(Instant.parse("2024-03-10T08:00:00Z"));
        ApplicationEventBus eventBus = new ApplicationEventBus();
        new PackagingQueue(database, eventBus);
        factory = new BranchSyncJobFactory(ledger, new RetentionManager(database, auditLog, clock), auditLog,
                new ArchiveExtractor(), locks, eventBus, clock);
        client = new FakeRepositoryClient();
        settings = EngineFixtures.settings(base, 5);
    }

    // =====================================================================
    // Scenarios
    // =====================================================================

    @Test
    void run_shouldSyncNewestBuild() throws Exception {
        client.withBuild(EngineFixtures.build(1, 1), zip("old"))
                .withBuild(EngineFixtures.build(2, 3), zip("newest"))
                .withBuild(EngineFixtures.build(2, 1), zip("older"));

        JobOutcome outcome = job(develop).run();

        assertEquals(JobOutcome.SYNCED, outcome);
        assertEquals(EngineFixtures.build(2, 3), latest(develop));
        Path extracted = new StagingLayout(base).extractedPath(develop, EngineFixtures.build(2, 3));
        assertEquals("newest", Files.readString(extracted.resolve("app/version.txt")));
        assertEquals(1, client.downloadCalls.get());

        List<PackagingRequest> queued = database.getPendingPackaging();
        assertEquals(1, queued.size());
        assertEquals(extracted, queued.get(0).sourcePath());
        assertEquals("2.4.1.0", queued.get(0).currentVersion());
        assertEquals("2.4.2.0", queued.get(0).proposedVersion());

        List<RetainedBuild> retained = database.getRetainedBuilds(develop.branchId());
        assertEquals(1, retained.size());
        assertNotNull(retained.get(0).sha256());
        assertFalse(locks.isHeld(develop.branchId()));
    }

    @Test
    void run_shouldReportUpToDateForEqualBuild() throws Exception {
        ledger.commit(develop.branchId(), EngineFixtures.build(2, 3), clock.instant());
        client.withBuild(EngineFixtures.build(2, 3), zip("same"));

        JobOutcome outcome = job(develop).run();

        assertEquals(JobOutcome.UP_TO_DATE, outcome);
        assertEquals(0, client.downloadCalls.get());
        assertTrue(lastAudit(develop).detail().startsWith("Up to date"));
    }

    @Test
    void run_shouldOnlyTouchCheckTimeOnRepoll() throws Exception {
        client.withBuild(EngineFixtures.build(2, 3), zip("v1"));
        job(develop).run();
        LedgerEntry afterSync = ledger.read(develop.branchId()).orElseThrow();
        List<RetainedBuild> retainedAfterSync = database.getRetainedBuilds(develop.branchId());

        clock.advance(Duration.ofMinutes(1));
        JobOutcome outcome = job(develop).run();

        LedgerEntry afterRepoll = ledger.read(develop.branchId()).orElseThrow();
        assertEquals(JobOutcome.UP_TO_DATE, outcome);
        assertEquals(afterSync.latestBuild(), afterRepoll.latestBuild());
        assertEquals(afterSync.lastSuccess(), afterRepoll.lastSuccess());
        assertEquals(afterSync.lastChecked().plus(Duration.ofMinutes(1)), afterRepoll.lastChecked());
        assertEquals(retainedAfterSync, database.getRetainedBuilds(develop.branchId()));
        assertEquals(1, database.getPendingPackaging().size());
    }

    @Test
    void run_shouldKeepLedgerAndRetryAfterDownloadTimeout() throws Exception {
        client.withBuild(EngineFixtures.build(2, 3), zip("v1"));
        client.downloadFailure = new DownloadTimeoutException("no bytes for 300s");

        JobOutcome first = job(develop).run();

        assertEquals(JobOutcome.FAILED, first);
        assertTrue(latestOrEmpty(develop).isEmpty());
        AuditEntry failure = lastAudit(develop);
        assertEquals(Severity.WARNING, failure.severity());
        assertEquals(AuditCategory.ERROR, failure.category());
        assertTrue(failure.detail().contains("downloading"));

        client.downloadFailure = null;
        assertEquals(JobOutcome.SYNCED, job(develop).run());
        assertEquals(EngineFixtures.build(2, 3), latest(develop));
    }

    @Test
    void run_shouldKeepArchiveButNotCommitCorruptBuild() {
        client.withBuild(EngineFixtures.build(2, 3), "this is not a zip".getBytes());

        JobOutcome outcome = job(develop).run();

        assertEquals(JobOutcome.FAILED, outcome);
        assertTrue(latestOrEmpty(develop).isEmpty());
        assertEquals(Severity.ERROR, lastAudit(develop).severity());
        Path archive = new StagingLayout(base).archivePath(develop, EngineFixtures.build(2, 3),
                "paymentservice.zip");
        assertTrue(Files.exists(archive));
        assertFalse(Files.exists(new StagingLayout(base).extractedPath(develop, EngineFixtures.build(2, 3))));
        assertTrue(database.getPendingPackaging().isEmpty());
    }

    @Test
    void run_shouldEvictOldestBuildsBeyondRetention() throws Exception {
        StagingLayout layout = new StagingLayout(base);
        for (int day = 1; day <= 6; day++) {
            client.withBuild(EngineFixtures.build(day, 1), zip("day " + day));
            clock.advance(Duration.ofMinutes(1));
            assertEquals(JobOutcome.SYNCED, job(develop).run());
        }

        List<BuildReference> retained = database.getRetainedBuilds(develop.branchId()).stream()
                .map(RetainedBuild::build)
                .toList();
        assertEquals(5, retained.size());
        assertFalse(retained.contains(EngineFixtures.build(1, 1)));
        assertFalse(Files.exists(layout.extractedPath(develop, EngineFixtures.build(1, 1))));
        assertFalse(Files.exists(layout.archivePath(develop, EngineFixtures.build(1, 1), "paymentservice.zip")));
        assertTrue(Files.exists(layout.extractedPath(develop, EngineFixtures.build(6, 1))));
    }

    // =====================================================================
    // Exclusion and cancellation
    // =====================================================================

    @Test
    void run_shouldSkipSecondJobForBranchInFlight() throws Exception {
        client.withBuild(EngineFixtures.build(2, 3), zip("v1"));
        client.holdListing();

        CompletableFuture<JobOutcome> first = CompletableFuture.supplyAsync(() -> job(develop).run());
        assertTrue(client.awaitListingEntered());

        JobOutcome second = job(develop).run();
        client.releaseListing();

        assertEquals(JobOutcome.SKIPPED_IN_PROGRESS, second);
        assertEquals(JobOutcome.SYNCED, first.get(10, TimeUnit.SECONDS));
        assertEquals(1, client.listCalls.get());
        assertEquals(1, client.downloadCalls.get());
        assertEquals(1, database.getPendingPackaging().size());
    }

    @Test
    void reserve_shouldRefuseBranchHeldByRunningJob() throws Exception {
        client.withBuild(EngineFixtures.build(2, 3), zip("v1"));
        client.holdListing();

        CompletableFuture<JobOutcome> first = CompletableFuture.supplyAsync(() -> job(develop).run());
        assertTrue(client.awaitListingEntered());

        boolean reserved = job(develop).reserve();
        String skipAudit = lastAudit(develop).detail();
        client.releaseListing();

        assertFalse(reserved);
        assertEquals("Sync already in progress, skipped", skipAudit);
        assertEquals(JobOutcome.SYNCED, first.get(10, TimeUnit.SECONDS));
    }

    @Test
    void run_shouldUseLockTakenByReserve() throws Exception {
        client.withBuild(EngineFixtures.build(2, 3), zip("v1"));
        BranchSyncJob job = job(develop);

        assertTrue(job.reserve());
        assertTrue(locks.isHeld(develop.branchId()));

        assertEquals(JobOutcome.SYNCED, job.run());
        assertFalse(locks.isHeld(develop.branchId()));
    }

    @Test
    void run_shouldReleaseReservationWhenCancelled() {
        BranchSyncJob job = job(develop, () -> true);
        assertTrue(job.reserve());

        assertEquals(JobOutcome.SKIPPED_SHUTDOWN, job.run());
        assertFalse(locks.isHeld(develop.branchId()));
    }

    @Test
    void run_shouldDoNothingWhenCancelledBeforeStart() {
        client.withBuild(EngineFixtures.build(2, 3), new byte[0]);

        JobOutcome outcome = job(develop, () -> true).run();

        assertEquals(JobOutcome.SKIPPED_SHUTDOWN, outcome);
        assertEquals(0, client.listCalls.get());
        assertFalse(locks.isHeld(develop.branchId()));
    }

    @Test
    void run_shouldStopBeforeDownloadWhenCancelledDuringCheck() throws Exception {
        client.withBuild(EngineFixtures.build(2, 3), zip("v1"));
        AtomicInteger polls = new AtomicInteger();

        JobOutcome outcome = job(develop, () -> polls.incrementAndGet() > 1).run();

        assertEquals(JobOutcome.SKIPPED_SHUTDOWN, outcome);
        assertEquals(1, client.listCalls.get());
        assertEquals(0, client.downloadCalls.get());
        assertTrue(latestOrEmpty(develop).isEmpty());
    }

    // =====================================================================
    // Failures
    // =====================================================================

    @Test
    void run_shouldContainUnexpectedRuntimeException() {
        client.listBug = new IllegalStateException("bug in listing");

        BranchSyncJob job = job(develop);
        JobOutcome outcome = job.run();

        assertEquals(JobOutcome.FAILED, outcome);
        assertEquals(JobState.IDLE, job.state());
        assertFalse(locks.isHeld(develop.branchId()));
        AuditEntry entry = lastAudit(develop);
        assertEquals(Severity.ERROR, entry.severity());
        assertTrue(entry.detail().contains("bug in listing"));
    }

    @Test
    void run_shouldFailBeforeDownloadWhenVersionCannotAdvance() throws Exception {
        Branch exhausted = new Branch(12, EngineFixtures.PAYMENTS.id(), "release", BranchStatus.ACTIVE,
                new VersionTuple(Integer.MAX_VALUE, 0, 0, 0), AutoIncrement.MAJOR, null, null);
        SyncTarget target = new SyncTarget(EngineFixtures.PAYMENTS, exhausted);
        client.withBuild(EngineFixtures.build(2, 3), zip("v1"));

        JobOutcome outcome = job(target).run();

        assertEquals(JobOutcome.FAILED, outcome);
        assertEquals(0, client.downloadCalls.get());
        assertTrue(latestOrEmpty(target).isEmpty());
        assertTrue(database.getRetainedBuilds(target.branchId()).isEmpty());
        AuditEntry entry = lastAudit(target);
        assertEquals(Severity.ERROR, entry.severity());
        assertTrue(entry.detail().contains("cannot advance"));
    }

    @Test
    void run_shouldRetainCommittedBuildWhenPublishingFails() throws Exception {
        AuditLog auditLog = new AuditLog(database);
        ApplicationEventBus brokenBus = new ApplicationEventBus() {
            @Override
            public void post(Object event) {
                throw new IllegalStateException("subscriber registry broken");
            }
        };
        BranchSyncJobFactory brokenFactory = new BranchSyncJobFactory(ledger,
                new RetentionManager(database, auditLog, clock), auditLog, new ArchiveExtractor(), locks,
                brokenBus, clock);
        client.withBuild(EngineFixtures.build(2, 3), zip("v1"));

        JobOutcome outcome = brokenFactory.create(develop, settings, client, () -> false).run();

        assertEquals(JobOutcome.FAILED, outcome);
        assertEquals(EngineFixtures.build(2, 3), latest(develop));
        List<RetainedBuild> retained = database.getRetainedBuilds(develop.branchId());
        assertEquals(1, retained.size());
        assertEquals(EngineFixtures.build(2, 3), retained.get(0).build());
    }

    @Test
    void run_shouldFailOnBadTemplateWithoutListing() {
        Branch broken = new Branch(12, EngineFixtures.PAYMENTS.id(), "hotfix", BranchStatus.ACTIVE,
                VersionTuple.INITIAL, AutoIncrement.BUILD, "{ProjectShortKey}/{nope}/Build{date}.{buildNumber}",
                null);
        SyncTarget target = new SyncTarget(EngineFixtures.PAYMENTS, broken);

        JobOutcome outcome = job(target).run();

        assertEquals(JobOutcome.FAILED, outcome);
        assertEquals(0, client.listCalls.get());
        assertEquals(Severity.ERROR, lastAudit(target).severity());
    }

    @Test
    void run_shouldSweepLeftoversOfInterruptedRun() throws Exception {
        StagingLayout layout = new StagingLayout(base);
        Path staging = Files.createDirectories(layout.stagingDirectory(develop));
        Path partial = Files.writeString(staging.resolve("Build20240302.3-paymentservice.zip.tmp"), "half");

        job(develop).run();

        assertFalse(Files.exists(partial));
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private BranchSyncJob job(SyncTarget target) {
        return job(target, () -> false);
    }

    private BranchSyncJob job(SyncTarget target, BooleanSupplier cancelled) {
        return factory.create(target, settings, client, cancelled);
    }

    private BuildReference latest(SyncTarget target) {
        return latestOrEmpty(target).orElseThrow();
    }

    private Optional<BuildReference> latestOrEmpty(SyncTarget target) {
        return ledger.read(target.branchId()).flatMap(LedgerEntry::latest);
    }

    private AuditEntry lastAudit(SyncTarget target) {
        return database.getRecentAudit(target.branchId(), 1).get(0);
    }

    private static byte[] zip(String version) throws Exception {
        return TestArchives.zip(Map.of("app/version.txt", version));
    }
}
