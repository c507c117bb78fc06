package de.bsommerfeld.artifactsync.engine;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.artifactsync.core.config.SettingsSource;
import de.bsommerfeld.artifactsync.core.config.SyncSettings;
import de.bsommerfeld.artifactsync.core.domain.AuditCategory;
import de.bsommerfeld.artifactsync.core.domain.CatalogSnapshot;
import de.bsommerfeld.artifactsync.core.domain.SyncTarget;
import de.bsommerfeld.artifactsync.core.error.CatalogUnavailableException;
import de.bsommerfeld.artifactsync.db.AuditLog;
import de.bsommerfeld.artifactsync.db.DatabaseService;
import de.bsommerfeld.artifactsync.repository.RepositoryClient;
import de.bsommerfeld.artifactsync.repository.RepositoryClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives the polling loop.
 *
 * <h3>Cycle</h3>
 * Settings snapshot, catalog snapshot, one {@link BranchSyncJob} per active
 * target on the worker pool, then wait for the batch until the cycle
 * timeout. The branch lock is taken at dispatch, so a branch whose job is
 * still running or still queued from an earlier cycle is counted as
 * {@link JobOutcome#SKIPPED_IN_PROGRESS} and never queued twice.
 *
 * <h3>Threads</h3>
 * The loop runs on a single {@code sync-scheduler} thread and reschedules
 * itself after each cycle with the interval of the latest settings, so a
 * changed interval takes effect without a restart. Jobs run on a fixed pool
 * of {@code sync-worker-N} threads sized once from the settings at startup.
 */
@Singleton
public class SyncScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(SyncScheduler.class);

    private final SettingsSource settingsSource;
    private final DatabaseService database;
    private final RepositoryClientFactory clientFactory;
    private final BranchSyncJobFactory jobFactory;
    private final AuditLog auditLog;

    private final ScheduledExecutorService loop;
    private final ExecutorService workers;

    private volatile boolean shuttingDown;
    private volatile Duration interval;

    @Inject
    public SyncScheduler(SettingsSource settingsSource, DatabaseService database,
            RepositoryClientFactory clientFactory, BranchSyncJobFactory jobFactory, AuditLog auditLog) {
        this.settingsSource = settingsSource;
        this.database = database;
        this.clientFactory = clientFactory;
        this.jobFactory = jobFactory;
        this.auditLog = auditLog;

        SyncSettings initial = settingsSource.current();
        this.interval = initial.pollInterval();
        this.loop = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("sync-scheduler")
                .setDaemon(false)
                .build());
        this.workers = Executors.newFixedThreadPool(initial.maxConcurrentJobs(), new ThreadFactoryBuilder()
                .setNameFormat("sync-worker-%d")
                .setDaemon(true)
                .build());
    }

    /** Starts the loop; the first cycle runs immediately. */
    public void start() {
        LOG.info("Sync scheduler started (interval {}s)", interval.toSeconds());
        loop.execute(this::loopOnce);
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    private void loopOnce() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            LOG.error("Sync cycle failed", e);
        } finally {
            scheduleNext();
        }
    }

    private void scheduleNext() {
        if (shuttingDown) return;
        try {
            interval = settingsSource.current().pollInterval();
        } catch (RuntimeException e) {
            LOG.warn("Could not read settings, keeping interval {}s: {}", interval.toSeconds(), e.getMessage());
        }
        try {
            loop.schedule(this::loopOnce, interval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Loop stopped, not scheduling another cycle");
        }
    }

    // =====================================================================
    // Cycle
    // =====================================================================

    /**
     * Runs one cycle on the calling thread and waits for its jobs, at most
     * for the configured cycle timeout.
     */
    public CycleReport runCycle() {
        long started = System.nanoTime();
        SyncSettings settings = settingsSource.current();

        CatalogSnapshot catalog;
        try {
            catalog = database.loadCatalog();
        } catch (CatalogUnavailableException e) {
            auditLog.error(null, AuditCategory.ERROR, "Catalog unavailable, cycle deferred: " + e.getMessage());
            return CycleReport.deferred(Duration.ofNanos(System.nanoTime() - started));
        }

        List<SyncTarget> targets = catalog.activeTargets();
        RepositoryClient client = clientFactory.create(settings);
        LOG.debug("Dispatching {} job(s)", targets.size());

        Map<SyncTarget, Future<JobOutcome>> futures = new LinkedHashMap<>();
        Map<JobOutcome, Integer> outcomes = new EnumMap<>(JobOutcome.class);
        int busy = 0;
        for (SyncTarget target : targets) {
            if (shuttingDown) break;
            BranchSyncJob job = jobFactory.create(target, settings, client, this::isShuttingDown);
            if (!job.reserve()) {
                busy++;
                continue;
            }
            try {
                futures.put(target, workers.submit(job::run));
            } catch (RejectedExecutionException e) {
                job.releaseReservation();
                LOG.info("Worker pool closed, {} not dispatched", target.label());
                break;
            }
        }
        if (busy > 0) {
            outcomes.put(JobOutcome.SKIPPED_IN_PROGRESS, busy);
            LOG.info("{} branch(es) still in progress from an earlier cycle, skipped", busy);
        }

        int unfinished = 0;
        long deadline = started + settings.cycleTimeout().toNanos();
        for (Map.Entry<SyncTarget, Future<JobOutcome>> entry : futures.entrySet()) {
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                JobOutcome outcome = entry.getValue().get(remaining, TimeUnit.NANOSECONDS);
                outcomes.merge(outcome, 1, Integer::sum);
            } catch (TimeoutException e) {
                unfinished++;
                LOG.warn("Job for {} still running at cycle timeout", entry.getKey().label());
            } catch (ExecutionException e) {
                // run() catches everything; only an Error gets here
                outcomes.merge(JobOutcome.FAILED, 1, Integer::sum);
                LOG.error("Job for {} died", entry.getKey().label(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for jobs");
                unfinished++;
            }
        }

        CycleReport report = new CycleReport(futures.size() + busy, outcomes, unfinished, false,
                Duration.ofNanos(System.nanoTime() - started));
        LOG.info("Cycle finished: {}", report);
        return report;
    }

    // =====================================================================
    // Shutdown
    // =====================================================================

    /**
     * Stops scheduling, lets running jobs reach their next safe boundary and
     * waits up to the shutdown grace period for the pool to drain. Workers
     * are never interrupted, since that could cut an extraction short; jobs
     * still running after the grace period are left to the JVM exit and their
     * leftovers to the next sweep.
     *
     * @return {@code true} if all workers finished within the grace period
     */
    public boolean shutdown() {
        if (shuttingDown) return workers.isTerminated();
        shuttingDown = true;
        LOG.info("Shutting down sync scheduler");

        Duration grace = currentGrace();
        loop.shutdownNow();
        workers.shutdown();
        try {
            if (workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.info("All sync workers finished");
                return true;
            }
            LOG.warn("Sync workers still busy after {}s grace, abandoning them", grace.toSeconds());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for sync workers");
            return false;
        }
    }

    private Duration currentGrace() {
        try {
            return settingsSource.current().shutdownGrace();
        } catch (RuntimeException e) {
            return Duration.ofSeconds(60);
        }
    }
}
