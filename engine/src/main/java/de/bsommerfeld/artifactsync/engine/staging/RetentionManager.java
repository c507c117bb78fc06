package de.bsommerfeld.artifactsync.engine.staging;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.artifactsync.core.domain.AuditCategory;
import de.bsommerfeld.artifactsync.core.domain.RetainedBuild;
import de.bsommerfeld.artifactsync.core.util.StorageUtils;
import de.bsommerfeld.artifactsync.db.AuditLog;
import de.bsommerfeld.artifactsync.db.DatabaseService;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Keeps the set of materialized builds per branch bounded.
 *
 * <h3>Ordering</h3>
 * Builds are ordered by {@link de.bsommerfeld.artifactsync.core.domain.BuildReference},
 * the same order the ledger uses, so eviction always removes the oldest
 * builds first regardless of when they were synced.
 *
 * <h3>Failures</h3>
 * A file that cannot be deleted produces a WARNING {@code cleanup} audit
 * entry. The history row is marked deleted anyway; the staging sweep never
 * touches complete build folders, so such a folder stays until removed by
 * hand.
 */
@Singleton
public class RetentionManager {

    private final DatabaseService database;
    private final AuditLog auditLog;
    private final Clock clock;

    @Inject
    public RetentionManager(DatabaseService database, AuditLog auditLog, Clock clock) {
        this.database = database;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    /**
     * Adds {@code newBuild} to the branch's retention set and evicts the
     * oldest entries beyond {@code limit}. Calling it again with the same
     * build changes nothing.
     *
     * @return the evicted builds, oldest first
     */
    public List<RetainedBuild> retain(long branchId, RetainedBuild newBuild, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Retention limit must be >= 1, got " + limit);
        }
        if (newBuild.branchId() != branchId) {
            throw new IllegalArgumentException("Build belongs to branch " + newBuild.branchId()
                    + ", not " + branchId);
        }

        database.saveRetainedBuild(newBuild);

        List<RetainedBuild> retained = new ArrayList<>(database.getRetainedBuilds(branchId));
        retained.sort(Comparator.comparing(RetainedBuild::build));
        int excess = retained.size() - limit;
        if (excess <= 0) return List.of();

        List<RetainedBuild> evicted = List.copyOf(retained.subList(0, excess));
        for (RetainedBuild build : evicted) {
            evict(branchId, build);
        }
        return evicted;
    }

    private void evict(long branchId, RetainedBuild build) {
        boolean clean = delete(branchId, build, build.archivePath(), false);
        clean &= delete(branchId, build, build.extractedPath(), true);

        database.markRetainedBuildDeleted(branchId, build.build(), clock.instant());
        if (clean) {
            auditLog.info(branchId, AuditCategory.CLEANUP, "Evicted build " + build.build());
        }
    }

    private boolean delete(long branchId, RetainedBuild build, Path path, boolean directory) {
        if (path == null) return true;
        try {
            if (directory) {
                StorageUtils.deleteRecursively(path);
            } else {
                Files.deleteIfExists(path);
            }
            return true;
        } catch (IOException e) {
            auditLog.warning(branchId, AuditCategory.CLEANUP,
                    "Could not delete " + path + " of evicted build " + build.build() + ": " + e.getMessage());
            return false;
        }
    }
}
