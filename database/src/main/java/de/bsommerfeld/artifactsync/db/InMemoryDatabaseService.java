package de.bsommerfeld.artifactsync.db;

import de.bsommerfeld.artifactsync.core.domain.AuditEntry;
import de.bsommerfeld.artifactsync.core.domain.Branch;
import de.bsommerfeld.artifactsync.core.domain.BuildReference;
import de.bsommerfeld.artifactsync.core.domain.CatalogSnapshot;
import de.bsommerfeld.artifactsync.core.domain.Component;
import de.bsommerfeld.artifactsync.core.domain.LedgerEntry;
import de.bsommerfeld.artifactsync.core.domain.PackagingRequest;
import de.bsommerfeld.artifactsync.core.domain.RetainedBuild;
import de.bsommerfeld.artifactsync.core.error.CatalogUnavailableException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory {@link DatabaseService}. No disk I/O and no schema; the catalog
 * is seeded through {@link #putComponent} and {@link #putBranch}. Used by the
 * engine tests and anywhere a throwaway store is enough.
 *
 * <p>
 * Every method is {@code synchronized}, which gives the same atomic
 * compare-and-write for {@link #commitLedgerEntry} that the SQLite write
 * transaction provides.
 */
public class InMemoryDatabaseService implements DatabaseService {

    private final Map<Long, Component> components = new LinkedHashMap<>();
    private final Map<Long, Branch> branches = new LinkedHashMap<>();
    private final Map<Long, LedgerEntry> ledger = new TreeMap<>();
    private final Map<Long, Map<BuildReference, RetainedBuild>> retained = new TreeMap<>();
    private final List<AuditEntry> audit = new ArrayList<>();
    private final List<PackagingRequest> packaging = new ArrayList<>();

    private boolean catalogUnavailable;

    // -- Seeding --

    public synchronized void putComponent(Component component) {
        components.put(component.id(), component);
    }

    public synchronized void putBranch(Branch branch) {
        branches.put(branch.id(), branch);
    }

    /** Makes {@link #loadCatalog()} fail until reset. */
    public synchronized void setCatalogUnavailable(boolean unavailable) {
        this.catalogUnavailable = unavailable;
    }

    // -- Catalog --

    @Override
    public synchronized CatalogSnapshot loadCatalog() throws CatalogUnavailableException {
        if (catalogUnavailable) {
            throw new CatalogUnavailableException("Catalog marked unavailable");
        }
        return new CatalogSnapshot(new ArrayList<>(components.values()), new ArrayList<>(branches.values()));
    }

    // -- Version ledger --

    @Override
    public synchronized Optional<LedgerEntry> getLedgerEntry(long branchId) {
        return Optional.ofNullable(ledger.get(branchId));
    }

    @Override
    public synchronized List<LedgerEntry> getLedgerEntries() {
        return new ArrayList<>(ledger.values());
    }

    @Override
    public synchronized boolean commitLedgerEntry(long branchId, BuildReference build, Instant at) {
        LedgerEntry current = ledger.getOrDefault(branchId, LedgerEntry.neverSynced(branchId));
        if (!build.isNewerThan(current.latestBuild())) {
            return false;
        }
        ledger.put(branchId, current.withCommitted(build, at));
        return true;
    }

    @Override
    public synchronized void touchLedgerChecked(long branchId, Instant at) {
        LedgerEntry current = ledger.getOrDefault(branchId, LedgerEntry.neverSynced(branchId));
        ledger.put(branchId, current.withChecked(at));
    }

    // -- Retention --

    @Override
    public synchronized void saveRetainedBuild(RetainedBuild build) {
        retained.computeIfAbsent(build.branchId(), id -> new TreeMap<>()).put(build.build(), build);
    }

    @Override
    public synchronized List<RetainedBuild> getRetainedBuilds(long branchId) {
        Map<BuildReference, RetainedBuild> builds = retained.get(branchId);
        if (builds == null) return Collections.emptyList();
        List<RetainedBuild> result = new ArrayList<>(builds.values());
        result.sort(Comparator.comparing(RetainedBuild::build));
        return result;
    }

    @Override
    public synchronized void markRetainedBuildDeleted(long branchId, BuildReference build, Instant at) {
        Map<BuildReference, RetainedBuild> builds = retained.get(branchId);
        if (builds != null) {
            builds.remove(build);
        }
    }

    // -- Audit --

    @Override
    public synchronized void appendAudit(AuditEntry entry) {
        audit.add(entry);
    }

    @Override
    public synchronized List<AuditEntry> getRecentAudit(Long branchId, int limit) {
        List<AuditEntry> result = new ArrayList<>();
        for (int i = audit.size() - 1; i >= 0 && result.size() < limit; i--) {
            AuditEntry entry = audit.get(i);
            if (branchId == null || branchId.equals(entry.branchId())) {
                result.add(entry);
            }
        }
        return result;
    }

    // -- Packaging --

    @Override
    public synchronized void enqueuePackaging(PackagingRequest request) {
        packaging.add(request);
    }

    @Override
    public synchronized List<PackagingRequest> getPendingPackaging() {
        return new ArrayList<>(packaging);
    }
}
