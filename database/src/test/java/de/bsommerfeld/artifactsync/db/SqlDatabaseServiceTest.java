package de.bsommerfeld.artifactsync.db;

import de.bsommerfeld.artifactsync.core.domain.AuditCategory;
import de.bsommerfeld.artifactsync.core.domain.AuditEntry;
import de.bsommerfeld.artifactsync.core.domain.AutoIncrement;
import de.bsommerfeld.artifactsync.core.domain.BranchStatus;
import de.bsommerfeld.artifactsync.core.domain.BuildReference;
import de.bsommerfeld.artifactsync.core.domain.CatalogSnapshot;
import de.bsommerfeld.artifactsync.core.domain.LedgerEntry;
import de.bsommerfeld.artifactsync.core.domain.PackagingRequest;
import de.bsommerfeld.artifactsync.core.domain.RetainedBuild;
import de.bsommerfeld.artifactsync.core.domain.Severity;
import de.bsommerfeld.artifactsync.core.domain.SyncTarget;
import de.bsommerfeld.artifactsync.core.domain.VersionTuple;
import de.bsommerfeld.artifactsync.core.error.CatalogUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the SQLite service against a temporary database file.
 */
class SqlDatabaseServiceTest {

    private static final Instant T1 = Instant.parse("2025-01-02T10:00:00Z");
    private static final Instant T2 = Instant.parse("2025-01-02T11:00:00Z");

    @TempDir
    Path tempDir;

    private SqlDatabaseService db;

    @BeforeEach
    void setUp() {
        db = new SqlDatabaseService(tempDir.resolve("data/test.db"));
    }

    private void exec(String... statements) throws SQLException {
        try (Connection conn = db.getConnection(); Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
    }

    private static BuildReference build(int day, int number) {
        return BuildReference.of(LocalDate.of(2025, 1, day), number);
    }

    // -- Schema --

    @Test
    void constructor_shouldBeRerunnableOnExistingDatabase() {
        assertDoesNotThrow(() -> new SqlDatabaseService(tempDir.resolve("data/test.db")));
    }

    // -- Catalog --

    @Test
    void loadCatalog_shouldMapComponentsAndBranches() throws Exception {
        exec("INSERT INTO projects (project_id, project_name, project_key) VALUES (1, 'Payments', 'PAY')",
                "INSERT INTO components (component_id, project_id, component_name, enabled) VALUES (10, 1, 'Gateway', 1)",
                "INSERT INTO components (component_id, project_id, component_name, enabled) VALUES (11, 1, 'Legacy', 0)",
                "INSERT INTO branches (branch_id, component_id, branch_name, status, major_version, minor_version,"
                        + " patch_version, build_version, auto_increment, path_pattern)"
                        + " VALUES (100, 10, 'feature/login', 'active', 2, 1, 0, 3, 'minor', 'x/{date}.{buildNumber}')",
                "INSERT INTO branches (branch_id, component_id, branch_name, status)"
                        + " VALUES (101, 10, 'release', 'archived')",
                "INSERT INTO branches (branch_id, component_id, branch_name) VALUES (110, 11, 'develop')");

        CatalogSnapshot snapshot = db.loadCatalog();

        assertEquals(2, snapshot.components().size());
        assertEquals(3, snapshot.branches().size());

        List<SyncTarget> targets = snapshot.activeTargets();
        assertEquals(1, targets.size());
        SyncTarget target = targets.get(0);
        assertEquals("PAY", target.component().projectShortKey());
        assertEquals("Payments", target.component().projectName());
        assertEquals(new VersionTuple(2, 1, 0, 3), target.branch().version());
        assertEquals(AutoIncrement.MINOR, target.branch().autoIncrement());
        assertEquals(BranchStatus.ACTIVE, target.branch().status());
        assertEquals("x/{date}.{buildNumber}", target.branch().pathPatternOverride());
    }

    @Test
    void loadCatalog_shouldRejectDuplicateBranchNamePerComponent() throws Exception {
        exec("INSERT INTO projects (project_id, project_name, project_key) VALUES (1, 'P', 'P')",
                "INSERT INTO components (component_id, project_id, component_name) VALUES (10, 1, 'C')",
                "INSERT INTO branches (branch_id, component_id, branch_name) VALUES (100, 10, 'develop')");

        assertThrows(SQLException.class,
                () -> exec("INSERT INTO branches (branch_id, component_id, branch_name) VALUES (101, 10, 'develop')"));
    }

    @Test
    void loadCatalog_shouldWrapFailures() throws Exception {
        exec("DROP TABLE branches");

        assertThrows(CatalogUnavailableException.class, () -> db.loadCatalog());
    }

    // -- Ledger --

    @Test
    void commitLedgerEntry_shouldStoreFirstBuild() {
        assertTrue(db.commitLedgerEntry(7, build(2, 1), T1));

        LedgerEntry entry = db.getLedgerEntry(7).orElseThrow();
        assertEquals(build(2, 1), entry.latestBuild());
        assertEquals(T1, entry.lastChecked());
        assertEquals(T1, entry.lastSuccess());
    }

    @Test
    void commitLedgerEntry_shouldNeverRegress() {
        assertTrue(db.commitLedgerEntry(7, build(3, 1), T1));

        assertFalse(db.commitLedgerEntry(7, build(2, 9), T2));
        assertFalse(db.commitLedgerEntry(7, build(3, 1), T2));
        assertTrue(db.commitLedgerEntry(7, build(3, 2), T2));

        assertEquals(build(3, 2), db.getLedgerEntry(7).orElseThrow().latestBuild());
    }

    @Test
    void commitLedgerEntry_shouldCompareDatesAcrossMonths() {
        db.commitLedgerEntry(7, BuildReference.of(LocalDate.of(2024, 12, 31), 50), T1);

        assertTrue(db.commitLedgerEntry(7, BuildReference.of(LocalDate.of(2025, 1, 1), 1), T2));
    }

    @Test
    void commitLedgerEntry_shouldAgreeWithInMemoryLedger() {
        InMemoryDatabaseService memory = new InMemoryDatabaseService();
        List<BuildReference> sequence = List.of(build(5, 2), build(5, 1), build(5, 10), build(4, 99),
                BuildReference.of(LocalDate.of(2024, 12, 31), 1000), build(6, 0), build(6, 0), build(6, 1));

        for (BuildReference candidate : sequence) {
            assertEquals(memory.commitLedgerEntry(9, candidate, T1), db.commitLedgerEntry(9, candidate, T1),
                    "commit of " + candidate);
        }
        assertEquals(memory.getLedgerEntry(9).orElseThrow().latestBuild(),
                db.getLedgerEntry(9).orElseThrow().latestBuild());
    }

    @Test
    void commitLedgerEntry_shouldLeaveRowUntouchedWhenRejected() {
        db.commitLedgerEntry(7, build(3, 1), T1);

        assertFalse(db.commitLedgerEntry(7, build(3, 1), T2));
        assertTrue(db.commitLedgerEntry(8, build(1, 1), T2));

        LedgerEntry entry = db.getLedgerEntry(7).orElseThrow();
        assertEquals(T1, entry.lastSuccess());
        assertEquals(T1, entry.lastChecked());
    }

    @Test
    void touchLedgerChecked_shouldCreateRowWithoutBuild() {
        db.touchLedgerChecked(8, T1);

        LedgerEntry entry = db.getLedgerEntry(8).orElseThrow();
        assertNull(entry.latestBuild());
        assertEquals(T1, entry.lastChecked());
        assertNull(entry.lastSuccess());
    }

    @Test
    void touchLedgerChecked_shouldKeepCommittedBuild() {
        db.commitLedgerEntry(8, build(2, 1), T1);
        db.touchLedgerChecked(8, T2);

        LedgerEntry entry = db.getLedgerEntry(8).orElseThrow();
        assertEquals(build(2, 1), entry.latestBuild());
        assertEquals(T2, entry.lastChecked());
        assertEquals(T1, entry.lastSuccess());
    }

    @Test
    void commitLedgerEntry_shouldFillRowCreatedByCheck() {
        db.touchLedgerChecked(8, T1);

        assertTrue(db.commitLedgerEntry(8, build(2, 1), T2));
        assertEquals(build(2, 1), db.getLedgerEntry(8).orElseThrow().latestBuild());
    }

    @Test
    void getLedgerEntries_shouldOrderByBranch() {
        db.touchLedgerChecked(9, T1);
        db.touchLedgerChecked(3, T1);

        List<LedgerEntry> entries = db.getLedgerEntries();

        assertEquals(List.of(3L, 9L), entries.stream().map(LedgerEntry::branchId).toList());
    }

    // -- Retention --

    @Test
    void retainedBuilds_shouldBeOrderedOldestFirstAndDroppable() {
        db.saveRetainedBuild(retained(5, build(3, 1)));
        db.saveRetainedBuild(retained(5, build(2, 2)));
        db.saveRetainedBuild(retained(5, build(2, 1)));

        assertEquals(List.of(build(2, 1), build(2, 2), build(3, 1)),
                db.getRetainedBuilds(5).stream().map(RetainedBuild::build).toList());

        db.markRetainedBuildDeleted(5, build(2, 1), T2);

        assertEquals(2, db.getRetainedBuilds(5).size());
        assertTrue(db.getRetainedBuilds(6).isEmpty());
    }

    @Test
    void saveRetainedBuild_shouldBeIdempotent() {
        db.saveRetainedBuild(retained(5, build(2, 1)));
        db.saveRetainedBuild(retained(5, build(2, 1)));

        assertEquals(1, db.getRetainedBuilds(5).size());
        assertEquals("abc", db.getRetainedBuilds(5).get(0).sha256());
    }

    private static RetainedBuild retained(long branchId, BuildReference ref) {
        return new RetainedBuild(branchId, ref, Path.of("/staging/" + ref + "-a.zip"),
                Path.of("/extracted/" + ref), 1024, "abc", T1);
    }

    // -- Audit --

    @Test
    void getRecentAudit_shouldReturnNewestFirstAndFilterByBranch() {
        db.appendAudit(AuditEntry.info(1L, AuditCategory.DETECT, "first"));
        db.appendAudit(AuditEntry.warning(2L, AuditCategory.DOWNLOAD, "second"));
        db.appendAudit(AuditEntry.error(null, AuditCategory.ERROR, "cycle"));

        List<AuditEntry> all = db.getRecentAudit(null, 10);
        assertEquals(List.of("cycle", "second", "first"), all.stream().map(AuditEntry::detail).toList());
        assertNull(all.get(0).branchId());

        List<AuditEntry> branchTwo = db.getRecentAudit(2L, 10);
        assertEquals(1, branchTwo.size());
        assertEquals(Severity.WARNING, branchTwo.get(0).severity());
        assertEquals(AuditCategory.DOWNLOAD, branchTwo.get(0).category());

        assertEquals(1, db.getRecentAudit(null, 1).size());
    }

    // -- Packaging --

    @Test
    void enqueuePackaging_shouldBeListedAsPending() {
        var request = new PackagingRequest(10, 100, build(2, 4), Path.of("/extracted/Build20250102.4"),
                "1.2.0.0", "1.2.1.0", T1);

        db.enqueuePackaging(request);

        List<PackagingRequest> pending = db.getPendingPackaging();
        assertEquals(1, pending.size());
        assertEquals(request, pending.get(0));
    }
}
