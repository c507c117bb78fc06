package de.bsommerfeld.artifactsync.db;

import de.bsommerfeld.artifactsync.core.domain.AuditCategory;
import de.bsommerfeld.artifactsync.core.domain.AuditEntry;
import de.bsommerfeld.artifactsync.core.domain.BuildReference;
import de.bsommerfeld.artifactsync.core.domain.LedgerEntry;
import de.bsommerfeld.artifactsync.core.domain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class VersionLedgerTest {

    private static final Instant NOW = Instant.parse("2025-01-02T12:00:00Z");

    private InMemoryDatabaseService database;
    private VersionLedger ledger;

    @BeforeEach
    void setUp() {
        database = new InMemoryDatabaseService();
        ledger = new VersionLedger(database, new AuditLog(database));
    }

    private static BuildReference build(int day, int number) {
        return BuildReference.of(LocalDate.of(2025, 1, day), number);
    }

    @Test
    void commit_shouldAcceptStrictlyNewerBuilds() {
        assertTrue(ledger.commit(1, build(2, 1), NOW));
        assertTrue(ledger.commit(1, build(2, 2), NOW));
        assertTrue(ledger.commit(1, build(3, 1), NOW));

        assertEquals(build(3, 1), ledger.read(1).flatMap(LedgerEntry::latest).orElseThrow());
    }

    @Test
    void commit_shouldRejectOlderOrEqualBuildAndAudit() {
        ledger.commit(1, build(3, 1), NOW);

        assertFalse(ledger.commit(1, build(2, 5), NOW));
        assertFalse(ledger.commit(1, build(3, 1), NOW));

        assertEquals(build(3, 1), ledger.read(1).orElseThrow().latestBuild());
        List<AuditEntry> audit = database.getRecentAudit(1L, 10);
        assertEquals(2, audit.size());
        assertTrue(audit.stream().allMatch(e -> e.severity() == Severity.WARNING));
        assertTrue(audit.get(0).detail().contains("Build20250103.1"));
        assertEquals(AuditCategory.DETECT, audit.get(0).category());
    }

    @Test
    void commit_shouldStayMonotonicUnderConcurrentCommits() throws Exception {
        List<BuildReference> builds = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            builds.add(build(2, i));
        }
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        for (BuildReference b : builds) {
            pool.submit(() -> {
                start.await();
                if (ledger.commit(1, b, NOW)) accepted.incrementAndGet();
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(build(2, 49), ledger.read(1).orElseThrow().latestBuild());
        assertTrue(accepted.get() >= 1);
    }

    @Test
    void touchChecked_shouldNotAffectLatestBuild() {
        ledger.commit(1, build(2, 1), NOW);
        Instant later = NOW.plusSeconds(60);

        ledger.touchChecked(1, later);

        LedgerEntry entry = ledger.read(1).orElseThrow();
        assertEquals(build(2, 1), entry.latestBuild());
        assertEquals(later, entry.lastChecked());
        assertEquals(NOW, entry.lastSuccess());
    }

    @Test
    void read_shouldBeEmptyForUnknownBranch() {
        assertTrue(ledger.read(42).isEmpty());
    }
}
