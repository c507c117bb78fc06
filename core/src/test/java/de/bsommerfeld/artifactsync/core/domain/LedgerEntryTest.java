package de.bsommerfeld.artifactsync.core.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class LedgerEntryTest {

    @Test
    void neverSynced_shouldHaveNoBuild() {
        var entry = LedgerEntry.neverSynced(5);

        assertTrue(entry.latest().isEmpty());
        assertNull(entry.lastChecked());
        assertNull(entry.lastSuccess());
    }

    @Test
    void withChecked_shouldKeepBuildAndSuccess() {
        var build = BuildReference.of(LocalDate.of(2025, 1, 2), 1);
        var t1 = Instant.parse("2025-01-02T10:00:00Z");
        var t2 = Instant.parse("2025-01-02T11:00:00Z");

        var entry = LedgerEntry.neverSynced(5).withCommitted(build, t1).withChecked(t2);

        assertEquals(build, entry.latestBuild());
        assertEquals(t1, entry.lastSuccess());
        assertEquals(t2, entry.lastChecked());
    }

    @Test
    void auditEntry_shouldNormalizeNullDetail() {
        var entry = AuditEntry.info(1L, AuditCategory.DETECT, null);
        assertEquals("", entry.detail());
        assertEquals(Severity.INFO, entry.severity());
    }

    @Test
    void auditCategory_shouldRoundTripDbValue() {
        assertEquals("extract", AuditCategory.EXTRACT.dbValue());
        assertEquals(AuditCategory.CLEANUP, AuditCategory.fromDbValue("cleanup"));
    }
}
