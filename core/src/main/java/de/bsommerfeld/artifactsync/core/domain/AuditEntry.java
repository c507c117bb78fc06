package de.bsommerfeld.artifactsync.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable audit record. Entries are appended by the engine and never
 * updated or deleted by it.
 *
 * @param timestamp when the event happened
 * @param severity  severity
 * @param branchId  affected branch, or {@code null} for cycle-level events
 * @param category  pipeline stage
 * @param detail    free text
 */
public record AuditEntry(Instant timestamp, Severity severity, Long branchId, AuditCategory category,
        String detail) {

    public AuditEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(category, "category");
        detail = detail == null ? "" : detail;
    }

    public static AuditEntry info(Long branchId, AuditCategory category, String detail) {
        return new AuditEntry(Instant.now(), Severity.INFO, branchId, category, detail);
    }

    public static AuditEntry warning(Long branchId, AuditCategory category, String detail) {
        return new AuditEntry(Instant.now(), Severity.WARNING, branchId, category, detail);
    }

    public static AuditEntry error(Long branchId, AuditCategory category, String detail) {
        return new AuditEntry(Instant.now(), Severity.ERROR, branchId, category, detail);
    }
}
