/**
 * Persistence for the sync engine: SQLite in production, in memory in tests.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Engine]
 *      │
 *      ├── VersionLedger    ← monotonic latest-build per branch
 *      ├── AuditLog         ← append-only, mirrored to SLF4J
 *      └── PackagingQueue   ← BuildStagedEvent subscriber
 *             │
 *             ▼
 *      DatabaseService      ← interface
 *        ┌────┴────┐
 *        │         │
 *      SqlDB    InMemoryDB
 * </pre>
 *
 * <h2>Tables</h2>
 * <ul>
 * <li>{@code projects}, {@code components}, {@code branches}: catalog,
 * written by administration and only read here</li>
 * <li>{@code version_ledger}: one row per branch; the build columns only
 * move forward, enforced inside the upsert itself</li>
 * <li>{@code artifact_history}: every committed build with size, checksum
 * and paths; {@code extracted} rows form the retention set</li>
 * <li>{@code audit_log}: pipeline events per branch or per cycle</li>
 * <li>{@code packaging_queue}: builds waiting for the installer build</li>
 * </ul>
 *
 * Build dates are stored as {@code yyyyMMdd} text and timestamps as ISO-8601
 * instants, so lexical and chronological order agree.
 *
 * <h2>SQL File Inventory</h2>
 * All statements live in {@code sql/*.sql} and are loaded through
 * {@link de.bsommerfeld.artifactsync.db.SqlLoader}; {@code schema.sql} is
 * applied on every start.
 */
package de.bsommerfeld.artifactsync.db;
