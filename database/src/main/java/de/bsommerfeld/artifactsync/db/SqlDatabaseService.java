package de.bsommerfeld.artifactsync.db;

import de.bsommerfeld.artifactsync.core.domain.AuditCategory;
import de.bsommerfeld.artifactsync.core.domain.AuditEntry;
import de.bsommerfeld.artifactsync.core.domain.AutoIncrement;
import de.bsommerfeld.artifactsync.core.domain.Branch;
import de.bsommerfeld.artifactsync.core.domain.BranchStatus;
import de.bsommerfeld.artifactsync.core.domain.BuildReference;
import de.bsommerfeld.artifactsync.core.domain.CatalogSnapshot;
import de.bsommerfeld.artifactsync.core.domain.Component;
import de.bsommerfeld.artifactsync.core.domain.LedgerEntry;
import de.bsommerfeld.artifactsync.core.domain.PackagingRequest;
import de.bsommerfeld.artifactsync.core.domain.RetainedBuild;
import de.bsommerfeld.artifactsync.core.domain.Severity;
import de.bsommerfeld.artifactsync.core.domain.VersionTuple;
import de.bsommerfeld.artifactsync.core.error.CatalogUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * SQLite-backed {@link DatabaseService}.
 *
 * <p>
 * All SQL lives in {@code sql/*.sql} resources loaded via {@link SqlLoader}.
 * {@code schema.sql} is applied on every startup; each DDL statement uses
 * {@code IF NOT EXISTS} so re-running it is safe.
 *
 * <h3>Connection strategy</h3>
 * One connection per operation, closed right after. SQLite serializes
 * writers at the file level; WAL mode lets the catalog read and the status
 * command run alongside writers, and a busy timeout absorbs short write
 * contention between workers.
 *
 * <h3>Column formats</h3>
 * Build dates are stored as {@code yyyyMMdd} text, which also sorts in date
 * order for listings. Which build is newer is never decided in SQL; the
 * ledger guard reads the current entry and asks {@link BuildReference}.
 * Timestamps are ISO-8601 instants.
 *
 * @see SqlLoader
 */
public class SqlDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);
    private static final int BUSY_TIMEOUT_MS = 10_000;

    private final String dbUrl;

    public SqlDatabaseService(Path databaseFile) {
        Path parent = databaseFile.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new DatabaseException("Failed to create database directory " + parent, e);
        }
        this.dbUrl = "jdbc:sqlite:" + databaseFile.toAbsolutePath();
        initialize();
    }

    Connection getConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", String.valueOf(BUSY_TIMEOUT_MS));
        props.setProperty("journal_mode", "WAL");
        return DriverManager.getConnection(dbUrl, props);
    }

    private void initialize() {
        LOG.info("Initializing database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new DatabaseException("Database initialization failed", e);
        }
    }

    /**
     * Applies {@code schema.sql}, one statement at a time inside a single
     * transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql");
                Statement stmt = conn.createStatement()) {

            if (schemaStream == null) {
                throw new SQLException("schema.sql not found on classpath");
            }

            String schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            conn.setAutoCommit(false);
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty())
                    continue;
                stmt.execute(sql.trim());
            }
            conn.commit();
            LOG.info("Database schema applied.");
        } catch (IOException | SQLException e) {
            if (!conn.getAutoCommit())
                conn.rollback();
            throw new SQLException("Schema application failed", e);
        }
    }

    // =====================================================================
    // Catalog
    // =====================================================================

    @Override
    public CatalogSnapshot loadCatalog() throws CatalogUnavailableException {
        try (Connection conn = getConnection()) {
            // one read transaction so components and branches come from the same state
            conn.setAutoCommit(false);
            try {
                List<Component> components = readComponents(conn);
                List<Branch> branches = readBranches(conn);
                conn.commit();
                return new CatalogSnapshot(components, branches);
            } catch (SQLException | IllegalArgumentException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | IllegalArgumentException e) {
            throw new CatalogUnavailableException("Failed to read catalog: " + e.getMessage(), e);
        }
    }

    private List<Component> readComponents(Connection conn) throws SQLException {
        List<Component> components = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-components"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                components.add(new Component(
                        rs.getLong("component_id"),
                        rs.getLong("project_id"),
                        rs.getString("project_key"),
                        rs.getString("project_name"),
                        rs.getString("component_name"),
                        rs.getInt("enabled") != 0));
            }
        }
        return components;
    }

    private List<Branch> readBranches(Connection conn) throws SQLException {
        List<Branch> branches = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-branches"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                branches.add(new Branch(
                        rs.getLong("branch_id"),
                        rs.getLong("component_id"),
                        rs.getString("branch_name"),
                        BranchStatus.fromString(rs.getString("status")),
                        new VersionTuple(
                                rs.getInt("major_version"),
                                rs.getInt("minor_version"),
                                rs.getInt("patch_version"),
                                rs.getInt("build_version")),
                        AutoIncrement.fromString(rs.getString("auto_increment")),
                        rs.getString("path_pattern"),
                        rs.getString("description")));
            }
        }
        return branches;
    }

    // =====================================================================
    // Version Ledger
    // =====================================================================

    @Override
    public Optional<LedgerEntry> getLedgerEntry(long branchId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-ledger-entry"))) {
            ps.setLong(1, branchId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapLedgerEntry(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read ledger entry for branch " + branchId, e);
        }
    }

    @Override
    public List<LedgerEntry> getLedgerEntries() {
        List<LedgerEntry> entries = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-ledger-entries"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                entries.add(mapLedgerEntry(rs));
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read ledger", e);
        }
        return entries;
    }

    /**
     * Reads the current build and writes the new one inside one
     * {@code BEGIN IMMEDIATE} transaction, so no other writer can slip in
     * between. Whether the build is newer is decided by
     * {@link BuildReference#isNewerThan(BuildReference)}.
     */
    @Override
    public boolean commitLedgerEntry(long branchId, BuildReference build, Instant at) {
        try (Connection conn = getConnection()) {
            execute(conn, "BEGIN IMMEDIATE");
            try {
                Optional<BuildReference> current = readLatestBuild(conn, branchId);
                if (!build.isNewerThan(current.orElse(null))) {
                    execute(conn, "ROLLBACK");
                    LOG.debug("[DB] Ledger commit branch={} build={} rejected, at {}", branchId, build,
                            current.orElse(null));
                    return false;
                }
                try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("commit-ledger-entry"))) {
                    ps.setLong(1, branchId);
                    ps.setString(2, build.formattedDate());
                    ps.setInt(3, build.buildNumber());
                    ps.setString(4, at.toString());
                    ps.setString(5, at.toString());
                    ps.executeUpdate();
                }
                execute(conn, "COMMIT");
                LOG.debug("[DB] Ledger commit branch={} build={}", branchId, build);
                return true;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to commit ledger entry for branch " + branchId, e);
        }
    }

    private Optional<BuildReference> readLatestBuild(Connection conn, long branchId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-ledger-entry"))) {
            ps.setLong(1, branchId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapLedgerEntry(rs).latest() : Optional.empty();
            }
        }
    }

    private static void execute(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            execute(conn, "ROLLBACK");
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    @Override
    public void touchLedgerChecked(long branchId, Instant at) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("touch-ledger-checked"))) {
            ps.setLong(1, branchId);
            ps.setString(2, at.toString());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to record check for branch " + branchId, e);
        }
    }

    private LedgerEntry mapLedgerEntry(ResultSet rs) throws SQLException {
        String date = rs.getString("build_date");
        int number = rs.getInt("build_number");
        BuildReference latest = date == null ? null : new BuildReference(parseDate(date), number);
        return new LedgerEntry(
                rs.getLong("branch_id"),
                latest,
                parseInstant(rs.getString("last_checked")),
                parseInstant(rs.getString("last_success")));
    }

    // =====================================================================
    // Artifact History (retention set)
    // =====================================================================

    @Override
    public void saveRetainedBuild(RetainedBuild build) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-artifact-history"))) {
            ps.setLong(1, build.branchId());
            ps.setString(2, build.build().formattedDate());
            ps.setInt(3, build.build().buildNumber());
            ps.setString(4, build.archivePath().toString());
            ps.setString(5, build.extractedPath().toString());
            ps.setLong(6, build.sizeBytes());
            if (build.sha256() != null) {
                ps.setString(7, build.sha256());
            } else {
                ps.setNull(7, Types.VARCHAR);
            }
            ps.setString(8, build.syncedAt().toString());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to record retained build " + build.build()
                    + " for branch " + build.branchId(), e);
        }
    }

    @Override
    public List<RetainedBuild> getRetainedBuilds(long branchId) {
        List<RetainedBuild> builds = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-retained-builds"))) {
            ps.setLong(1, branchId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    builds.add(new RetainedBuild(
                            rs.getLong("branch_id"),
                            new BuildReference(parseDate(rs.getString("build_date")), rs.getInt("build_number")),
                            Path.of(rs.getString("archive_path")),
                            Path.of(rs.getString("extracted_path")),
                            rs.getLong("size_bytes"),
                            rs.getString("sha256"),
                            parseInstant(rs.getString("synced_at"))));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read retained builds for branch " + branchId, e);
        }
        return builds;
    }

    @Override
    public void markRetainedBuildDeleted(long branchId, BuildReference build, Instant at) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("mark-artifact-deleted"))) {
            ps.setString(1, at.toString());
            ps.setLong(2, branchId);
            ps.setString(3, build.formattedDate());
            ps.setInt(4, build.buildNumber());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to mark " + build + " deleted for branch " + branchId, e);
        }
    }

    // =====================================================================
    // Audit Log
    // =====================================================================

    @Override
    public void appendAudit(AuditEntry entry) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-audit-entry"))) {
            ps.setString(1, entry.timestamp().toString());
            ps.setString(2, entry.severity().name());
            if (entry.branchId() != null) {
                ps.setLong(3, entry.branchId());
            } else {
                ps.setNull(3, Types.INTEGER);
            }
            ps.setString(4, entry.category().dbValue());
            ps.setString(5, entry.detail());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to append audit entry", e);
        }
    }

    @Override
    public List<AuditEntry> getRecentAudit(Long branchId, int limit) {
        String sql = SqlLoader.load(branchId == null ? "select-recent-audit" : "select-recent-audit-for-branch");
        List<AuditEntry> entries = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            if (branchId != null) {
                ps.setLong(idx++, branchId);
            }
            ps.setInt(idx, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long id = rs.getLong("branch_id");
                    Long entryBranch = rs.wasNull() ? null : id;
                    entries.add(new AuditEntry(
                            parseInstant(rs.getString("logged_at")),
                            Severity.valueOf(rs.getString("severity")),
                            entryBranch,
                            AuditCategory.fromDbValue(rs.getString("category")),
                            rs.getString("detail")));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read audit log", e);
        }
        return entries;
    }

    // =====================================================================
    // Packaging Queue
    // =====================================================================

    @Override
    public void enqueuePackaging(PackagingRequest request) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-packaging-request"))) {
            ps.setLong(1, request.componentId());
            ps.setLong(2, request.branchId());
            ps.setString(3, request.build().folderName());
            ps.setString(4, request.sourcePath().toString());
            ps.setString(5, request.currentVersion());
            ps.setString(6, request.proposedVersion());
            ps.setString(7, request.queuedAt().toString());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to enqueue packaging for branch " + request.branchId(), e);
        }
    }

    @Override
    public List<PackagingRequest> getPendingPackaging() {
        List<PackagingRequest> requests = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-pending-packaging"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String folder = rs.getString("build_folder");
                BuildReference build = BuildReference.parseFolder(folder)
                        .orElseThrow(() -> new SQLException("Malformed build folder in packaging queue: " + folder));
                requests.add(new PackagingRequest(
                        rs.getLong("component_id"),
                        rs.getLong("branch_id"),
                        build,
                        Path.of(rs.getString("source_path")),
                        rs.getString("current_version"),
                        rs.getString("proposed_version"),
                        parseInstant(rs.getString("queued_at"))));
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read packaging queue", e);
        }
        return requests;
    }

    // -- Helpers --

    private static LocalDate parseDate(String text) {
        return LocalDate.parse(text, BuildReference.DATE_FORMAT);
    }

    private static Instant parseInstant(String text) {
        return text == null ? null : Instant.parse(text);
    }
}
