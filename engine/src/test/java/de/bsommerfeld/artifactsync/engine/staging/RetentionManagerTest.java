package de.bsommerfeld.artifactsync.engine.staging;

import de.bsommerfeld.artifactsync.core.domain.AuditCategory;
import de.bsommerfeld.artifactsync.core.domain.BuildReference;
import de.bsommerfeld.artifactsync.core.domain.RetainedBuild;
import de.bsommerfeld.artifactsync.core.domain.Severity;
import de.bsommerfeld.artifactsync.db.AuditLog;
import de.bsommerfeld.artifactsync.db.InMemoryDatabaseService;
import de.bsommerfeld.artifactsync.engine.EngineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetentionManagerTest {

    private static final long BRANCH = 11;

    @TempDir
    Path base;

    private InMemoryDatabaseService database;
    private RetentionManager retention;

    @BeforeEach
    void setUp() {
        database = new InMemoryDatabaseService();
        retention = new RetentionManager(database, new AuditLog(database),
                Clock.fixed(Instant.parse("2024-03-10T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void retain_shouldKeepExactlyLimitNewestBuilds() throws Exception {
        for (int day = 1; day <= 6; day++) {
            retention.retain(BRANCH, materialize(EngineFixtures.build(day, 1)), 5);
        }

        List<BuildReference> kept = database.getRetainedBuilds(BRANCH).stream()
                .map(RetainedBuild::build)
                .toList();
        assertEquals(5, kept.size());
        assertEquals(EngineFixtures.build(2, 1), kept.get(0));
        assertFalse(Files.exists(archiveOf(EngineFixtures.build(1, 1))));
        assertFalse(Files.exists(extractedOf(EngineFixtures.build(1, 1))));
        assertTrue(Files.exists(extractedOf(EngineFixtures.build(2, 1))));
    }

    @Test
    void retain_shouldEvictByBuildOrderNotInsertionOrder() throws Exception {
        retention.retain(BRANCH, materialize(EngineFixtures.build(5, 1)), 2);
        retention.retain(BRANCH, materialize(EngineFixtures.build(3, 1)), 2);

        List<RetainedBuild> evicted = retention.retain(BRANCH, materialize(EngineFixtures.build(4, 1)), 2);

        assertEquals(1, evicted.size());
        assertEquals(EngineFixtures.build(3, 1), evicted.get(0).build());
    }

    @Test
    void retain_shouldBeIdempotent() throws Exception {
        RetainedBuild build = materialize(EngineFixtures.build(1, 1));
        retention.retain(BRANCH, build, 1);

        List<RetainedBuild> evicted = retention.retain(BRANCH, build, 1);

        assertTrue(evicted.isEmpty());
        assertEquals(1, database.getRetainedBuilds(BRANCH).size());
        assertTrue(Files.exists(build.extractedPath()));
    }

    @Test
    void retain_shouldDropRecordAndWarnWhenDeleteFails() throws Exception {
        RetainedBuild old = materialize(EngineFixtures.build(1, 1));
        // a non-empty directory where a file is expected makes deleteIfExists fail
        Files.delete(old.archivePath());
        Files.createDirectories(old.archivePath().resolve("blocker"));

        retention.retain(BRANCH, old, 1);
        retention.retain(BRANCH, materialize(EngineFixtures.build(2, 1)), 1);

        assertEquals(List.of(EngineFixtures.build(2, 1)),
                database.getRetainedBuilds(BRANCH).stream().map(RetainedBuild::build).toList());
        var warning = database.getRecentAudit(BRANCH, 10).stream()
                .filter(e -> e.severity() == Severity.WARNING)
                .findFirst()
                .orElseThrow();
        assertEquals(AuditCategory.CLEANUP, warning.category());
        assertFalse(Files.exists(old.extractedPath()));
    }

    @Test
    void retain_shouldRejectNonPositiveLimit() throws Exception {
        RetainedBuild build = materialize(EngineFixtures.build(1, 1));
        assertThrows(IllegalArgumentException.class, () -> retention.retain(BRANCH, build, 0));
    }

    private RetainedBuild materialize(BuildReference build) throws IOException {
        Path archive = archiveOf(build);
        Path extracted = extractedOf(build);
        Files.createDirectories(archive.getParent());
        Files.writeString(archive, "zip");
        Files.createDirectories(extracted.resolve("bin"));
        Files.writeString(extracted.resolve("bin/app.exe"), "exe");
        return new RetainedBuild(BRANCH, build, archive, extracted, 3, null, Instant.EPOCH);
    }

    private Path archiveOf(BuildReference build) {
        return base.resolve("staging").resolve(build.folderName() + "-app.zip");
    }

    private Path extractedOf(BuildReference build) {
        return base.resolve("extracted").resolve(build.folderName());
    }
}
