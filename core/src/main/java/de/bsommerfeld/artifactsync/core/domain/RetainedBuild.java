package de.bsommerfeld.artifactsync.core.domain;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A synchronized build that is still materialized on disk. The set of
 * retained builds per branch is bounded by the configured retention count.
 *
 * @param branchId      owning branch
 * @param build         build reference, unique per branch
 * @param archivePath   staged archive file
 * @param extractedPath extracted directory tree
 * @param sizeBytes     archive size as downloaded
 * @param sha256        archive checksum, may be {@code null} if the
 *                      repository reported none
 * @param syncedAt      commit time
 */
public record RetainedBuild(long branchId, BuildReference build, Path archivePath, Path extractedPath,
        long sizeBytes, String sha256, Instant syncedAt) {
}
