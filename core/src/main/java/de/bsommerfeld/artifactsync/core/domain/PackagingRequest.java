package de.bsommerfeld.artifactsync.core.domain;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Hand-over to the downstream packaging process: a freshly committed build
 * whose extracted tree is ready to be packaged.
 *
 * @param componentId     component key
 * @param branchId        branch key
 * @param build           committed build
 * @param sourcePath      extracted directory the packager reads from
 * @param currentVersion  branch version as maintained by administration
 * @param proposedVersion version the branch's auto-increment policy would
 *                        assign to this release
 * @param queuedAt        time of the request
 */
public record PackagingRequest(long componentId, long branchId, BuildReference build, Path sourcePath,
        String currentVersion, String proposedVersion, Instant queuedAt) {
}
