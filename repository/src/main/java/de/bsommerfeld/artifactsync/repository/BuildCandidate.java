package de.bsommerfeld.artifactsync.repository;

import de.bsommerfeld.artifactsync.core.domain.BuildReference;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A build found in the repository listing.
 *
 * @param build        parsed build reference
 * @param artifactPath repository-relative path of the artifact file
 */
public record BuildCandidate(BuildReference build, String artifactPath) {

    /** Last path segment, used to name the staged archive. */
    public String fileName() {
        return artifactPath.substring(artifactPath.lastIndexOf('/') + 1);
    }

    /** The candidate with the newest build reference, if any. */
    public static Optional<BuildCandidate> newest(List<BuildCandidate> candidates) {
        return candidates.stream().max(Comparator.comparing(BuildCandidate::build));
    }
}
