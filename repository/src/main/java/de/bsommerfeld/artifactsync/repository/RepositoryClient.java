package de.bsommerfeld.artifactsync.repository;

import de.bsommerfeld.artifactsync.core.error.DownloadIncompleteException;
import de.bsommerfeld.artifactsync.core.error.DownloadTimeoutException;
import de.bsommerfeld.artifactsync.core.error.RepositoryUnreachableException;
import de.bsommerfeld.artifactsync.core.error.StagingFilesystemException;
import de.bsommerfeld.artifactsync.repository.pattern.ResolvedPattern;

import java.nio.file.Path;
import java.util.List;

/**
 * Read-only access to the remote artifact repository.
 */
public interface RepositoryClient {

    /**
     * Lists the builds available under the pattern's listing prefix with one
     * remote call. Entries that do not fit the build segment are skipped. A
     * missing folder yields an empty list.
     *
     * @throws RepositoryUnreachableException on network or authentication
     *                                        failure
     */
    List<BuildCandidate> listCandidates(ResolvedPattern pattern) throws RepositoryUnreachableException;

    /**
     * Downloads the candidate's artifact to {@code destination}, verifying
     * size and checksum before it becomes visible there. A previous file at
     * {@code destination} is only replaced by a complete, verified one.
     *
     * @return bytes written
     */
    long download(BuildCandidate candidate, Path destination)
            throws RepositoryUnreachableException, DownloadTimeoutException, DownloadIncompleteException,
            StagingFilesystemException;
}
