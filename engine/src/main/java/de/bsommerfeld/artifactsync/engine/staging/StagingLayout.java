package de.bsommerfeld.artifactsync.engine.staging;

import de.bsommerfeld.artifactsync.core.domain.BuildReference;
import de.bsommerfeld.artifactsync.core.domain.SyncTarget;
import de.bsommerfeld.artifactsync.core.util.StorageUtils;
import de.bsommerfeld.artifactsync.engine.extract.ArchiveExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk partition of the staging area. Every branch owns one subtree:
 *
 * <pre>
 * &lt;base&gt;/&lt;componentId&gt;-&lt;componentName&gt;/&lt;branch&gt;/staging/&lt;BuildFolder&gt;-&lt;artifact&gt;
 * &lt;base&gt;/&lt;componentId&gt;-&lt;componentName&gt;/&lt;branch&gt;/extracted/&lt;BuildFolder&gt;/
 * </pre>
 *
 * Only the worker holding the branch lock touches a subtree.
 */
public final class StagingLayout {

    private static final Logger LOG = LoggerFactory.getLogger(StagingLayout.class);

    static final String STAGING_DIR = "staging";
    static final String EXTRACTED_DIR = "extracted";
    private static final String TMP_SUFFIX = ".tmp";

    private final Path baseDirectory;

    public StagingLayout(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    public Path baseDirectory() {
        return baseDirectory;
    }

    public Path branchRoot(SyncTarget target) {
        String componentDir = target.component().id() + "-" + safeSegment(target.component().name());
        return baseDirectory.resolve(componentDir).resolve(target.branch().pathSafeName());
    }

    public Path stagingDirectory(SyncTarget target) {
        return branchRoot(target).resolve(STAGING_DIR);
    }

    public Path extractedDirectory(SyncTarget target) {
        return branchRoot(target).resolve(EXTRACTED_DIR);
    }

    public Path archivePath(SyncTarget target, BuildReference build, String artifactFileName) {
        return stagingDirectory(target).resolve(build.folderName() + "-" + safeSegment(artifactFileName));
    }

    public Path extractedPath(SyncTarget target, BuildReference build) {
        return extractedDirectory(target).resolve(build.folderName());
    }

    /**
     * Cleans up after an interrupted run. A {@code .previous-*} tree whose
     * original directory is missing, because the run died between the two
     * renames of a swap, is renamed back first. Then partial {@code *.tmp}
     * downloads and the remaining {@code .extracting-*} and
     * {@code .previous-*} directories are removed. Must only be called while
     * the branch lock is held. Failures are logged; the next sweep retries
     * them.
     *
     * @return the paths that were removed
     */
    public List<Path> sweep(SyncTarget target) {
        List<Path> removed = new ArrayList<>();
        sweepDirectory(stagingDirectory(target), removed);
        restoreInterruptedSwaps(extractedDirectory(target));
        sweepDirectory(extractedDirectory(target), removed);
        if (!removed.isEmpty()) {
            LOG.info("Swept {} leftover(s) for {}", removed.size(), target.label());
        }
        return removed;
    }

    private static void sweepDirectory(Path dir, List<Path> removed) {
        if (!Files.isDirectory(dir)) return;
        try (DirectoryStream<Path> children = Files.newDirectoryStream(dir, StagingLayout::isLeftover)) {
            for (Path child : children) {
                try {
                    StorageUtils.deleteRecursively(child);
                    removed.add(child);
                } catch (IOException e) {
                    LOG.warn("Could not sweep {}: {}", child, e.getMessage());
                }
            }
        } catch (IOException e) {
            LOG.warn("Could not list {} for sweeping: {}", dir, e.getMessage());
        }
    }

    private static void restoreInterruptedSwaps(Path dir) {
        if (!Files.isDirectory(dir)) return;
        Map<Path, List<Path>> asidesByOriginal = new HashMap<>();
        try (DirectoryStream<Path> children = Files.newDirectoryStream(dir, ArchiveExtractor.PREVIOUS_PREFIX + "*")) {
            for (Path child : children) {
                ArchiveExtractor.swapTarget(child).ifPresent(original ->
                        asidesByOriginal.computeIfAbsent(original, k -> new ArrayList<>()).add(child));
            }
        } catch (IOException e) {
            LOG.warn("Could not list {} for interrupted swaps: {}", dir, e.getMessage());
            return;
        }

        asidesByOriginal.forEach((original, asides) -> {
            // with several candidates it is unknown which one was current
            if (asides.size() != 1 || Files.exists(original)) return;
            try {
                Files.move(asides.get(0), original);
                LOG.info("Restored {} from an interrupted swap", original);
            } catch (IOException e) {
                LOG.warn("Could not restore {} from {}: {}", original, asides.get(0), e.getMessage());
            }
        });
    }

    static boolean isLeftover(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(TMP_SUFFIX)
                || name.startsWith(ArchiveExtractor.EXTRACTING_PREFIX)
                || name.startsWith(ArchiveExtractor.PREVIOUS_PREFIX);
    }

    private static String safeSegment(String value) {
        return value.replace('/', '-').replace('\\', '-');
    }
}
