package de.bsommerfeld.artifactsync.engine.extract;

import com.google.inject.Singleton;
import de.bsommerfeld.artifactsync.core.error.ExtractionCorruptException;
import de.bsommerfeld.artifactsync.core.error.StagingFilesystemException;
import de.bsommerfeld.artifactsync.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Unpacks a zip archive into a directory that readers only ever see
 * complete.
 *
 * <h3>Procedure</h3>
 * <ol>
 * <li>Extract into a sibling {@code .extracting-<uuid>} directory.
 * {@link ZipInputStream} verifies CRC-32 and size of every entry as it is
 * read; names escaping the directory are rejected.</li>
 * <li>Rename an existing target aside to {@code .previous-<name>.<uuid>}.</li>
 * <li>Rename the temp directory to the target.</li>
 * <li>Delete the previous tree.</li>
 * </ol>
 * If step 1 fails the temp directory is removed and the target is untouched.
 * If step 3 fails the previous tree is renamed back. After a crash between
 * steps 2 and 3 the staging sweep renames the previous tree back to its
 * missing target; other {@code .extracting-*} and {@code .previous-*}
 * leftovers are removed by that sweep.
 *
 * <h3>Interrupts</h3>
 * An interrupt closes the archive channel mid-read. That is reported as a
 * {@link StagingFilesystemException} naming the interrupt, never as a corrupt
 * archive, and the interrupt flag stays set.
 */
@Singleton
public class ArchiveExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveExtractor.class);

    public static final String EXTRACTING_PREFIX = ".extracting-";
    public static final String PREVIOUS_PREFIX = ".previous-";

    static final int MAX_ENTRIES = 200_000;
    private static final int UUID_LENGTH = 36;
    private static final int BUFFER_SIZE = 64 * 1024;

    public ExtractionResult extract(Path archive, Path targetDirectory)
            throws ExtractionCorruptException, StagingFilesystemException {
        Path parent = targetDirectory.toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StagingFilesystemException("Cannot create " + parent, e);
        }

        Path temp = parent.resolve(EXTRACTING_PREFIX + UUID.randomUUID());
        ExtractionResult result;
        try {
            result = extractInto(archive, temp);
        } catch (ExtractionCorruptException | StagingFilesystemException e) {
            deleteQuietly(temp);
            throw e;
        }

        swap(temp, targetDirectory.toAbsolutePath());
        LOG.debug("Extracted {} into {} ({} files)", archive.getFileName(), targetDirectory, result.files());
        return new ExtractionResult(targetDirectory, result.files(), result.bytes());
    }

    // -- Extraction --

    private ExtractionResult extractInto(Path archive, Path directory)
            throws ExtractionCorruptException, StagingFilesystemException {
        try {
            Files.createDirectory(directory);
        } catch (IOException e) {
            throw new StagingFilesystemException("Cannot create " + directory, e);
        }

        InputStream raw;
        try {
            raw = Files.newInputStream(archive);
        } catch (IOException e) {
            throw new StagingFilesystemException("Cannot open archive " + archive, e);
        }

        int entries = 0;
        int files = 0;
        long bytes = 0;
        try (ZipInputStream zis = new ZipInputStream(raw)) {
            ZipEntry entry;
            while ((entry = nextEntry(zis, archive)) != null) {
                if (++entries > MAX_ENTRIES) {
                    throw new ExtractionCorruptException("Archive " + archive + " has more than " + MAX_ENTRIES
                            + " entries");
                }
                Path target = safeResolve(directory, entry.getName(), archive);
                if (entry.isDirectory()) {
                    createDirectories(target);
                    continue;
                }
                createDirectories(target.getParent());
                bytes += copyEntry(zis, target, entry, archive);
                files++;
            }
        } catch (IOException e) {
            // only close() can get here
            if (isInterrupt(e)) throw interrupted(archive, e);
            throw new ExtractionCorruptException("Failed to close archive " + archive, e);
        }

        if (entries == 0) {
            throw new ExtractionCorruptException("Archive " + archive + " is empty or not a zip file");
        }
        return new ExtractionResult(directory, files, bytes);
    }

    private static ZipEntry nextEntry(ZipInputStream zis, Path archive)
            throws ExtractionCorruptException, StagingFilesystemException {
        try {
            return zis.getNextEntry();
        } catch (IOException e) {
            if (isInterrupt(e)) throw interrupted(archive, e);
            throw new ExtractionCorruptException("Unreadable entry in " + archive + ": " + e.getMessage(), e);
        }
    }

    /** Copies one entry; read errors mean a corrupt archive, write errors a filesystem problem. */
    private static long copyEntry(ZipInputStream zis, Path target, ZipEntry entry, Path archive)
            throws ExtractionCorruptException, StagingFilesystemException {
        OutputStream out;
        try {
            out = Files.newOutputStream(target);
        } catch (IOException e) {
            throw new StagingFilesystemException("Cannot write " + target, e);
        }

        byte[] buffer = new byte[BUFFER_SIZE];
        long written = 0;
        try (out) {
            while (true) {
                int read;
                try {
                    read = zis.read(buffer);
                } catch (IOException e) {
                    if (isInterrupt(e)) throw interrupted(archive, e);
                    throw new ExtractionCorruptException("Corrupt entry " + entry.getName() + " in " + archive
                            + ": " + e.getMessage(), e);
                }
                if (read == -1) break;
                out.write(buffer, 0, read);
                written += read;
            }
        } catch (IOException e) {
            throw new StagingFilesystemException("Failed writing " + target + ": " + e.getMessage(), e);
        }

        if (entry.getSize() >= 0 && written != entry.getSize()) {
            throw new ExtractionCorruptException("Entry " + entry.getName() + " in " + archive + " is "
                    + written + " bytes, header says " + entry.getSize());
        }
        return written;
    }

    private static boolean isInterrupt(IOException e) {
        return e instanceof ClosedByInterruptException
                || e instanceof InterruptedIOException
                || Thread.currentThread().isInterrupted();
    }

    private static StagingFilesystemException interrupted(Path archive, IOException e) {
        return new StagingFilesystemException("Extraction of " + archive.getFileName() + " aborted by interrupt", e);
    }

    private static Path safeResolve(Path directory, String entryName, Path archive)
            throws ExtractionCorruptException {
        String name = entryName.replace('\\', '/');
        if (name.isEmpty() || name.startsWith("/") || name.matches("^[A-Za-z]:.*")) {
            throw new ExtractionCorruptException("Unsafe entry name '" + entryName + "' in " + archive);
        }
        Path resolved = directory.resolve(name).normalize();
        if (!resolved.startsWith(directory) || resolved.equals(directory)) {
            throw new ExtractionCorruptException("Entry '" + entryName + "' escapes the target directory in "
                    + archive);
        }
        return resolved;
    }

    private static void createDirectories(Path dir) throws StagingFilesystemException {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StagingFilesystemException("Cannot create " + dir, e);
        }
    }

    // -- Swap --

    private void swap(Path temp, Path target) throws StagingFilesystemException {
        Path previous = null;
        if (Files.exists(target)) {
            previous = asidePath(target);
            try {
                move(target, previous);
            } catch (IOException e) {
                deleteQuietly(temp);
                throw new StagingFilesystemException("Cannot move existing " + target + " aside", e);
            }
        }

        try {
            move(temp, target);
        } catch (IOException e) {
            if (previous != null) {
                rollback(previous, target);
            }
            deleteQuietly(temp);
            throw new StagingFilesystemException("Cannot move extracted tree into " + target, e);
        }

        if (previous != null) {
            deleteQuietly(previous);
        }
    }

    private void rollback(Path previous, Path target) {
        try {
            move(previous, target);
        } catch (IOException e) {
            LOG.error("Could not restore {} from {}; the next sweep removes the leftover", target, previous, e);
        }
    }

    static Path asidePath(Path target) {
        return target.resolveSibling(PREVIOUS_PREFIX + target.getFileName() + "." + UUID.randomUUID());
    }

    /**
     * The directory a {@code .previous-*} tree was renamed aside from, or
     * empty if the name does not carry one.
     */
    public static Optional<Path> swapTarget(Path aside) {
        String name = aside.getFileName().toString();
        int suffix = UUID_LENGTH + 1;
        if (!name.startsWith(PREVIOUS_PREFIX) || name.length() <= PREVIOUS_PREFIX.length() + suffix
                || name.charAt(name.length() - suffix) != '.') {
            return Optional.empty();
        }
        return Optional.of(aside.resolveSibling(name.substring(PREVIOUS_PREFIX.length(), name.length() - suffix)));
    }

    /** Atomic directory rename; overridable so tests can inject a failure. */
    void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            StorageUtils.deleteRecursively(path);
        } catch (IOException e) {
            LOG.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
