package de.bsommerfeld.artifactsync.repository.download;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.artifactsync.core.error.DownloadIncompleteException;
import de.bsommerfeld.artifactsync.core.error.DownloadTimeoutException;
import de.bsommerfeld.artifactsync.core.error.RepositoryUnreachableException;
import de.bsommerfeld.artifactsync.core.error.StagingFilesystemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Streams an HTTP response into a file.
 *
 * <h3>Write protocol</h3>
 * The body goes to {@code <target>.tmp} while its SHA-256 is computed on the
 * fly. Only after size and checksum match the expectation is the temp file
 * moved over {@code target} in one atomic rename. A failed or aborted
 * download therefore never touches an existing {@code target}, and the temp
 * file is removed.
 *
 * <h3>Deadline</h3>
 * The timeout covers the whole transfer, not just the response headers. A
 * shared watchdog thread closes the body stream once the deadline passes,
 * which unblocks a read on a stalled connection.
 */
public final class Downloader {

    private static final Logger LOG = LoggerFactory.getLogger(Downloader.class);
    private static final int BUFFER_SIZE = 64 * 1024;

    private static final ScheduledExecutorService WATCHDOG = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("download-watchdog").setDaemon(true).build());

    private Downloader() {}

    /**
     * Downloads {@code request} to {@code target}.
     *
     * @param expectedSize   size reported by the repository, or -1 if unknown
     * @param expectedSha256 checksum reported by the repository, or
     *                       {@code null} to skip verification
     * @return bytes written
     */
    public static long toFile(HttpClient http, HttpRequest request, Path target, long expectedSize,
            String expectedSha256, Duration timeout, DownloadProgressListener listener)
            throws RepositoryUnreachableException, DownloadTimeoutException, DownloadIncompleteException,
            StagingFilesystemException {

        String url = request.uri().toString();
        long deadline = System.nanoTime() + timeout.toNanos();
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");

        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new StagingFilesystemException("Cannot create staging directory for " + target, e);
        }

        HttpResponse<InputStream> response = send(http, request, url);
        InputStream body = response.body();
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            closeQuietly(body);
            if (response.statusCode() == 404) {
                throw new DownloadIncompleteException("Artifact vanished before download: " + url);
            }
            throw new RepositoryUnreachableException("HTTP " + response.statusCode() + " for " + url);
        }

        long total = expectedSize >= 0
                ? expectedSize
                : response.headers().firstValueAsLong("Content-Length").orElse(-1);

        AtomicBoolean timedOut = new AtomicBoolean();
        long remaining = Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
        ScheduledFuture<?> watchdog = WATCHDOG.schedule(() -> {
            timedOut.set(true);
            closeQuietly(body);
        }, remaining, TimeUnit.MILLISECONDS);

        boolean success = false;
        try {
            MessageDigest digest = HashUtil.newSha256();
            long written = transfer(body, temp, digest, total, listener, timedOut, url);
            verify(url, written, expectedSize, HashUtil.hex(digest), expectedSha256);
            moveIntoPlace(temp, target);
            success = true;
            return written;
        } finally {
            watchdog.cancel(false);
            closeQuietly(body);
            if (!success) {
                deleteTemp(temp);
            }
        }
    }

    private static HttpResponse<InputStream> send(HttpClient http, HttpRequest request, String url)
            throws RepositoryUnreachableException, DownloadTimeoutException {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException e) {
            throw new DownloadTimeoutException("Timed out waiting for " + url, e);
        } catch (IOException e) {
            throw new RepositoryUnreachableException("Request failed for " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepositoryUnreachableException("Download interrupted: " + url, e);
        }
    }

    /** Copies the body, keeping network and disk failures apart. */
    private static long transfer(InputStream in, Path temp, MessageDigest digest, long total,
            DownloadProgressListener listener, AtomicBoolean timedOut, String url)
            throws RepositoryUnreachableException, DownloadTimeoutException, StagingFilesystemException {
        OutputStream out;
        try {
            out = Files.newOutputStream(temp);
        } catch (IOException e) {
            throw new StagingFilesystemException("Cannot open " + temp + " for writing", e);
        }

        byte[] buffer = new byte[BUFFER_SIZE];
        long transferred = 0;
        try (out) {
            while (true) {
                int read;
                try {
                    read = in.read(buffer);
                } catch (IOException e) {
                    if (timedOut.get()) {
                        throw new DownloadTimeoutException("Download exceeded its deadline after "
                                + transferred + " bytes: " + url, e);
                    }
                    throw new RepositoryUnreachableException("Connection lost after " + transferred
                            + " bytes: " + url, e);
                }
                if (read == -1) break;
                out.write(buffer, 0, read);
                digest.update(buffer, 0, read);
                transferred += read;
                listener.onProgress(transferred, total);
            }
        } catch (IOException e) {
            throw new StagingFilesystemException("Failed writing " + temp + ": " + e.getMessage(), e);
        }
        if (timedOut.get()) {
            // the watchdog fired between the last chunk and end of stream
            throw new DownloadTimeoutException("Download exceeded its deadline: " + url);
        }
        return transferred;
    }

    private static void verify(String url, long written, long expectedSize, String actualSha256,
            String expectedSha256) throws DownloadIncompleteException {
        if (expectedSize >= 0 && written != expectedSize) {
            throw new DownloadIncompleteException("Size mismatch for " + url + ": expected "
                    + expectedSize + " bytes, got " + written);
        }
        if (expectedSha256 != null && !expectedSha256.isBlank()
                && !expectedSha256.equalsIgnoreCase(actualSha256)) {
            throw new DownloadIncompleteException("Checksum mismatch for " + url + ": expected "
                    + expectedSha256 + ", got " + actualSha256);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws StagingFilesystemException {
        try {
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StagingFilesystemException("Cannot move " + temp + " to " + target, e);
        }
    }

    private static void deleteTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Could not remove partial download {}: {}", temp, e.getMessage());
        }
    }

    private static void closeQuietly(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            LOG.debug("Ignoring failure while closing response body: {}", e.getMessage());
        }
    }
}
