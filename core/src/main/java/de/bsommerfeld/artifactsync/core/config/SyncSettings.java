package de.bsommerfeld.artifactsync.core.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration snapshot handed to each synchronization cycle.
 * Jobs only ever see the snapshot that was current when their cycle
 * started, so a config reload never changes settings under a running job.
 *
 * @param repositoryBaseUrl   Artifactory base URL, without trailing slash
 * @param repositoryKey       repository holding the builds (e.g. {@code raw})
 * @param username            basic-auth user, empty for anonymous access
 * @param password            basic-auth password
 * @param connectTimeout      TCP connect timeout
 * @param downloadTimeout     upper bound for a single listing or download
 * @param pollInterval        pause between the end of a cycle and the next
 * @param maxConcurrentJobs   worker pool size
 * @param cycleTimeout        how long a cycle waits for its jobs to settle
 * @param shutdownGrace       how long shutdown waits for in-flight jobs
 * @param baseDirectory       root of the staging/extraction tree
 * @param databaseFile        SQLite database file
 * @param retentionCount      builds kept on disk per branch
 * @param defaultPathTemplate template for branches without an override
 */
public record SyncSettings(URI repositoryBaseUrl, String repositoryKey, String username, String password,
        Duration connectTimeout, Duration downloadTimeout, Duration pollInterval, int maxConcurrentJobs,
        Duration cycleTimeout, Duration shutdownGrace, Path baseDirectory, Path databaseFile,
        int retentionCount, String defaultPathTemplate) {

    static final long MIN_INTERVAL_SECONDS = 30;

    public SyncSettings {
        Objects.requireNonNull(repositoryBaseUrl, "repositoryBaseUrl");
        Objects.requireNonNull(baseDirectory, "baseDirectory");
        Objects.requireNonNull(defaultPathTemplate, "defaultPathTemplate");
        username = username == null ? "" : username;
        password = password == null ? "" : password;
    }

    /**
     * Validates the bound configuration and resolves empty paths against the
     * application data directory.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public static SyncSettings from(SyncConfig config, Path appDataDir) {
        RepositoryConfig repo = config.getRepository();
        PollingConfig polling = config.getPolling();
        StorageConfig storage = config.getStorage();

        if (repo.getBaseUrl() == null || repo.getBaseUrl().isBlank()) {
            throw new IllegalArgumentException("repository.base-url must be set");
        }
        if (repo.getRepositoryKey() == null || repo.getRepositoryKey().isBlank()) {
            throw new IllegalArgumentException("repository.repository-key must be set");
        }
        requirePositive("repository.connect-timeout-seconds", repo.getConnectTimeoutSeconds());
        requirePositive("repository.download-timeout-seconds", repo.getDownloadTimeoutSeconds());
        if (polling.getIntervalSeconds() < MIN_INTERVAL_SECONDS) {
            throw new IllegalArgumentException("polling.interval-seconds must be >= " + MIN_INTERVAL_SECONDS
                    + ", got " + polling.getIntervalSeconds());
        }
        requirePositive("polling.max-concurrent-jobs", polling.getMaxConcurrentJobs());
        requirePositive("polling.cycle-timeout-seconds", polling.getCycleTimeoutSeconds());
        requirePositive("polling.shutdown-grace-seconds", polling.getShutdownGraceSeconds());
        requirePositive("storage.retention-count", storage.getRetentionCount());
        if (storage.getDefaultPathTemplate() == null || storage.getDefaultPathTemplate().isBlank()) {
            throw new IllegalArgumentException("storage.default-path-template must be set");
        }

        String baseUrl = repo.getBaseUrl().strip();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }

        return new SyncSettings(
                URI.create(baseUrl),
                repo.getRepositoryKey().strip(),
                repo.getUsername(),
                repo.getPassword(),
                Duration.ofSeconds(repo.getConnectTimeoutSeconds()),
                Duration.ofSeconds(repo.getDownloadTimeoutSeconds()),
                Duration.ofSeconds(polling.getIntervalSeconds()),
                polling.getMaxConcurrentJobs(),
                Duration.ofSeconds(polling.getCycleTimeoutSeconds()),
                Duration.ofSeconds(polling.getShutdownGraceSeconds()),
                resolve(storage.getBaseDirectory(), appDataDir.resolve("staging")),
                resolve(storage.getDatabaseFile(), appDataDir.resolve("artifact-sync.db")),
                storage.getRetentionCount(),
                storage.getDefaultPathTemplate().strip());
    }

    public boolean hasCredentials() {
        return !username.isBlank();
    }

    private static Path resolve(String configured, Path fallback) {
        if (configured == null || configured.isBlank()) return fallback.toAbsolutePath();
        return Path.of(configured.strip()).toAbsolutePath();
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be > 0, got " + value);
        }
    }

    @Override
    public String toString() {
        // keep the password out of logs
        return "SyncSettings[repository=" + repositoryBaseUrl + "/" + repositoryKey
                + ", user=" + (hasCredentials() ? username : "<anonymous>")
                + ", interval=" + pollInterval + ", workers=" + maxConcurrentJobs
                + ", base=" + baseDirectory + ", retention=" + retentionCount + "]";
    }
}
