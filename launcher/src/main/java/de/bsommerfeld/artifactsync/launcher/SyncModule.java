package de.bsommerfeld.artifactsync.launcher;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.artifactsync.core.config.FileSettingsSource;
import de.bsommerfeld.artifactsync.core.config.SettingsSource;
import de.bsommerfeld.artifactsync.db.DatabaseService;
import de.bsommerfeld.artifactsync.db.PackagingQueue;
import de.bsommerfeld.artifactsync.db.SqlDatabaseService;
import de.bsommerfeld.artifactsync.repository.ArtifactoryClientFactory;
import de.bsommerfeld.artifactsync.repository.RepositoryClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice wiring for the sync daemon. The configuration file is read while the
 * module is configured, so a broken file stops startup before any thread or
 * connection exists.
 */
public class SyncModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(SyncModule.class);

    private final Path configFile;
    private final Path appDataDir;

    public SyncModule(Path configFile, Path appDataDir) {
        this.configFile = configFile;
        this.appDataDir = appDataDir;
    }

    @Override
    protected void configure() {
        LOG.info("Loading configuration from: {}", configFile.toAbsolutePath());
        try {
            bind(SettingsSource.class).toInstance(new FileSettingsSource(configFile, appDataDir));
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to load configuration " + configFile + ": " + e.getMessage(), e);
        }

        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(RepositoryClientFactory.class).to(ArtifactoryClientFactory.class);

        // subscribes to BuildStagedEvent on construction
        bind(PackagingQueue.class).asEagerSingleton();
    }

    @Provides
    @Singleton
    DatabaseService provideDatabase(SettingsSource settings) {
        Path databaseFile = settings.current().databaseFile();
        LOG.info("Opening database {}", databaseFile);
        return new SqlDatabaseService(databaseFile);
    }
}
