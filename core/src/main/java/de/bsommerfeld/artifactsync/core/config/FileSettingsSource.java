package de.bsommerfeld.artifactsync.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * {@link SettingsSource} backed by {@code config.toml}. The file is re-read
 * whenever its modification time changes. A reload that fails to parse or
 * validate is logged and the last good snapshot stays in effect, so a typo
 * in a running system never stops synchronization.
 */
public class FileSettingsSource implements SettingsSource {

    private static final Logger LOG = LoggerFactory.getLogger(FileSettingsSource.class);

    private final Path configFile;
    private final Path appDataDir;

    private SyncSettings current;
    private FileTime loadedAt;

    /**
     * Loads the initial snapshot. Unlike later reloads, a broken file here is
     * fatal.
     *
     * @throws IOException              if the file cannot be read or written
     * @throws IllegalArgumentException if a value fails validation
     */
    public FileSettingsSource(Path configFile, Path appDataDir) throws IOException {
        this.configFile = configFile;
        this.appDataDir = appDataDir;
        this.current = SyncSettings.from(ConfigurationLoader.load(configFile), appDataDir);
        this.loadedAt = modificationTime();
        LOG.info("Loaded configuration: {}", current);
    }

    @Override
    public synchronized SyncSettings current() {
        FileTime modified = modificationTime();
        if (modified != null && !modified.equals(loadedAt)) {
            reload(modified);
        }
        return current;
    }

    private void reload(FileTime modified) {
        try {
            current = SyncSettings.from(ConfigurationLoader.load(configFile), appDataDir);
            LOG.info("Reloaded configuration: {}", current);
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Ignoring invalid configuration change in {}: {}", configFile, e.getMessage());
        }
        loadedAt = modified;
    }

    private FileTime modificationTime() {
        try {
            return Files.getLastModifiedTime(configFile);
        } catch (IOException e) {
            return null;
        }
    }
}
