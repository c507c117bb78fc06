package de.bsommerfeld.artifactsync.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@code config.toml}. A missing file is created with the
 * defaults so operators have a complete template to edit.
 */
public final class ConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigurationLoader() {
    }

    /**
     * Loads the configuration at {@code path}, writing defaults first if the
     * file does not exist.
     *
     * @throws IOException if the file cannot be read, written or parsed
     */
    public static SyncConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            LOG.info("No configuration at {}, writing defaults", path.toAbsolutePath());
            SyncConfig defaults = new SyncConfig();
            write(path, defaults);
            return defaults;
        }
        return MAPPER.readValue(path.toFile(), SyncConfig.class);
    }

    public static void write(Path path, SyncConfig config) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), config);
    }
}
