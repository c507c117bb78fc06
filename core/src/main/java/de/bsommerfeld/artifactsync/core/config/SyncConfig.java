package de.bsommerfeld.artifactsync.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Mutable so Jackson can bind it; the engine
 * never reads it directly but works on an immutable {@link SyncSettings}
 * snapshot derived from it.
 */
public class SyncConfig {

    @JsonProperty("repository")
    private RepositoryConfig repository = new RepositoryConfig();

    @JsonProperty("polling")
    private PollingConfig polling = new PollingConfig();

    @JsonProperty("storage")
    private StorageConfig storage = new StorageConfig();

    public RepositoryConfig getRepository() {
        return repository;
    }

    public PollingConfig getPolling() {
        return polling;
    }

    public StorageConfig getStorage() {
        return storage;
    }
}
