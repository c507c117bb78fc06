package de.bsommerfeld.artifactsync.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection parameters of the Artifactory instance. Values are persisted
 * in config.toml; setters exist for tests and for the launcher's overrides.
 */
public class RepositoryConfig {

    @JsonProperty("base-url")
    private String baseUrl = "https://artifactory.example.com/artifactory";

    @JsonProperty("repository-key")
    private String repositoryKey = "raw";

    @JsonProperty("username")
    private String username = "";

    @JsonProperty("password")
    private String password = "";

    @JsonProperty("connect-timeout-seconds")
    private long connectTimeoutSeconds = 30;

    @JsonProperty("download-timeout-seconds")
    private long downloadTimeoutSeconds = 300;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getRepositoryKey() {
        return repositoryKey;
    }

    public void setRepositoryKey(String repositoryKey) {
        this.repositoryKey = repositoryKey;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public long getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(long connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public long getDownloadTimeoutSeconds() {
        return downloadTimeoutSeconds;
    }

    public void setDownloadTimeoutSeconds(long downloadTimeoutSeconds) {
        this.downloadTimeoutSeconds = downloadTimeoutSeconds;
    }
}
