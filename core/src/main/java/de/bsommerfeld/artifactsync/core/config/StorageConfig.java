package de.bsommerfeld.artifactsync.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Local staging and persistence parameters. Empty paths resolve to
 * locations inside the application data directory.
 */
public class StorageConfig {

    public static final String DEFAULT_PATH_TEMPLATE =
            "{ProjectShortKey}/{ComponentName}/{branch}/Build{date}.{buildNumber}/{componentName}.zip";

    @JsonProperty("base-directory")
    private String baseDirectory = "";

    @JsonProperty("database-file")
    private String databaseFile = "";

    @JsonProperty("retention-count")
    private int retentionCount = 5;

    @JsonProperty("default-path-template")
    private String defaultPathTemplate = DEFAULT_PATH_TEMPLATE;

    public String getBaseDirectory() {
        return baseDirectory;
    }

    public void setBaseDirectory(String baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    public String getDatabaseFile() {
        return databaseFile;
    }

    public void setDatabaseFile(String databaseFile) {
        this.databaseFile = databaseFile;
    }

    public int getRetentionCount() {
        return retentionCount;
    }

    public void setRetentionCount(int retentionCount) {
        this.retentionCount = retentionCount;
    }

    public String getDefaultPathTemplate() {
        return defaultPathTemplate;
    }

    public void setDefaultPathTemplate(String defaultPathTemplate) {
        this.defaultPathTemplate = defaultPathTemplate;
    }
}
