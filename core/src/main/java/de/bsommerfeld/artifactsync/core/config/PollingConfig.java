package de.bsommerfeld.artifactsync.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Scheduler parameters. */
public class PollingConfig {

    @JsonProperty("interval-seconds")
    private long intervalSeconds = 60;

    @JsonProperty("max-concurrent-jobs")
    private int maxConcurrentJobs = 100;

    @JsonProperty("cycle-timeout-seconds")
    private long cycleTimeoutSeconds = 3600;

    @JsonProperty("shutdown-grace-seconds")
    private long shutdownGraceSeconds = 60;

    public long getIntervalSeconds() {
        return intervalSeconds;
    }

    public void setIntervalSeconds(long intervalSeconds) {
        this.intervalSeconds = intervalSeconds;
    }

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    public void setMaxConcurrentJobs(int maxConcurrentJobs) {
        this.maxConcurrentJobs = maxConcurrentJobs;
    }

    public long getCycleTimeoutSeconds() {
        return cycleTimeoutSeconds;
    }

    public void setCycleTimeoutSeconds(long cycleTimeoutSeconds) {
        this.cycleTimeoutSeconds = cycleTimeoutSeconds;
    }

    public long getShutdownGraceSeconds() {
        return shutdownGraceSeconds;
    }

    public void setShutdownGraceSeconds(long shutdownGraceSeconds) {
        this.shutdownGraceSeconds = shutdownGraceSeconds;
    }
}
