package io.jobargs4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the Mongo-backed broker and its runner.
 */
@ConfigurationProperties(prefix = "jobargs")
public class JobArgsProperties {
    private boolean enabled = true;
    private boolean processJobs = true; // false: submit only, never run
    private int maxConcurrency = 20;
    private int batchSize = 5;
    private int maxRetryCount = 5;
    private Duration lockLifetime = Duration.ofMinutes(10);
    private Duration pollInterval = Duration.ofSeconds(5);
    private boolean cleanupFinishedJobs = true;
    private String workerId;
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isProcessJobs() {
        return processJobs;
    }

    public void setProcessJobs(boolean processJobs) {
        this.processJobs = processJobs;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxRetryCount() {
        return maxRetryCount;
    }

    public void setMaxRetryCount(int maxRetryCount) {
        this.maxRetryCount = maxRetryCount;
    }

    public Duration getLockLifetime() {
        return lockLifetime;
    }

    public void setLockLifetime(Duration lockLifetime) {
        this.lockLifetime = lockLifetime;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public boolean isCleanupFinishedJobs() {
        return cleanupFinishedJobs;
    }

    public void setCleanupFinishedJobs(boolean cleanupFinishedJobs) {
        this.cleanupFinishedJobs = cleanupFinishedJobs;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
