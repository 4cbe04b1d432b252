package com.example.media_analyzer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configures worker polling and the number of analysis jobs allowed to run at the same time.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private int pollBatchSize = 2;
    private int executorThreads = 2;
    private int executorQueueCapacity = 20;
    private int maxConcurrentJobs = 2;
    private long cancelWaitSeconds = 30;

    public int getPollBatchSize() {
        return pollBatchSize;
    }

    public void setPollBatchSize(int pollBatchSize) {
        this.pollBatchSize = pollBatchSize;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    public void setMaxConcurrentJobs(int maxConcurrentJobs) {
        this.maxConcurrentJobs = maxConcurrentJobs;
    }

    /**
     * How long a retry request waits for a cancelled job's worker to let go of its workspace.
     */
    public long getCancelWaitSeconds() {
        return cancelWaitSeconds;
    }

    public void setCancelWaitSeconds(long cancelWaitSeconds) {
        this.cancelWaitSeconds = cancelWaitSeconds;
    }
}
