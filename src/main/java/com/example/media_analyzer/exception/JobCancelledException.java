package com.example.media_analyzer.exception;

import java.util.UUID;

public class JobCancelledException extends RuntimeException {
    private final UUID jobId;

    public JobCancelledException(UUID jobId) {
        super("cancelled");
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
