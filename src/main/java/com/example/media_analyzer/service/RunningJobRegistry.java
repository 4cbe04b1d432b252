package com.example.media_analyzer.service;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Tracks which jobs currently hold a worker thread, so a retry can wait until the previous run has let go.
 */
@Component
public class RunningJobRegistry {
    private final Map<UUID, CountDownLatch> running = new ConcurrentHashMap<>();

    public void register(UUID jobId) {
        running.put(jobId, new CountDownLatch(1));
    }

    public void release(UUID jobId) {
        CountDownLatch latch = running.remove(jobId);
        if (latch != null) {
            latch.countDown();
        }
    }

    public boolean isRunning(UUID jobId) {
        return running.containsKey(jobId);
    }

    /**
     * @return {@code true} when the job is not (or no longer) running.
     */
    public boolean awaitRelease(UUID jobId, Duration timeout) throws InterruptedException {
        CountDownLatch latch = running.get(jobId);
        return latch == null || latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
