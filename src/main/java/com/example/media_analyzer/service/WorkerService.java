package com.example.media_analyzer.service;

import com.example.media_analyzer.config.WorkerExecutorProperties;
import com.example.media_analyzer.model.AnalysisJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * Polls for queued jobs and runs each claimed job on the worker pool. A semaphore bounds how many pipelines
 * run at the same time; a job's stages all run on the thread that took it.
 */
@Service
public class WorkerService {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerService.class);

    private final PipelineJobService jobService;
    private final AnalysisPipeline pipeline;
    private final RunningJobRegistry running;
    private final Executor workerExecutor;
    private final WorkerExecutorProperties workerProperties;
    private final Semaphore pipelineSemaphore;

    public WorkerService(PipelineJobService jobService,
                         AnalysisPipeline pipeline,
                         RunningJobRegistry running,
                         @Qualifier("workerTaskExecutor") Executor workerExecutor,
                         WorkerExecutorProperties workerProperties) {
        this.jobService = jobService;
        this.pipeline = pipeline;
        this.running = running;
        this.workerExecutor = workerExecutor;
        this.workerProperties = workerProperties;
        this.pipelineSemaphore = new Semaphore(Math.max(1, workerProperties.getMaxConcurrentJobs()));
    }

    @Scheduled(fixedDelayString = "${worker.poll-delay-ms:3000}")
    public void poll() {
        int free = Math.min(workerProperties.getPollBatchSize(), pipelineSemaphore.availablePermits());
        if (free <= 0) {
            LOGGER.debug("Worker poll tick - all pipeline slots busy");
            return;
        }
        List<AnalysisJob> jobs = jobService.claimQueuedBatch(free);
        if (jobs.isEmpty()) {
            LOGGER.debug("Worker poll tick - no jobs claimed");
            return;
        }
        LOGGER.info("Worker claimed jobs count={} ids={}", jobs.size(), jobs.stream().map(AnalysisJob::getId).toList());
        jobs.forEach(job -> submitJob(job.getId()));
    }

    void submitJob(UUID jobId) {
        running.register(jobId);
        try {
            workerExecutor.execute(() -> runJobWithSemaphore(jobId));
        } catch (TaskRejectedException e) {
            running.release(jobId);
            LOGGER.warn("Worker pool full, requeueing jobId={}", jobId);
            jobService.requeue(jobId);
        }
    }

    void runJobWithSemaphore(UUID jobId) {
        boolean acquired = false;
        long t0 = System.nanoTime();
        try {
            pipelineSemaphore.acquire();
            acquired = true;
            LOGGER.info("JOB START jobId={}", jobId);
            boolean ok = pipeline.run(jobId);
            LOGGER.info("JOB {} jobId={} in={}ms", ok ? "DONE" : "FAILED", jobId, (System.nanoTime() - t0) / 1_000_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("JOB interrupted before start jobId={}", jobId);
            jobService.markFailed(jobId, "interrupted");
        } catch (Exception e) {
            LOGGER.error("Job {} failed outside the pipeline: {}", jobId, e.toString(), e);
            jobService.markFailed(jobId, e.getMessage());
        } finally {
            if (acquired) {
                pipelineSemaphore.release();
            }
            running.release(jobId);
        }
    }
}
