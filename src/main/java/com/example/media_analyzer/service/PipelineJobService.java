package com.example.media_analyzer.service;

import com.example.media_analyzer.config.WorkerExecutorProperties;
import com.example.media_analyzer.dto.web.AnalysisResultResponse;
import com.example.media_analyzer.dto.web.JobStatusResponse;
import com.example.media_analyzer.dto.web.JobSummaryResponse;
import com.example.media_analyzer.dto.web.PageResponse;
import com.example.media_analyzer.dto.web.ProgressEntryResponse;
import com.example.media_analyzer.exception.StorageException;
import com.example.media_analyzer.model.AnalysisJob;
import com.example.media_analyzer.model.AnalysisReport;
import com.example.media_analyzer.model.Transcript;
import com.example.media_analyzer.repository.AnalysisJobRepository;
import com.example.media_analyzer.repository.AnalysisReportRepository;
import com.example.media_analyzer.repository.FrameRecordRepository;
import com.example.media_analyzer.repository.ProgressLogEntryRepository;
import com.example.media_analyzer.repository.TranscriptRepository;
import com.example.media_analyzer.service.Interfaces.AnalysisResultStore;
import com.example.media_analyzer.service.Interfaces.StorageService;
import com.example.media_analyzer.util.AnalysisMode;
import com.example.media_analyzer.util.MediaKind;
import com.example.media_analyzer.util.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Owns the lifecycle of analysis jobs: submission, status, retry, cancellation, and the stage transitions
 * requested by the pipeline.
 */
@Service
public class PipelineJobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineJobService.class);
    static final String CANCELLED = "cancelled";
    static final int MAX_PAGE_SIZE = 100;

    private final AnalysisJobRepository jobRepo;
    private final ProgressLogEntryRepository progressRepo;
    private final TranscriptRepository transcriptRepo;
    private final FrameRecordRepository frameRepo;
    private final AnalysisReportRepository reportRepo;
    private final AnalysisResultStore resultStore;
    private final StorageService storage;
    private final ProgressLogger progress;
    private final RunningJobRegistry running;
    private final WorkerExecutorProperties workerProperties;
    private final Clock clock;

    public PipelineJobService(AnalysisJobRepository jobRepo,
                              ProgressLogEntryRepository progressRepo,
                              TranscriptRepository transcriptRepo,
                              FrameRecordRepository frameRepo,
                              AnalysisReportRepository reportRepo,
                              AnalysisResultStore resultStore,
                              StorageService storage,
                              ProgressLogger progress,
                              RunningJobRegistry running,
                              WorkerExecutorProperties workerProperties,
                              Clock clock) {
        this.jobRepo = jobRepo;
        this.progressRepo = progressRepo;
        this.transcriptRepo = transcriptRepo;
        this.frameRepo = frameRepo;
        this.reportRepo = reportRepo;
        this.resultStore = resultStore;
        this.storage = storage;
        this.progress = progress;
        this.running = running;
        this.workerProperties = workerProperties;
        this.clock = clock;
    }

    public UUID submit(String mediaPath, String context, AnalysisMode analysisMode) {
        if (mediaPath == null || mediaPath.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "MEDIA_PATH_REQUIRED");
        }
        String key = mediaPath.strip();
        MediaKind kind = MediaKind.fromFileName(key)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNSUPPORTED_MEDIA_TYPE"));
        boolean exists;
        try {
            exists = storage.existsInRaw(key);
        } catch (StorageException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_OBJECT_KEY", e);
        }
        if (!exists) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "MEDIA_NOT_FOUND");
        }
        AnalysisJob job = jobRepo.save(new AnalysisJob(key, kind, context, analysisMode));
        LOGGER.info("JOB submitted jobId={} media={} kind={} mode={}", job.getId(), key, kind, job.getAnalysisMode());
        progress.info(job.getId(), PipelineStage.QUEUED, "Job queued for " + kind.name().toLowerCase(Locale.ROOT) + " analysis");
        return job.getId();
    }

    @Transactional(readOnly = true)
    public JobStatusResponse getStatus(UUID jobId) {
        AnalysisJob job = find(jobId);
        List<ProgressEntryResponse> log = progressRepo.findByJobIdOrdered(jobId).stream()
                .map(ProgressEntryResponse::from)
                .toList();
        return new JobStatusResponse(job.getId(), job.getMediaPath(), job.getMediaKind(), job.getAnalysisMode(),
                job.getStage(), job.getAttempts(), job.getErrorMessage(), job.getCreatedAt(), job.getUpdatedAt(), log);
    }

    /**
     * Newest first, optionally restricted to one stage.
     */
    @Transactional(readOnly = true)
    public PageResponse<JobSummaryResponse> list(PipelineStage stage, int page, int size) {
        if (page < 0 || size < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_PAGE");
        }
        PageRequest pageable = PageRequest.of(page, Math.min(size, MAX_PAGE_SIZE));
        Page<AnalysisJob> result = stage == null
                ? jobRepo.findAllByOrderByCreatedAtDesc(pageable)
                : jobRepo.findByStageOrderByCreatedAtDesc(stage, pageable);
        return new PageResponse<>(result.map(JobSummaryResponse::from).getContent(),
                result.getNumber(), result.getSize(), result.getTotalElements());
    }

    /**
     * Removes a finished job: its published frames, its rows, and the raw media once no other job refers to it.
     * Unfinished jobs must be cancelled first.
     */
    public void delete(UUID jobId) {
        AnalysisJob job = find(jobId);
        if (!job.getStage().isTerminal()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_NOT_FINISHED");
        }
        awaitWorkerRelease(jobId);

        int removed = storage.deleteOutPrefix(outPrefix(jobId));
        resultStore.deleteJob(jobId);

        String mediaPath = job.getMediaPath();
        boolean rawDeleted = false;
        if (!jobRepo.existsByMediaPath(mediaPath)) {
            try {
                rawDeleted = storage.deleteRaw(mediaPath);
            } catch (StorageException e) {
                LOGGER.warn("JOB delete left raw media behind jobId={} media={} err={}", jobId, mediaPath, e.getMessage());
            }
        }
        LOGGER.info("JOB deleted jobId={} removedFiles={} rawDeleted={}", jobId, removed, rawDeleted);
    }

    /**
     * Sends a failed job back to the queue. Waits for the previous run to let go of the job, clears its partial
     * results and uploaded frames, and resets it to {@link PipelineStage#QUEUED}.
     */
    public void retry(UUID jobId) {
        AnalysisJob job = find(jobId);
        if (job.getStage() != PipelineStage.FAILED) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_NOT_RETRYABLE");
        }
        awaitWorkerRelease(jobId);

        resultStore.clearResults(jobId);
        int removed = storage.deleteOutPrefix(outPrefix(jobId));

        job.setStage(PipelineStage.QUEUED);
        job.setErrorMessage(null);
        job.setCancelRequested(false);
        job.setStartedAt(null);
        job.setFinishedAt(null);
        jobRepo.save(job);
        LOGGER.info("JOB retry jobId={} attempts={} removedFiles={}", jobId, job.getAttempts(), removed);
        progress.info(jobId, PipelineStage.QUEUED, "Retry requested, partial results cleared");
    }

    /**
     * Queued jobs fail at once; running jobs stop at the next stage or frame boundary.
     */
    public void cancel(UUID jobId) {
        AnalysisJob job = find(jobId);
        if (job.getStage().isTerminal()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_ALREADY_FINISHED");
        }
        if (job.getStage() == PipelineStage.QUEUED) {
            job.setStage(PipelineStage.FAILED);
            job.setErrorMessage(CANCELLED);
            job.setFinishedAt(Instant.now(clock));
            jobRepo.save(job);
            progress.error(jobId, PipelineStage.FAILED, "Job cancelled before start");
        } else {
            job.setCancelRequested(true);
            jobRepo.save(job);
            progress.warning(jobId, job.getStage(), "Cancellation requested");
        }
        LOGGER.info("JOB cancel requested jobId={} stage={}", jobId, job.getStage());
    }

    @Transactional(readOnly = true)
    public AnalysisResultResponse getResult(UUID jobId) {
        AnalysisJob job = find(jobId);
        if (job.getStage() != PipelineStage.COMPLETED) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_NOT_COMPLETED");
        }
        Transcript t = transcriptRepo.findByJobId(jobId).orElse(null);
        AnalysisReport r = reportRepo.findByJobId(jobId).orElse(null);
        var frames = frameRepo.findByJobIdOrdered(jobId).stream()
                .map(f -> new AnalysisResultResponse.FramePart(f.getFrameIndex(), f.getTimestampSeconds(), f.getFrameNumber(),
                        f.getExtractionMethod(), f.getSceneChangeScore(), f.getImageUrl(), f.getDescription(), f.isFallback()))
                .toList();
        return new AnalysisResultResponse(jobId,
                t == null ? null : new AnalysisResultResponse.TranscriptPart(t.getText(), t.getLang(), t.getProvider(),
                        t.getSegments(), t.isEnriched(), t.getEnrichment()),
                frames,
                r == null ? null : new AnalysisResultResponse.ReportPart(r.getAnalysisMode(), r.getSummary(), r.getDocument()));
    }

    // ---- worker side ----

    @Transactional
    public List<AnalysisJob> claimQueuedBatch(int maxBatchSize) {
        if (maxBatchSize <= 0) {
            return List.of();
        }
        List<UUID> ids = jobRepo.selectQueuedIdsForUpdate(maxBatchSize);
        if (ids.isEmpty()) {
            return List.of();
        }
        Map<UUID, Integer> order = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            order.put(ids.get(i), i);
        }
        Instant now = Instant.now(clock);
        List<AnalysisJob> jobs = new ArrayList<>(jobRepo.findAllById(ids));
        for (AnalysisJob job : jobs) {
            job.setStage(PipelineStage.EXTRACTING_AUDIO);
            job.setAttempts(job.getAttempts() + 1);
            job.setStartedAt(now);
        }
        jobs.sort(Comparator.comparingInt(j -> order.getOrDefault(j.getId(), Integer.MAX_VALUE)));
        return jobs;
    }

    /** Puts a claimed job back when no worker thread could take it. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void requeue(UUID jobId) {
        jobRepo.findById(jobId).ifPresent(job -> {
            job.setStage(PipelineStage.QUEUED);
            job.setAttempts(Math.max(0, job.getAttempts() - 1));
            job.setStartedAt(null);
        });
    }

    @Transactional(readOnly = true)
    public AnalysisJob getJob(UUID jobId) {
        return find(jobId);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markStage(UUID jobId, PipelineStage stage) {
        AnalysisJob job = find(jobId);
        if (job.getStage().isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " is already " + job.getStage());
        }
        job.setStage(stage);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markCompleted(UUID jobId) {
        AnalysisJob job = find(jobId);
        job.setStage(PipelineStage.COMPLETED);
        job.setErrorMessage(null);
        job.setFinishedAt(Instant.now(clock));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID jobId, String message) {
        AnalysisJob job = find(jobId);
        job.setStage(PipelineStage.FAILED);
        job.setErrorMessage(message == null || message.isBlank() ? "unknown" : message);
        job.setCancelRequested(false);
        job.setFinishedAt(Instant.now(clock));
    }

    public boolean isCancelRequested(UUID jobId) {
        return Boolean.TRUE.equals(jobRepo.findCancelRequested(jobId));
    }

    public static String outPrefix(UUID jobId) {
        return "analyses/" + jobId + "/";
    }

    private void awaitWorkerRelease(UUID jobId) {
        Duration wait = Duration.ofSeconds(Math.max(1, workerProperties.getCancelWaitSeconds()));
        try {
            if (!running.awaitRelease(jobId, wait)) {
                throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_STILL_RUNNING");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "INTERRUPTED");
        }
    }

    private AnalysisJob find(UUID jobId) {
        return jobRepo.findById(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
    }
}
