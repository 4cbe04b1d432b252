package com.example.media_analyzer.service;

import com.example.media_analyzer.model.AnalysisJob;
import com.example.media_analyzer.model.ProgressLogEntry;
import com.example.media_analyzer.repository.AnalysisJobRepository;
import com.example.media_analyzer.repository.ProgressLogEntryRepository;
import com.example.media_analyzer.util.LogLevel;
import com.example.media_analyzer.util.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Appends entries to a job's user-facing progress log. Each entry commits on its own. A write that loses the
 * sequence number to a concurrent writer is retried once with a fresh number; any other failed write is logged and
 * dropped so it never changes the outcome of the job.
 */
@Service
public class ProgressLogger {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressLogger.class);
    private static final int MAX_MESSAGE_CHARS = 4000;
    static final int MAX_ATTEMPTS = 2;

    private final ProgressLogEntryRepository entries;
    private final AnalysisJobRepository jobs;
    private final TransactionTemplate tx;
    private final Clock clock;

    public ProgressLogger(ProgressLogEntryRepository entries,
                          AnalysisJobRepository jobs,
                          PlatformTransactionManager txManager,
                          Clock clock) {
        this.entries = entries;
        this.jobs = jobs;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public void info(UUID jobId, PipelineStage stage, String message) {
        log(jobId, LogLevel.INFO, stage, message);
    }

    public void warning(UUID jobId, PipelineStage stage, String message) {
        log(jobId, LogLevel.WARNING, stage, message);
    }

    public void error(UUID jobId, PipelineStage stage, String message) {
        log(jobId, LogLevel.ERROR, stage, message);
    }

    public void success(UUID jobId, PipelineStage stage, String message) {
        log(jobId, LogLevel.SUCCESS, stage, message);
    }

    public void log(UUID jobId, LogLevel level, PipelineStage stage, String message) {
        String text = message == null ? "" : message;
        if (text.length() > MAX_MESSAGE_CHARS) {
            text = text.substring(0, MAX_MESSAGE_CHARS);
        }
        String finalText = text;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                append(jobId, level, stage, finalText);
                return;
            } catch (DataIntegrityViolationException e) {
                // another writer took the same seq
                if (attempt == MAX_ATTEMPTS) {
                    LOGGER.warn("PROGRESS write failed jobId={} level={} msg='{}' err={}", jobId, level, finalText, e.toString());
                } else {
                    LOGGER.debug("PROGRESS seq collision jobId={}, retrying", jobId);
                }
            } catch (RuntimeException e) {
                LOGGER.warn("PROGRESS write failed jobId={} level={} msg='{}' err={}", jobId, level, finalText, e.toString());
                return;
            }
        }
    }

    private void append(UUID jobId, LogLevel level, PipelineStage stage, String text) {
        tx.executeWithoutResult(status -> {
            AnalysisJob job = jobs.getReferenceById(jobId);
            int seq = entries.findMaxSeq(jobId) + 1;
            entries.saveAndFlush(new ProgressLogEntry(job, seq, level, stage, text, Instant.now(clock)));
        });
    }
}
