package com.example.media_analyzer.service;

import com.example.media_analyzer.model.ProgressLogEntry;
import com.example.media_analyzer.repository.AnalysisJobRepository;
import com.example.media_analyzer.repository.ProgressLogEntryRepository;
import com.example.media_analyzer.util.LogLevel;
import com.example.media_analyzer.util.PipelineStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgressLoggerTest {

    @Mock private ProgressLogEntryRepository entries;
    @Mock private AnalysisJobRepository jobs;
    @Mock private PlatformTransactionManager txManager;

    private final UUID jobId = UUID.randomUUID();
    private ProgressLogger logger;

    @BeforeEach
    void setUp() {
        logger = new ProgressLogger(entries, jobs, txManager, Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void sequenceCollisionIsRetriedWithNextNumber() {
        when(entries.findMaxSeq(jobId)).thenReturn(3, 4);
        when(entries.saveAndFlush(any(ProgressLogEntry.class)))
                .thenThrow(new DataIntegrityViolationException("uq_progress_job_seq"))
                .thenAnswer(inv -> inv.getArgument(0));

        logger.warning(jobId, PipelineStage.ANALYZING_FRAMES, "Cancellation requested");

        ArgumentCaptor<ProgressLogEntry> saved = ArgumentCaptor.forClass(ProgressLogEntry.class);
        verify(entries, times(2)).saveAndFlush(saved.capture());
        assertThat(saved.getAllValues()).extracting(ProgressLogEntry::getSeq).containsExactly(4, 5);
        ProgressLogEntry written = saved.getAllValues().get(1);
        assertThat(written.getLevel()).isEqualTo(LogLevel.WARNING);
        assertThat(written.getMessage()).isEqualTo("Cancellation requested");
        verify(txManager).rollback(any());
    }

    @Test
    void persistentCollisionIsDroppedAfterSecondAttempt() {
        when(entries.findMaxSeq(jobId)).thenReturn(7);
        when(entries.saveAndFlush(any(ProgressLogEntry.class)))
                .thenThrow(new DataIntegrityViolationException("uq_progress_job_seq"));

        logger.info(jobId, PipelineStage.QUEUED, "Job queued");

        verify(entries, times(ProgressLogger.MAX_ATTEMPTS)).saveAndFlush(any(ProgressLogEntry.class));
    }

    @Test
    void otherFailuresAreNotRetried() {
        when(entries.findMaxSeq(jobId)).thenThrow(new QueryTimeoutException("db busy"));

        logger.error(jobId, PipelineStage.FAILED, "boom");

        verify(entries, times(1)).findMaxSeq(jobId);
    }

    @Test
    void longMessagesAreTruncated() {
        when(entries.findMaxSeq(jobId)).thenReturn(0);
        when(entries.saveAndFlush(any(ProgressLogEntry.class))).thenAnswer(inv -> inv.getArgument(0));

        logger.success(jobId, PipelineStage.COMPLETED, "x".repeat(5000));

        ArgumentCaptor<ProgressLogEntry> saved = ArgumentCaptor.forClass(ProgressLogEntry.class);
        verify(entries).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getMessage()).hasSize(4000);
        assertThat(saved.getValue().getSeq()).isEqualTo(1);
    }
}
