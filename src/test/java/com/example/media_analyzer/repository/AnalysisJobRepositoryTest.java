package com.example.media_analyzer.repository;

import com.example.media_analyzer.model.AnalysisJob;
import com.example.media_analyzer.model.ProgressLogEntry;
import com.example.media_analyzer.util.AnalysisMode;
import com.example.media_analyzer.util.LogLevel;
import com.example.media_analyzer.util.MediaKind;
import com.example.media_analyzer.util.PipelineStage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
class AnalysisJobRepositoryTest {

    @Autowired
    private AnalysisJobRepository jobRepository;

    @Autowired
    private ProgressLogEntryRepository progressRepository;

    @Test
    void newJobDefaultsToQueued() {
        AnalysisJob job = jobRepository.saveAndFlush(new AnalysisJob("uploads/a.mp4", MediaKind.VIDEO, null, null));

        AnalysisJob loaded = jobRepository.findById(job.getId()).orElseThrow();
        assertThat(loaded.getStage()).isEqualTo(PipelineStage.QUEUED);
        assertThat(loaded.getAnalysisMode()).isEqualTo(AnalysisMode.AUTO);
        assertThat(loaded.getAttempts()).isZero();
        assertThat(loaded.getCreatedAt()).isNotNull();
        assertThat(jobRepository.findCancelRequested(job.getId())).isFalse();
        assertThat(jobRepository.findCancelRequested(UUID.randomUUID())).isNull();
    }

    @Test
    void cancelFlagIsReadBackWithoutLoadingTheEntity() {
        AnalysisJob job = new AnalysisJob("uploads/b.mp3", MediaKind.AUDIO, "ctx", AnalysisMode.NOTES);
        job.setCancelRequested(true);
        jobRepository.saveAndFlush(job);

        assertThat(jobRepository.findCancelRequested(job.getId())).isTrue();
    }

    @Test
    void progressEntriesAreOrderedBySequence() {
        AnalysisJob job = jobRepository.saveAndFlush(new AnalysisJob("uploads/c.mp4", MediaKind.VIDEO, null, AnalysisMode.AUTO));
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        progressRepository.save(new ProgressLogEntry(job, 2, LogLevel.INFO, PipelineStage.TRANSCRIBING, "second", now));
        progressRepository.save(new ProgressLogEntry(job, 1, LogLevel.INFO, PipelineStage.QUEUED, "first", now));
        progressRepository.flush();

        List<ProgressLogEntry> entries = progressRepository.findByJobIdOrdered(job.getId());

        assertThat(entries).extracting(ProgressLogEntry::getMessage).containsExactly("first", "second");
        assertThat(progressRepository.findMaxSeq(job.getId())).isEqualTo(2);
        assertThat(progressRepository.findMaxSeq(UUID.randomUUID())).isZero();
    }

    @Test
    void duplicateSequenceWithinJobIsRejected() {
        AnalysisJob job = jobRepository.saveAndFlush(new AnalysisJob("uploads/d.mp4", MediaKind.VIDEO, null, AnalysisMode.AUTO));
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        progressRepository.saveAndFlush(new ProgressLogEntry(job, 1, LogLevel.INFO, PipelineStage.QUEUED, "a", now));

        assertThrows(DataIntegrityViolationException.class, () -> progressRepository.saveAndFlush(
                new ProgressLogEntry(job, 1, LogLevel.WARNING, PipelineStage.QUEUED, "b", now)));
    }

    @Test
    void jobsArePagedByStage() {
        for (int i = 0; i < 3; i++) {
            AnalysisJob failed = new AnalysisJob("uploads/f" + i + ".mp4", MediaKind.VIDEO, null, AnalysisMode.AUTO);
            failed.setStage(PipelineStage.FAILED);
            jobRepository.save(failed);
        }
        jobRepository.saveAndFlush(new AnalysisJob("uploads/q.mp4", MediaKind.VIDEO, null, AnalysisMode.AUTO));

        Page<AnalysisJob> firstPage = jobRepository.findByStageOrderByCreatedAtDesc(PipelineStage.FAILED, PageRequest.of(0, 2));
        Page<AnalysisJob> all = jobRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, 10));

        assertThat(firstPage.getContent()).hasSize(2).allMatch(j -> j.getStage() == PipelineStage.FAILED);
        assertThat(firstPage.getTotalElements()).isEqualTo(3);
        assertThat(all.getTotalElements()).isEqualTo(4);
    }

    @Test
    void sharedMediaAndProgressCleanupAreScopedToJob() {
        AnalysisJob job = jobRepository.saveAndFlush(new AnalysisJob("uploads/shared.mp4", MediaKind.VIDEO, null, AnalysisMode.AUTO));
        AnalysisJob other = jobRepository.saveAndFlush(new AnalysisJob("uploads/other.mp4", MediaKind.VIDEO, null, AnalysisMode.AUTO));
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        progressRepository.save(new ProgressLogEntry(job, 1, LogLevel.INFO, PipelineStage.QUEUED, "queued", now));
        progressRepository.saveAndFlush(new ProgressLogEntry(other, 1, LogLevel.INFO, PipelineStage.QUEUED, "queued", now));

        assertThat(jobRepository.existsByMediaPath("uploads/shared.mp4")).isTrue();
        assertThat(jobRepository.existsByMediaPath("uploads/gone.mp4")).isFalse();
        assertThat(progressRepository.deleteByJobId(job.getId())).isEqualTo(1);
        assertThat(progressRepository.findByJobIdOrdered(other.getId())).hasSize(1);
    }
}
