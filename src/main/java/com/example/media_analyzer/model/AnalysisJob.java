package com.example.media_analyzer.model;

import com.example.media_analyzer.util.AnalysisMode;
import com.example.media_analyzer.util.MediaKind;
import com.example.media_analyzer.util.PipelineStage;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "analysis_job",
        indexes = {
                @Index(name = "idx_analysis_job_stage_created", columnList = "stage, created_at")
        }
)
public class AnalysisJob {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "media_path", nullable = false, length = 1024)
    private String mediaPath;

    @Enumerated(EnumType.STRING)
    @Column(name = "media_kind", nullable = false, length = 16)
    private MediaKind mediaKind;

    @Column(name = "context", columnDefinition = "text")
    private String context;

    @Enumerated(EnumType.STRING)
    @Column(name = "analysis_mode", nullable = false, length = 32)
    private AnalysisMode analysisMode = AnalysisMode.AUTO;

    @Enumerated(EnumType.STRING)
    @Column(name = "stage", nullable = false, length = 32)
    private PipelineStage stage = PipelineStage.QUEUED;

    @Column(name = "attempts", nullable = false)
    private int attempts = 0;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested = false;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected AnalysisJob() {}

    public AnalysisJob(String mediaPath, MediaKind mediaKind, String context, AnalysisMode analysisMode) {
        this.mediaPath = mediaPath;
        this.mediaKind = mediaKind;
        this.context = context;
        this.analysisMode = analysisMode == null ? AnalysisMode.AUTO : analysisMode;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getMediaPath() {
        return mediaPath;
    }

    public MediaKind getMediaKind() {
        return mediaKind;
    }

    public String getContext() {
        return context;
    }

    public AnalysisMode getAnalysisMode() {
        return analysisMode;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public void setStage(PipelineStage stage) {
        this.stage = stage;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public void setCancelRequested(boolean cancelRequested) {
        this.cancelRequested = cancelRequested;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (stage == null) stage = PipelineStage.QUEUED;
    }
}
