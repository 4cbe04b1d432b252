package com.example.media_analyzer.model;

import com.example.media_analyzer.util.LogLevel;
import com.example.media_analyzer.util.PipelineStage;
import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * One line of the user-facing progress log of a job. Append-only; read back ordered by {@code seq}.
 */
@Entity
@Table(
        name = "progress_log_entry",
        uniqueConstraints = @UniqueConstraint(name = "uq_progress_job_seq", columnNames = {"job_id", "seq"})
)
public class ProgressLogEntry {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false, foreignKey = @ForeignKey(name = "fk_progress_job"))
    private AnalysisJob job;

    @Column(name = "seq", nullable = false)
    private int seq;

    @Enumerated(EnumType.STRING)
    @Column(name = "level", nullable = false, length = 16)
    private LogLevel level;

    @Enumerated(EnumType.STRING)
    @Column(name = "stage", length = 32)
    private PipelineStage stage;

    @Column(name = "message", nullable = false, columnDefinition = "text")
    private String message;

    @Column(name = "logged_at", nullable = false)
    private Instant loggedAt;

    protected ProgressLogEntry() {}

    public ProgressLogEntry(AnalysisJob job, int seq, LogLevel level, PipelineStage stage, String message, Instant loggedAt) {
        this.job = job;
        this.seq = seq;
        this.level = level;
        this.stage = stage;
        this.message = message;
        this.loggedAt = loggedAt;
    }

    public UUID getId() { return id; }
    public AnalysisJob getJob() { return job; }
    public int getSeq() { return seq; }
    public LogLevel getLevel() { return level; }
    public PipelineStage getStage() { return stage; }
    public String getMessage() { return message; }
    public Instant getLoggedAt() { return loggedAt; }
}
