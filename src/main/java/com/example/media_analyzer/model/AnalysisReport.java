package com.example.media_analyzer.model;

import com.example.media_analyzer.util.AnalysisMode;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Synthesized analysis of a completed job.
 */
@Entity
@Table(name = "analysis_report")
public class AnalysisReport {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false, unique = true, foreignKey = @ForeignKey(name = "fk_report_job"))
    private AnalysisJob job;

    @Enumerated(EnumType.STRING)
    @Column(name = "analysis_mode", nullable = false, length = 32)
    private AnalysisMode analysisMode;

    @Column(name = "summary", columnDefinition = "text")
    private String summary;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "document")
    private JsonNode document;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected AnalysisReport() {}

    public AnalysisReport(AnalysisJob job, AnalysisMode analysisMode, String summary, JsonNode document) {
        this.job = job;
        this.analysisMode = analysisMode;
        this.summary = summary;
        this.document = document;
    }

    public UUID getId() { return id; }
    public AnalysisJob getJob() { return job; }
    public AnalysisMode getAnalysisMode() { return analysisMode; }
    public String getSummary() { return summary; }
    public JsonNode getDocument() { return document; }
    public Instant getCreatedAt() { return createdAt; }
}
