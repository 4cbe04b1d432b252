package com.example.media_analyzer.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "transcript")
public class Transcript {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false, unique = true, foreignKey = @ForeignKey(name = "fk_transcript_job"))
    private AnalysisJob job;

    @Column(name = "lang", nullable = false, length = 16)
    private String lang;

    @Column(name = "provider", nullable = false, length = 64)
    private String provider;

    @Column(name = "text", columnDefinition = "text")
    private String text;

    // array of {start, end, text}
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "segments")
    private JsonNode segments;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "enrichment")
    private JsonNode enrichment;

    @Column(name = "enriched", nullable = false)
    private boolean enriched;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Transcript() {}

    public Transcript(AnalysisJob job, String lang, String provider) {
        this.job = job;
        this.lang = lang;
        this.provider = provider;
    }

    public UUID getId() { return id; }
    public AnalysisJob getJob() { return job; }
    public String getLang() { return lang; }
    public String getProvider() { return provider; }
    public String getText() { return text; }
    public void setText(String text) { this.text = text; }
    public JsonNode getSegments() { return segments; }
    public void setSegments(JsonNode segments) { this.segments = segments; }
    public JsonNode getEnrichment() { return enrichment; }
    public void setEnrichment(JsonNode enrichment) { this.enrichment = enrichment; }
    public boolean isEnriched() { return enriched; }
    public void setEnriched(boolean enriched) { this.enriched = enriched; }
    public Instant getCreatedAt() { return createdAt; }
}
