package com.example.media_analyzer.model;

import com.example.media_analyzer.util.ExtractionMethod;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "frame_record",
        indexes = @Index(name = "idx_frame_record_job_index", columnList = "job_id, frame_index")
)
public class FrameRecord {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false, foreignKey = @ForeignKey(name = "fk_frame_job"))
    private AnalysisJob job;

    @Column(name = "frame_index", nullable = false)
    private int frameIndex;

    @Column(name = "timestamp_seconds", nullable = false)
    private double timestampSeconds;

    @Column(name = "frame_number", nullable = false)
    private long frameNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "extraction_method", nullable = false, length = 16)
    private ExtractionMethod extractionMethod;

    @Column(name = "scene_change_score", nullable = false)
    private double sceneChangeScore;

    @Column(name = "image_key", length = 1024)
    private String imageKey;

    @Column(name = "image_url", length = 2048)
    private String imageUrl;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "fallback", nullable = false)
    private boolean fallback;

    @Column(name = "external_calls", nullable = false)
    private int externalCalls;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected FrameRecord() {}

    public FrameRecord(AnalysisJob job, int frameIndex, double timestampSeconds, long frameNumber,
                       ExtractionMethod extractionMethod, double sceneChangeScore) {
        this.job = job;
        this.frameIndex = frameIndex;
        this.timestampSeconds = timestampSeconds;
        this.frameNumber = frameNumber;
        this.extractionMethod = extractionMethod;
        this.sceneChangeScore = sceneChangeScore;
    }

    public UUID getId() { return id; }
    public AnalysisJob getJob() { return job; }
    public int getFrameIndex() { return frameIndex; }
    public double getTimestampSeconds() { return timestampSeconds; }
    public long getFrameNumber() { return frameNumber; }
    public ExtractionMethod getExtractionMethod() { return extractionMethod; }
    public double getSceneChangeScore() { return sceneChangeScore; }
    public String getImageKey() { return imageKey; }
    public void setImageKey(String imageKey) { this.imageKey = imageKey; }
    public String getImageUrl() { return imageUrl; }
    public void setImageUrl(String imageUrl) { this.imageUrl = imageUrl; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public boolean isFallback() { return fallback; }
    public void setFallback(boolean fallback) { this.fallback = fallback; }
    public int getExternalCalls() { return externalCalls; }
    public void setExternalCalls(int externalCalls) { this.externalCalls = externalCalls; }
    public Instant getCreatedAt() { return createdAt; }
}
