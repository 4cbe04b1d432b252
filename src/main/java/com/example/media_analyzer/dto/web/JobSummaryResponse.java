package com.example.media_analyzer.dto.web;

import com.example.media_analyzer.model.AnalysisJob;
import com.example.media_analyzer.util.AnalysisMode;
import com.example.media_analyzer.util.MediaKind;
import com.example.media_analyzer.util.PipelineStage;

import java.time.Instant;
import java.util.UUID;

public record JobSummaryResponse(UUID id,
                                 String mediaPath,
                                 MediaKind mediaKind,
                                 AnalysisMode analysisMode,
                                 PipelineStage stage,
                                 String errorMessage,
                                 Instant createdAt,
                                 Instant finishedAt) {

    public static JobSummaryResponse from(AnalysisJob job) {
        return new JobSummaryResponse(job.getId(), job.getMediaPath(), job.getMediaKind(), job.getAnalysisMode(),
                job.getStage(), job.getErrorMessage(), job.getCreatedAt(), job.getFinishedAt());
    }
}
