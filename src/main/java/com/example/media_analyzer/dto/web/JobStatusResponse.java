package com.example.media_analyzer.dto.web;

import com.example.media_analyzer.util.AnalysisMode;
import com.example.media_analyzer.util.MediaKind;
import com.example.media_analyzer.util.PipelineStage;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record JobStatusResponse(UUID id,
                                String mediaPath,
                                MediaKind mediaKind,
                                AnalysisMode analysisMode,
                                PipelineStage stage,
                                int attempts,
                                String errorMessage,
                                Instant createdAt,
                                Instant updatedAt,
                                List<ProgressEntryResponse> progressLog) {
}
