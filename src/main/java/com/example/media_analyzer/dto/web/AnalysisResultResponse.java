package com.example.media_analyzer.dto.web;

import com.example.media_analyzer.util.AnalysisMode;
import com.example.media_analyzer.util.ExtractionMethod;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.UUID;

/**
 * Everything a completed job produced.
 */
public record AnalysisResultResponse(UUID jobId,
                                     TranscriptPart transcript,
                                     List<FramePart> frames,
                                     ReportPart report) {

    public record TranscriptPart(String text, String lang, String provider, JsonNode segments, boolean enriched, JsonNode enrichment) {}

    public record FramePart(int frameIndex,
                            double timestampSeconds,
                            long frameNumber,
                            ExtractionMethod extractionMethod,
                            double sceneChangeScore,
                            String imageUrl,
                            String description,
                            boolean fallback) {}

    public record ReportPart(AnalysisMode analysisMode, String summary, JsonNode document) {}
}
