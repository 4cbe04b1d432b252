package com.example.media_analyzer.dto.web;

import com.example.media_analyzer.model.ProgressLogEntry;
import com.example.media_analyzer.util.LogLevel;
import com.example.media_analyzer.util.PipelineStage;

import java.time.Instant;

public record ProgressEntryResponse(int seq, Instant timestamp, LogLevel level, PipelineStage stage, String message) {

    public static ProgressEntryResponse from(ProgressLogEntry e) {
        return new ProgressEntryResponse(e.getSeq(), e.getLoggedAt(), e.getLevel(), e.getStage(), e.getMessage());
    }
}
