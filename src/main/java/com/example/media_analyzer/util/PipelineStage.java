package com.example.media_analyzer.util;

public enum PipelineStage {
    QUEUED,
    EXTRACTING_AUDIO,
    TRANSCRIBING,
    ENRICHING,
    SAMPLING_FRAMES,
    DEDUPLICATING,
    ANALYZING_FRAMES,
    SYNTHESIZING,
    PERSISTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
