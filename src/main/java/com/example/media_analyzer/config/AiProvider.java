package com.example.media_analyzer.config;

import java.util.Locale;

/**
 * Closed set of AI backends. Each capability picks one of them once, at startup.
 */
public enum AiProvider {
    OPENAI(true, true, true),
    OLLAMA(false, true, true),
    DUMMY(true, true, true);

    private final boolean transcription;
    private final boolean vision;
    private final boolean analysis;

    AiProvider(boolean transcription, boolean vision, boolean analysis) {
        this.transcription = transcription;
        this.vision = vision;
        this.analysis = analysis;
    }

    public boolean supportsTranscription() {
        return transcription;
    }

    public boolean supportsVision() {
        return vision;
    }

    public boolean supportsAnalysis() {
        return analysis;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
