package com.example.media_analyzer.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Report template requested for a job. {@link #AUTO} lets the pipeline infer the template for audio-only media.
 */
public enum AnalysisMode {
    AUTO,
    REVERSE_ENGINEERING,
    MEETING,
    DEBRIEF,
    BRAINSTORMING,
    NOTES;

    @JsonCreator
    public static AnalysisMode fromJson(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (AnalysisMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported AnalysisMode: " + value);
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
