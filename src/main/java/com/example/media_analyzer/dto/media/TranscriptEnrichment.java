package com.example.media_analyzer.dto.media;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Semantic layer over a transcript. When {@code enriched} is false the lists are empty and
 * {@code error} says why (null when the transcript was simply empty).
 */
public record TranscriptEnrichment(boolean enriched,
                                   String semanticSummary,
                                   List<TopicSpan> topics,
                                   List<String> keywords,
                                   String tone,
                                   int speakersDetected,
                                   String error,
                                   ObjectNode raw) {

    public TranscriptEnrichment {
        semanticSummary = semanticSummary == null ? "" : semanticSummary;
        topics = topics == null ? List.of() : List.copyOf(topics);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        tone = tone == null || tone.isBlank() ? "unknown" : tone;
    }

    public static TranscriptEnrichment notEnriched(String error) {
        return new TranscriptEnrichment(false, "", List.of(), List.of(), "unknown", 1, error, null);
    }
}
