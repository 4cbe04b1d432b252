package com.example.media_analyzer.dto.media;

/**
 * A topic the narration covers between {@code startTime} and {@code endTime}, in seconds.
 */
public record TopicSpan(String topic, double startTime, double endTime, String description) {

    public boolean contains(double timestampSeconds) {
        return startTime <= timestampSeconds && timestampSeconds <= endTime;
    }
}
