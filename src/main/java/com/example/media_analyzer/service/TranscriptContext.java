package com.example.media_analyzer.service;

import com.example.media_analyzer.dto.media.TopicSpan;
import com.example.media_analyzer.engine.Interfaces.TranscriptionEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Correlates a frame timestamp with the narration around it.
 */
public final class TranscriptContext {
    private TranscriptContext() {}

    /**
     * Text of every segment overlapping {@code [ts - radius, ts + radius]}, in segment order, joined by spaces.
     */
    public static String window(List<TranscriptionEngine.Segment> segments, double timestampSeconds, double radiusSeconds) {
        if (segments == null || segments.isEmpty()) {
            return "";
        }
        double from = Math.max(0, timestampSeconds - radiusSeconds);
        double to = timestampSeconds + radiusSeconds;
        List<String> parts = new ArrayList<>();
        for (TranscriptionEngine.Segment seg : segments) {
            if (seg.start() <= to && seg.end() >= from) {
                String text = seg.text() == null ? "" : seg.text().strip();
                if (!text.isEmpty()) {
                    parts.add(text);
                }
            }
        }
        return String.join(" ", parts);
    }

    public static List<String> topicsAt(List<TopicSpan> topics, double timestampSeconds) {
        if (topics == null || topics.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (TopicSpan t : topics) {
            if (t.contains(timestampSeconds) && t.topic() != null && !t.topic().isBlank()) {
                out.add(t.topic());
            }
        }
        return out;
    }
}
