package com.example.media_analyzer.dto.media;

/**
 * Stream facts read with ffprobe.
 */
public record MediaProbe(double durationSeconds,
                         boolean hasVideo,
                         boolean hasAudio,
                         double fps,
                         long frameCount,
                         int width,
                         int height) {
}
