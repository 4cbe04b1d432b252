package com.example.media_analyzer.sampling;

public record VideoInfo(double fps, long frameCount, int width, int height, double durationSeconds) {

    public static VideoInfo of(double fps, long frameCount, int width, int height) {
        double duration = fps > 0 ? frameCount / fps : 0;
        return new VideoInfo(fps, frameCount, width, height, duration);
    }
}
