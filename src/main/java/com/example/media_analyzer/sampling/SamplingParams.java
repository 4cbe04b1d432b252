package com.example.media_analyzer.sampling;

public record SamplingParams(double targetIntervalSeconds, int minFrames, int maxFrames, double sceneThreshold) {

    public SamplingParams {
        if (targetIntervalSeconds <= 0) {
            throw new IllegalArgumentException("targetIntervalSeconds must be > 0");
        }
        if (minFrames < 1 || maxFrames < minFrames) {
            throw new IllegalArgumentException("expected 1 <= minFrames <= maxFrames, got " + minFrames + ".." + maxFrames);
        }
    }

    public static SamplingParams defaults() {
        return new SamplingParams(4.0, 10, 50, 20.0);
    }
}
