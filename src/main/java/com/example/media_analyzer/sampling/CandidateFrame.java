package com.example.media_analyzer.sampling;

import com.example.media_analyzer.util.ExtractionMethod;

/**
 * A frame picked by {@link FrameSampler}. {@code sceneChangeScore} is only meaningful for
 * {@link ExtractionMethod#SCENE_CHANGE} frames and is 0 otherwise.
 */
public record CandidateFrame(int frameIndex,
                             double timestampSeconds,
                             long frameNumber,
                             FrameImage image,
                             ExtractionMethod extractionMethod,
                             double sceneChangeScore) {

    public CandidateFrame withIndex(int index) {
        return new CandidateFrame(index, timestampSeconds, frameNumber, image, extractionMethod, sceneChangeScore);
    }
}
