package com.example.media_analyzer.dto.media;

import com.example.media_analyzer.util.ExtractionMethod;
import com.example.media_analyzer.vision.FrameDescription;

/**
 * A described frame ready to be persisted. {@code imageUrl} is null when the upload failed.
 */
public record AnalyzedFrame(int frameIndex,
                            double timestampSeconds,
                            long frameNumber,
                            ExtractionMethod extractionMethod,
                            double sceneChangeScore,
                            String imageKey,
                            String imageUrl,
                            FrameDescription description) {
}
