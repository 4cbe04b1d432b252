package com.example.media_analyzer.sampling;

import com.example.media_analyzer.exception.SourceUnreadableException;

/**
 * Random and sequential access to the frames of one video.
 */
public interface VideoSource {

    /**
     * @throws SourceUnreadableException when the video cannot be opened.
     */
    VideoInfo info();

    /**
     * Grabs a single frame.
     *
     * @param frameNumber zero-based frame position, clamped by the caller to {@code frameCount - 1}.
     * @return the frame, or {@code null} when this position cannot be decoded.
     */
    FrameImage grab(long frameNumber);

    /**
     * Visits every {@code step}-th frame from the start, in order, with its 8-bit luma plane.
     * The scan ends when the visitor returns {@code false} or the input is exhausted.
     */
    void scan(int step, LumaVisitor visitor);

    @FunctionalInterface
    interface LumaVisitor {
        boolean visit(long frameNumber, byte[] luma);
    }
}
