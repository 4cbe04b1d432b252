package com.example.media_analyzer.sampling;

import com.example.media_analyzer.exception.FrameDecodeException;

import java.awt.image.BufferedImage;

/**
 * Opaque handle to the pixels of one sampled frame. Implementations may hold the pixels in memory or in a
 * file inside the job workspace; callers never depend on which.
 */
public interface FrameImage {

    /**
     * Decodes the pixels.
     *
     * @throws FrameDecodeException when the frame cannot be decoded or was already released.
     */
    BufferedImage read();

    /**
     * JPEG bytes of the frame, as sent to vision providers and object storage.
     *
     * @throws FrameDecodeException when the frame cannot be encoded or was already released.
     */
    byte[] encoded();

    /** Frees the backing buffer or file. Safe to call more than once. */
    void release();

    boolean isReleased();
}
