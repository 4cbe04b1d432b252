package com.example.media_analyzer.exception;

/**
 * A single frame image cannot be decoded into pixels.
 */
public class FrameDecodeException extends RuntimeException {
    public FrameDecodeException(String message) {
        super(message);
    }

    public FrameDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
