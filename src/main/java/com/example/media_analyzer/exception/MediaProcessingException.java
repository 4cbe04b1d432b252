package com.example.media_analyzer.exception;

/**
 * An ffmpeg or ffprobe invocation failed.
 */
public class MediaProcessingException extends RuntimeException {
    public MediaProcessingException(String message) {
        super(message);
    }

    public MediaProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
