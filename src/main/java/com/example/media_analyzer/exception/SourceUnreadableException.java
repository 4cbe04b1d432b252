package com.example.media_analyzer.exception;

/**
 * The media source cannot be opened or has no readable frames.
 */
public class SourceUnreadableException extends RuntimeException {
    public SourceUnreadableException(String message) {
        super(message);
    }

    public SourceUnreadableException(String message, Throwable cause) {
        super(message, cause);
    }
}
