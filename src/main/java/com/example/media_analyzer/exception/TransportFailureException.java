package com.example.media_analyzer.exception;

/**
 * An external AI capability was unreachable, timed out or answered with an error status.
 */
public class TransportFailureException extends RuntimeException {
    public TransportFailureException(String message) {
        super(message);
    }

    public TransportFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
