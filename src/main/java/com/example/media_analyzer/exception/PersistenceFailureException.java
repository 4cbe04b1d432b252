package com.example.media_analyzer.exception;

/**
 * The result store rejected a write.
 */
public class PersistenceFailureException extends RuntimeException {
    public PersistenceFailureException(String message) {
        super(message);
    }

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
