package com.example.media_analyzer.exception;

/**
 * Raised when the object store cannot read, write or resolve a key.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
