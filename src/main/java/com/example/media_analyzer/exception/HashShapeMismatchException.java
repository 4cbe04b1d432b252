package com.example.media_analyzer.exception;

public class HashShapeMismatchException extends IllegalArgumentException {
    public HashShapeMismatchException(int left, int right) {
        super("hash length mismatch: " + left + " vs " + right);
    }
}
