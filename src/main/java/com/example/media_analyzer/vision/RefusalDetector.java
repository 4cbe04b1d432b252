package com.example.media_analyzer.vision;

/**
 * Classifies a provider answer as a refusal. Implementations must be side-effect free.
 */
@FunctionalInterface
public interface RefusalDetector {
    boolean looksLikeRefusal(String text);
}
