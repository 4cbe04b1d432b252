package com.example.media_analyzer.vision;

/**
 * Outcome of describing one frame. Either the provider's text, or a locally generated fallback document.
 *
 * @param text JSON document, or provider prose when the provider ignored the JSON instruction.
 * @param fallback {@code true} when the document was synthesized locally.
 * @param externalCalls number of vision calls spent on this frame.
 */
public record FrameDescription(String text, boolean fallback, int externalCalls) {

    public static FrameDescription accepted(String text, int externalCalls) {
        return new FrameDescription(text, false, externalCalls);
    }

    public static FrameDescription fallback(String text, int externalCalls) {
        return new FrameDescription(text, true, externalCalls);
    }

    public String confidence() {
        return fallback ? "low" : "provider";
    }
}
