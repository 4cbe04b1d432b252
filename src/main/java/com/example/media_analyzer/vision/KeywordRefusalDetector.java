package com.example.media_analyzer.vision;

import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring match against the phrases vision models use when declining a request.
 * An empty answer also counts as a refusal.
 */
public class KeywordRefusalDetector implements RefusalDetector {
    public static final List<String> DEFAULT_MARKERS = List.of(
            "i'm sorry",
            "i can't assist",
            "i'm unable",
            "cannot assist",
            "content policy",
            "i cannot",
            "i'm not able"
    );

    private final List<String> markers;

    public KeywordRefusalDetector() {
        this(DEFAULT_MARKERS);
    }

    public KeywordRefusalDetector(List<String> markers) {
        this.markers = markers.stream().map(m -> m.toLowerCase(Locale.ROOT)).toList();
    }

    @Override
    public boolean looksLikeRefusal(String text) {
        if (text == null || text.isBlank()) {
            return true;
        }
        // providers use typographic apostrophes as often as ASCII ones
        String normalized = text.toLowerCase(Locale.ROOT).replace('’', '\'');
        for (String marker : markers) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
