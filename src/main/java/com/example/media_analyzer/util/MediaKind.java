package com.example.media_analyzer.util;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Distinguishes video uploads, which go through frame analysis, from audio-only uploads.
 */
public enum MediaKind {
    VIDEO(Set.of("mp4", "mov", "avi", "mkv", "webm", "m4v")),
    AUDIO(Set.of("mp3", "wav", "m4a", "ogg", "flac", "aac", "wma", "opus"));

    private final Set<String> extensions;

    MediaKind(Set<String> extensions) {
        this.extensions = extensions;
    }

    public Set<String> extensions() {
        return extensions;
    }

    /**
     * Resolves the kind from the file extension of an object key or file name.
     *
     * @param name object key or original file name.
     * @return the matching kind, empty when the extension is not supported.
     */
    public static Optional<MediaKind> fromFileName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (MediaKind kind : values()) {
            if (kind.extensions.contains(ext)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
