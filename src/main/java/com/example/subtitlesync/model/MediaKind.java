package com.example.subtitlesync.model;

import java.util.Locale;

/**
 * Kind of media item handled by the scanner.
 */
public enum MediaKind {
    MOVIE("movie"),
    EPISODE("episode");

    private final String label;

    MediaKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parse a user supplied kind ("movie" or "episode"). Blank input means no filter.
     */
    public static MediaKind fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MediaKind kind : values()) {
            if (kind.label.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported media type: " + value);
    }
}
