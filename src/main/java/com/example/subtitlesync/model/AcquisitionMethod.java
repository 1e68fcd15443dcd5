package com.example.subtitlesync.model;

import java.util.Locale;

/**
 * How subtitles are acquired for an item.
 */
public enum AcquisitionMethod {
    /** Search OpenSubtitles directly and write the file beside the media. */
    LOCAL("local"),
    /** Ask Plex to search and attach the subtitle itself. */
    DELEGATED("plex");

    private final String label;

    AcquisitionMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static AcquisitionMethod fromLabel(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "", "local" -> LOCAL;
            case "plex", "delegated" -> DELEGATED;
            default -> throw new IllegalArgumentException("Unsupported download method: " + value);
        };
    }
}
