package com.example.subtitlesync.model;

/**
 * One subtitle search result, flattened from the catalog response.
 */
public record SubtitleCandidate(
        String language,
        int fileId,
        double rating,
        int downloadCount,
        String releaseName,
        String uploader) {

    public static final String UNKNOWN = "Unknown";

    public SubtitleCandidate {
        if (releaseName == null || releaseName.isBlank()) {
            releaseName = UNKNOWN;
        }
        if (uploader == null || uploader.isBlank()) {
            uploader = UNKNOWN;
        }
    }
}
