package com.example.subtitlesync.model;

/**
 * Record of a subtitle acquired during a run.
 */
public record DownloadRecord(
        String mediaTitle,
        MediaKind kind,
        String language,
        AcquisitionMethod method,
        double rating,
        int downloadCount,
        String releaseName,
        String uploader,
        String subtitleFile,
        String timestamp) {

    public static DownloadRecord local(MediaItem item, SubtitleCandidate candidate, String subtitleFile,
            String timestamp) {
        return new DownloadRecord(item.displayName(), item.kind(), candidate.language(), AcquisitionMethod.LOCAL,
                candidate.rating(), candidate.downloadCount(), candidate.releaseName(), candidate.uploader(),
                subtitleFile, timestamp);
    }

    public static DownloadRecord delegated(MediaItem item, String language, String timestamp) {
        return new DownloadRecord(item.displayName(), item.kind(), language, AcquisitionMethod.DELEGATED,
                0.0, 0, "Plex OpenSubtitles Agent", "Plex", "Downloaded by Plex", timestamp);
    }
}
