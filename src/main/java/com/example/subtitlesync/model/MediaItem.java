package com.example.subtitlesync.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A movie or episode as reported by the media library.
 * Subtitle languages are kept exactly as the library reports them.
 */
public record MediaItem(
        String id,
        String title,
        MediaKind kind,
        String showTitle,
        Integer seasonNumber,
        Integer episodeNumber,
        String imdbId,
        String tmdbId,
        Set<String> subtitleLanguages,
        Path filePath,
        Long fileSize) {

    public MediaItem {
        subtitleLanguages = subtitleLanguages == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(subtitleLanguages));
    }

    public boolean isEpisode() {
        return kind == MediaKind.EPISODE;
    }

    /**
     * Name used in logs and in the report, e.g. {@code Show - S01E02 - Title}.
     */
    public String displayName() {
        if (!isEpisode()) {
            return title;
        }
        return String.format("%s - S%02dE%02d - %s",
                showTitle, seasonNumber == null ? 0 : seasonNumber,
                episodeNumber == null ? 0 : episodeNumber, title);
    }

    public MediaItem withSubtitleLanguages(Set<String> languages) {
        return new MediaItem(id, title, kind, showTitle, seasonNumber, episodeNumber,
                imdbId, tmdbId, languages, filePath, fileSize);
    }
}
