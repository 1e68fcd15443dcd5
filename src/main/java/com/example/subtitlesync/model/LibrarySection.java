package com.example.subtitlesync.model;

/**
 * A library section on the media server ({@code movie}, {@code show}, ...).
 */
public record LibrarySection(String key, String title, String type) {

    public boolean isMovieSection() {
        return "movie".equals(type);
    }

    public boolean isShowSection() {
        return "show".equals(type);
    }

    /**
     * Kind of items scanned in this section, or null if the section holds neither.
     */
    public MediaKind itemKind() {
        if (isMovieSection()) {
            return MediaKind.MOVIE;
        }
        if (isShowSection()) {
            return MediaKind.EPISODE;
        }
        return null;
    }
}
