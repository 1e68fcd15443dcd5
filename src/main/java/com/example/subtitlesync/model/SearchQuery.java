package com.example.subtitlesync.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters of one subtitle search. Exactly one of imdbId, tmdbId or query is set.
 */
public record SearchQuery(
        String languages,
        String imdbId,
        String tmdbId,
        String query,
        Integer seasonNumber,
        Integer episodeNumber,
        Long movieByteSize) {

    /**
     * Build the search for an item. External ids win over free text; episodes search by
     * show name and carry season and episode numbers.
     */
    public static SearchQuery forItem(MediaItem item, Collection<String> languages) {
        String joined = String.join(",", languages);
        String imdbId = stripImdbPrefix(item.imdbId());
        String tmdbId = isBlank(imdbId) && !isBlank(item.tmdbId()) ? item.tmdbId() : null;
        String query = null;
        if (isBlank(imdbId) && tmdbId == null) {
            query = item.isEpisode() ? item.showTitle() : item.title();
        }
        Integer season = item.isEpisode() ? item.seasonNumber() : null;
        Integer episode = item.isEpisode() ? item.episodeNumber() : null;
        Long size = item.fileSize() != null && item.fileSize() > 0 ? item.fileSize() : null;
        return new SearchQuery(joined, isBlank(imdbId) ? null : imdbId, tmdbId, query, season, episode, size);
    }

    /**
     * Query parameters in the order the catalog documents them. Absent values are omitted.
     */
    public Map<String, String> toParameters() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("languages", languages);
        if (imdbId != null) {
            params.put("imdb_id", imdbId);
        } else if (tmdbId != null) {
            params.put("tmdb_id", tmdbId);
        } else if (query != null) {
            params.put("query", query);
        }
        if (seasonNumber != null) {
            params.put("season_number", seasonNumber.toString());
        }
        if (episodeNumber != null) {
            params.put("episode_number", episodeNumber.toString());
        }
        if (movieByteSize != null) {
            params.put("moviebytesize", movieByteSize.toString());
        }
        return params;
    }

    private static String stripImdbPrefix(String imdbId) {
        if (isBlank(imdbId)) {
            return null;
        }
        return imdbId.startsWith("tt") ? imdbId.substring(2) : imdbId;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
