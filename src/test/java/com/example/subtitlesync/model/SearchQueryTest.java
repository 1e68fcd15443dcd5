package com.example.subtitlesync.model;

import com.example.subtitlesync.test.MediaItems;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SearchQueryTest {

    @Test
    void testForItem_whenImdbIdPresent_shouldStripPrefixAndIgnoreTitle() {
        var item = MediaItems.movie("1", "The Matrix", Path.of("/m/matrix.mkv"), 1_234L, "tt0133093");

        var query = SearchQuery.forItem(item, List.of("en", "es"));

        assertEquals(new SearchQuery("en,es", "0133093", null, null, null, null, 1_234L), query);
    }

    @Test
    void testForItem_whenOnlyTmdbId_shouldSearchByTmdb() {
        var item = new MediaItem("1", "Heat", MediaKind.MOVIE, null, null, null, null, "949",
                Set.of(), null, null);

        var query = SearchQuery.forItem(item, List.of("en"));

        assertEquals("949", query.tmdbId());
        assertNull(query.query());
        assertNull(query.movieByteSize());
    }

    @Test
    void testForItem_whenNoIds_shouldSearchByTitle() {
        var item = MediaItems.movie("1", "Heat");

        var query = SearchQuery.forItem(item, List.of("en"));

        assertEquals("Heat", query.query());
        assertNull(query.seasonNumber());
    }

    @Test
    void testForItem_whenEpisode_shouldSearchByShowWithSeasonAndEpisode() {
        var item = MediaItems.episode("9", "The Wire", 2, 5, "Undertow");

        var query = SearchQuery.forItem(item, List.of("en"));

        assertEquals("The Wire", query.query());
        assertEquals(2, query.seasonNumber());
        assertEquals(5, query.episodeNumber());
    }

    @Test
    void testForItem_whenFileSizeIsZero_shouldOmitSize() {
        var item = MediaItems.movie("1", "Heat", Path.of("/m/heat.mkv"), 0L, null);

        var query = SearchQuery.forItem(item, List.of("en"));

        assertNull(query.movieByteSize());
    }

    @Test
    void testToParameters_shouldKeepDocumentedOrder() {
        var query = new SearchQuery("en", null, null, "The Wire", 1, 3, 42L);

        var params = query.toParameters();

        assertEquals(List.of("languages", "query", "season_number", "episode_number", "moviebytesize"),
                List.copyOf(params.keySet()));
        assertEquals("3", params.get("episode_number"));
    }

    @Test
    void testToParameters_whenImdbAndTmdbBothSet_shouldOnlySendImdb() {
        var query = new SearchQuery("en", "133093", "603", null, null, null, null);

        assertEquals(Map.of("languages", "en", "imdb_id", "133093"), query.toParameters());
    }
}
