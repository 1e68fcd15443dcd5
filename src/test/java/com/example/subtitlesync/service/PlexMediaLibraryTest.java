package com.example.subtitlesync.service;

import com.example.subtitlesync.config.AppSettings;
import com.example.subtitlesync.model.LibrarySection;
import com.example.subtitlesync.model.MediaKind;
import com.example.subtitlesync.test.MediaItems;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.util.Set;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class PlexMediaLibraryTest {
    private static final String PLEX = "http://plex.test:32400";

    private static final String SECTIONS = """
            {"MediaContainer":{"size":3,"Directory":[
              {"key":"1","title":"Movies","type":"movie"},
              {"key":"2","title":"TV Shows","type":"show"},
              {"key":"3","title":"Music","type":"artist"}]}}
            """;

    private static final String MOVIE_METADATA = """
            {"MediaContainer":{"size":1,"Metadata":[{
              "ratingKey":"101","type":"movie","title":"The Matrix",
              "Guid":[{"id":"imdb://tt0133093"},{"id":"tmdb://603"},{"id":"tvdb://1"}],
              "Media":[{"Part":[{"file":"/movies/The Matrix.mkv","size":734003200,"Stream":[
                {"streamType":1,"codec":"h264"},
                {"streamType":2,"languageCode":"eng"},
                {"streamType":3,"languageCode":"spa"},
                {"streamType":3,"languageCode":"fre"}]}]}]}]}}
            """;

    private MockRestServiceServer server;
    private PlexMediaLibrary library;

    @BeforeEach
    void setUp() {
        var settings = new AppSettings();
        settings.setPlexUrl(PLEX);
        settings.setPlexToken("plex-token");

        var builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        library = new PlexMediaLibrary(builder, settings);
    }

    @Test
    void testServerInfo_shouldReadServerIdentity() {
        server.expect(requestTo(PLEX + "/"))
                .andExpect(header("X-Plex-Token", "plex-token"))
                .andRespond(withSuccess("""
                        {"MediaContainer":{"friendlyName":"Living Room","version":"1.40.1","platform":"Linux"}}
                        """, MediaType.APPLICATION_JSON));

        var info = library.serverInfo();

        assertEquals("Living Room", info.friendlyName());
        assertEquals("1.40.1", info.version());
        assertEquals("Linux", info.platform());
    }

    @Test
    void testSections_shouldMapDirectories() {
        server.expect(requestTo(PLEX + "/library/sections"))
                .andRespond(withSuccess(SECTIONS, MediaType.APPLICATION_JSON));

        var sections = library.sections();

        assertEquals(3, sections.size());
        assertEquals(new LibrarySection("2", "TV Shows", "show"), sections.get(1));
        assertNull(sections.get(2).itemKind());
    }

    @Test
    void testSection_whenTitleUnknown_shouldBeEmpty() {
        server.expect(requestTo(PLEX + "/library/sections"))
                .andRespond(withSuccess(SECTIONS, MediaType.APPLICATION_JSON));

        assertTrue(library.section("Anime").isEmpty());
    }

    @Test
    void testItems_whenShowSection_shouldRequestEpisodes() {
        server.expect(requestTo(PLEX + "/library/sections/2/all?type=4"))
                .andRespond(withSuccess("""
                        {"MediaContainer":{"size":1,"Metadata":[{"ratingKey":"7","type":"episode",
                          "title":"The Target","grandparentTitle":"The Wire","parentIndex":1,"index":1}]}}
                        """, MediaType.APPLICATION_JSON));

        var items = library.items(new LibrarySection("2", "TV Shows", "show"));

        assertEquals(1, items.size());
        var episode = items.get(0);
        assertEquals(MediaKind.EPISODE, episode.kind());
        assertEquals("The Wire - S01E01 - The Target", episode.displayName());
    }

    @Test
    void testReload_shouldMapIdsSubtitlesAndFile() {
        server.expect(requestTo(PLEX + "/library/metadata/101?includeGuids=1"))
                .andRespond(withSuccess(MOVIE_METADATA, MediaType.APPLICATION_JSON));

        var item = library.reload(MediaItems.movie("101", "The Matrix"));

        assertEquals("tt0133093", item.imdbId());
        assertEquals("603", item.tmdbId());
        assertEquals(Set.of("spa", "fre"), item.subtitleLanguages());
        assertEquals(Path.of("/movies/The Matrix.mkv"), item.filePath());
        assertEquals(734003200L, item.fileSize());
        assertNull(item.showTitle());
    }

    @Test
    void testReload_whenItemGone_shouldThrow() {
        server.expect(requestTo(PLEX + "/library/metadata/101?includeGuids=1"))
                .andRespond(withSuccess("{\"MediaContainer\":{\"size\":0}}", MediaType.APPLICATION_JSON));

        assertThrows(MediaLibraryException.class, () -> library.reload(MediaItems.movie("101", "The Matrix")));
    }

    @Test
    void testRequest_whenServerFails_shouldWrapError() {
        server.expect(requestTo(PLEX + "/library/sections")).andRespond(withServerError());

        assertThrows(MediaLibraryException.class, () -> library.sections());
    }

    @Test
    void testSearchAndAttachSubtitle_shouldSelectFirstResult() {
        server.expect(requestTo(PLEX + "/library/metadata/101/subtitles?language=en"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"MediaContainer":{"size":2,"Stream":[
                          {"key":"sub-1","codec":"srt","languageCode":"eng","providerTitle":"OpenSubtitles"},
                          {"key":"sub-2","codec":"srt","languageCode":"eng","providerTitle":"OpenSubtitles"}]}}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(PLEX + "/library/metadata/101/subtitles?")))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(queryParam("key", "sub-1"))
                .andExpect(queryParam("codec", "srt"))
                .andExpect(queryParam("language", "eng"))
                .andRespond(withSuccess());

        assertTrue(library.searchAndAttachSubtitle(MediaItems.movie("101", "The Matrix"), "en"));
        server.verify();
    }

    @Test
    void testSearchAndAttachSubtitle_whenNoResults_shouldReturnFalse() {
        server.expect(requestTo(PLEX + "/library/metadata/101/subtitles?language=de"))
                .andRespond(withSuccess("{\"MediaContainer\":{\"size\":0}}", MediaType.APPLICATION_JSON));

        assertFalse(library.searchAndAttachSubtitle(MediaItems.movie("101", "The Matrix"), "de"));
        server.verify();
    }
}
