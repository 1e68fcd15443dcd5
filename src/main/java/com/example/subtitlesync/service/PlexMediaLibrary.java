package com.example.subtitlesync.service;

import com.example.subtitlesync.config.AppSettings;
import com.example.subtitlesync.model.LibrarySection;
import com.example.subtitlesync.model.MediaItem;
import com.example.subtitlesync.model.MediaKind;
import com.example.subtitlesync.model.PlexResponse;
import com.example.subtitlesync.model.ServerInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Media library backed by the Plex Media Server HTTP API (JSON flavour).
 */
@Service
public class PlexMediaLibrary implements MediaLibrary {

    private static final Logger log = LoggerFactory.getLogger(PlexMediaLibrary.class);

    private static final String EPISODE_TYPE = "4";
    private static final String IMDB_PREFIX = "imdb://";
    private static final String TMDB_PREFIX = "tmdb://";

    private final AppSettings appSettings;
    private final RestClient restClient;
    private final JsonMapper jsonMapper;

    public PlexMediaLibrary(RestClient.Builder restClientBuilder, AppSettings appSettings) {
        this.restClient = restClientBuilder.build();
        this.jsonMapper = JsonMapper.builder().build();
        this.appSettings = appSettings;
    }

    @Override
    public ServerInfo serverInfo() {
        PlexResponse.MediaContainer container = get("/", Map.of());
        return new ServerInfo(container.friendlyName(), container.version(), container.platform());
    }

    @Override
    public List<LibrarySection> sections() {
        PlexResponse.MediaContainer container = get("/library/sections", Map.of());
        if (container.directories() == null) {
            return List.of();
        }
        return container.directories().stream()
                .map(directory -> new LibrarySection(directory.key(), directory.title(), directory.type()))
                .toList();
    }

    @Override
    public Optional<LibrarySection> section(String title) {
        return sections().stream()
                .filter(section -> section.title().equals(title))
                .findFirst();
    }

    @Override
    public List<MediaItem> items(LibrarySection section) {
        Map<String, String> params = section.isShowSection() ? Map.of("type", EPISODE_TYPE) : Map.of();
        PlexResponse.MediaContainer container = get("/library/sections/" + section.key() + "/all", params);
        if (container.metadata() == null) {
            return List.of();
        }
        List<MediaItem> items = new ArrayList<>(container.metadata().size());
        for (PlexResponse.Metadata metadata : container.metadata()) {
            items.add(toMediaItem(metadata));
        }
        log.debug("Section '{}' lists {} items", section.title(), items.size());
        return items;
    }

    @Override
    public MediaItem reload(MediaItem item) {
        PlexResponse.MediaContainer container = get("/library/metadata/" + item.id(), Map.of("includeGuids", "1"));
        if (container.metadata() == null || container.metadata().isEmpty()) {
            throw new MediaLibraryException("Item " + item.id() + " (" + item.title() + ") no longer exists");
        }
        return toMediaItem(container.metadata().get(0));
    }

    @Override
    public boolean searchAndAttachSubtitle(MediaItem item, String language) {
        String path = "/library/metadata/" + item.id() + "/subtitles";
        PlexResponse.MediaContainer results = get(path, Map.of("language", language));
        if (results.streams() == null || results.streams().isEmpty()) {
            log.debug("Plex found no {} subtitle for {}", language, item.displayName());
            return false;
        }

        PlexResponse.Stream best = results.streams().get(0);
        URI uri = uri(path, Map.of(
                "key", nullToEmpty(best.key()),
                "codec", nullToEmpty(best.codec()),
                "language", best.languageCode() == null ? language : best.languageCode(),
                "providerTitle", nullToEmpty(best.providerTitle())));
        try {
            restClient.put()
                    .uri(uri)
                    .headers(this::addPlexHeaders)
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (RestClientException e) {
            throw new MediaLibraryException("Plex failed to attach " + language + " subtitle to "
                    + item.displayName() + ": " + e.getMessage(), e);
        }
    }

    private PlexResponse.MediaContainer get(String path, Map<String, String> params) {
        URI uri = uri(path, params);
        try {
            String response = restClient.get()
                    .uri(uri)
                    .headers(this::addPlexHeaders)
                    .retrieve()
                    .body(String.class);
            PlexResponse parsed = response == null ? null : jsonMapper.readValue(response, PlexResponse.class);
            if (parsed == null || parsed.mediaContainer() == null) {
                throw new MediaLibraryException("Empty response from Plex for " + path);
            }
            return parsed.mediaContainer();
        } catch (RestClientException | JacksonException e) {
            throw new MediaLibraryException("Plex request failed for " + path + ": " + e.getMessage(), e);
        }
    }

    private URI uri(String path, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(appSettings.getPlexUrl()).path(path);
        params.forEach((name, value) -> builder.queryParam(name, value));
        return builder.encode().build().toUri();
    }

    private MediaItem toMediaItem(PlexResponse.Metadata metadata) {
        MediaKind kind = "episode".equals(metadata.type()) ? MediaKind.EPISODE : MediaKind.MOVIE;

        String imdbId = null;
        String tmdbId = null;
        if (metadata.guids() != null) {
            for (PlexResponse.Guid guid : metadata.guids()) {
                String id = guid.id();
                if (id == null) {
                    continue;
                }
                if (imdbId == null && id.startsWith(IMDB_PREFIX)) {
                    imdbId = id.substring(IMDB_PREFIX.length());
                } else if (tmdbId == null && id.startsWith(TMDB_PREFIX)) {
                    tmdbId = id.substring(TMDB_PREFIX.length());
                }
            }
        }

        Set<String> subtitleLanguages = new LinkedHashSet<>();
        PlexResponse.Part firstPart = null;
        if (metadata.media() != null) {
            for (PlexResponse.Media media : metadata.media()) {
                if (media.parts() == null) {
                    continue;
                }
                for (PlexResponse.Part part : media.parts()) {
                    if (firstPart == null) {
                        firstPart = part;
                    }
                    if (part.streams() == null) {
                        continue;
                    }
                    for (PlexResponse.Stream stream : part.streams()) {
                        Integer streamType = stream.streamType();
                        if (streamType != null && streamType == PlexResponse.Stream.SUBTITLE
                                && stream.languageCode() != null) {
                            subtitleLanguages.add(stream.languageCode());
                        }
                    }
                }
            }
        }

        Path filePath = firstPart != null && firstPart.file() != null ? Path.of(firstPart.file()) : null;
        Long fileSize = firstPart != null ? firstPart.size() : null;

        return new MediaItem(
                metadata.ratingKey(),
                metadata.title(),
                kind,
                kind == MediaKind.EPISODE ? metadata.grandparentTitle() : null,
                kind == MediaKind.EPISODE ? metadata.parentIndex() : null,
                kind == MediaKind.EPISODE ? metadata.index() : null,
                imdbId,
                tmdbId,
                subtitleLanguages,
                filePath,
                fileSize);
    }

    private void addPlexHeaders(HttpHeaders headers) {
        headers.set("Accept", "application/json");
        headers.set("X-Plex-Token", appSettings.getPlexToken());
        headers.set("X-Plex-Client-Identifier", "subtitle-sync");
        headers.set("X-Plex-Product", appSettings.getUserAgent());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
