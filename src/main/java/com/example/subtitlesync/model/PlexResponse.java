package com.example.subtitlesync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Plex Media Server JSON envelope. Every endpoint answers with a MediaContainer; which
 * lists are filled depends on the endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlexResponse(
        @JsonProperty("MediaContainer") MediaContainer mediaContainer) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MediaContainer(
            @JsonProperty("friendlyName") String friendlyName,
            @JsonProperty("version") String version,
            @JsonProperty("platform") String platform,
            @JsonProperty("size") Integer size,
            @JsonProperty("Directory") List<Directory> directories,
            @JsonProperty("Metadata") List<Metadata> metadata,
            @JsonProperty("Stream") List<Stream> streams) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Directory(
            @JsonProperty("key") String key,
            @JsonProperty("title") String title,
            @JsonProperty("type") String type) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(
            @JsonProperty("ratingKey") String ratingKey,
            @JsonProperty("type") String type,
            @JsonProperty("title") String title,
            @JsonProperty("grandparentTitle") String grandparentTitle,
            @JsonProperty("parentIndex") Integer parentIndex,
            @JsonProperty("index") Integer index,
            @JsonProperty("Guid") List<Guid> guids,
            @JsonProperty("Media") List<Media> media) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Guid(
            @JsonProperty("id") String id) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Media(
            @JsonProperty("Part") List<Part> parts) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Part(
            @JsonProperty("file") String file,
            @JsonProperty("size") Long size,
            @JsonProperty("Stream") List<Stream> streams) {
    }

    /**
     * A media stream. streamType 3 marks subtitles. Subtitle search results reuse this
     * shape with key, codec and providerTitle filled in.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Stream(
            @JsonProperty("streamType") Integer streamType,
            @JsonProperty("languageCode") String languageCode,
            @JsonProperty("key") String key,
            @JsonProperty("codec") String codec,
            @JsonProperty("providerTitle") String providerTitle) {

        public static final int SUBTITLE = 3;
    }
}
