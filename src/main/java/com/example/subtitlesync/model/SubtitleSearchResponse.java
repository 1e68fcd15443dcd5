package com.example.subtitlesync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Subtitle search response matching OpenSubtitles API format.
 * Using nullable types (Integer, Double) to handle null values from API.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubtitleSearchResponse(
        @JsonProperty("total_pages") Integer totalPages,
        @JsonProperty("total_count") Integer totalCount,
        @JsonProperty("page") Integer page,
        @JsonProperty("data") List<SubtitleData> data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SubtitleData(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("attributes") SubtitleAttributes attributes) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SubtitleAttributes(
            @JsonProperty("subtitle_id") String subtitleId,
            @JsonProperty("language") String language,
            @JsonProperty("download_count") Integer downloadCount,
            @JsonProperty("ratings") Double ratings,
            @JsonProperty("release") String release,
            @JsonProperty("uploader") Uploader uploader,
            @JsonProperty("files") List<SubtitleFile> files) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Uploader(
            @JsonProperty("uploader_id") Integer uploaderId,
            @JsonProperty("name") String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SubtitleFile(
            @JsonProperty("file_id") Integer fileId,
            @JsonProperty("file_name") String fileName) {
    }
}
