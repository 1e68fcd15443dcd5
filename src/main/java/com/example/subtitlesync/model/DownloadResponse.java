package com.example.subtitlesync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Download response matching OpenSubtitles API format.
 * {@code remaining} is null when the server does not report the quota.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DownloadResponse(
        @JsonProperty("link") String link,
        @JsonProperty("file_name") String fileName,
        @JsonProperty("requests") Integer requests,
        @JsonProperty("remaining") Integer remaining,
        @JsonProperty("message") String message,
        @JsonProperty("reset_time") String resetTime) {
}
