package com.example.subtitlesync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Download request matching OpenSubtitles API format.
 */
public record DownloadRequest(
        @JsonProperty("file_id") int fileId) {
}
