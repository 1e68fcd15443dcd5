package com.example.subtitlesync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Login response matching OpenSubtitles API format.
 * The user block is optional; older accounts may omit parts of it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoginResponse(
        @JsonProperty("user") UserInfo user,
        @JsonProperty("token") String token,
        @JsonProperty("status") Integer status) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserInfo(
            @JsonProperty("allowed_downloads") Integer allowedDownloads,
            @JsonProperty("level") String level,
            @JsonProperty("user_id") Integer userId,
            @JsonProperty("vip") Boolean vip) {
    }
}
