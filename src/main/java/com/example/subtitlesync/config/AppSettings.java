package com.example.subtitlesync.config;

import com.example.subtitlesync.model.AcquisitionMethod;
import com.example.subtitlesync.model.MediaKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Application settings for one run.
 * Values come from command-line options, environment variables or a .env file
 * (see application.properties for the mapping).
 */
@Component
public class AppSettings {

    // Plex Configuration
    @Value("${plex.url:http://localhost:32400}")
    private String plexUrl = "http://localhost:32400";

    @Value("${plex.token:}")
    private String plexToken = "";

    // OpenSubtitles Configuration
    @Value("${opensubtitles.base-url:https://api.opensubtitles.com/api/v1}")
    private String openSubtitlesBaseUrl = "https://api.opensubtitles.com/api/v1";

    @Value("${opensubtitles.api-key:}")
    private String openSubtitlesApiKey = "";

    @Value("${opensubtitles.username:}")
    private String openSubtitlesUsername = "";

    @Value("${opensubtitles.password:}")
    private String openSubtitlesPassword = "";

    @Value("${opensubtitles.user-agent:SubtitleSync v1.0}")
    private String userAgent = "SubtitleSync v1.0";

    // Run Settings
    @Value("${subtitles.languages:en}")
    private String languages = "en";

    @Value("${subtitles.method:local}")
    private String method = "local";

    @Value("${subtitles.library:}")
    private String library = "";

    @Value("${subtitles.type:}")
    private String type = "";

    @Value("${subtitles.max-downloads:}")
    private Integer maxDownloads;

    @Value("${subtitles.report:subtitle_download_report.txt}")
    private String reportFile = "subtitle_download_report.txt";

    /**
     * Fail fast on settings without which no work can be done.
     *
     * @throws IllegalStateException describing the first missing setting
     */
    public void validate() {
        if (isBlank(plexToken)) {
            throw new IllegalStateException("PLEX_TOKEN is required. Set it in .env or pass --plex-token");
        }
        if (getAcquisitionMethod() == AcquisitionMethod.LOCAL && !isOpenSubtitlesConfigured()) {
            throw new IllegalStateException(
                    "OpenSubtitles credentials required for local method. Use --method=plex for remote operation.");
        }
        if (maxDownloads != null && maxDownloads < 0) {
            throw new IllegalStateException("--max-downloads must not be negative");
        }
    }

    /**
     * Check if API key, username and password are all present.
     */
    public boolean isOpenSubtitlesConfigured() {
        return !isBlank(openSubtitlesApiKey) && !isBlank(openSubtitlesUsername) && !isBlank(openSubtitlesPassword);
    }

    public AcquisitionMethod getAcquisitionMethod() {
        return AcquisitionMethod.fromLabel(method);
    }

    /**
     * Media kind filter, or null when all kinds are scanned.
     */
    public MediaKind getMediaKindFilter() {
        return MediaKind.fromLabel(type);
    }

    /**
     * Raw language codes as configured, split on commas or whitespace.
     */
    public List<String> getLanguageCodes() {
        if (isBlank(languages)) {
            return List.of();
        }
        return Arrays.stream(languages.split("[,\\s]+"))
                .filter(code -> !code.isBlank())
                .toList();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // Getters and Setters
    public String getPlexUrl() {
        return plexUrl;
    }

    public void setPlexUrl(String plexUrl) {
        this.plexUrl = plexUrl;
    }

    public String getPlexToken() {
        return plexToken;
    }

    public void setPlexToken(String plexToken) {
        this.plexToken = plexToken;
    }

    public String getOpenSubtitlesBaseUrl() {
        return openSubtitlesBaseUrl;
    }

    public void setOpenSubtitlesBaseUrl(String baseUrl) {
        this.openSubtitlesBaseUrl = baseUrl;
    }

    public String getOpenSubtitlesApiKey() {
        return openSubtitlesApiKey;
    }

    public void setOpenSubtitlesApiKey(String key) {
        this.openSubtitlesApiKey = key;
    }

    public String getOpenSubtitlesUsername() {
        return openSubtitlesUsername;
    }

    public void setOpenSubtitlesUsername(String username) {
        this.openSubtitlesUsername = username;
    }

    public String getOpenSubtitlesPassword() {
        return openSubtitlesPassword;
    }

    public void setOpenSubtitlesPassword(String password) {
        this.openSubtitlesPassword = password;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getLanguages() {
        return languages;
    }

    public void setLanguages(String languages) {
        this.languages = languages;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public String getLibrary() {
        return library;
    }

    public void setLibrary(String library) {
        this.library = library;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Integer getMaxDownloads() {
        return maxDownloads;
    }

    public void setMaxDownloads(Integer maxDownloads) {
        this.maxDownloads = maxDownloads;
    }

    public String getReportFile() {
        return reportFile;
    }

    public void setReportFile(String reportFile) {
        this.reportFile = reportFile;
    }
}
