package com.example.subtitlesync.service;

import com.example.subtitlesync.config.AppSettings;
import com.example.subtitlesync.model.AcquisitionMethod;
import com.example.subtitlesync.model.LibrarySection;
import com.example.subtitlesync.model.MediaItem;
import com.example.subtitlesync.model.ServerInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks configuration and connectivity without downloading anything.
 */
@Service
public class StatusCheckService {

    private static final Logger log = LoggerFactory.getLogger(StatusCheckService.class);

    private static final String RULE = "=".repeat(80);

    private final AppSettings appSettings;
    private final MediaLibrary mediaLibrary;
    private final OpenSubtitlesClient openSubtitlesClient;
    private final SubtitleFileService subtitleFileService;

    public StatusCheckService(AppSettings appSettings, MediaLibrary mediaLibrary,
            OpenSubtitlesClient openSubtitlesClient, SubtitleFileService subtitleFileService) {
        this.appSettings = appSettings;
        this.mediaLibrary = mediaLibrary;
        this.openSubtitlesClient = openSubtitlesClient;
        this.subtitleFileService = subtitleFileService;
    }

    /**
     * Findings of a status check.
     */
    public record StatusResult(List<String> info, List<String> warnings, List<String> issues) {

        public boolean isReady() {
            return issues.isEmpty();
        }

        public String render() {
            StringBuilder out = new StringBuilder();
            out.append(RULE).append('\n').append("STATUS CHECK RESULTS").append('\n').append(RULE).append("\n\n");
            appendSection(out, "Information:", info);
            appendSection(out, "Warnings:", warnings);
            appendSection(out, "Issues (must be resolved):", issues);
            out.append(RULE).append('\n');
            if (isReady()) {
                out.append("STATUS: READY TO DOWNLOAD SUBTITLES\n").append(RULE).append("\n\n");
                out.append("Run without --status to start downloading subtitles.\n");
            } else {
                out.append("STATUS: CONFIGURATION ISSUES FOUND\n").append(RULE).append("\n\n");
                out.append("Please fix the issues above before running again.\n");
                out.append("Check your .env file or command-line arguments.\n");
            }
            return out.toString();
        }

        private static void appendSection(StringBuilder out, String title, List<String> lines) {
            if (lines.isEmpty()) {
                return;
            }
            out.append(title).append('\n');
            lines.forEach(line -> out.append("  ").append(line).append('\n'));
            out.append('\n');
        }
    }

    /**
     * Run all status checks.
     */
    public StatusResult checkAll() {
        List<String> info = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> issues = new ArrayList<>();

        AcquisitionMethod method = appSettings.getAcquisitionMethod();
        checkSettings(method, info, warnings, issues);

        if (!isBlank(appSettings.getPlexUrl()) && !isBlank(appSettings.getPlexToken())) {
            checkPlex(method, info, warnings, issues);
        }

        if (method == AcquisitionMethod.LOCAL) {
            if (!isBlank(appSettings.getOpenSubtitlesApiKey())) {
                checkApiKey(info, warnings, issues);
            }
            if (appSettings.isOpenSubtitlesConfigured()) {
                checkLogin(info, warnings, issues);
            }
        } else {
            info.add("Using Plex's built-in subtitle download (OpenSubtitles credentials not required)");
        }

        return new StatusResult(List.copyOf(info), List.copyOf(warnings), List.copyOf(issues));
    }

    private void checkSettings(AcquisitionMethod method, List<String> info, List<String> warnings,
            List<String> issues) {
        Path envFile = Path.of(".env");
        if (Files.exists(envFile)) {
            info.add(".env file found at: " + envFile.toAbsolutePath());
        } else {
            warnings.add(".env file not found (using command-line args or system env vars)");
        }

        info.add("Download method: " + method.label());

        if (!isBlank(appSettings.getPlexUrl())) {
            info.add("PLEX_URL: " + appSettings.getPlexUrl());
        } else {
            issues.add("PLEX_URL is not set");
        }
        if (!isBlank(appSettings.getPlexToken())) {
            info.add("PLEX_TOKEN: " + mask(appSettings.getPlexToken()));
        } else {
            issues.add("PLEX_TOKEN is not set");
        }

        if (method == AcquisitionMethod.LOCAL) {
            if (!isBlank(appSettings.getOpenSubtitlesApiKey())) {
                info.add("OPENSUBTITLES_API_KEY: " + mask(appSettings.getOpenSubtitlesApiKey()));
            } else {
                issues.add("OPENSUBTITLES_API_KEY is not set (required for local method)");
            }
            if (!isBlank(appSettings.getOpenSubtitlesUsername())) {
                info.add("OPENSUBTITLES_USERNAME: " + appSettings.getOpenSubtitlesUsername());
            } else {
                issues.add("OPENSUBTITLES_USERNAME is not set (required for local method)");
            }
            if (!isBlank(appSettings.getOpenSubtitlesPassword())) {
                info.add("OPENSUBTITLES_PASSWORD: " + "*".repeat(appSettings.getOpenSubtitlesPassword().length()));
            } else {
                issues.add("OPENSUBTITLES_PASSWORD is not set (required for local method)");
            }
        }

        List<String> languages = appSettings.getLanguageCodes();
        if (languages.isEmpty()) {
            warnings.add("SUBTITLE_LANGUAGES not set, defaulting to 'en'");
        } else {
            info.add("SUBTITLE_LANGUAGES: " + String.join(", ", languages));
            for (String language : languages) {
                if (language.length() != 2) {
                    warnings.add("Language code '" + language + "' should be 2 letters (ISO 639-1)");
                }
            }
        }
    }

    private void checkPlex(AcquisitionMethod method, List<String> info, List<String> warnings,
            List<String> issues) {
        try {
            ServerInfo server = mediaLibrary.serverInfo();
            info.add("Connected to Plex server: " + server.friendlyName());
            info.add("  Version: " + server.version());
            info.add("  Platform: " + server.platform());

            List<LibrarySection> movieSections = new ArrayList<>();
            List<LibrarySection> showSections = new ArrayList<>();
            for (LibrarySection section : mediaLibrary.sections()) {
                if (section.isMovieSection()) {
                    movieSections.add(section);
                } else if (section.isShowSection()) {
                    showSections.add(section);
                }
            }

            if (movieSections.isEmpty() && showSections.isEmpty()) {
                warnings.add("No movie or TV show libraries found");
                return;
            }
            info.add("Found " + movieSections.size() + " movie and " + showSections.size() + " TV show libraries:");
            for (LibrarySection section : movieSections) {
                info.add("  - " + section.title() + " (Movies): " + mediaLibrary.items(section).size() + " items");
            }
            for (LibrarySection section : showSections) {
                info.add("  - " + section.title() + " (TV Shows): " + mediaLibrary.items(section).size()
                        + " episodes");
            }

            if (method == AcquisitionMethod.LOCAL) {
                LibrarySection sample = movieSections.isEmpty() ? showSections.get(0) : movieSections.get(0);
                checkWriteAccess(sample, info, warnings, issues);
            } else {
                info.add("Skipping filesystem write check (using Plex download method)");
            }
        } catch (MediaLibraryException e) {
            log.debug("Plex check failed", e);
            issues.add("Failed to connect to Plex: " + e.getMessage());
        }
    }

    private void checkWriteAccess(LibrarySection section, List<String> info, List<String> warnings,
            List<String> issues) {
        List<MediaItem> items = mediaLibrary.items(section);
        if (items.isEmpty()) {
            return;
        }
        MediaItem sample = mediaLibrary.reload(items.get(0));
        if (sample.filePath() == null || sample.filePath().getParent() == null) {
            return;
        }
        Path mediaDir = sample.filePath().getParent();
        if (!Files.isDirectory(mediaDir)) {
            warnings.add("Media directory not accessible: " + mediaDir);
            info.add("  -> Consider using --method=plex for remote downloads");
            return;
        }
        String problem = subtitleFileService.testWriteAccess(mediaDir);
        if (problem == null) {
            info.add("Write permissions OK in: " + mediaDir);
        } else {
            issues.add(problem);
        }
    }

    private void checkApiKey(List<String> info, List<String> warnings, List<String> issues) {
        try {
            OpenSubtitlesClient.ApiKeyStatus status = openSubtitlesClient.checkApiKey();
            switch (status.statusCode()) {
                case 200 -> {
                    info.add("OpenSubtitles API key is valid");
                    if (status.rateLimitRemaining() != null) {
                        String limit = status.rateLimitLimit() == null ? "unknown" : status.rateLimitLimit();
                        info.add("  Rate limit: " + status.rateLimitRemaining() + "/" + limit + " requests remaining");
                    }
                }
                case 401 -> issues.add("OpenSubtitles API key is invalid");
                case 429 -> warnings.add("Rate limit exceeded - wait before making more requests");
                default -> warnings.add("Unexpected API response: " + status.statusCode());
            }
        } catch (RestClientException e) {
            issues.add("Failed to connect to OpenSubtitles API: " + e.getMessage());
        }
    }

    private void checkLogin(List<String> info, List<String> warnings, List<String> issues) {
        if (!openSubtitlesClient.login()) {
            issues.add("OpenSubtitles login failed for user " + appSettings.getOpenSubtitlesUsername()
                    + " (see log for the cause)");
            return;
        }
        info.add("Successfully logged in as: " + appSettings.getOpenSubtitlesUsername());
        openSubtitlesClient.getAccountInfo().ifPresent(account -> {
            info.add("  Account level: " + orUnknown(account.level()));
            info.add("  Daily download limit: " + orUnknown(account.allowedDownloads()));
        });
        openSubtitlesClient.probeQuota().ifPresent(quota -> {
            if (quota.remaining() != null) {
                info.add("  Downloads remaining today: " + quota.remaining());
            }
            if (!isBlank(quota.resetTime())) {
                info.add("  Quota resets in: " + quota.resetTime());
            }
        });
    }

    private static String mask(String secret) {
        String tail = secret.length() > 4 ? secret.substring(secret.length() - 4) : "";
        return "*".repeat(20) + "..." + tail;
    }

    private static String orUnknown(Object value) {
        return value == null ? "unknown" : value.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
