package com.example.subtitlesync.service.acquisition;

import com.example.subtitlesync.model.AcquisitionMethod;
import com.example.subtitlesync.model.DownloadRecord;
import com.example.subtitlesync.model.MediaItem;
import com.example.subtitlesync.model.SearchQuery;
import com.example.subtitlesync.model.SubtitleCandidate;
import com.example.subtitlesync.service.CandidateSelector;
import com.example.subtitlesync.service.DownloadReport;
import com.example.subtitlesync.service.OpenSubtitlesClient;
import com.example.subtitlesync.service.SubtitleFileService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Searches OpenSubtitles once per item for all missing languages, downloads the best match
 * per language and writes it beside the media file.
 */
@Component
public class LocalSubtitleAcquirer implements SubtitleAcquirer {

    private static final Logger log = LoggerFactory.getLogger(LocalSubtitleAcquirer.class);

    private final OpenSubtitlesClient openSubtitlesClient;
    private final CandidateSelector candidateSelector;
    private final SubtitleFileService subtitleFileService;
    private final DownloadReport downloadReport;

    public LocalSubtitleAcquirer(OpenSubtitlesClient openSubtitlesClient, CandidateSelector candidateSelector,
            SubtitleFileService subtitleFileService, DownloadReport downloadReport) {
        this.openSubtitlesClient = openSubtitlesClient;
        this.candidateSelector = candidateSelector;
        this.subtitleFileService = subtitleFileService;
        this.downloadReport = downloadReport;
    }

    @Override
    public AcquisitionMethod method() {
        return AcquisitionMethod.LOCAL;
    }

    @Override
    public Set<String> pendingLanguages(MediaItem item, Set<String> missing) {
        if (openSubtitlesClient.isAuthenticationFailed()) {
            log.debug("OpenSubtitles authentication failed, skipping {}", item.displayName());
            return Set.of();
        }
        Path mediaPath = item.filePath();
        if (mediaPath == null) {
            log.warn("Could not get path for: {}", item.displayName());
            return Set.of();
        }
        if (!subtitleFileService.mediaFileExists(mediaPath)) {
            log.warn("File not found: {}", mediaPath);
            return Set.of();
        }

        Set<String> pending = new LinkedHashSet<>();
        for (String language : missing) {
            if (subtitleFileService.subtitleExists(mediaPath, language)) {
                log.debug("  {} subtitle already on disk for {}", language, item.displayName());
            } else {
                pending.add(language);
            }
        }
        return pending;
    }

    @Override
    public int acquire(MediaItem item, Set<String> languages) {
        SearchQuery query = SearchQuery.forItem(item, languages);

        log.info("  Searching for subtitles...");
        Optional<List<SubtitleCandidate>> results = openSubtitlesClient.search(query);

        if (results.isEmpty()) {
            log.error("  Search failed for {}", item.displayName());
            return 0;
        }
        List<SubtitleCandidate> candidates = results.get();
        if (candidates.isEmpty()) {
            log.info("  No subtitles found for {}", item.displayName());
            return 0;
        }

        log.info("  Found {} subtitle option(s)", candidates.size());

        int downloaded = 0;
        for (String language : languages) {
            if (acquireLanguage(item, language, candidates)) {
                downloaded++;
            }
        }
        return downloaded;
    }

    private boolean acquireLanguage(MediaItem item, String language, List<SubtitleCandidate> candidates) {
        Optional<SubtitleCandidate> best = candidateSelector.selectBest(candidates, language);
        if (best.isEmpty()) {
            log.info("  No {} subtitles found for {}", language, item.displayName());
            return false;
        }

        SubtitleCandidate candidate = best.get();
        log.info(String.format(Locale.ROOT, "  Downloading %s subtitle (Rating: %.1f, Downloads: %d)...",
                language, candidate.rating(), candidate.downloadCount()));

        Optional<byte[]> content = openSubtitlesClient.download(candidate.fileId());
        if (content.isEmpty()) {
            log.warn("  Failed to download {} subtitle for {}", language, item.displayName());
            return false;
        }

        try {
            Path saved = subtitleFileService.writeSubtitle(item.filePath(), language, content.get());
            log.info("  Saved: {}", saved.getFileName());
            downloadReport.add(DownloadRecord.local(item, candidate, saved.toString(), downloadReport.timestamp()));
            return true;
        } catch (IOException e) {
            log.error("  Failed to save {} subtitle for {}: {}", language, item.displayName(), e.getMessage());
            return false;
        }
    }
}
