package com.example.subtitlesync.service;

import com.example.subtitlesync.config.AppSettings;
import com.example.subtitlesync.model.AcquisitionMethod;
import com.example.subtitlesync.model.MediaItem;
import com.example.subtitlesync.service.acquisition.SubtitleAcquirer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Acquires the missing subtitles of a single item with the configured method.
 */
@Service
public class SubtitleAcquisitionService {

    private static final Logger log = LoggerFactory.getLogger(SubtitleAcquisitionService.class);

    private final LanguageCodec languageCodec;
    private final SubtitleAcquirer acquirer;
    private final Set<String> wantedLanguages;

    public SubtitleAcquisitionService(LanguageCodec languageCodec, List<SubtitleAcquirer> acquirers,
            AppSettings appSettings) {
        this.languageCodec = languageCodec;
        this.wantedLanguages = languageCodec.parseLanguages(appSettings.getLanguageCodes());
        this.acquirer = select(acquirers, appSettings.getAcquisitionMethod());
    }

    private static SubtitleAcquirer select(List<SubtitleAcquirer> acquirers, AcquisitionMethod method) {
        return acquirers.stream()
                .filter(candidate -> candidate.method() == method)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No acquirer for method " + method.label()));
    }

    public Set<String> getWantedLanguages() {
        return wantedLanguages;
    }

    public AcquisitionMethod getMethod() {
        return acquirer.method();
    }

    /**
     * Check which wanted languages the item has no subtitles for in the library.
     */
    public Set<String> missingLanguages(MediaItem item) {
        return languageCodec.missingLanguages(item, wantedLanguages);
    }

    public boolean needsSubtitles(MediaItem item) {
        return !missingLanguages(item).isEmpty();
    }

    /**
     * Download missing subtitles for a single item.
     *
     * @return Number of subtitles acquired
     */
    public int acquire(MediaItem item) {
        Set<String> missing = missingLanguages(item);
        if (missing.isEmpty()) {
            return 0;
        }

        Set<String> pending = acquirer.pendingLanguages(item, missing);
        if (pending.isEmpty()) {
            log.debug("Nothing to do for {}", item.displayName());
            return 0;
        }

        log.info("Downloading subtitles for: {}", item.displayName());
        log.info("  Missing languages: {}", String.join(", ", pending));

        return acquirer.acquire(item, pending);
    }
}
