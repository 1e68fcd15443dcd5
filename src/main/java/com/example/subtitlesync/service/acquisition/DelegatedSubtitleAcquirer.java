package com.example.subtitlesync.service.acquisition;

import com.example.subtitlesync.model.AcquisitionMethod;
import com.example.subtitlesync.model.DownloadRecord;
import com.example.subtitlesync.model.MediaItem;
import com.example.subtitlesync.service.DownloadReport;
import com.example.subtitlesync.service.LanguageCodec;
import com.example.subtitlesync.service.MediaLibrary;
import com.example.subtitlesync.service.MediaLibraryException;
import com.example.subtitlesync.service.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;

/**
 * Lets Plex search for and attach subtitles with its own OpenSubtitles agent, then checks
 * the item's streams to see whether the language arrived.
 */
@Component
public class DelegatedSubtitleAcquirer implements SubtitleAcquirer {

    private static final Logger log = LoggerFactory.getLogger(DelegatedSubtitleAcquirer.class);

    static final Duration SETTLE_DELAY = Duration.ofSeconds(2);

    private final MediaLibrary mediaLibrary;
    private final LanguageCodec languageCodec;
    private final DownloadReport downloadReport;
    private final Sleeper sleeper;

    public DelegatedSubtitleAcquirer(MediaLibrary mediaLibrary, LanguageCodec languageCodec,
            DownloadReport downloadReport, Sleeper sleeper) {
        this.mediaLibrary = mediaLibrary;
        this.languageCodec = languageCodec;
        this.downloadReport = downloadReport;
        this.sleeper = sleeper;
    }

    @Override
    public AcquisitionMethod method() {
        return AcquisitionMethod.DELEGATED;
    }

    @Override
    public Set<String> pendingLanguages(MediaItem item, Set<String> missing) {
        return missing;
    }

    @Override
    public int acquire(MediaItem item, Set<String> languages) {
        int downloaded = 0;
        for (String language : languages) {
            if (acquireLanguage(item, language)) {
                downloaded++;
                downloadReport.add(DownloadRecord.delegated(item, language, downloadReport.timestamp()));
            }
        }
        return downloaded;
    }

    private boolean acquireLanguage(MediaItem item, String language) {
        try {
            log.info("  Searching via Plex for {} subtitles...", language);
            if (!mediaLibrary.searchAndAttachSubtitle(item, language)) {
                log.warn("  Plex did not find {} subtitle for {}", language, item.displayName());
                return false;
            }

            sleeper.sleep(SETTLE_DELAY);

            MediaItem refreshed = mediaLibrary.reload(item);
            if (languageCodec.existingLanguages(refreshed).contains(language)) {
                log.info("  Plex downloaded {} subtitle", language);
                return true;
            }
            log.warn("  Plex did not attach {} subtitle for {}", language, item.displayName());
            return false;
        } catch (MediaLibraryException e) {
            log.error("  Failed to download {} via Plex for {}: {}", language, item.displayName(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("  Interrupted while waiting for Plex to attach {} subtitle", language);
            return false;
        }
    }
}
