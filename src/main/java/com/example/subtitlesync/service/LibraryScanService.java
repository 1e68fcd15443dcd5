package com.example.subtitlesync.service;

import com.example.subtitlesync.model.LibrarySection;
import com.example.subtitlesync.model.MediaItem;
import com.example.subtitlesync.model.MediaKind;
import com.example.subtitlesync.model.ScanStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Walks library sections item by item, acquiring missing subtitles within an optional
 * download budget. A failing item is counted and the scan moves on.
 */
@Service
public class LibraryScanService {

    private static final Logger log = LoggerFactory.getLogger(LibraryScanService.class);

    private static final String BANNER = "=".repeat(60);

    private final MediaLibrary mediaLibrary;
    private final SubtitleAcquisitionService acquisitionService;

    public LibraryScanService(MediaLibrary mediaLibrary, SubtitleAcquisitionService acquisitionService) {
        this.mediaLibrary = mediaLibrary;
        this.acquisitionService = acquisitionService;
    }

    /**
     * Process a library by name.
     *
     * @param libraryName  Title of the library section
     * @param kindFilter   Only scan libraries holding this kind, or null for any
     * @param maxDownloads Maximum number of subtitles to acquire, or null for unlimited
     * @throws MediaLibraryException if the library list cannot be loaded
     */
    public ScanStatistics scanLibrary(String libraryName, MediaKind kindFilter, Integer maxDownloads) {
        Optional<LibrarySection> section = mediaLibrary.section(libraryName);
        if (section.isEmpty()) {
            log.error("Could not find library '{}'", libraryName);
            return ScanStatistics.EMPTY;
        }
        return scanSection(section.get(), kindFilter, maxDownloads);
    }

    /**
     * Process all movie and TV show libraries, sharing the download budget across them.
     */
    public ScanStatistics scanAllLibraries(MediaKind kindFilter, Integer maxDownloads) {
        ScanStatistics total = ScanStatistics.EMPTY;
        for (LibrarySection section : mediaLibrary.sections()) {
            if (section.itemKind() == null) {
                log.debug("Ignoring library '{}' of type {}", section.title(), section.type());
                continue;
            }

            Integer remaining = null;
            if (maxDownloads != null) {
                remaining = maxDownloads - total.downloaded();
                if (remaining <= 0) {
                    log.info("Skipping library '{}' - download limit reached", section.title());
                    continue;
                }
            }

            total = total.plus(scanSection(section, kindFilter, remaining));
        }
        return total;
    }

    ScanStatistics scanSection(LibrarySection section, MediaKind kindFilter, Integer maxDownloads) {
        MediaKind sectionKind = section.itemKind();
        if (sectionKind == null) {
            log.warn("Unsupported library type: {}", section.type());
            return ScanStatistics.EMPTY;
        }
        if (kindFilter != null && kindFilter != sectionKind) {
            log.info("Skipping library '{}' - holds {} items, filter is {}",
                    section.title(), sectionKind.label(), kindFilter.label());
            return ScanStatistics.EMPTY;
        }

        log.info(BANNER);
        log.info("Processing library: {}", section.title());
        if (maxDownloads != null) {
            log.info("Max downloads: {}", maxDownloads);
        }
        log.info(BANNER);

        List<MediaItem> items;
        try {
            items = mediaLibrary.items(section);
        } catch (MediaLibraryException e) {
            log.error("Could not list library '{}': {}", section.title(), e.getMessage());
            return new ScanStatistics(0, 0, 0, 0, 1);
        }

        int total = items.size();
        log.info("Found {} items to scan", total);

        int needsSubtitles = 0;
        int downloaded = 0;
        int skipped = 0;
        int errors = 0;

        for (int i = 0; i < total; i++) {
            if (maxDownloads != null && downloaded >= maxDownloads) {
                skipped = total - i;
                log.info("Reached download limit of {}. Skipping remaining {} items.", maxDownloads, skipped);
                break;
            }

            MediaItem item = items.get(i);
            try {
                MediaItem current = mediaLibrary.reload(item);
                if (acquisitionService.needsSubtitles(current)) {
                    needsSubtitles++;
                    log.info("[{}/{}] Processing {}", i + 1, total, current.displayName());
                    downloaded += acquisitionService.acquire(current);
                } else {
                    log.debug("[{}/{}] Skipping {} - has all subtitles", i + 1, total, current.displayName());
                }
            } catch (RuntimeException e) {
                log.error("Error processing item {} ({}): {}", i + 1, item.title(), e.getMessage(), e);
                errors++;
            }
        }

        ScanStatistics stats = new ScanStatistics(total, needsSubtitles, downloaded, skipped, errors);
        logSummary(section.title(), stats);
        return stats;
    }

    private void logSummary(String libraryName, ScanStatistics stats) {
        log.info(BANNER);
        log.info("Summary for {}:", libraryName);
        log.info("  Total items scanned: {}", stats.total());
        log.info("  Items needing subtitles: {}", stats.needsSubtitles());
        log.info("  Subtitles downloaded: {}", stats.downloaded());
        if (stats.skipped() > 0) {
            log.info("  Items skipped (limit reached): {}", stats.skipped());
        }
        log.info("  Errors: {}", stats.errors());
        log.info(BANNER);
    }
}
