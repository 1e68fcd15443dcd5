package com.example.subtitlesync;

import com.example.subtitlesync.config.AppSettings;
import com.example.subtitlesync.model.MediaKind;
import com.example.subtitlesync.model.ScanStatistics;
import com.example.subtitlesync.service.DownloadReport;
import com.example.subtitlesync.service.LibraryScanService;
import com.example.subtitlesync.service.MediaLibraryException;
import com.example.subtitlesync.service.StatusCheckService;
import com.example.subtitlesync.service.SubtitleAcquisitionService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Command-line entry point: runs the status check or a subtitle scan, then prints and saves
 * the report. The report is also written when the JVM shuts down mid-scan (Ctrl+C).
 */
@Component
public class SubtitleSyncRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(SubtitleSyncRunner.class);

    private static final String BASE_PACKAGE = "com.example.subtitlesync";

    private final AppSettings appSettings;
    private final LibraryScanService libraryScanService;
    private final SubtitleAcquisitionService acquisitionService;
    private final StatusCheckService statusCheckService;
    private final DownloadReport downloadReport;
    private final LoggingSystem loggingSystem;

    private final AtomicBoolean reportWritten = new AtomicBoolean(false);
    private volatile int exitCode = 0;

    public SubtitleSyncRunner(AppSettings appSettings, LibraryScanService libraryScanService,
            SubtitleAcquisitionService acquisitionService, StatusCheckService statusCheckService,
            DownloadReport downloadReport, LoggingSystem loggingSystem) {
        this.appSettings = appSettings;
        this.libraryScanService = libraryScanService;
        this.acquisitionService = acquisitionService;
        this.statusCheckService = statusCheckService;
        this.downloadReport = downloadReport;
        this.loggingSystem = loggingSystem;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption("verbose")) {
            loggingSystem.setLogLevel(BASE_PACKAGE, LogLevel.DEBUG);
        }

        if (args.containsOption("status")) {
            StatusCheckService.StatusResult result = statusCheckService.checkAll();
            System.out.println(result.render());
            exitCode = result.isReady() ? 0 : 1;
            return;
        }

        MediaKind kindFilter;
        try {
            appSettings.validate();
            kindFilter = appSettings.getMediaKindFilter();
        } catch (IllegalStateException | IllegalArgumentException e) {
            log.error(e.getMessage());
            exitCode = 1;
            return;
        }

        log.info("Download method: {}", acquisitionService.getMethod().label());
        log.info("Target languages: {}", String.join(", ", acquisitionService.getWantedLanguages()));

        try {
            String library = appSettings.getLibrary();
            ScanStatistics stats = library == null || library.isBlank()
                    ? libraryScanService.scanAllLibraries(kindFilter, appSettings.getMaxDownloads())
                    : libraryScanService.scanLibrary(library, kindFilter, appSettings.getMaxDownloads());
            log.info("Run complete: {} scanned, {} needed subtitles, {} downloaded, {} skipped, {} errors",
                    stats.total(), stats.needsSubtitles(), stats.downloaded(), stats.skipped(), stats.errors());
        } catch (MediaLibraryException e) {
            log.error("Error during processing: {}", e.getMessage());
            exitCode = 1;
        }

        writeReport();
    }

    @PreDestroy
    public void onShutdown() {
        if (!reportWritten.get() && !downloadReport.isEmpty()) {
            log.info("Interrupted - saving report for the {} subtitles acquired so far", downloadReport.size());
            writeReport();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void writeReport() {
        if (!reportWritten.compareAndSet(false, true)) {
            return;
        }
        System.out.println(downloadReport.render());
        if (downloadReport.isEmpty()) {
            return;
        }
        Path reportFile = Path.of(appSettings.getReportFile());
        try {
            downloadReport.save(reportFile);
        } catch (IOException e) {
            log.error("Failed to save report to {}: {}", reportFile, e.getMessage());
        }
    }
}
