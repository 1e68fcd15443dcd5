package com.example.subtitlesync.service;

import com.example.subtitlesync.model.AcquisitionMethod;
import com.example.subtitlesync.model.DownloadRecord;
import com.example.subtitlesync.model.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Collects the subtitles acquired during a run and renders the text report.
 * Records may be added by the scan while the shutdown path renders, so access is synchronized.
 */
@Component
public class DownloadReport {

    private static final Logger log = LoggerFactory.getLogger(DownloadReport.class);

    public static final String NOTHING_DOWNLOADED = "No subtitles were downloaded.";
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String RULE = "=".repeat(80);
    private static final String THIN_RULE = "-".repeat(80);

    private final List<DownloadRecord> records = Collections.synchronizedList(new ArrayList<>());
    private final Clock clock;

    public DownloadReport(Clock clock) {
        this.clock = clock;
    }

    public void add(DownloadRecord record) {
        records.add(record);
    }

    /**
     * Snapshot of the records in acquisition order.
     */
    public List<DownloadRecord> records() {
        synchronized (records) {
            return List.copyOf(records);
        }
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    /**
     * Current time formatted for report entries.
     */
    public String timestamp() {
        return LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
    }

    /**
     * Generate a detailed report of downloaded subtitles.
     */
    public String render() {
        List<DownloadRecord> snapshot = records();
        if (snapshot.isEmpty()) {
            return NOTHING_DOWNLOADED;
        }

        String methods = snapshot.stream()
                .map(record -> record.method().label())
                .distinct()
                .collect(Collectors.joining(", "));

        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add(RULE);
        lines.add("SUBTITLE DOWNLOAD REPORT");
        lines.add(RULE);
        lines.add("Total subtitles downloaded: " + snapshot.size());
        lines.add("Download method: " + methods);
        lines.add("Generated: " + timestamp());
        lines.add(RULE);

        List<DownloadRecord> movies = filter(snapshot, MediaKind.MOVIE);
        List<DownloadRecord> episodes = filter(snapshot, MediaKind.EPISODE);

        if (!movies.isEmpty()) {
            lines.add("");
            lines.add("MOVIES (" + movies.size() + " subtitles)");
            lines.add(THIN_RULE);
            movies.forEach(record -> appendRecord(lines, record));
        }

        if (!episodes.isEmpty()) {
            lines.add("");
            lines.add("TV EPISODES (" + episodes.size() + " subtitles)");
            lines.add(THIN_RULE);
            episodes.forEach(record -> appendRecord(lines, record));
        }

        lines.add("");
        lines.add(RULE);
        lines.add("SUMMARY STATISTICS");
        lines.add(RULE);

        List<DownloadRecord> local = snapshot.stream()
                .filter(record -> record.method() == AcquisitionMethod.LOCAL)
                .toList();
        if (!local.isEmpty()) {
            double averageRating = local.stream().mapToDouble(DownloadRecord::rating).average().orElse(0.0);
            long totalDownloads = local.stream().mapToLong(DownloadRecord::downloadCount).sum();
            lines.add(String.format(Locale.ROOT, "Average subtitle rating: %.1f/10", averageRating));
            lines.add(String.format(Locale.ROOT, "Total community downloads: %,d", totalDownloads));
        }

        lines.add("");
        lines.add("Language breakdown:");
        languageBreakdown(snapshot).forEach((language, count) ->
                lines.add("  " + language.toUpperCase(Locale.ROOT) + ": " + count));
        lines.add(RULE);

        return String.join("\n", lines);
    }

    /**
     * Number of subtitles per language, sorted by language code.
     */
    public Map<String, Long> languageBreakdown() {
        return languageBreakdown(records());
    }

    /**
     * Save the report to a file (UTF-8).
     */
    public void save(Path outputFile) throws IOException {
        Files.writeString(outputFile, render(), StandardCharsets.UTF_8);
        log.info("Report saved to: {}", outputFile.toAbsolutePath());
    }

    private static Map<String, Long> languageBreakdown(List<DownloadRecord> snapshot) {
        return snapshot.stream()
                .collect(Collectors.groupingBy(DownloadRecord::language, TreeMap::new, Collectors.counting()));
    }

    private static List<DownloadRecord> filter(List<DownloadRecord> snapshot, MediaKind kind) {
        return snapshot.stream().filter(record -> record.kind() == kind).toList();
    }

    private static void appendRecord(List<String> lines, DownloadRecord record) {
        lines.add("");
        lines.add(record.mediaTitle());
        lines.add("  Language: " + record.language().toUpperCase(Locale.ROOT));
        if (record.method() == AcquisitionMethod.LOCAL) {
            lines.add(String.format(Locale.ROOT, "  Rating: %.1f/10", record.rating()));
            lines.add(String.format(Locale.ROOT, "  Downloads: %,d", record.downloadCount()));
            lines.add("  Release: " + record.releaseName());
            lines.add("  Uploader: " + record.uploader());
            lines.add("  File: " + Path.of(record.subtitleFile()).getFileName());
        } else {
            lines.add("  Method: Plex OpenSubtitles Agent");
        }
        lines.add("  Timestamp: " + record.timestamp());
    }
}
