package com.example.subtitlesync.model;

/**
 * Counters for one library scan, or the sum over several.
 */
public record ScanStatistics(
        int total,
        int needsSubtitles,
        int downloaded,
        int skipped,
        int errors) {

    public static final ScanStatistics EMPTY = new ScanStatistics(0, 0, 0, 0, 0);

    public ScanStatistics plus(ScanStatistics other) {
        return new ScanStatistics(
                total + other.total,
                needsSubtitles + other.needsSubtitles,
                downloaded + other.downloaded,
                skipped + other.skipped,
                errors + other.errors);
    }
}
