package com.example.subtitlesync.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Service for reading and writing subtitle files beside media files on the local file system.
 * A subtitle for {@code Movie.mkv} in English is stored as {@code Movie.en.srt}.
 */
@Service
public class SubtitleFileService {

    private static final Logger log = LoggerFactory.getLogger(SubtitleFileService.class);

    private static final String SUBTITLE_EXTENSION = ".srt";
    private static final String FORCED_MARKER = ".forced";

    /**
     * Generate the subtitle path for a media file: the media extension is replaced by
     * {@code .<language>[.forced].srt}.
     */
    public Path subtitlePath(Path mediaPath, String language, boolean forced) {
        String fileName = mediaPath.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        String baseName = lastDot > 0 ? fileName.substring(0, lastDot) : fileName;

        StringBuilder name = new StringBuilder(baseName).append('.').append(language);
        if (forced) {
            name.append(FORCED_MARKER);
        }
        name.append(SUBTITLE_EXTENSION);
        return mediaPath.resolveSibling(name.toString());
    }

    public Path subtitlePath(Path mediaPath, String language) {
        return subtitlePath(mediaPath, language, false);
    }

    /**
     * Check if a subtitle file for the language already exists on disk.
     */
    public boolean subtitleExists(Path mediaPath, String language) {
        return Files.exists(subtitlePath(mediaPath, language));
    }

    public boolean mediaFileExists(Path mediaPath) {
        return mediaPath != null && Files.isRegularFile(mediaPath);
    }

    /**
     * Write subtitle bytes next to the media file.
     *
     * @return path where the subtitle was saved
     */
    public Path writeSubtitle(Path mediaPath, String language, byte[] content) throws IOException {
        Path subtitlePath = subtitlePath(mediaPath, language);
        Files.write(subtitlePath, content);
        log.debug("Wrote {} bytes to {}", content.length, subtitlePath);
        return subtitlePath;
    }

    /**
     * Test whether new files can be created in a directory by creating and deleting a probe file.
     *
     * @return null if writable, otherwise the reason it is not
     */
    public String testWriteAccess(Path directory) {
        if (!Files.isDirectory(directory)) {
            return "Media directory not accessible: " + directory;
        }
        Path probe = directory.resolve(".subtitle_sync_test");
        try {
            Files.deleteIfExists(probe);
            Files.createFile(probe);
            Files.delete(probe);
            return null; // Success
        } catch (IOException e) {
            return "No write permission in: " + directory + " (" + e.getMessage() + ")";
        }
    }
}
