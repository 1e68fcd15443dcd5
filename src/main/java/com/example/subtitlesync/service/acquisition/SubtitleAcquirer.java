package com.example.subtitlesync.service.acquisition;

import com.example.subtitlesync.model.AcquisitionMethod;
import com.example.subtitlesync.model.MediaItem;

import java.util.Set;

/**
 * Strategy for obtaining missing subtitles for one item.
 * Implemented by LocalSubtitleAcquirer (OpenSubtitles + disk) and DelegatedSubtitleAcquirer (Plex).
 */
public interface SubtitleAcquirer {

    /**
     * The method this strategy implements.
     */
    AcquisitionMethod method();

    /**
     * Narrow the languages missing from the library metadata to those that still need work.
     *
     * @param item    Item being processed
     * @param missing Languages the library reports as missing
     * @return Languages to acquire; empty when nothing is to be done
     */
    Set<String> pendingLanguages(MediaItem item, Set<String> missing);

    /**
     * Acquire a subtitle for each language. A failure for one language never stops the others.
     *
     * @return Number of subtitles acquired
     */
    int acquire(MediaItem item, Set<String> languages);
}
