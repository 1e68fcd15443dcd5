package com.example.subtitlesync.model;

import com.example.subtitlesync.test.MediaItems;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MediaItemTest {

    @Test
    void testDisplayName_whenEpisode_shouldIncludeShowAndNumbers() {
        var item = MediaItems.episode("1", "The Wire", 1, 2, "The Detail");

        assertEquals("The Wire - S01E02 - The Detail", item.displayName());
    }

    @Test
    void testDisplayName_whenMovie_shouldBeTitle() {
        assertEquals("Heat", MediaItems.movie("1", "Heat").displayName());
    }

    @Test
    void testWithSubtitleLanguages_shouldReplaceLanguagesOnly() {
        var item = MediaItems.movie("1", "Heat", "eng");

        var updated = item.withSubtitleLanguages(Set.of("spa"));

        assertEquals(Set.of("spa"), updated.subtitleLanguages());
        assertEquals(item.id(), updated.id());
        assertEquals(Set.of("eng"), item.subtitleLanguages());
    }

    @Test
    void testMediaKindFromLabel() {
        assertNull(MediaKind.fromLabel(" "));
        assertEquals(MediaKind.EPISODE, MediaKind.fromLabel("Episode"));
        assertThrows(IllegalArgumentException.class, () -> MediaKind.fromLabel("show"));
    }

    @Test
    void testAcquisitionMethodFromLabel() {
        assertEquals(AcquisitionMethod.LOCAL, AcquisitionMethod.fromLabel(""));
        assertEquals(AcquisitionMethod.DELEGATED, AcquisitionMethod.fromLabel("PLEX"));
        assertThrows(IllegalArgumentException.class, () -> AcquisitionMethod.fromLabel("ftp"));
    }

    @Test
    void testScanStatisticsPlus() {
        var sum = new ScanStatistics(5, 3, 2, 1, 0).plus(new ScanStatistics(4, 2, 1, 0, 1));

        assertEquals(new ScanStatistics(9, 5, 3, 1, 1), sum);
    }
}
