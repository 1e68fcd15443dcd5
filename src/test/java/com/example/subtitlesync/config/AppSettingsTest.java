package com.example.subtitlesync.config;

import com.example.subtitlesync.model.AcquisitionMethod;
import com.example.subtitlesync.model.MediaKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppSettingsTest {
    private AppSettings settings;

    @BeforeEach
    void setUp() {
        settings = new AppSettings();
        settings.setPlexToken("token");
        settings.setOpenSubtitlesApiKey("key");
        settings.setOpenSubtitlesUsername("user");
        settings.setOpenSubtitlesPassword("pass");
    }

    @Test
    void testValidate_whenFullyConfigured_shouldPass() {
        assertDoesNotThrow(settings::validate);
    }

    @Test
    void testValidate_whenPlexTokenMissing_shouldFail() {
        settings.setPlexToken(" ");

        var e = assertThrows(IllegalStateException.class, settings::validate);
        assertTrue(e.getMessage().contains("PLEX_TOKEN"));
    }

    @Test
    void testValidate_whenLocalWithoutCredentials_shouldFail() {
        settings.setOpenSubtitlesPassword("");

        assertFalse(settings.isOpenSubtitlesConfigured());
        assertThrows(IllegalStateException.class, settings::validate);
    }

    @Test
    void testValidate_whenDelegatedWithoutCredentials_shouldPass() {
        settings.setMethod("plex");
        settings.setOpenSubtitlesApiKey("");

        assertEquals(AcquisitionMethod.DELEGATED, settings.getAcquisitionMethod());
        assertDoesNotThrow(settings::validate);
    }

    @Test
    void testValidate_whenMaxDownloadsNegative_shouldFail() {
        settings.setMaxDownloads(-1);

        assertThrows(IllegalStateException.class, settings::validate);
    }

    @Test
    void testGetLanguageCodes_shouldSplitOnCommasAndSpaces() {
        settings.setLanguages("en, es  fr,,de");

        assertEquals(List.of("en", "es", "fr", "de"), settings.getLanguageCodes());
    }

    @Test
    void testGetLanguageCodes_whenBlank_shouldBeEmpty() {
        settings.setLanguages("");

        assertTrue(settings.getLanguageCodes().isEmpty());
    }

    @Test
    void testGetMediaKindFilter() {
        assertNull(settings.getMediaKindFilter());
        settings.setType("movie");
        assertEquals(MediaKind.MOVIE, settings.getMediaKindFilter());
        settings.setType("album");
        assertThrows(IllegalArgumentException.class, settings::getMediaKindFilter);
    }
}
