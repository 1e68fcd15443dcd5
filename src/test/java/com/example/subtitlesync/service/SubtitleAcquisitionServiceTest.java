package com.example.subtitlesync.service;

import com.example.subtitlesync.config.AppSettings;
import com.example.subtitlesync.model.AcquisitionMethod;
import com.example.subtitlesync.model.SearchQuery;
import com.example.subtitlesync.model.SubtitleCandidate;
import com.example.subtitlesync.service.acquisition.LocalSubtitleAcquirer;
import com.example.subtitlesync.service.acquisition.SubtitleAcquirer;
import com.example.subtitlesync.test.MediaItems;
import com.example.subtitlesync.test.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubtitleAcquisitionServiceTest {
    @Mock
    private SubtitleAcquirer localAcquirer;

    @Mock
    private SubtitleAcquirer delegatedAcquirer;

    @Mock
    private OpenSubtitlesClient openSubtitlesClient;

    @TempDir
    Path tempDir;

    private AppSettings settings;

    @BeforeEach
    void setUp() {
        settings = new AppSettings();
        settings.setLanguages("en, es");
        lenient().when(localAcquirer.method()).thenReturn(AcquisitionMethod.LOCAL);
        lenient().when(delegatedAcquirer.method()).thenReturn(AcquisitionMethod.DELEGATED);
    }

    @Test
    void testConstructor_shouldSelectAcquirerForConfiguredMethod() {
        settings.setMethod("plex");

        var service = new SubtitleAcquisitionService(new LanguageCodec(), List.of(localAcquirer, delegatedAcquirer),
                settings);

        assertEquals(AcquisitionMethod.DELEGATED, service.getMethod());
        assertEquals(Set.of("en", "es"), service.getWantedLanguages());
    }

    @Test
    void testConstructor_whenNoAcquirerForMethod_shouldFail() {
        settings.setMethod("plex");

        assertThrows(IllegalStateException.class,
                () -> new SubtitleAcquisitionService(new LanguageCodec(), List.of(localAcquirer), settings));
    }

    @Test
    void testAcquire_whenItemHasAllLanguages_shouldNotCallAcquirer() {
        var service = new SubtitleAcquisitionService(new LanguageCodec(), List.of(localAcquirer), settings);
        var item = MediaItems.movie("1", "Heat", "eng", "spa");

        assertFalse(service.needsSubtitles(item));
        assertEquals(0, service.acquire(item));
        verify(localAcquirer, never()).pendingLanguages(any(), any());
        verify(localAcquirer, never()).acquire(any(), any());
    }

    @Test
    void testAcquire_shouldPassPendingLanguagesToAcquirer() {
        var service = new SubtitleAcquisitionService(new LanguageCodec(), List.of(localAcquirer), settings);
        var item = MediaItems.movie("1", "Heat", "eng");
        when(localAcquirer.pendingLanguages(item, Set.of("es"))).thenReturn(Set.of("es"));
        when(localAcquirer.acquire(item, Set.of("es"))).thenReturn(1);

        assertTrue(service.needsSubtitles(item));
        assertEquals(1, service.acquire(item));
    }

    @Test
    void testAcquire_whenNothingPending_shouldSkipAcquire() {
        var service = new SubtitleAcquisitionService(new LanguageCodec(), List.of(localAcquirer), settings);
        var item = MediaItems.movie("1", "Heat");
        when(localAcquirer.pendingLanguages(item, Set.of("en", "es"))).thenReturn(Set.of());

        assertEquals(0, service.acquire(item));
        verify(localAcquirer, never()).acquire(any(), any());
    }

    @Test
    void testAcquire_whenRunTwiceWithLocalAcquirer_shouldNotSearchAgain() throws Exception {
        var media = Files.createFile(tempDir.resolve("Heat.mkv"));
        var item = MediaItems.movie("1", "Heat", media, 10L, null);
        var report = new DownloadReport(new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
        var localAcquirer = new LocalSubtitleAcquirer(openSubtitlesClient, new CandidateSelector(),
                new SubtitleFileService(), report);
        settings.setLanguages("en");
        var service = new SubtitleAcquisitionService(new LanguageCodec(), List.of(localAcquirer), settings);
        when(openSubtitlesClient.search(any(SearchQuery.class)))
                .thenReturn(Optional.of(List.of(new SubtitleCandidate("en", 7, 8.0, 10, "r", "u"))));
        when(openSubtitlesClient.download(7)).thenReturn(Optional.of("subtitle".getBytes(StandardCharsets.UTF_8)));

        var first = service.acquire(item);
        var second = service.acquire(item);

        assertEquals(1, first);
        assertEquals(0, second);
        assertTrue(Files.exists(tempDir.resolve("Heat.en.srt")));
        verify(openSubtitlesClient, times(1)).search(any(SearchQuery.class));
        verify(openSubtitlesClient, times(1)).download(anyInt());
        assertEquals(1, report.size());
    }
}
