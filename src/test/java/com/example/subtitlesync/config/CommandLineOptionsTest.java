package com.example.subtitlesync.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineOptionsTest {

    @Test
    void testToPropertyArguments_shouldRewriteKnownOptions() {
        var result = CommandLineOptions.toPropertyArguments(new String[]{
                "--type=movie", "--max-downloads=10", "--plex-token=abc", "--languages=en,es"});

        assertArrayEquals(new String[]{
                "--subtitles.type=movie", "--subtitles.max-downloads=10", "--plex.token=abc",
                "--subtitles.languages=en,es"}, result);
    }

    @Test
    void testToPropertyArguments_shouldKeepFlagsAndUnknownArguments() {
        var result = CommandLineOptions.toPropertyArguments(new String[]{"--status", "--verbose", "--foo=bar", "extra"});

        assertArrayEquals(new String[]{"--status", "--verbose", "--foo=bar", "extra"}, result);
    }

    @Test
    void testRewrite_whenValueContainsEquals_shouldKeepWholeValue() {
        assertEquals("--subtitles.library=A=B", CommandLineOptions.rewrite("--library=A=B"));
    }
}
