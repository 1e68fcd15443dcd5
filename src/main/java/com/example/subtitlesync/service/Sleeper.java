package com.example.subtitlesync.service;

import java.time.Duration;

/**
 * Blocks the calling thread for a duration.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
