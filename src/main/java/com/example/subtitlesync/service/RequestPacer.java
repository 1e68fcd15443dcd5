package com.example.subtitlesync.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Serializes outbound catalog calls behind a minimum interval, measured from the start
 * of the previous call. Also performs the server-requested waits after a 429.
 */
@Component
public class RequestPacer {

    private static final Logger log = LoggerFactory.getLogger(RequestPacer.class);

    public static final Duration MIN_REQUEST_INTERVAL = Duration.ofSeconds(1);

    private final Duration minInterval;
    private final Clock clock;
    private final Sleeper sleeper;

    private Instant lastRequest;

    @Autowired
    public RequestPacer(Clock clock, Sleeper sleeper) {
        this(MIN_REQUEST_INTERVAL, clock, sleeper);
    }

    RequestPacer(Duration minInterval, Clock clock, Sleeper sleeper) {
        this.minInterval = minInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Block until the minimum interval since the previous call has elapsed, then mark the
     * start of a new call.
     */
    public synchronized void awaitTurn() {
        if (lastRequest != null) {
            Duration elapsed = Duration.between(lastRequest, clock.instant());
            Duration remaining = minInterval.minus(elapsed);
            if (!remaining.isNegative() && !remaining.isZero()) {
                log.debug("Rate limiting: sleeping {} ms", remaining.toMillis());
                pause(remaining);
            }
        }
        lastRequest = clock.instant();
    }

    /**
     * Sleep for the given duration. An interrupt ends the wait early and is preserved on the thread.
     */
    public void pause(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting {} ms", duration.toMillis());
        }
    }
}
