package com.tidewatch.heartbeat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Lets at most one wake through per window.
 */
public class UrgencyDebouncer {

    private final Duration window;
    private final Clock clock;
    private Instant last;

    public UrgencyDebouncer(Duration window, Clock clock) {
        this.window = window;
        this.clock = clock;
    }

    /**
     * @return true, and start a new window, if no wake went through within
     *         the current window
     */
    public synchronized boolean tryAcquire() {
        Instant now = clock.instant();
        if (last != null && Duration.between(last, now).compareTo(window) < 0) {
            return false;
        }
        last = now;
        return true;
    }
}
