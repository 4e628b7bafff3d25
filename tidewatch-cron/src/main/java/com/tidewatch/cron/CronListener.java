package com.tidewatch.cron;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Observer of scheduler activity. All methods default to no-ops; exceptions
 * thrown by a listener are logged and otherwise ignored.
 */
public interface CronListener {

    default void onJobStart(CronJob job, Instant startedAt) {
    }

    default void onJobComplete(JobOutcome outcome) {
    }

    default void onReload(List<CronJob> jobs) {
    }

    default void onInvalidJob(CronJob job, String problem) {
    }

    /**
     * A finished run. {@code response} is the trimmed stdout (at most 2000
     * characters) on success; {@code error} is set on failure.
     */
    record JobOutcome(CronJob job, Instant startedAt, Duration duration, boolean ok,
            String response, String error) {
    }
}
