package com.tidewatch.cron;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * One line of the schedule file: a named task fired whenever its cron
 * expression matches the current minute.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CronJob {

    public static final String DEFAULT_CHANNEL = "general";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(15);

    /** Unique key within the schedule. No whitespace. */
    private String name;
    /** Five-field cron expression. */
    private String schedule;
    /** Opaque work description handed to the task executor. */
    private String task;
    @Builder.Default
    private String channel = DEFAULT_CHANNEL;
    private boolean disabled;
    @Builder.Default
    private Duration timeout = DEFAULT_TIMEOUT;

    public boolean isEnabled() {
        return !disabled;
    }
}
