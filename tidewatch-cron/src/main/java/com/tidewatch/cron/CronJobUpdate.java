package com.tidewatch.cron;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Partial update of a {@link CronJob}; null fields are left unchanged.
 */
@Value
@Builder
public class CronJobUpdate {
    String schedule;
    String task;
    String channel;
    Boolean disabled;
    Duration timeout;

    public static CronJobUpdate disabled(boolean disabled) {
        return CronJobUpdate.builder().disabled(disabled).build();
    }

    void applyTo(CronJob job) {
        if (schedule != null)
            job.setSchedule(schedule);
        if (task != null)
            job.setTask(task);
        if (channel != null)
            job.setChannel(channel);
        if (disabled != null)
            job.setDisabled(disabled);
        if (timeout != null)
            job.setTimeout(timeout);
    }
}
