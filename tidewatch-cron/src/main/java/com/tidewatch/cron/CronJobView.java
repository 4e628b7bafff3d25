package com.tidewatch.cron;

/** A scheduled job together with whether it is executing right now. */
public record CronJobView(CronJob job, boolean running) {
}
