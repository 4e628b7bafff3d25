package com.tidewatch.cron;

/** Outcome of a manual trigger. */
public enum RunNowResult {
    TRIGGERED,
    NOT_FOUND,
    ALREADY_RUNNING
}
