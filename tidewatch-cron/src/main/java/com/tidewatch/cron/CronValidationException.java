package com.tidewatch.cron;

/**
 * A cron expression that cannot be parsed, or a job the schedule file
 * cannot represent.
 */
public class CronValidationException extends RuntimeException {

    public CronValidationException(String message) {
        super(message);
    }
}
