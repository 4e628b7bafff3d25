package com.tidewatch.cron;

/**
 * The schedule file could not be read or written.
 */
public class ScheduleStoreException extends RuntimeException {

    public ScheduleStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
