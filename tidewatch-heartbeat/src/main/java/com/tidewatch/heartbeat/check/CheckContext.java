package com.tidewatch.heartbeat.check;

/**
 * What a check knows about the beat it runs in. {@code sinceMinutes} is the
 * lookback window for sources that are queried by age.
 */
public record CheckContext(long beatNumber, int sinceMinutes) {
}
