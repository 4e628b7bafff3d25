package com.tidewatch.heartbeat.check;

import java.util.Map;

/**
 * Persists per-source high-water marks (epoch millis of the newest item
 * already seen).
 */
public interface WatermarkStore {

    /** Current marks; empty when nothing has been stored or the store is unreadable. */
    Map<String, Long> read();

    void write(Map<String, Long> watermarks);
}
