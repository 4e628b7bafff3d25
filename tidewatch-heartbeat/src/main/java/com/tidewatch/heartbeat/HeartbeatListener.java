package com.tidewatch.heartbeat;

/**
 * Observer of heartbeat activity; exceptions are logged and ignored.
 */
public interface HeartbeatListener {

    default void onBeatStart(long beatNumber, int sinceMinutes) {
    }

    default void onBeat(BeatResult result) {
    }
}
