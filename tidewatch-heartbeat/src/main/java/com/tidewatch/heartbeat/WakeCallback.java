package com.tidewatch.heartbeat;

/**
 * Asks the consuming agent to act on an urgent briefing now.
 */
@FunctionalInterface
public interface WakeCallback {

    WakeCallback NONE = briefing -> {
    };

    void wake(String briefing);
}
