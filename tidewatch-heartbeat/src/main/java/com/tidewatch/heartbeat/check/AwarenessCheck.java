package com.tidewatch.heartbeat.check;

/**
 * A lightweight probe run on every heartbeat. Implementations should return
 * quickly and report problems through the result rather than by throwing;
 * the registry converts any exception into a failed result anyway.
 */
public interface AwarenessCheck {

    /** Stable display name, also used to find the result in a briefing. */
    String name();

    CheckResult run(CheckContext context) throws Exception;
}
