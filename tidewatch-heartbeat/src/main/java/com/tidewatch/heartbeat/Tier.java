package com.tidewatch.heartbeat;

import java.util.Locale;

/**
 * Cadence label of a beat: every 6th beat is a TIDE, every other 3rd beat a
 * BREATH, the rest PULSE.
 */
public enum Tier {
    PULSE,
    BREATH,
    TIDE;

    public static Tier forBeat(long beatNumber) {
        if (beatNumber > 0 && beatNumber % 6 == 0) {
            return TIDE;
        }
        if (beatNumber > 0 && beatNumber % 3 == 0) {
            return BREATH;
        }
        return PULSE;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
