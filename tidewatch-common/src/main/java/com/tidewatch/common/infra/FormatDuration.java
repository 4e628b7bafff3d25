package com.tidewatch.common.infra;

import java.time.Duration;
import java.util.Locale;

/**
 * Duration formatting for status lines and alerts.
 */
public final class FormatDuration {

    private FormatDuration() {
    }

    /**
     * "450ms" below one second, "2.5s" below one minute, "1.5m" above.
     */
    public static String format(long ms) {
        if (ms < 0)
            ms = 0;
        if (ms < 1000) {
            return ms + "ms";
        }
        if (ms < 60_000) {
            return String.format(Locale.ROOT, "%.1fs", ms / 1000.0);
        }
        return String.format(Locale.ROOT, "%.1fm", ms / 60_000.0);
    }

    public static String format(Duration duration) {
        return format(duration == null ? 0 : duration.toMillis());
    }

    /**
     * Seconds with one decimal, as used in alert text ("12.3s").
     */
    public static String formatSeconds(long ms) {
        if (ms < 0)
            ms = 0;
        return String.format(Locale.ROOT, "%.1fs", ms / 1000.0);
    }
}
