package com.tidewatch.common.infra;

import com.tidewatch.common.config.TidewatchConfig;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.regex.Pattern;

/**
 * Daily wall-clock window during which scheduling and checking may run.
 * <p>
 * Start is inclusive, end is exclusive. When the end lies before the start
 * the window spans midnight, so 22:00-06:00 covers 23:30 and 05:30 but not
 * 12:00. {@link #ALWAYS} is the absent window.
 */
public final class ActiveHours {

    private static final Pattern HHMM = Pattern.compile("^([01]\\d|2[0-3]|24):[0-5]\\d$");

    /** No window configured: always active. */
    public static final ActiveHours ALWAYS = new ActiveHours(-1, -1);

    private final int startMinute;
    private final int endMinute;

    private ActiveHours(int startMinute, int endMinute) {
        this.startMinute = startMinute;
        this.endMinute = endMinute;
    }

    /**
     * Build a window from "HH:mm" strings. "24:00" is accepted as an end.
     *
     * @throws IllegalArgumentException if either bound is malformed or both are equal
     */
    public static ActiveHours of(String start, String end) {
        int s = parseHhmm(start, false);
        int e = parseHhmm(end, true);
        if (s < 0) {
            throw new IllegalArgumentException("Invalid active hours start \"" + start + "\" (expected HH:mm)");
        }
        if (e < 0) {
            throw new IllegalArgumentException("Invalid active hours end \"" + end + "\" (expected HH:mm)");
        }
        if (s == e) {
            throw new IllegalArgumentException("Active hours start and end are equal (" + start + ")");
        }
        return new ActiveHours(s, e);
    }

    /**
     * Resolve a configured window; {@code null} means always active.
     */
    public static ActiveHours from(TidewatchConfig.ActiveHoursConfig config) {
        if (config == null || (config.getStart() == null && config.getEnd() == null)) {
            return ALWAYS;
        }
        return of(config.getStart(), config.getEnd());
    }

    public boolean isAlways() {
        return startMinute < 0;
    }

    public boolean contains(LocalTime time) {
        if (isAlways()) {
            return true;
        }
        int current = time.getHour() * 60 + time.getMinute();
        if (endMinute < startMinute) {
            return current >= startMinute || current < endMinute;
        }
        return current >= startMinute && current < endMinute;
    }

    public boolean contains(LocalDateTime dateTime) {
        return contains(dateTime.toLocalTime());
    }

    /** Display form, "24/7" for the absent window. */
    @Override
    public String toString() {
        if (isAlways()) {
            return "24/7";
        }
        return format(startMinute) + "-" + format(endMinute);
    }

    static int parseHhmm(String hhmm, boolean allow24) {
        if (hhmm == null || !HHMM.matcher(hhmm.trim()).matches()) {
            return -1;
        }
        String[] parts = hhmm.trim().split(":");
        int h = Integer.parseInt(parts[0]);
        int m = Integer.parseInt(parts[1]);
        if (h == 24 && (!allow24 || m != 0)) {
            return -1;
        }
        return h * 60 + m;
    }

    private static String format(int minuteOfDay) {
        return String.format("%02d:%02d", minuteOfDay / 60, minuteOfDay % 60);
    }
}
