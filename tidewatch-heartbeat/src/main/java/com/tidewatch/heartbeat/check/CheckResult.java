package com.tidewatch.heartbeat.check;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one awareness check. {@code data} carries check-specific
 * payload, such as the new messages found.
 */
public record CheckResult(String name, boolean ok, String message, Duration duration, Map<String, Object> data) {

    public CheckResult {
        duration = duration == null ? Duration.ZERO : duration;
        data = data == null ? Map.of() : data;
    }

    public static CheckResult failed(String name, String message, Duration duration) {
        return new CheckResult(name, false, message, duration, Map.of());
    }

    /**
     * Elements of the list stored under {@code key} that are of {@code type};
     * empty when the key is absent or holds something else.
     */
    public <T> List<T> dataList(String key, Class<T> type) {
        Object value = data.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
