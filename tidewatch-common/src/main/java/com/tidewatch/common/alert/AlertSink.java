package com.tidewatch.common.alert;

import org.slf4j.LoggerFactory;

/**
 * Delivers a human-readable notification somewhere a person will see it.
 * <p>
 * Delivery is best effort: callers go through {@link #notifyQuietly} so a
 * broken sink never takes a loop down with it.
 */
@FunctionalInterface
public interface AlertSink {

    /** A sink that drops everything. */
    AlertSink NONE = message -> {
    };

    void notify(String message) throws Exception;

    /**
     * Deliver {@code message}, logging and discarding any failure.
     */
    static void notifyQuietly(AlertSink sink, String message) {
        if (sink == null) {
            return;
        }
        try {
            sink.notify(message);
        } catch (Exception e) {
            LoggerFactory.getLogger(AlertSink.class).debug("Alert delivery failed: {}", e.getMessage(), e);
        }
    }
}
