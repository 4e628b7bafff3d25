package com.tidewatch.app.alert;

import com.tidewatch.common.alert.AlertSink;
import lombok.extern.slf4j.Slf4j;

/**
 * Fallback sink used when no webhook is configured: alerts end up in the
 * application log.
 */
@Slf4j
public class LoggingAlertSink implements AlertSink {

    private final String channel;

    public LoggingAlertSink(String channel) {
        this.channel = channel == null ? "" : channel;
    }

    @Override
    public void notify(String message) {
        if (channel.isEmpty()) {
            log.warn("ALERT {}", message);
        } else {
            log.warn("ALERT [{}] {}", channel, message);
        }
    }
}
