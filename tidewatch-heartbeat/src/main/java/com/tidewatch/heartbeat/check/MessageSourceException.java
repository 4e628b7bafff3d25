package com.tidewatch.heartbeat.check;

/**
 * The message source could not deliver messages this time.
 */
public class MessageSourceException extends Exception {

    public MessageSourceException(String message) {
        super(message);
    }

    public MessageSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
