package com.tidewatch.heartbeat.check;

/**
 * One item from a message source.
 *
 * @param source      room or channel id the item belongs to
 * @param timestamp   epoch millis; 0 when unknown
 * @param text        false for reactions, membership changes and other non-text events
 * @param replacement true for an edit of an earlier message
 * @param reply       true when the item answers another message or sits in a thread
 */
public record InboundMessage(String source, String sender, String content, long timestamp,
        boolean text, boolean replacement, boolean reply) {

    public static InboundMessage text(String source, String sender, String content, long timestamp) {
        return new InboundMessage(source, sender, content, timestamp, true, false, false);
    }

    public InboundMessage withContent(String newContent) {
        return new InboundMessage(source, sender, newContent, timestamp, text, replacement, reply);
    }
}
