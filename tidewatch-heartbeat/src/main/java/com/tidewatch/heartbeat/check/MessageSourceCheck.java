package com.tidewatch.heartbeat.check;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reports chat messages that arrived since the previous beat.
 * <p>
 * Per source, items at or below the stored watermark are skipped, and the
 * watermark advances to the newest timestamp seen, including items that are
 * filtered out (edits, bot senders, non-text events, empty bodies). The new
 * watermarks are saved before the result is returned.
 */
@Slf4j
public class MessageSourceCheck implements AwarenessCheck {

    public static final String NAME = "Messages";
    public static final String DATA_MESSAGES = "messages";
    public static final String DATA_PRIORITY = "priorityMessages";

    private final MessageSource source;
    private final WatermarkStore watermarks;
    private final List<String> prioritySenders;
    private final Set<String> botSenders;

    public MessageSourceCheck(MessageSource source, WatermarkStore watermarks,
            List<String> prioritySenders, List<String> botSenders) {
        this.source = source;
        this.watermarks = watermarks;
        this.prioritySenders = List.copyOf(prioritySenders);
        this.botSenders = Set.copyOf(botSenders);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run(CheckContext context) {
        return Checks.timed(NAME, () -> check(context.sinceMinutes()));
    }

    private Checks.Outcome check(int sinceMinutes) {
        Map<String, List<InboundMessage>> bySource;
        try {
            bySource = source.fetch(sinceMinutes);
        } catch (MessageSourceException e) {
            log.debug("{} fetch failed: {}", source.name(), e.getMessage());
            Map<String, Object> data = Map.of(DATA_MESSAGES, List.of());
            if (!source.ping()) {
                return Checks.Outcome.failed(source.name() + " unreachable", data);
            }
            return Checks.Outcome.ok("Connected, no new messages", data);
        }

        Map<String, Long> previous = watermarks.read();
        Map<String, Long> next = new HashMap<>(previous);
        List<InboundMessage> messages = new ArrayList<>();

        for (Map.Entry<String, List<InboundMessage>> entry : bySource.entrySet()) {
            String sourceId = entry.getKey();
            long watermark = previous.getOrDefault(sourceId, 0L);
            for (InboundMessage msg : entry.getValue()) {
                if (msg.timestamp() > next.getOrDefault(sourceId, 0L)) {
                    next.put(sourceId, msg.timestamp());
                }
                if (msg.timestamp() <= watermark
                        || msg.replacement()
                        || botSenders.contains(msg.sender())
                        || !msg.text()
                        || msg.content() == null || msg.content().isEmpty()) {
                    continue;
                }
                messages.add(msg.reply() ? msg.withContent("[reply] " + msg.content()) : msg);
            }
        }

        watermarks.write(next);

        List<InboundMessage> priority = messages.stream().filter(this::isPriority).toList();
        int count = messages.size();
        String text = count == 0 ? "No new messages" : count + " new message" + (count > 1 ? "s" : "");
        if (!priority.isEmpty()) {
            text += " (" + priority.size() + " priority!)";
        }
        return Checks.Outcome.ok(text, Map.of(DATA_MESSAGES, messages, DATA_PRIORITY, priority));
    }

    private boolean isPriority(InboundMessage msg) {
        String sender = msg.sender() == null ? "" : msg.sender();
        return prioritySenders.stream().anyMatch(sender::contains);
    }
}
