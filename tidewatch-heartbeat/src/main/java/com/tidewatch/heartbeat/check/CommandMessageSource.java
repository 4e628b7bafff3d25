package com.tidewatch.heartbeat.check;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tidewatch.common.infra.ProcessRunner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Message source backed by a shell command that prints recent messages as
 * JSON: either an object mapping room id to an array of events, or a bare
 * array (filed under room {@code "unknown"}). {@code {sinceMinutes}} in the
 * command is replaced by the lookback window.
 * <p>
 * Events may be Matrix-shaped ({@code type}, {@code sender},
 * {@code origin_server_ts}, {@code content.body},
 * {@code content["m.relates_to"]}) or flat ({@code sender}, {@code body},
 * {@code timestamp}).
 */
@Slf4j
public class CommandMessageSource implements MessageSource {

    static final String UNKNOWN_ROOM = "unknown";
    private static final String TEXT_EVENT = "m.room.message";
    private static final String RELATES_TO = "m.relates_to";

    private final String name;
    private final String fetchCommand;
    private final String pingCommand;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public CommandMessageSource(String name, String fetchCommand, String pingCommand,
            ObjectMapper objectMapper, Duration timeout) {
        this.name = name;
        this.fetchCommand = fetchCommand;
        this.pingCommand = pingCommand;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Map<String, List<InboundMessage>> fetch(int sinceMinutes) throws MessageSourceException {
        String command = fetchCommand.replace("{sinceMinutes}", Integer.toString(sinceMinutes));
        ProcessRunner.Result result;
        try {
            result = ProcessRunner.run(List.of("sh", "-c", command), null, timeout);
        } catch (IOException e) {
            throw new MessageSourceException("Failed to run message command: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessageSourceException("Interrupted", e);
        }
        if (result.exitCode() != 0 || result.stdout().isBlank()) {
            throw new MessageSourceException("Message command produced no output (exit " + result.exitCode() + ")");
        }
        return parse(result.stdout());
    }

    @Override
    public boolean ping() {
        if (pingCommand == null || pingCommand.isBlank()) {
            return false;
        }
        try {
            return ProcessRunner.run(List.of("sh", "-c", pingCommand), null, timeout).exitCode() == 0;
        } catch (IOException e) {
            log.debug("Ping command failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    Map<String, List<InboundMessage>> parse(String json) throws MessageSourceException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new MessageSourceException("Message command printed invalid JSON: " + e.getMessage(), e);
        }
        Map<String, List<InboundMessage>> rooms = new LinkedHashMap<>();
        if (root.isArray()) {
            rooms.put(UNKNOWN_ROOM, events(UNKNOWN_ROOM, root));
        } else if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isArray()) {
                    rooms.put(field.getKey(), events(field.getKey(), field.getValue()));
                }
            }
        } else {
            throw new MessageSourceException("Message command printed neither an object nor an array");
        }
        return rooms;
    }

    private static List<InboundMessage> events(String room, JsonNode array) {
        List<InboundMessage> out = new ArrayList<>();
        for (JsonNode event : array) {
            out.add(toMessage(room, event));
        }
        return out;
    }

    static InboundMessage toMessage(String room, JsonNode event) {
        JsonNode content = event.path("content");
        JsonNode relates = content.path(RELATES_TO);

        long ts = event.has("origin_server_ts")
                ? event.path("origin_server_ts").asLong(0)
                : event.path("timestamp").asLong(0);
        String sender = event.hasNonNull("sender") ? event.get("sender").asText() : event.path("user_id").asText("");
        boolean text = !event.has("type") || TEXT_EVENT.equals(event.path("type").asText());
        boolean replacement = "m.replace".equals(relates.path("rel_type").asText());
        boolean reply = !relates.path("m.in_reply_to").path("event_id").asText("").isEmpty()
                || "m.thread".equals(relates.path("rel_type").asText());

        return new InboundMessage(room, sender, extractBody(event), ts, text, replacement, reply);
    }

    /**
     * Message body with any quoted reply fallback removed; reactions render as
     * {@code [reaction: key]}.
     */
    static String extractBody(JsonNode event) {
        JsonNode content = event.path("content");
        String body;
        if (content.hasNonNull("body")) {
            body = content.get("body").asText();
        } else if (content.path(RELATES_TO).hasNonNull("key")) {
            return "[reaction: " + content.path(RELATES_TO).get("key").asText() + "]";
        } else if (event.hasNonNull("body")) {
            body = event.get("body").asText();
        } else if (content.isTextual()) {
            body = content.asText();
        } else {
            return "";
        }

        if (body.startsWith("> ")) {
            String[] lines = body.split("\n", -1);
            int idx = 0;
            while (idx < lines.length && lines[idx].startsWith("> ")) {
                idx++;
            }
            if (idx < lines.length && lines[idx].trim().isEmpty()) {
                idx++;
            }
            String cleaned = String.join("\n", Arrays.copyOfRange(lines, idx, lines.length)).trim();
            if (!cleaned.isEmpty()) {
                body = cleaned;
            }
        }
        return body;
    }
}
