package com.tidewatch.heartbeat.check;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageSourceCheckTest {

    private static final CheckContext CONTEXT = new CheckContext(1, 16);

    /** Serves whatever the test puts in {@code rooms}, or fails when {@code available} is false. */
    static class FakeSource implements MessageSource {
        Map<String, List<InboundMessage>> rooms = new LinkedHashMap<>();
        boolean available = true;
        boolean reachable = true;
        int lastSinceMinutes;

        @Override
        public String name() {
            return "Matrix";
        }

        @Override
        public Map<String, List<InboundMessage>> fetch(int sinceMinutes) throws MessageSourceException {
            lastSinceMinutes = sinceMinutes;
            if (!available) {
                throw new MessageSourceException("no output");
            }
            return rooms;
        }

        @Override
        public boolean ping() {
            return reachable;
        }
    }

    private FakeSource source;
    private InMemoryWatermarkStore watermarks;
    private MessageSourceCheck check;

    @BeforeEach
    void setUp() {
        source = new FakeSource();
        watermarks = new InMemoryWatermarkStore();
        check = new MessageSourceCheck(source, watermarks, List.of("@admin"), List.of("@bot:example.org"));
    }

    @Test
    void watermarkAdvancesPastFilteredBotMessages() {
        source.rooms.put("!ops", List.of(
                InboundMessage.text("!ops", "@alice:example.org", "hello", 100),
                InboundMessage.text("!ops", "@bot:example.org", "beep", 200)));

        CheckResult result = check.run(CONTEXT);

        assertTrue(result.ok());
        assertEquals("1 new message", result.message());
        assertEquals(Map.of("!ops", 200L), watermarks.read());
        assertEquals(16, source.lastSinceMinutes);
    }

    @Test
    void alreadySeenMessagesAreNotReportedAgain() {
        source.rooms.put("!ops", List.of(InboundMessage.text("!ops", "@alice:example.org", "hello", 100)));

        check.run(CONTEXT);
        CheckResult second = check.run(CONTEXT);

        assertEquals("No new messages", second.message());
        assertTrue(second.dataList(MessageSourceCheck.DATA_MESSAGES, InboundMessage.class).isEmpty());
    }

    @Test
    void watermarksArePerSource() {
        watermarks.write(Map.of("!a", 500L));
        source.rooms.put("!a", List.of(InboundMessage.text("!a", "@x", "old", 400)));
        source.rooms.put("!b", List.of(InboundMessage.text("!b", "@y", "new", 400)));

        CheckResult result = check.run(CONTEXT);

        List<InboundMessage> messages = result.dataList(MessageSourceCheck.DATA_MESSAGES, InboundMessage.class);
        assertEquals(List.of("new"), messages.stream().map(InboundMessage::content).toList());
        assertEquals(Map.of("!a", 500L, "!b", 400L), watermarks.read());
    }

    @Test
    void editsNonTextAndEmptyItemsAreSkippedRepliesMarked() {
        source.rooms.put("!ops", List.of(
                new InboundMessage("!ops", "@alice", "edited", 10, true, true, false),
                new InboundMessage("!ops", "@alice", "[reaction: 👍]", 11, false, false, false),
                new InboundMessage("!ops", "@alice", "", 12, true, false, false),
                new InboundMessage("!ops", "@alice", "sure thing", 13, true, false, true)));

        CheckResult result = check.run(CONTEXT);

        List<InboundMessage> messages = result.dataList(MessageSourceCheck.DATA_MESSAGES, InboundMessage.class);
        assertEquals(1, messages.size());
        assertEquals("[reply] sure thing", messages.get(0).content());
        assertEquals(Map.of("!ops", 13L), watermarks.read());
    }

    @Test
    void prioritySendersMatchBySubstring() {
        source.rooms.put("!ops", List.of(
                InboundMessage.text("!ops", "@admin:example.org", "server is on fire", 1),
                InboundMessage.text("!ops", "@carol:example.org", "lunch?", 2)));

        CheckResult result = check.run(CONTEXT);

        assertEquals("2 new messages (1 priority!)", result.message());
        List<InboundMessage> priority = result.dataList(MessageSourceCheck.DATA_PRIORITY, InboundMessage.class);
        assertEquals("@admin:example.org", priority.get(0).sender());
    }

    @Nested
    class Unavailable {

        @BeforeEach
        void goDark() {
            source.available = false;
            watermarks.write(Map.of("!ops", 42L));
        }

        @Test
        void unreachableSourceFails() {
            source.reachable = false;

            CheckResult result = check.run(CONTEXT);

            assertFalse(result.ok());
            assertEquals("Matrix unreachable", result.message());
            assertEquals(Map.of("!ops", 42L), watermarks.read());
        }

        @Test
        void reachableSourceWithoutOutputIsQuiet() {
            CheckResult result = check.run(CONTEXT);

            assertTrue(result.ok());
            assertEquals("Connected, no new messages", result.message());
        }
    }
}
