package com.tidewatch.heartbeat.wake;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class QueueingWakeCallbackTest {

    private final AtomicBoolean idle = new AtomicBoolean(true);
    private final List<String> delivered = new ArrayList<>();
    private final QueueingWakeCallback callback = new QueueingWakeCallback(idle::get, delivered::add);

    @Test
    void idleConsumerIsWokenImmediately() {
        callback.wake("Heartbeat #1 [pulse] - 09:00");

        assertEquals(1, delivered.size());
        assertTrue(delivered.get(0).startsWith("[HEARTBEAT - Urgent]\n\nHeartbeat #1 [pulse] - 09:00\n\n"));
        assertEquals(0, callback.pendingCount());
    }

    @Test
    void busyConsumerGetsFollowUpsInOrder() {
        idle.set(false);
        callback.wake("first");
        callback.wake("second");

        assertTrue(delivered.isEmpty());
        assertEquals(0, callback.drainFollowUps());

        idle.set(true);
        assertEquals(2, callback.drainFollowUps());
        assertEquals(QueueingWakeCallback.formatMessage("first"), delivered.get(0));
        assertEquals(QueueingWakeCallback.formatMessage("second"), delivered.get(1));
        assertEquals(0, callback.pendingCount());
    }
}
