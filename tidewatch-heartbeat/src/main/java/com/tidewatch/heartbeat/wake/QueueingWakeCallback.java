package com.tidewatch.heartbeat.wake;

import com.tidewatch.heartbeat.WakeCallback;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Delivers wake messages to a consumer that may be busy. An idle consumer
 * gets the message at once; a busy one gets it as a follow-up, handed over
 * by {@link #drainFollowUps()} when it next reports idle.
 */
@Slf4j
public class QueueingWakeCallback implements WakeCallback {

    private final BooleanSupplier consumerIdle;
    private final Consumer<String> deliver;
    private final Deque<String> followUps = new ArrayDeque<>();

    public QueueingWakeCallback(BooleanSupplier consumerIdle, Consumer<String> deliver) {
        this.consumerIdle = consumerIdle;
        this.deliver = deliver;
    }

    public static String formatMessage(String briefing) {
        return "[HEARTBEAT - Urgent]\n\n" + briefing
                + "\n\nCheck messages and address any priority messages before continuing other work.";
    }

    @Override
    public void wake(String briefing) {
        String message = formatMessage(briefing);
        if (consumerIdle.getAsBoolean()) {
            deliver.accept(message);
        } else {
            synchronized (followUps) {
                followUps.addLast(message);
            }
            log.debug("Consumer busy, wake queued as follow-up");
        }
    }

    /**
     * Deliver queued follow-ups, oldest first, if the consumer is idle.
     *
     * @return how many were delivered
     */
    public int drainFollowUps() {
        if (!consumerIdle.getAsBoolean()) {
            return 0;
        }
        int delivered = 0;
        String next;
        while ((next = poll()) != null) {
            deliver.accept(next);
            delivered++;
        }
        return delivered;
    }

    public int pendingCount() {
        synchronized (followUps) {
            return followUps.size();
        }
    }

    private String poll() {
        synchronized (followUps) {
            return followUps.pollFirst();
        }
    }
}
