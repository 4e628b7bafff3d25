package com.tidewatch.heartbeat;

import java.time.Instant;

public record HeartbeatStatus(boolean active, boolean running, long beatNumber, long runCount, long okCount,
        long alertCount, Instant lastRun, int intervalMinutes, int historySize) {
}
