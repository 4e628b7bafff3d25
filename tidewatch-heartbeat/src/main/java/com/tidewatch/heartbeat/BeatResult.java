package com.tidewatch.heartbeat;

import com.tidewatch.heartbeat.check.CheckResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Everything one heartbeat found out.
 *
 * @param ok     true when every check passed
 * @param urgent true when a priority message arrived or any check failed
 */
public record BeatResult(long beatNumber, Tier tier, boolean ok, List<CheckResult> checks,
        List<String> failedChecks, String briefing, boolean urgent, Instant timestamp, Duration duration) {

    public BeatResult {
        checks = List.copyOf(checks);
        failedChecks = List.copyOf(failedChecks);
    }

    /**
     * Stand-in result for a beat whose orchestration itself failed.
     */
    static BeatResult error(long beatNumber, String message, Instant timestamp) {
        return new BeatResult(beatNumber, Tier.PULSE, false, List.of(), List.of("runner: " + message),
                "Heartbeat error: " + message, true, timestamp, Duration.ZERO);
    }

    public long passedCount() {
        return checks.stream().filter(CheckResult::ok).count();
    }
}
