package com.tidewatch.cron;

import java.util.List;

public record CronStatus(boolean active, int jobCount, int enabledCount, List<String> runningNames,
        long runCount, long okCount, long errorCount) {
}
