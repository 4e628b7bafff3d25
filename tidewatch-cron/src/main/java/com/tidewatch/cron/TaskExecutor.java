package com.tidewatch.cron;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Runs one unit of scheduled work in isolation. Implementations must honour
 * the timeout and complete the future (normally or exceptionally) in every
 * case.
 */
@FunctionalInterface
public interface TaskExecutor {

    CompletableFuture<TaskResult> execute(String task, Duration timeout);
}
