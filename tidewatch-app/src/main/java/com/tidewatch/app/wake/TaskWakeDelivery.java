package com.tidewatch.app.wake;

import com.tidewatch.cron.CronJob;
import com.tidewatch.cron.TaskExecutor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Hands a wake message to the agent by running it as a task through the
 * same executor the scheduler uses. The outcome is only logged.
 */
@Slf4j
public class TaskWakeDelivery implements Consumer<String> {

    private final TaskExecutor executor;
    private final Duration timeout;

    public TaskWakeDelivery(TaskExecutor executor) {
        this(executor, CronJob.DEFAULT_TIMEOUT);
    }

    public TaskWakeDelivery(TaskExecutor executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public void accept(String message) {
        log.info("Waking agent with urgent heartbeat briefing");
        executor.execute(message, timeout).whenComplete((result, error) -> {
            if (error != null) {
                log.warn("Wake delivery failed: {}", error.getMessage());
            } else if (result.timedOut() || result.exitCode() != 0) {
                log.warn("Wake delivery ended with exit code {}{}", result.exitCode(),
                        result.timedOut() ? " (timed out)" : "");
            } else {
                log.debug("Wake delivered");
            }
        });
    }
}
