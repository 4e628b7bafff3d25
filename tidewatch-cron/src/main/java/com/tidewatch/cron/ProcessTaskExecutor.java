package com.tidewatch.cron;

import com.tidewatch.common.infra.ProcessRunner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs each task as a fresh subprocess: the configured command line with the
 * task text appended as the last argument. Each job therefore gets its own
 * crash-isolated process with no shared state.
 * <p>
 * The executor hosts the wait and both output readers, so each running task
 * holds three of its threads; it should be a cached pool.
 */
@Slf4j
public class ProcessTaskExecutor implements TaskExecutor {

    private final List<String> command;
    private final String workingDirectory;
    private final ExecutorService executor;

    public ProcessTaskExecutor(List<String> command, String workingDirectory, ExecutorService executor) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Executor command must name a program");
        }
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<TaskResult> execute(String task, Duration timeout) {
        return CompletableFuture.supplyAsync(() -> {
            List<String> argv = new ArrayList<>(command);
            argv.add(task);
            try {
                ProcessRunner.Result result = ProcessRunner.run(argv, workingDirectory, timeout, executor);
                if (result.timedOut()) {
                    log.warn("Task process killed after {}", timeout);
                }
                return new TaskResult(result.stdout(), result.stderr(), result.exitCode(), result.timedOut());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to start " + command.get(0) + ": " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
        }, executor);
    }
}
