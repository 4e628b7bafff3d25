package com.tidewatch.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command to completion with a time limit, capturing stdout
 * and stderr separately.
 */
@Slf4j
public final class ProcessRunner {

    /** Pipe readers block for the whole life of the child, so they get threads of their own. */
    private static final ExecutorService OUTPUT_READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "process-output");
        t.setDaemon(true);
        return t;
    });

    private ProcessRunner() {
    }

    /**
     * Outcome of one process run. {@code exitCode} is -1 when the process was
     * killed for exceeding its time limit.
     */
    public record Result(String stdout, String stderr, int exitCode, boolean timedOut) {
    }

    /**
     * Start {@code command} and wait up to {@code timeout} for it to exit.
     * Output is drained on a dedicated reader pool.
     *
     * @throws IOException if the process cannot be started
     */
    public static Result run(List<String> command, String workingDirectory, Duration timeout)
            throws IOException, InterruptedException {
        return run(command, workingDirectory, timeout, OUTPUT_READERS);
    }

    /**
     * Same as {@link #run(List, String, Duration)}, draining stdout and stderr
     * on {@code readers}. It must be able to run two tasks for as long as the
     * process lives; a bounded or shared pool can leave the output unread.
     *
     * @throws IOException if the process cannot be started
     */
    public static Result run(List<String> command, String workingDirectory, Duration timeout, Executor readers)
            throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDirectory != null && !workingDirectory.isBlank()) {
            pb.directory(new File(workingDirectory));
        }
        pb.redirectInput(ProcessBuilder.Redirect.from(new File(nullDevice())));

        log.debug("Executing: {} (cwd={})", command.get(0), workingDirectory);
        Process process = pb.start();

        // Drain both pipes concurrently so a chatty child never blocks on a full buffer
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(
                () -> readAll(process.getInputStream()), readers);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(
                () -> readAll(process.getErrorStream()), readers);

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            process.waitFor(5, TimeUnit.SECONDS);
        }
        int exitCode = finished ? process.exitValue() : -1;
        return new Result(collect(stdout), collect(stderr), exitCode, !finished);
    }

    private static String readAll(InputStream is) {
        try (is) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String collect(CompletableFuture<String> future) throws InterruptedException {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Process output unavailable: {}", e.getMessage());
            return "";
        }
    }

    private static String nullDevice() {
        return System.getProperty("os.name", "").toLowerCase().startsWith("windows") ? "NUL" : "/dev/null";
    }
}
