package com.tidewatch.heartbeat.check;

import com.tidewatch.common.infra.FormatDuration;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Ordered set of awareness checks, run concurrently on every beat.
 * <p>
 * A check never fails the beat: exceptions and overruns are turned into
 * {@code ok=false} results, and results always come back in registration
 * order.
 */
@Slf4j
public class CheckRegistry {

    public static final Duration DEFAULT_CHECK_TIMEOUT = Duration.ofSeconds(30);

    private final List<AwarenessCheck> checks = new CopyOnWriteArrayList<>();
    private final Executor executor;
    private final Duration checkTimeout;

    public CheckRegistry(Executor executor) {
        this(executor, DEFAULT_CHECK_TIMEOUT);
    }

    public CheckRegistry(Executor executor, Duration checkTimeout) {
        this.executor = executor;
        this.checkTimeout = checkTimeout;
    }

    /**
     * @throws IllegalArgumentException if a check with the same name is registered
     */
    public void register(AwarenessCheck check) {
        if (checks.stream().anyMatch(c -> c.name().equals(check.name()))) {
            throw new IllegalArgumentException("Check already registered: " + check.name());
        }
        checks.add(check);
        log.debug("Registered check: {}", check.name());
    }

    public boolean unregister(String name) {
        return checks.removeIf(c -> c.name().equals(name));
    }

    public List<String> names() {
        return checks.stream().map(AwarenessCheck::name).toList();
    }

    /**
     * Run every registered check and wait for all of them, each bounded by
     * the per-check timeout.
     */
    public List<CheckResult> runAll(CheckContext context) {
        List<AwarenessCheck> snapshot = List.copyOf(checks);
        List<CompletableFuture<CheckResult>> futures = new ArrayList<>(snapshot.size());
        for (AwarenessCheck check : snapshot) {
            CheckResult timedOut = CheckResult.failed(check.name(),
                    "Timed out after " + FormatDuration.format(checkTimeout), checkTimeout);
            futures.add(CompletableFuture
                    .supplyAsync(() -> runSafely(check, context), executor)
                    .completeOnTimeout(timedOut, checkTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(e -> CheckResult.failed(check.name(), "Exception: " + e.getMessage(), null)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

        List<CheckResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<CheckResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private static CheckResult runSafely(AwarenessCheck check, CheckContext context) {
        long start = System.nanoTime();
        try {
            CheckResult result = check.run(context);
            if (result == null) {
                return CheckResult.failed(check.name(), "Exception: check returned no result",
                        Duration.ofNanos(System.nanoTime() - start));
            }
            return result;
        } catch (Exception e) {
            log.debug("Check {} threw: {}", check.name(), e.getMessage(), e);
            return CheckResult.failed(check.name(), "Exception: " + e.getMessage(),
                    Duration.ofNanos(System.nanoTime() - start));
        }
    }
}
